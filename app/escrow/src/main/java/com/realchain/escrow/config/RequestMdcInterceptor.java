/*
 * どこで: Escrow Web 層
 * 何を: Deal API のリクエストごとに request_id/caller_id/deal_id/deal_action を MDC へ載せる
 * なぜ: Deal 単位でログを追えるようにし、X-Request-Id を応答にも返して呼び出し側と突き合わせるため
 */
package com.realchain.escrow.config;

import com.realchain.escrow.model.DealAction;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";

  // POST の URI テンプレートと Deal 操作の対応
  private static final Map<String, DealAction> ACTIONS_BY_PATTERN =
      Map.of(
          "/v1/deals", DealAction.CREATE_LISTING,
          "/v1/deals/{deal_id}/offers", DealAction.MAKE_OFFER,
          "/v1/deals/{deal_id}/confirmations", DealAction.CONFIRM_TRANSFER,
          "/v1/deals/{deal_id}/cancellations", DealAction.CANCEL_DEAL);

  private static final String MDC_ENTRIES = RequestMdcInterceptor.class.getName() + ".entries";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final String requestId = firstNonBlank(request.getHeader(REQUEST_ID_HEADER));
    final Map<String, String> entries = new LinkedHashMap<>();
    entries.put("request_id", requestId == null ? UUID.randomUUID().toString() : requestId);
    entries.put("http_method", request.getMethod());
    entries.put("http_path", request.getRequestURI());
    entries.put("client_ip", clientIp(request));
    entries.put("caller_id", firstNonBlank(request.getHeader("X-Caller-Id")));
    entries.put("idempotency_key", firstNonBlank(request.getHeader("Idempotency-Key")));
    entries.put("trace_id", firstNonBlank(request.getHeader("X-Trace-Id")));
    entries.put("deal_id", pathVariable(request, "deal_id"));
    entries.put("deal_action", dealAction(request));
    entries.values().removeIf(value -> value == null);
    entries.forEach(MDC::put);
    request.setAttribute(MDC_ENTRIES, entries.keySet());
    response.setHeader(REQUEST_ID_HEADER, entries.get("request_id"));
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(MDC_ENTRIES) instanceof Iterable<?> keys) {
      keys.forEach(key -> MDC.remove(String.valueOf(key)));
    }
  }

  @Nullable
  private static String dealAction(HttpServletRequest request) {
    if (!"POST".equals(request.getMethod())) {
      return null;
    }
    final Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
    final DealAction action = pattern == null ? null : ACTIONS_BY_PATTERN.get(pattern.toString());
    return action == null ? null : action.wireName();
  }

  @Nullable
  private static String pathVariable(HttpServletRequest request, String name) {
    // ハンドラ解決後にだけ設定される
    if (request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE)
        instanceof Map<?, ?> variables) {
      final Object value = variables.get(name);
      return value == null ? null : firstNonBlank(value.toString());
    }
    return null;
  }

  private static String clientIp(HttpServletRequest request) {
    final String forwarded = firstNonBlank(request.getHeader("X-Forwarded-For"));
    if (forwarded == null) {
      return request.getRemoteAddr();
    }
    return forwarded.split(",", 2)[0].trim();
  }

  @Nullable
  private static String firstNonBlank(@Nullable String value) {
    return value == null || value.isBlank() ? null : value;
  }
}

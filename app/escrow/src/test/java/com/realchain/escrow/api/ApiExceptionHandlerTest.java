/*
 * どこで: Escrow API 層テスト
 * 何を: 例外ハンドラが検証エラーと型付き失敗を {"code","message"} に変換することを検証する
 * なぜ: 入力エラーが 500 ではなく 400 として返ることを保証するため
 */
package com.realchain.escrow.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doReturn;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.method.annotation.HandlerMethodValidationException;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void handlerMethodValidationReturnsFirstNonBlankMessage() {
    final HandlerMethodValidationException ex =
        Mockito.mock(HandlerMethodValidationException.class);
    doReturn(
            List.of(
                new DefaultMessageSourceResolvable(new String[] {"Size"}, " "),
                new DefaultMessageSourceResolvable(
                    new String[] {"Size"}, "X-Caller-Id must be at most 128 characters")))
        .when(ex)
        .getAllErrors();

    final ResponseEntity<ApiErrorResponse> response = handler.handleHandlerMethodValidation(ex);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .isEqualTo(
            new ApiErrorResponse(
                ApiErrorCode.BAD_REQUEST, "X-Caller-Id must be at most 128 characters"));
  }

  @Test
  void handlerMethodValidationFallsBackWhenNoMessage() {
    final HandlerMethodValidationException ex =
        Mockito.mock(HandlerMethodValidationException.class);
    doReturn(List.of()).when(ex).getAllErrors();

    assertThat(handler.handleHandlerMethodValidation(ex).getBody())
        .isEqualTo(new ApiErrorResponse(ApiErrorCode.BAD_REQUEST, "request is invalid"));
  }

  @Test
  void dealOperationUsesCodeStatus() {
    final ResponseEntity<ApiErrorResponse> response =
        handler.handleDealOperation(new DealNotActiveException("deal is PENDING"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    assertThat(response.getBody())
        .isEqualTo(new ApiErrorResponse(ApiErrorCode.DEAL_NOT_ACTIVE, "deal is PENDING"));
  }
}

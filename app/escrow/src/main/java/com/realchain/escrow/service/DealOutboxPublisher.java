/*
 * どこで: Escrow outbox publish サービス
 * 何を: Deal ごとに先頭の outbox イベントを claim し、version 順に NATS JetStream へ publish する
 * なぜ: DB 更新とイベント配信の整合性を保ち、購読側が Deal の遷移を順番どおりに受け取れるようにするため
 */
package com.realchain.escrow.service;

import com.realchain.common.event.DealEventPayload;
import com.realchain.escrow.config.EscrowNatsProperties;
import com.realchain.escrow.config.EscrowOutboxProperties;
import com.realchain.escrow.model.OutboxEventRecord;
import com.realchain.escrow.repository.OutboxEventRepository;
import com.realchain.proto.escrow.DealEvent;
import com.realchain.proto.escrow.DealTransfer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
// outbox と NATS の両方が有効な場合のみ登録する
@ConditionalOnProperty(
    name = {"escrow.outbox.enabled", "nats.enabled"},
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class DealOutboxPublisher {

  private static final Logger logger = LoggerFactory.getLogger(DealOutboxPublisher.class);
  private static final String HEADER_MESSAGE_ID = "Nats-Msg-Id";
  private static final String HEADER_EVENT_TYPE = "event_type";
  private static final String HEADER_DEAL_ID = "deal_id";
  private static final String HEADER_DEAL_VERSION = "deal_version";
  private static final String HEADER_OCCURRED_AT = "occurred_at";
  private static final String HEADER_TRACE_ID = "trace_id";
  // 同時に再送待ちになった Deal が同じ瞬間に戻ってこないよう、待ち時間に最大 20% を足す
  private static final double RETRY_JITTER_RATIO = 0.2d;

  private final JetStream jetStream;
  private final OutboxEventRepository outboxEventRepository;
  private final EscrowOutboxProperties properties;
  private final EscrowNatsProperties natsProperties;
  private final ObjectMapper objectMapper;
  private final EscrowMetrics metrics;
  private final Clock clock;
  private final String workerId = resolveWorkerId();

  /**
   * claim できた Deal ごとの先頭イベントを publish する。
   *
   * @return puback を受け取り PUBLISHED にできた件数
   */
  public int publishPendingBatch() {
    final Instant now = Instant.now(clock);
    final List<OutboxEventRecord> heads =
        outboxEventRepository.claimNextPerDeal(
            properties.batchSize(), now, now.plus(properties.lease()), workerId);
    int published = 0;
    for (OutboxEventRecord record : heads) {
      if (publish(record, now)) {
        published++;
      }
    }
    metrics.updateOutboxFailedCurrent(outboxEventRepository.countFailed());
    return published;
  }

  private boolean publish(OutboxEventRecord record, Instant now) {
    final DealEventPayload payload;
    final Instant occurredAt;
    try {
      payload = objectMapper.readValue(record.payloadJson(), DealEventPayload.class);
      occurredAt = Instant.parse(payload.occurredAt());
    } catch (JsonProcessingException | DateTimeParseException ex) {
      // 壊れた payload は再送しても直らない
      giveUp(record, properties.maxAttempts(), "deal event payload is unreadable", ex);
      return false;
    }
    metrics.recordOutboxBacklogAge(occurredAt, now);
    try {
      final PublishAck ack =
          jetStream.publish(
              natsProperties.subject(),
              buildHeaders(record, payload),
              buildEvent(record, payload).toByteArray());
      if (ack == null) {
        throw new IllegalStateException("puback is missing");
      }
      if (!outboxEventRepository.markPublished(record.eventId(), workerId, now)) {
        logger.warn(
            "deal event published after lease was lost dealId={} dealVersion={} eventId={}",
            record.dealId(),
            record.dealVersion(),
            record.eventId());
        return false;
      }
      metrics.recordOutboxPublishDelay(occurredAt, now);
      return true;
    } catch (JetStreamApiException | IOException | DataAccessException | IllegalStateException ex) {
      onPublishFailure(record, now, ex);
      return false;
    }
  }

  private void onPublishFailure(OutboxEventRecord record, Instant now, Exception ex) {
    final int attempt = record.attemptCount() + 1;
    if (attempt >= properties.maxAttempts()) {
      giveUp(record, attempt, truncateError(ex.getMessage()), ex);
      return;
    }
    final Instant nextRetryAt = now.plus(retryDelay(attempt));
    final boolean released =
        outboxEventRepository.scheduleRetry(
            record.eventId(), workerId, attempt, nextRetryAt, truncateError(ex.getMessage()));
    // 再送待ちの間は同じ Deal の後続イベントも止まる
    logger.warn(
        "deal event publish will be retried dealId={} dealVersion={} attempt={} nextRetryAt={}"
            + " leaseHeld={}",
        record.dealId(),
        record.dealVersion(),
        attempt,
        nextRetryAt,
        released,
        ex);
  }

  private void giveUp(OutboxEventRecord record, int attempt, String reason, Exception ex) {
    final boolean released =
        outboxEventRepository.markFailed(record.eventId(), workerId, attempt, reason);
    logger.error(
        "deal event moved to FAILED; later events of the deal proceed without it dealId={}"
            + " dealVersion={} eventType={} attempt={} leaseHeld={}",
        record.dealId(),
        record.dealVersion(),
        record.eventType(),
        attempt,
        released,
        ex);
  }

  @VisibleForTesting
  Duration retryDelay(int attempt) {
    final long baseMillis = properties.retryBackoff().toMillis();
    final long maxMillis = properties.retryBackoffMax().toMillis();
    // 2^30 倍以上はどのみち上限に張り付く
    final long exponential = baseMillis << Math.min(attempt - 1, 30);
    final long capped = exponential <= 0 ? maxMillis : Math.min(exponential, maxMillis);
    final long jitter =
        (long) (capped * RETRY_JITTER_RATIO * ThreadLocalRandom.current().nextDouble());
    return Duration.ofMillis(capped + jitter);
  }

  @VisibleForTesting
  DealEvent buildEvent(OutboxEventRecord record, DealEventPayload payload) {
    final DealEvent.Builder builder =
        DealEvent.newBuilder()
            .setEventId(payload.eventId())
            .setEventType(toProtoEventType(record.eventType()))
            .setOccurredAt(payload.occurredAt())
            .setDealId(payload.dealId())
            .setCallerId(nullToEmpty(payload.callerId()))
            .setSeller(nullToEmpty(payload.seller()))
            // protobuf の string は null を受け付けないため、buyer 未確定は空文字で表す
            .setBuyer(nullToEmpty(payload.buyer()))
            .setStatus(nullToEmpty(payload.status()))
            .setPrice(payload.price())
            .setPropertyHash(nullToEmpty(payload.propertyHash()))
            .setVersion(record.dealVersion())
            .setTraceId(nullToEmpty(payload.traceId()));
    for (DealEventPayload.Transfer transfer : payload.transfers()) {
      builder.addTransfers(
          DealTransfer.newBuilder()
              .setKind(transfer.kind())
              .setSender(transfer.sender())
              .setReceiver(transfer.receiver())
              .setAmount(transfer.amount())
              .build());
    }
    return builder.build();
  }

  private Headers buildHeaders(OutboxEventRecord record, DealEventPayload payload) {
    final Headers headers = new Headers();
    // JetStream の重複排除は Nats-Msg-Id 単位
    headers.add(HEADER_MESSAGE_ID, record.eventId().toString());
    headers.add(HEADER_EVENT_TYPE, record.eventType());
    headers.add(HEADER_DEAL_ID, record.dealId().toString());
    headers.add(HEADER_DEAL_VERSION, Long.toString(record.dealVersion()));
    headers.add(HEADER_OCCURRED_AT, payload.occurredAt());
    headers.add(HEADER_TRACE_ID, nullToEmpty(payload.traceId()));
    return headers;
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    return message.length() <= maxLength ? message : message.substring(0, maxLength);
  }

  private static DealEvent.EventType toProtoEventType(String eventType) {
    return switch (eventType) {
      case "DealListed" -> DealEvent.EventType.DEAL_LISTED;
      case "OfferMade" -> DealEvent.EventType.OFFER_MADE;
      case "TransferConfirmed" -> DealEvent.EventType.TRANSFER_CONFIRMED;
      case "DealCancelled" -> DealEvent.EventType.DEAL_CANCELLED;
      default -> throw new IllegalStateException("unknown deal event type: " + eventType);
    };
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  private static String resolveWorkerId() {
    // Pod 名が入る HOSTNAME を優先し、無ければ pid で区別する
    final String hostname = System.getenv("HOSTNAME");
    if (hostname != null && !hostname.isBlank()) {
      return hostname;
    }
    return "escrow-" + ProcessHandle.current().pid();
  }
}

/*
 * どこで: Escrow retention サービス
 * 何を: 期限切れの idempotency と publish 済み outbox を削除する
 * なぜ: テーブル肥大化を防ぐため。Deal の state/custody/audit は監査用に保持し続ける
 */
package com.realchain.escrow.service;

import com.realchain.escrow.config.EscrowOutboxProperties;
import com.realchain.escrow.repository.IdempotencyKeyRepository;
import com.realchain.escrow.repository.OutboxEventRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DealRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(DealRetentionService.class);

  private final IdempotencyKeyRepository idempotencyKeyRepository;
  private final OutboxEventRepository outboxEventRepository;
  private final EscrowOutboxProperties outboxProperties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    // idempotency は expires_at に TTL が反映済みなので、期限切れのみ削除する。
    final int deletedIdempotency = idempotencyKeyRepository.deleteExpired(now);
    final Instant outboxThreshold = now.minus(outboxProperties.publishedTtl());
    final int deletedOutbox = outboxEventRepository.deletePublishedBefore(outboxThreshold);
    logger.info(
        "escrow retention cleanup deleted idempotencyKeys={} outboxEvents={} outboxThreshold={}",
        deletedIdempotency,
        deletedOutbox,
        outboxThreshold);
  }
}

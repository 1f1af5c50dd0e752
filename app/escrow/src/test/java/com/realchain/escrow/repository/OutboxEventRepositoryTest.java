/*
 * どこで: OutboxEventRepository の統合テスト
 * 何を: Deal ごとの version 順 claim、リース切れの再 claim、publish/再送/FAILED の解放と保持期限削除を検証する
 * なぜ: 同じ Deal のイベントが追い越して配信されず、詰まった Deal が他の Deal を止めないことを保証するため
 */
package com.realchain.escrow.repository;

import static com.realchain.common.JdbcTimestampUtils.toTimestamp;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.realchain.escrow.AbstractPostgresContainerTest;
import com.realchain.escrow.model.OutboxEventRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class OutboxEventRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final Duration LEASE = Duration.ofSeconds(30);
  private static final String WORKER = "escrow-0";
  private static final String OTHER_WORKER = "escrow-1";

  @Autowired private OutboxEventRepository outboxEventRepository;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM deal_audit", params);
    jdbcTemplate.update("DELETE FROM outbox_events", params);
    jdbcTemplate.update("DELETE FROM custody_transfers", params);
    jdbcTemplate.update("DELETE FROM deal_state", params);
    jdbcTemplate.update("DELETE FROM deals", params);
  }

  @Test
  void claimReturnsOnlyLowestVersionPerDeal() {
    final UUID dealA = deal();
    final UUID dealB = deal();
    final UUID listedA = event(dealA, 1L, NOW.minusSeconds(30));
    event(dealA, 2L, NOW.minusSeconds(20));
    final UUID listedB = event(dealB, 1L, NOW.minusSeconds(10));

    final List<OutboxEventRecord> claimed = claim(10, NOW, WORKER);

    assertThat(claimed).extracting(OutboxEventRecord::eventId).containsExactly(listedA, listedB);
    assertThat(claimed.get(0).dealVersion()).isEqualTo(1L);
    assertThat(statusOf(listedA)).isEqualTo("IN_FLIGHT");
    assertThat(claim(10, NOW, OTHER_WORKER)).isEmpty();
  }

  @Test
  void markPublishedReleasesNextVersionOfSameDeal() {
    final UUID dealId = deal();
    final UUID listed = event(dealId, 1L, NOW.minusSeconds(20));
    final UUID offered = event(dealId, 2L, NOW.minusSeconds(10));
    claim(10, NOW, WORKER);

    assertThat(outboxEventRepository.markPublished(listed, WORKER, NOW)).isTrue();

    assertThat(claim(10, NOW, WORKER))
        .singleElement()
        .satisfies(
            record -> {
              assertThat(record.eventId()).isEqualTo(offered);
              assertThat(record.dealVersion()).isEqualTo(2L);
              assertThat(record.payloadJson()).contains("\"deal_version\": 2");
            });
    assertThat(statusOf(listed)).isEqualTo("PUBLISHED");
  }

  @Test
  void expiredLeaseIsClaimedAgainByAnotherWorker() {
    final UUID dealId = deal();
    final UUID listed = event(dealId, 1L, NOW.minusSeconds(5));
    claim(10, NOW, WORKER);

    assertThat(claim(10, NOW.plus(LEASE).minusSeconds(1), OTHER_WORKER)).isEmpty();
    final List<OutboxEventRecord> reclaimed = claim(10, NOW.plus(LEASE), OTHER_WORKER);

    assertThat(reclaimed).extracting(OutboxEventRecord::eventId).containsExactly(listed);
    // 元のワーカーはリースを失っているので完了を書けない
    assertThat(outboxEventRepository.markPublished(listed, WORKER, NOW.plus(LEASE))).isFalse();
    assertThat(outboxEventRepository.markPublished(listed, OTHER_WORKER, NOW.plus(LEASE)))
        .isTrue();
  }

  @Test
  void scheduledRetryHoldsBackWholeDealUntilDue() {
    final UUID dealId = deal();
    final UUID listed = event(dealId, 1L, NOW.minusSeconds(20));
    event(dealId, 2L, NOW.minusSeconds(10));
    claim(10, NOW, WORKER);

    assertThat(
            outboxEventRepository.scheduleRetry(
                listed, WORKER, 1, NOW.plusSeconds(5), "nats publish failed"))
        .isTrue();

    assertThat(claim(10, NOW.plusSeconds(4), WORKER)).isEmpty();
    assertThat(claim(10, NOW.plusSeconds(5), WORKER))
        .singleElement()
        .satisfies(
            record -> {
              assertThat(record.eventId()).isEqualTo(listed);
              assertThat(record.attemptCount()).isEqualTo(1);
            });
  }

  @Test
  void failedEventNoLongerBlocksLaterVersions() {
    final UUID dealId = deal();
    final UUID listed = event(dealId, 1L, NOW.minusSeconds(20));
    final UUID offered = event(dealId, 2L, NOW.minusSeconds(10));
    claim(10, NOW, WORKER);

    assertThat(outboxEventRepository.markFailed(listed, WORKER, 10, "nats unavailable")).isTrue();

    assertThat(claim(10, NOW, WORKER))
        .extracting(OutboxEventRecord::eventId)
        .containsExactly(offered);
    assertThat(outboxEventRepository.countFailed()).isEqualTo(1);
    final String lastError =
        jdbcTemplate.queryForObject(
            "SELECT last_error FROM outbox_events WHERE event_id = :eventId",
            new MapSqlParameterSource("eventId", listed),
            String.class);
    assertThat(lastError).isEqualTo("nats unavailable");
  }

  @Test
  void releaseWithoutLeaseIsRejected() {
    final UUID dealId = deal();
    final UUID listed = event(dealId, 1L, NOW.minusSeconds(5));
    claim(10, NOW, WORKER);

    assertThat(outboxEventRepository.markFailed(listed, OTHER_WORKER, 1, "boom")).isFalse();
    assertThat(
            outboxEventRepository.scheduleRetry(listed, OTHER_WORKER, 1, NOW.plusSeconds(1), "x"))
        .isFalse();
    assertThat(statusOf(listed)).isEqualTo("IN_FLIGHT");
  }

  @Test
  void claimHonoursLimitInCreationOrder() {
    final UUID newest = event(deal(), 1L, NOW.minusSeconds(1));
    final UUID oldest = event(deal(), 1L, NOW.minusSeconds(30));
    final UUID middle = event(deal(), 1L, NOW.minusSeconds(10));

    assertThat(claim(2, NOW, WORKER))
        .extracting(OutboxEventRecord::eventId)
        .containsExactly(oldest, middle);
    assertThat(statusOf(newest)).isEqualTo("PENDING");
  }

  @Test
  void duplicateVersionOfSameDealIsRejected() {
    final UUID dealId = deal();
    event(dealId, 1L, NOW);

    assertThatThrownBy(() -> event(dealId, 1L, NOW))
        .isInstanceOf(DuplicateKeyException.class);
  }

  @Test
  void deletePublishedBeforeKeepsUnpublishedAndFailed() {
    final Instant threshold = NOW.minus(Duration.ofDays(7));
    final UUID dealId = deal();
    final UUID oldPublished = event(dealId, 1L, threshold.minusSeconds(60));
    final UUID recentPublished = event(dealId, 2L, threshold.minusSeconds(50));
    final UUID failed = event(dealId, 3L, threshold.minusSeconds(40));
    final UUID pending = event(dealId, 4L, threshold.minusSeconds(30));
    publish(oldPublished, threshold.minusSeconds(1));
    publish(recentPublished, threshold.plusSeconds(1));
    claim(10, NOW, WORKER);
    outboxEventRepository.markFailed(failed, WORKER, 10, "gave up");

    final int deleted = outboxEventRepository.deletePublishedBefore(threshold);

    assertThat(deleted).isEqualTo(1);
    assertThat(statusOf(oldPublished)).isNull();
    assertThat(statusOf(recentPublished)).isEqualTo("PUBLISHED");
    assertThat(statusOf(failed)).isEqualTo("FAILED");
    assertThat(statusOf(pending)).isEqualTo("PENDING");
  }

  private List<OutboxEventRecord> claim(int limit, Instant now, String worker) {
    return outboxEventRepository.claimNextPerDeal(limit, now, now.plus(LEASE), worker);
  }

  private void publish(UUID eventId, Instant publishedAt) {
    assertThat(claim(10, publishedAt, WORKER))
        .extracting(OutboxEventRecord::eventId)
        .contains(eventId);
    assertThat(outboxEventRepository.markPublished(eventId, WORKER, publishedAt)).isTrue();
  }

  private UUID deal() {
    final UUID dealId = UUID.randomUUID();
    jdbcTemplate.update(
        "INSERT INTO deals (deal_id, version, created_at, updated_at)"
            + " VALUES (:dealId, 0, :createdAt, :createdAt)",
        new MapSqlParameterSource()
            .addValue("dealId", dealId)
            .addValue("createdAt", toTimestamp(NOW.minus(Duration.ofDays(30)))));
    return dealId;
  }

  private UUID event(UUID dealId, long version, Instant createdAt) {
    final UUID eventId = UUID.randomUUID();
    outboxEventRepository.insert(
        eventId,
        version == 1L ? "DealListed" : "OfferMade",
        dealId,
        version,
        "{\"deal_version\": " + version + "}",
        createdAt);
    return eventId;
  }

  private String statusOf(UUID eventId) {
    final List<String> statuses =
        jdbcTemplate.queryForList(
            "SELECT status FROM outbox_events WHERE event_id = :eventId",
            new MapSqlParameterSource("eventId", eventId),
            String.class);
    return statuses.isEmpty() ? null : statuses.get(0);
  }
}

/*
 * どこで: Escrow データアクセス
 * 何を: Deal イベントの outbox_events を登録し、Deal ごとに version 順で claim/解放する
 * なぜ: 状態遷移と同じトランザクションで記録したイベントを、Deal 内の順序を崩さず配信するため
 */
package com.realchain.escrow.repository;

import static com.realchain.common.JdbcTimestampUtils.toTimestamp;

import com.realchain.escrow.model.OutboxEventRecord;
import com.realchain.escrow.model.OutboxStatus;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class OutboxEventRepository {

  private static final RowMapper<OutboxEventRecord> CLAIMED_ROW =
      (rs, rowNum) ->
          new OutboxEventRecord(
              UUID.fromString(rs.getString("event_id")),
              rs.getString("event_type"),
              UUID.fromString(rs.getString("deal_id")),
              rs.getLong("deal_version"),
              rs.getString("payload_text"),
              rs.getInt("attempt_count"),
              rs.getTimestamp("created_at").toInstant());

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** dealVersion は遷移後の Deal の version。同じ Deal で重複すると一意制約違反になる。 */
  public void insert(
      UUID eventId,
      String eventType,
      UUID dealId,
      long dealVersion,
      String payloadJson,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO outbox_events (
          event_id, event_type, deal_id, deal_version, payload, status, attempt_count, created_at
        ) VALUES (
          :eventId, :eventType, :dealId, :dealVersion, :payload::jsonb, 'PENDING', 0, :createdAt
        )
        """;
    jdbcTemplate.update(
        sql,
        new MapSqlParameterSource()
            .addValue("eventId", eventId)
            .addValue("eventType", eventType)
            .addValue("dealId", dealId)
            .addValue("dealVersion", dealVersion)
            .addValue("payload", payloadJson)
            .addValue("createdAt", toTimestamp(createdAt)));
  }

  /**
   * 各 Deal の未配信イベントのうち最小 version のものだけを claim する。
   *
   * <p>先行イベントが PENDING/IN_FLIGHT の間は後続を渡さない。FAILED になったイベントは順序待ちから外れる。
   * リース切れの IN_FLIGHT は再 claim の対象になる。
   */
  public List<OutboxEventRecord> claimNextPerDeal(
      int limit, Instant now, Instant leaseUntil, String lockedBy) {
    final String sql =
        """
        WITH head AS (
          SELECT DISTINCT ON (deal_id) event_id
          FROM outbox_events
          WHERE status IN ('PENDING', 'IN_FLIGHT')
          ORDER BY deal_id, deal_version
        ),
        ready AS (
          SELECT e.event_id
          FROM outbox_events e
          JOIN head h ON h.event_id = e.event_id
          WHERE (e.status = 'PENDING' AND (e.next_retry_at IS NULL OR e.next_retry_at <= :now))
             OR (e.status = 'IN_FLIGHT' AND (e.lease_until IS NULL OR e.lease_until <= :now))
          ORDER BY e.created_at
          LIMIT :limit
          FOR UPDATE OF e SKIP LOCKED
        )
        UPDATE outbox_events e
        SET status = 'IN_FLIGHT',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM ready
        WHERE e.event_id = ready.event_id
        RETURNING e.event_id, e.event_type, e.deal_id, e.deal_version,
                  e.payload::text AS payload_text, e.attempt_count, e.created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("limit", limit)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy);
    // RETURNING は順序を保証しない
    return jdbcTemplate.query(sql, params, CLAIMED_ROW).stream()
        .sorted(Comparator.comparing(OutboxEventRecord::createdAt))
        .toList();
  }

  /** @return リースを保持していた場合 true */
  public boolean markPublished(UUID eventId, String lockedBy, Instant publishedAt) {
    final String sql =
        """
        UPDATE outbox_events
        SET status = 'PUBLISHED',
            published_at = :publishedAt,
            last_error = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    return jdbcTemplate.update(
            sql,
            new MapSqlParameterSource()
                .addValue("eventId", eventId)
                .addValue("lockedBy", lockedBy)
                .addValue("publishedAt", toTimestamp(publishedAt)))
        == 1;
  }

  /** PENDING に戻して nextRetryAt まで claim 対象から外す。同じ Deal の後続も待たせたままにする。 */
  public boolean scheduleRetry(
      UUID eventId, String lockedBy, int attemptCount, Instant nextRetryAt, String lastError) {
    return release(eventId, lockedBy, OutboxStatus.PENDING, attemptCount, nextRetryAt, lastError);
  }

  /** FAILED にして配信を諦める。同じ Deal の後続イベントはこれ以降 claim できるようになる。 */
  public boolean markFailed(UUID eventId, String lockedBy, int attemptCount, String lastError) {
    return release(eventId, lockedBy, OutboxStatus.FAILED, attemptCount, null, lastError);
  }

  public int deletePublishedBefore(Instant threshold) {
    // 未配信と FAILED は調査用に残す
    return jdbcTemplate.update(
        "DELETE FROM outbox_events WHERE status = 'PUBLISHED' AND published_at <= :threshold",
        new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }

  public int countFailed() {
    final Integer count =
        jdbcTemplate.queryForObject(
            "SELECT count(*) FROM outbox_events WHERE status = 'FAILED'",
            new MapSqlParameterSource(),
            Integer.class);
    return count == null ? 0 : count;
  }

  private boolean release(
      UUID eventId,
      String lockedBy,
      OutboxStatus status,
      int attemptCount,
      Instant nextRetryAt,
      String lastError) {
    final String sql =
        """
        UPDATE outbox_events
        SET status = :status,
            attempt_count = :attemptCount,
            next_retry_at = :nextRetryAt,
            last_error = :lastError,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE event_id = :eventId
          AND locked_by = :lockedBy
        """;
    return jdbcTemplate.update(
            sql,
            new MapSqlParameterSource()
                .addValue("status", status.name())
                .addValue("attemptCount", attemptCount)
                .addValue("nextRetryAt", toTimestamp(nextRetryAt))
                .addValue("lastError", lastError)
                .addValue("eventId", eventId)
                .addValue("lockedBy", lockedBy))
        == 1;
  }
}

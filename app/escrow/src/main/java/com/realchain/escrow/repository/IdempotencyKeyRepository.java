/*
 * どこで: Escrow データアクセス
 * 何を: 呼び出し元単位の idempotency_keys を保存/参照し、キーごとの advisory lock を取る
 * なぜ: Deal 操作の再送時に同一レスポンス(成功/失敗とも)を返すため
 */
package com.realchain.escrow.repository;

import static com.realchain.common.JdbcTimestampUtils.toTimestamp;

import com.realchain.escrow.model.DealAction;
import com.realchain.escrow.model.IdempotencyRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class IdempotencyKeyRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** コミットまたはロールバックまで保持される。lockKey は呼び出し元とキーの組から作る。 */
  @Transactional(propagation = Propagation.MANDATORY)
  public void acquireLock(long lockKey) {
    jdbcTemplate.query(
        "SELECT pg_advisory_xact_lock(:lockKey)",
        new MapSqlParameterSource("lockKey", lockKey),
        rs -> null);
  }

  /** 期限は DB の now() ではなく呼び出し側の時計で判定する。 */
  public Optional<IdempotencyRecord> findActive(
      String callerId, String idempotencyKey, Instant now) {
    final String sql =
        """
        SELECT caller_id, idem_key, action, deal_id, request_hash, response_code,
               response_body::text AS response_body_text, created_at, expires_at
        FROM idempotency_keys
        WHERE caller_id = :callerId
          AND idem_key = :idempotencyKey
          AND expires_at > :now
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("callerId", callerId)
            .addValue("idempotencyKey", idempotencyKey)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * 応答を保存する。同じ呼び出し元・キーの有効な記録が残っている場合は上書きしない。
   *
   * @return 保存できた場合 true
   */
  public boolean save(IdempotencyRecord record) {
    final String sql =
        """
        INSERT INTO idempotency_keys AS k (
          caller_id, idem_key, action, deal_id, request_hash,
          response_code, response_body, created_at, expires_at
        ) VALUES (
          :callerId, :idempotencyKey, :action, :dealId, :requestHash,
          :responseCode, :responseBody::jsonb, :createdAt, :expiresAt
        )
        ON CONFLICT (caller_id, idem_key) DO UPDATE
          SET action = EXCLUDED.action,
              deal_id = EXCLUDED.deal_id,
              request_hash = EXCLUDED.request_hash,
              response_code = EXCLUDED.response_code,
              response_body = EXCLUDED.response_body,
              created_at = EXCLUDED.created_at,
              expires_at = EXCLUDED.expires_at
        WHERE k.expires_at <= EXCLUDED.created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("callerId", record.callerId())
            .addValue("idempotencyKey", record.idempotencyKey())
            .addValue("action", record.action().wireName())
            .addValue("dealId", record.dealId())
            .addValue("requestHash", record.requestHash())
            .addValue("responseCode", record.responseCode())
            .addValue("responseBody", record.responseBodyJson())
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("expiresAt", toTimestamp(record.expiresAt()));
    return jdbcTemplate.update(sql, params) == 1;
  }

  public int deleteExpired(Instant now) {
    return jdbcTemplate.update(
        "DELETE FROM idempotency_keys WHERE expires_at <= :now",
        new MapSqlParameterSource("now", toTimestamp(now)));
  }

  private IdempotencyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String dealId = rs.getString("deal_id");
    return new IdempotencyRecord(
        rs.getString("caller_id"),
        rs.getString("idem_key"),
        DealAction.fromWireName(rs.getString("action")),
        dealId == null ? null : UUID.fromString(dealId),
        rs.getString("request_hash"),
        rs.getInt("response_code"),
        rs.getString("response_body_text"),
        rs.getTimestamp("created_at").toInstant(),
        rs.getTimestamp("expires_at").toInstant());
  }
}

/*
 * どこで: Escrow データアクセス
 * 何を: deal_audit の登録を行う
 * なぜ: 操作履歴を追跡できるようにするため
 */
package com.realchain.escrow.repository;

import com.realchain.escrow.model.DealAuditRecord;
import java.util.UUID;

import lombok.RequiredArgsConstructor;

import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import static com.realchain.common.JdbcTimestampUtils.toTimestamp;

@Repository
@RequiredArgsConstructor
public class DealAuditRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int insert(DealAuditRecord record) {
    String sql = """
        INSERT INTO deal_audit (
          audit_id,
          occurred_at,
          deal_id,
          action,
          caller_id,
          from_status,
          to_status,
          request_id,
          detail
        ) VALUES (
          :auditId,
          :occurredAt,
          :dealId,
          :action,
          :callerId,
          :fromStatus,
          :toStatus,
          :requestId,
          :detail::jsonb
        )
        """;
    MapSqlParameterSource params = new MapSqlParameterSource()
        .addValue("auditId", record.auditId())
        .addValue("occurredAt", toTimestamp(record.occurredAt()))
        .addValue("dealId", record.dealId())
        .addValue("action", record.action())
        .addValue("callerId", record.callerId())
        .addValue("fromStatus", record.fromStatus())
        .addValue("toStatus", record.toStatus())
        .addValue("requestId", record.requestId())
        .addValue("detail", record.detailJson());
    return jdbcTemplate.update(sql, params);
  }

  public int countByDealId(UUID dealId) {
    final Integer count = jdbcTemplate.queryForObject(
        "SELECT COUNT(*) FROM deal_audit WHERE deal_id = :dealId",
        new MapSqlParameterSource().addValue("dealId", dealId),
        Integer.class);
    return count == null ? 0 : count;
  }
}

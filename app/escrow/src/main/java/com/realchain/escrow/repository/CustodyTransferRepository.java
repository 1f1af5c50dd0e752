/*
 * どこで: Escrow データアクセス
 * 何を: custody_transfers の登録/参照を行う
 * なぜ: 状態遷移と同一トランザクションで資金移動を記録するため
 */
package com.realchain.escrow.repository;

import static com.realchain.common.JdbcTimestampUtils.toTimestamp;

import com.realchain.escrow.model.CustodyTransferRecord;
import com.realchain.escrow.model.TransferKind;
import com.realchain.escrow.service.ApprovedTransfer;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class CustodyTransferRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  // ApprovedTransfer は TransactionBundleValidator でしか生成できないため、
  // ガード評価を経ない custodian 発の送金はここに到達しない。
  public CustodyTransferRecord insert(ApprovedTransfer transfer, Instant appliedAt) {
    final CustodyTransferRecord record =
        new CustodyTransferRecord(
            UUID.randomUUID(),
            transfer.dealId(),
            transfer.kind(),
            transfer.sender(),
            transfer.receiver(),
            transfer.amount(),
            appliedAt);
    final String sql =
        """
        INSERT INTO custody_transfers (
          transfer_id,
          deal_id,
          kind,
          sender,
          receiver,
          amount,
          applied_at
        ) VALUES (
          :transferId,
          :dealId,
          :kind,
          :sender,
          :receiver,
          :amount,
          :appliedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("transferId", record.transferId())
            .addValue("dealId", record.dealId())
            .addValue("kind", record.kind().name())
            .addValue("sender", record.sender())
            .addValue("receiver", record.receiver())
            .addValue("amount", record.amount())
            .addValue("appliedAt", toTimestamp(appliedAt));
    jdbcTemplate.update(sql, params);
    return record;
  }

  public List<CustodyTransferRecord> findByDealId(UUID dealId) {
    final String sql =
        """
        SELECT transfer_id, deal_id, kind, sender, receiver, amount, applied_at
        FROM custody_transfers
        WHERE deal_id = :dealId
        ORDER BY applied_at, kind
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("dealId", dealId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private CustodyTransferRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new CustodyTransferRecord(
        UUID.fromString(rs.getString("transfer_id")),
        UUID.fromString(rs.getString("deal_id")),
        TransferKind.valueOf(rs.getString("kind")),
        rs.getString("sender"),
        rs.getString("receiver"),
        rs.getLong("amount"),
        rs.getTimestamp("applied_at").toInstant());
  }
}

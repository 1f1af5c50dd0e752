/*
 * どこで: Escrow データアクセス
 * 何を: deals / deal_state テーブル上に DealStateStore を実装する
 * なぜ: Deal ごとの state を行ロック付きで永続化するため
 */
package com.realchain.escrow.repository;

import static com.realchain.common.JdbcTimestampUtils.toTimestamp;

import com.realchain.escrow.model.DealStateSnapshot;
import com.realchain.escrow.model.StateKey;
import com.realchain.escrow.model.StateValue;
import com.realchain.escrow.model.StateValueType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
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
public class JdbcDealStateStore implements DealStateStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void create(UUID dealId, Instant createdAt) {
    final String sql =
        """
        INSERT INTO deals (deal_id, version, created_at, updated_at)
        VALUES (:dealId, 0, :createdAt, :createdAt)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("dealId", dealId)
            .addValue("createdAt", toTimestamp(createdAt));
    jdbcTemplate.update(sql, params);
  }

  @Override
  @Transactional(propagation = Propagation.MANDATORY)
  public boolean lock(UUID dealId) {
    // 同一 Deal の操作をトランザクション終了まで直列化する
    final String sql = "SELECT deal_id FROM deals WHERE deal_id = :dealId FOR UPDATE";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("dealId", dealId);
    return !jdbcTemplate.queryForList(sql, params, UUID.class).isEmpty();
  }

  @Override
  public Optional<StateValue> find(UUID dealId, StateKey key) {
    final String sql =
        """
        SELECT state_key, value_type, bytes_value, uint_value
        FROM deal_state
        WHERE deal_id = :dealId
          AND state_key = :stateKey
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("dealId", dealId)
            .addValue("stateKey", key.keyName());
    return jdbcTemplate.query(sql, params, this::mapValue).stream().findFirst();
  }

  @Override
  public void put(UUID dealId, StateKey key, StateValue value) {
    DealStateStore.requireDeclaredType(key, value);
    final String sql =
        """
        INSERT INTO deal_state (deal_id, state_key, value_type, bytes_value, uint_value)
        VALUES (:dealId, :stateKey, :valueType, :bytesValue, :uintValue)
        ON CONFLICT (deal_id, state_key)
        DO UPDATE SET
          value_type = EXCLUDED.value_type,
          bytes_value = EXCLUDED.bytes_value,
          uint_value = EXCLUDED.uint_value
        """;
    final boolean bytes = value.type() == StateValueType.BYTES;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("dealId", dealId)
            .addValue("stateKey", key.keyName())
            .addValue("valueType", value.type().name())
            .addValue("bytesValue", bytes ? value.bytes() : null)
            .addValue("uintValue", bytes ? null : value.uint());
    jdbcTemplate.update(sql, params);
  }

  @Override
  public Optional<DealStateSnapshot> load(UUID dealId) {
    final String headerSql =
        """
        SELECT version, updated_at
        FROM deals
        WHERE deal_id = :dealId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("dealId", dealId);
    final List<Header> headers =
        jdbcTemplate.query(
            headerSql,
            params,
            (rs, rowNum) ->
                new Header(rs.getLong("version"), rs.getTimestamp("updated_at").toInstant()));
    if (headers.isEmpty()) {
      return Optional.empty();
    }
    final String stateSql =
        """
        SELECT state_key, value_type, bytes_value, uint_value
        FROM deal_state
        WHERE deal_id = :dealId
        """;
    final Map<StateKey, StateValue> values = new EnumMap<>(StateKey.class);
    jdbcTemplate.query(
        stateSql,
        params,
        rs -> {
          values.put(StateKey.fromKeyName(rs.getString("state_key")), mapValue(rs, 0));
        });
    final Header header = headers.get(0);
    return Optional.of(new DealStateSnapshot(dealId, values, header.version(), header.updatedAt()));
  }

  @Override
  public long touch(UUID dealId, Instant updatedAt) {
    final String sql =
        """
        UPDATE deals
        SET version = version + 1,
            updated_at = :updatedAt
        WHERE deal_id = :dealId
        RETURNING version
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("dealId", dealId)
            .addValue("updatedAt", toTimestamp(updatedAt));
    final List<Long> versions = jdbcTemplate.queryForList(sql, params, Long.class);
    if (versions.isEmpty()) {
      throw new IllegalStateException("deal header is missing: " + dealId);
    }
    return versions.get(0);
  }

  @Override
  public List<UUID> findDealIdsByBytesValue(StateKey key, String value) {
    final String sql =
        """
        SELECT s.deal_id
        FROM deal_state s
        JOIN deals d ON d.deal_id = s.deal_id
        WHERE s.state_key = :stateKey
          AND s.value_type = 'BYTES'
          AND s.bytes_value = :value
        ORDER BY d.created_at DESC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("stateKey", key.keyName())
            .addValue("value", value);
    return jdbcTemplate.queryForList(sql, params, UUID.class);
  }

  private StateValue mapValue(ResultSet rs, int rowNum) throws SQLException {
    final StateValueType type = StateValueType.valueOf(rs.getString("value_type"));
    if (type == StateValueType.BYTES) {
      return StateValue.ofBytes(rs.getString("bytes_value"));
    }
    return StateValue.ofUint(rs.getLong("uint_value"));
  }

  private record Header(long version, Instant updatedAt) {}
}

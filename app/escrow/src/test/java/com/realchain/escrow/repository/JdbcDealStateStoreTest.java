/*
 * どこで: JdbcDealStateStore の統合テスト
 * 何を: 型付き key/value の保存・未設定の区別・version 更新・ロックを検証する
 * なぜ: StateStore の契約が Postgres 上でも保たれることを保証するため
 */
package com.realchain.escrow.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.realchain.escrow.AbstractPostgresContainerTest;
import com.realchain.escrow.model.DealStateSnapshot;
import com.realchain.escrow.model.StateKey;
import com.realchain.escrow.model.StateValue;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;

@SpringBootTest
@ActiveProfiles("test")
class JdbcDealStateStoreTest extends AbstractPostgresContainerTest {

  private static final Instant CREATED_AT = Instant.parse("2026-01-17T00:00:00Z");

  @Autowired private DealStateStore stateStore;

  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @Autowired private TransactionTemplate transactionTemplate;

  @BeforeEach
  void cleanup() {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    jdbcTemplate.update("DELETE FROM custody_transfers", params);
    jdbcTemplate.update("DELETE FROM deal_state", params);
    jdbcTemplate.update("DELETE FROM deals", params);
  }

  @Test
  void putAndFindKeepsDeclaredTypes() {
    final UUID dealId = UUID.randomUUID();
    stateStore.create(dealId, CREATED_AT);

    stateStore.put(dealId, StateKey.SELLER, StateValue.ofBytes("seller"));
    stateStore.put(dealId, StateKey.PRICE, StateValue.ofUint(1000L));

    assertThat(stateStore.get(dealId, StateKey.SELLER)).isEqualTo(StateValue.ofBytes("seller"));
    assertThat(stateStore.get(dealId, StateKey.PRICE)).isEqualTo(StateValue.ofUint(1000L));
  }

  @Test
  void unsetKeyIsDistinctFromEmptyValue() {
    final UUID dealId = UUID.randomUUID();
    stateStore.create(dealId, CREATED_AT);

    assertThat(stateStore.exists(dealId, StateKey.BUYER)).isFalse();
    assertThatThrownBy(() -> stateStore.get(dealId, StateKey.BUYER))
        .isInstanceOf(StateKeyNotFoundException.class);

    stateStore.put(dealId, StateKey.BUYER, StateValue.ofBytes(""));
    stateStore.put(dealId, StateKey.STATUS, StateValue.ofUint(0L));

    assertThat(stateStore.exists(dealId, StateKey.BUYER)).isTrue();
    assertThat(stateStore.get(dealId, StateKey.BUYER).bytes()).isEmpty();
    assertThat(stateStore.get(dealId, StateKey.STATUS).uint()).isZero();
  }

  @Test
  void putRejectsUndeclaredType() {
    final UUID dealId = UUID.randomUUID();
    stateStore.create(dealId, CREATED_AT);

    assertThatThrownBy(() -> stateStore.put(dealId, StateKey.PRICE, StateValue.ofBytes("1000")))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(stateStore.exists(dealId, StateKey.PRICE)).isFalse();
  }

  @Test
  void putOverwritesExistingKey() {
    final UUID dealId = UUID.randomUUID();
    stateStore.create(dealId, CREATED_AT);

    stateStore.put(dealId, StateKey.STATUS, StateValue.ofUint(0L));
    stateStore.put(dealId, StateKey.STATUS, StateValue.ofUint(1L));

    assertThat(stateStore.get(dealId, StateKey.STATUS).uint()).isEqualTo(1L);
  }

  @Test
  void touchIncrementsVersionAndLoadReturnsAllKeys() {
    final UUID dealId = UUID.randomUUID();
    stateStore.create(dealId, CREATED_AT);
    stateStore.put(dealId, StateKey.SELLER, StateValue.ofBytes("seller"));

    assertThat(stateStore.touch(dealId, CREATED_AT)).isEqualTo(1L);
    assertThat(stateStore.touch(dealId, CREATED_AT.plusSeconds(5))).isEqualTo(2L);

    final Optional<DealStateSnapshot> snapshot = stateStore.load(dealId);
    assertThat(snapshot).isPresent();
    assertThat(snapshot.get().version()).isEqualTo(2L);
    assertThat(snapshot.get().updatedAt()).isEqualTo(CREATED_AT.plusSeconds(5));
    assertThat(snapshot.get().values()).containsOnlyKeys(StateKey.SELLER);
  }

  @Test
  void loadReturnsEmptyForUnknownDeal() {
    assertThat(stateStore.load(UUID.randomUUID())).isEmpty();
  }

  @Test
  void findDealIdsByBytesValueMatchesOnlyThatKey() {
    final UUID first = UUID.randomUUID();
    final UUID second = UUID.randomUUID();
    stateStore.create(first, CREATED_AT);
    stateStore.create(second, CREATED_AT.plusSeconds(1));
    stateStore.put(first, StateKey.SELLER, StateValue.ofBytes("alice"));
    stateStore.put(second, StateKey.BUYER, StateValue.ofBytes("alice"));

    assertThat(stateStore.findDealIdsByBytesValue(StateKey.SELLER, "alice")).containsExactly(first);
  }

  @Test
  void lockRequiresTransactionAndReportsExistence() {
    final UUID dealId = UUID.randomUUID();
    stateStore.create(dealId, CREATED_AT);

    assertThatThrownBy(() -> stateStore.lock(dealId))
        .isInstanceOf(IllegalTransactionStateException.class);
    final Boolean lockedExisting = transactionTemplate.execute(status -> stateStore.lock(dealId));
    final Boolean lockedMissing =
        transactionTemplate.execute(status -> stateStore.lock(UUID.randomUUID()));
    assertThat(lockedExisting).isTrue();
    assertThat(lockedMissing).isFalse();
  }
}

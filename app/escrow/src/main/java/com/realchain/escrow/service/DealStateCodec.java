/*
 * どこで: Escrow サービス層
 * 何を: StateStore の生の key/value と型付き DealRecord を相互変換する
 * なぜ: 型タグの判定を読み出し箇所ごとに繰り返さないため
 */
package com.realchain.escrow.service;

import com.realchain.escrow.model.DealRecord;
import com.realchain.escrow.model.DealStateSnapshot;
import com.realchain.escrow.model.DealStatus;
import com.realchain.escrow.model.StateKey;
import com.realchain.escrow.model.StateValue;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class DealStateCodec {

  public DealRecord decode(DealStateSnapshot snapshot) {
    return new DealRecord(
        snapshot.dealId(),
        requireBytes(snapshot, StateKey.SELLER),
        // buyer は ACTIVE の間は未設定
        snapshot.find(StateKey.BUYER).map(StateValue::bytes).orElse(null),
        requireUint(snapshot, StateKey.PRICE),
        requireUint(snapshot, StateKey.RESERVE),
        requireBytes(snapshot, StateKey.PROP_HASH),
        requireBytes(snapshot, StateKey.CUSTODIAN),
        Instant.ofEpochSecond(requireUint(snapshot, StateKey.CREATED)),
        Instant.ofEpochSecond(requireUint(snapshot, StateKey.DEADLINE)),
        DealStatus.fromCode(requireUint(snapshot, StateKey.STATUS)),
        snapshot.version(),
        snapshot.updatedAt());
  }

  public Map<StateKey, StateValue> encodeListing(
      String seller,
      long price,
      long reserve,
      String propertyHash,
      String custodian,
      Instant createdAt,
      Instant deadline) {
    final Map<StateKey, StateValue> values = new EnumMap<>(StateKey.class);
    values.put(StateKey.SELLER, StateValue.ofBytes(seller));
    values.put(StateKey.PRICE, StateValue.ofUint(price));
    values.put(StateKey.RESERVE, StateValue.ofUint(reserve));
    values.put(StateKey.PROP_HASH, StateValue.ofBytes(propertyHash));
    values.put(StateKey.CUSTODIAN, StateValue.ofBytes(custodian));
    values.put(StateKey.CREATED, StateValue.ofUint(createdAt.getEpochSecond()));
    values.put(StateKey.DEADLINE, StateValue.ofUint(deadline.getEpochSecond()));
    values.put(StateKey.STATUS, encodeStatus(DealStatus.ACTIVE));
    return values;
  }

  public StateValue encodeStatus(DealStatus status) {
    return StateValue.ofUint(status.code());
  }

  private String requireBytes(DealStateSnapshot snapshot, StateKey key) {
    return require(snapshot, key).bytes();
  }

  private long requireUint(DealStateSnapshot snapshot, StateKey key) {
    return require(snapshot, key).uint();
  }

  private StateValue require(DealStateSnapshot snapshot, StateKey key) {
    final StateValue value =
        snapshot
            .find(key)
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "deal state is incomplete: " + key.keyName() + " (deal " + snapshot.dealId() + ")"));
    if (value.type() != key.valueType()) {
      throw new IllegalStateException("unexpected value type for " + key.keyName());
    }
    return value;
  }
}

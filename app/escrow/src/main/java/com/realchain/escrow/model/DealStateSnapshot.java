/*
 * どこで: Escrow ドメインモデル
 * 何を: StateStore から読み出した Deal 1 件分の生の key/value を表す
 * なぜ: 型付き DealRecord へのデコードを 1 回で済ませるため
 */
package com.realchain.escrow.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public record DealStateSnapshot(
    UUID dealId, Map<StateKey, StateValue> values, long version, Instant updatedAt) {

  public DealStateSnapshot {
    final Map<StateKey, StateValue> copy = new EnumMap<>(StateKey.class);
    if (values != null) {
      copy.putAll(values);
    }
    values = Collections.unmodifiableMap(copy);
  }

  public Optional<StateValue> find(StateKey key) {
    return Optional.ofNullable(values.get(key));
  }
}

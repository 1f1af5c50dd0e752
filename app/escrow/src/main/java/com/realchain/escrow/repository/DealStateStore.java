/*
 * どこで: Escrow データアクセス
 * 何を: Deal 単位の型付き key/value state の読み書きを定義する
 * なぜ: 状態遷移ロジックを永続化方式から切り離すため
 */
package com.realchain.escrow.repository;

import com.realchain.escrow.model.DealStateSnapshot;
import com.realchain.escrow.model.StateKey;
import com.realchain.escrow.model.StateValue;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface DealStateStore {

  /** Deal のヘッダ行を作成する。state はまだ 1 件も持たない。 */
  void create(UUID dealId, Instant createdAt);

  /**
   * Deal のヘッダ行を排他ロックする。呼び出し元のトランザクション終了まで同一 Deal の操作は直列化される。
   *
   * @return Deal が存在すれば true
   */
  boolean lock(UUID dealId);

  Optional<StateValue> find(UUID dealId, StateKey key);

  /**
   * @throws StateKeyNotFoundException キーが未設定の場合
   */
  default StateValue get(UUID dealId, StateKey key) {
    return find(dealId, key).orElseThrow(() -> new StateKeyNotFoundException(dealId, key));
  }

  default boolean exists(UUID dealId, StateKey key) {
    return find(dealId, key).isPresent();
  }

  /**
   * @throws IllegalArgumentException 値の型がキーの宣言型と一致しない場合
   */
  void put(UUID dealId, StateKey key, StateValue value);

  Optional<DealStateSnapshot> load(UUID dealId);

  /** version を 1 進めて新しい version を返す。 */
  long touch(UUID dealId, Instant updatedAt);

  List<UUID> findDealIdsByBytesValue(StateKey key, String value);

  static void requireDeclaredType(StateKey key, StateValue value) {
    if (value == null) {
      throw new IllegalArgumentException("state value is required: " + key.keyName());
    }
    if (key.valueType() != value.type()) {
      throw new IllegalArgumentException(
          "state key " + key.keyName() + " expects " + key.valueType() + " but got " + value.type());
    }
  }
}

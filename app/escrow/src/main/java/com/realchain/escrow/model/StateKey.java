/*
 * どこで: Escrow ドメインモデル
 * 何を: Deal 単位の key/value state のキーと値の型を定義する
 * なぜ: 型タグの判定を StateStore 境界の 1 か所に閉じ込めるため
 */
package com.realchain.escrow.model;

public enum StateKey {
  SELLER("seller", StateValueType.BYTES),
  BUYER("buyer", StateValueType.BYTES),
  PRICE("price", StateValueType.UINT),
  RESERVE("reserve", StateValueType.UINT),
  PROP_HASH("prop_hash", StateValueType.BYTES),
  CREATED("created", StateValueType.UINT),
  DEADLINE("deadline", StateValueType.UINT),
  STATUS("status", StateValueType.UINT),
  CUSTODIAN("custodian", StateValueType.BYTES);

  private final String keyName;
  private final StateValueType valueType;

  StateKey(String keyName, StateValueType valueType) {
    this.keyName = keyName;
    this.valueType = valueType;
  }

  public String keyName() {
    return keyName;
  }

  public StateValueType valueType() {
    return valueType;
  }

  public static StateKey fromKeyName(String keyName) {
    for (StateKey key : values()) {
      if (key.keyName.equals(keyName)) {
        return key;
      }
    }
    throw new IllegalArgumentException("unknown state key: " + keyName);
  }
}

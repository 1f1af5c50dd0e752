/*
 * どこで: Escrow ドメインモデル
 * 何を: StateStore に保存する型付きの値を表す
 * なぜ: 「未設定」と「ゼロ値/空文字」を区別して扱うため
 */
package com.realchain.escrow.model;

public record StateValue(StateValueType type, String bytes, long uint) {

  public StateValue {
    if (type == null) {
      throw new IllegalArgumentException("state value type is required");
    }
    if (type == StateValueType.BYTES && bytes == null) {
      throw new IllegalArgumentException("bytes value is required");
    }
    if (type == StateValueType.UINT && uint < 0) {
      // 符号なし 64-bit のうち long で表現できる範囲のみ受け付ける
      throw new IllegalArgumentException("uint value must not be negative");
    }
  }

  public static StateValue ofBytes(String bytes) {
    return new StateValue(StateValueType.BYTES, bytes, 0L);
  }

  public static StateValue ofUint(long uint) {
    return new StateValue(StateValueType.UINT, null, uint);
  }
}

package com.realchain.escrow.repository;

import com.realchain.escrow.model.StateKey;
import java.util.UUID;

// 未設定のキーを get したときに送出する。ゼロ値/空文字が保存されている場合とは区別される。
public class StateKeyNotFoundException extends RuntimeException {

  public StateKeyNotFoundException(UUID dealId, StateKey key) {
    super("state key is not set: " + key.keyName() + " (deal " + dealId + ")");
  }
}

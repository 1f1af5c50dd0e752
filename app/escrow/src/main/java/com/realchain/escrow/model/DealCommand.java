/*
 * どこで: Escrow ドメインモデル
 * 何を: dispatch へ渡す 1 回分の操作要求を表す
 * なぜ: REST/テストなど入口に依存せず同じ経路で処理するため
 */
package com.realchain.escrow.model;

import java.util.UUID;

public record DealCommand(
    DealAction action,
    UUID dealId,
    String callerId,
    DealArguments arguments,
    TransactionBundle bundle) {

  public DealCommand {
    arguments = arguments == null ? DealArguments.none() : arguments;
    bundle = bundle == null ? new TransactionBundle(null) : bundle;
  }
}

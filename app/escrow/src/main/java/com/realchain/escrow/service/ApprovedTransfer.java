/*
 * どこで: Escrow サービス層
 * 何を: ガード評価とバンドル検証を通過した custody 移動を表す
 * なぜ: custodian 発の送金を TransactionBundleValidator だけが生成できるようにするため
 */
package com.realchain.escrow.service;

import com.realchain.escrow.model.TransferKind;
import java.util.Objects;
import java.util.UUID;

public final class ApprovedTransfer {

  private final UUID dealId;
  private final TransferKind kind;
  private final String sender;
  private final String receiver;
  private final long amount;

  // パッケージ外からは生成できない。
  ApprovedTransfer(UUID dealId, TransferKind kind, String sender, String receiver, long amount) {
    this.dealId = Objects.requireNonNull(dealId, "dealId");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.sender = Objects.requireNonNull(sender, "sender");
    this.receiver = Objects.requireNonNull(receiver, "receiver");
    this.amount = amount;
  }

  public UUID dealId() {
    return dealId;
  }

  public TransferKind kind() {
    return kind;
  }

  public String sender() {
    return sender;
  }

  public String receiver() {
    return receiver;
  }

  public long amount() {
    return amount;
  }

  @Override
  public String toString() {
    return "ApprovedTransfer[" + kind + " " + sender + "->" + receiver + " " + amount + "]";
  }
}

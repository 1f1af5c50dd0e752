/*
 * どこで: Escrow ドメインモデル
 * 何を: 全件適用か全件棄却のどちらかになる台帳トランザクション群を表す
 * なぜ: 資金移動と状態遷移を 1 単位として受け渡すため
 */
package com.realchain.escrow.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record TransactionBundle(List<BundleTransaction> transactions) {

  public TransactionBundle {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    transactions =
        transactions == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(transactions));
  }

  public static TransactionBundle of(BundleTransaction... transactions) {
    return new TransactionBundle(List.of(transactions));
  }

  public int size() {
    return transactions.size();
  }

  public List<BundleTransaction> payments() {
    return transactions.stream().filter(BundleTransaction::isPayment).toList();
  }

  public List<BundleTransaction> appCalls() {
    return transactions.stream().filter(BundleTransaction::isAppCall).toList();
  }
}

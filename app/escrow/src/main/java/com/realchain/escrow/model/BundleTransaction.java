/*
 * どこで: Escrow ドメインモデル
 * 何を: バンドルを構成する 1 件の台帳トランザクションを表す
 * なぜ: 送金とアプリ呼び出しを同じ形で検証できるようにするため
 */
package com.realchain.escrow.model;

public record BundleTransaction(
    BundleTransactionType type, String sender, String receiver, long amount, String method) {

  public static BundleTransaction payment(String sender, String receiver, long amount) {
    return new BundleTransaction(BundleTransactionType.PAYMENT, sender, receiver, amount, null);
  }

  public static BundleTransaction appCall(String sender, String method) {
    return new BundleTransaction(BundleTransactionType.APP_CALL, sender, null, 0L, method);
  }

  public boolean isPayment() {
    return type == BundleTransactionType.PAYMENT;
  }

  public boolean isAppCall() {
    return type == BundleTransactionType.APP_CALL;
  }
}

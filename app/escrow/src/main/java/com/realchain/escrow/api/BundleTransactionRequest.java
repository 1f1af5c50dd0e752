/*
 * どこで: Escrow API
 * 何を: バンドル内の 1 トランザクションの入力を保持する
 * なぜ: 署名済みバンドルをドメインモデルへ変換するため
 */
package com.realchain.escrow.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.realchain.escrow.model.BundleTransaction;
import com.realchain.escrow.model.BundleTransactionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BundleTransactionRequest(
    @NotNull(message = "bundle type is required") BundleTransactionType type,
    @NotBlank(message = "bundle sender is required") String sender,
    String receiver,
    @PositiveOrZero(message = "bundle amount must not be negative") Long amount,
    String method) {

  public BundleTransaction toModel() {
    return new BundleTransaction(type, sender, receiver, amount == null ? 0L : amount, method);
  }
}

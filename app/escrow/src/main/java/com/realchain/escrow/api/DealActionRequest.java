/*
 * どこで: Escrow API
 * 何を: make_offer / confirm_transfer / cancel_deal のリクエストを保持する
 * なぜ: 3 操作で共通のバンドル入力を 1 つの形にまとめるため
 */
package com.realchain.escrow.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.realchain.escrow.model.TransactionBundle;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * @param bundle 署名済みのバンドル
 * @param propertyHash confirm_transfer でのみ参照する。指定時は登録済みのハッシュと一致する必要がある
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DealActionRequest(
    @NotEmpty(message = "bundle is required")
        List<@NotNull(message = "bundle entry must not be null") @Valid BundleTransactionRequest>
            bundle,
    String propertyHash) {

  public DealActionRequest {
    // SpotBugs の EI_EXPOSE_REP 対応: 受け取ったリストを防御的コピーして不変化する
    if (bundle != null) {
      bundle = Collections.unmodifiableList(new ArrayList<>(bundle));
    }
  }

  public TransactionBundle toBundle() {
    return new TransactionBundle(bundle.stream().map(BundleTransactionRequest::toModel).toList());
  }
}

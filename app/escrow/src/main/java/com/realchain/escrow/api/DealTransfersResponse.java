/*
 * どこで: Escrow API
 * 何を: Deal に紐づく custody 移動の一覧レスポンスを表す
 * なぜ: 入金/payout/返金の履歴を状態と合わせて確認できるようにするため
 */
package com.realchain.escrow.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DealTransfersResponse(UUID dealId, List<CustodyTransferResponse> transfers) {
  public DealTransfersResponse {
    if (transfers != null) {
      transfers = Collections.unmodifiableList(new ArrayList<>(transfers));
    }
  }
}

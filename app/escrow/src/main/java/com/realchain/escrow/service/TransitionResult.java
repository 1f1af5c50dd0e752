package com.realchain.escrow.service;

import com.realchain.escrow.model.DealRecord;
import com.realchain.escrow.model.DealStatus;
import java.util.List;

/**
 * 1 回の状態遷移の結果。
 *
 * @param fromStatus 遷移前の状態。create_listing では null
 * @param deal 遷移後のスナップショット
 * @param transfers 同一バンドルで適用する custody 移動
 */
public record TransitionResult(DealStatus fromStatus, DealRecord deal, List<ApprovedTransfer> transfers) {

  public TransitionResult {
    transfers = transfers == null ? List.of() : List.copyOf(transfers);
  }
}

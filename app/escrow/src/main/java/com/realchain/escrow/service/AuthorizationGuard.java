/*
 * どこで: Escrow サービス層
 * 何を: 呼び出し元の役割を Deal に記録された seller/buyer と照合する
 * なぜ: 役割判定と deadline 後のキャンセル開放を 1 か所で扱うため
 */
package com.realchain.escrow.service;

import com.realchain.escrow.api.UnauthorizedDealActionException;
import com.realchain.escrow.model.DealRecord;
import com.realchain.escrow.model.DealRole;
import java.time.Instant;
import org.springframework.stereotype.Component;

@Component
public class AuthorizationGuard {

  public boolean hasRole(DealRecord deal, String caller, DealRole role) {
    if (caller == null || caller.isBlank()) {
      return false;
    }
    return switch (role) {
      case SELLER -> caller.equals(deal.seller());
      // buyer 未記録の間は誰も BUYER を満たさない
      case BUYER -> deal.hasBuyer() && caller.equals(deal.buyer());
      case SELLER_OR_BUYER -> hasRole(deal, caller, DealRole.SELLER)
          || hasRole(deal, caller, DealRole.BUYER);
      case ANYONE -> true;
    };
  }

  public void authorize(DealRecord deal, String caller, DealRole role) {
    if (!hasRole(deal, caller, role)) {
      throw new UnauthorizedDealActionException(
          "caller " + caller + " is not " + role.name().toLowerCase() + " of deal " + deal.dealId());
    }
  }

  /** seller 自身による自分の出品へのオファーを拒否する。 */
  public void authorizeOffer(DealRecord deal, String caller) {
    authorize(deal, caller, DealRole.ANYONE);
    if (hasRole(deal, caller, DealRole.SELLER)) {
      throw new UnauthorizedDealActionException("seller cannot make an offer on own listing");
    }
  }

  /**
   * deadline 到達後は誰でもキャンセルできる。それまでは seller か buyer に限る。
   */
  public void authorizeCancellation(DealRecord deal, String caller, Instant now) {
    if (deal.isExpired(now)) {
      authorize(deal, caller, DealRole.ANYONE);
      return;
    }
    authorize(deal, caller, DealRole.SELLER_OR_BUYER);
  }
}

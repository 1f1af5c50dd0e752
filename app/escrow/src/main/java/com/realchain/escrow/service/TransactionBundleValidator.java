/*
 * どこで: Escrow サービス層
 * 何を: 状態遷移に同梱された送金バンドルの形状・相手先・金額を検証する
 * なぜ: 資金移動と状態遷移を 1 対 1 で結び付け、custodian 発の送金をここだけで承認するため
 */
package com.realchain.escrow.service;

import com.realchain.escrow.api.BundleMismatchException;
import com.realchain.escrow.model.BundleTransaction;
import com.realchain.escrow.model.DealAction;
import com.realchain.escrow.model.DealRecord;
import com.realchain.escrow.model.TransactionBundle;
import com.realchain.escrow.model.TransferKind;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class TransactionBundleValidator {

  private static final int PAYMENT_BUNDLE_SIZE = 2;
  private static final int CALL_ONLY_BUNDLE_SIZE = 1;

  /** buyer から custodian への price 全額の入金を検証する。 */
  public ApprovedTransfer validateOffer(
      DealRecord deal, String caller, TransactionBundle bundle) {
    requireSize(bundle, PAYMENT_BUNDLE_SIZE);
    requireAppCall(bundle, caller, DealAction.MAKE_OFFER);
    final BundleTransaction payment = requireSinglePayment(bundle);
    if (payment.amount() <= 0 || payment.amount() != deal.price()) {
      throw mismatch("payment amount must equal price " + deal.price() + " but was " + payment.amount());
    }
    if (!caller.equals(payment.sender())) {
      throw mismatch("payment sender must be the caller");
    }
    if (!deal.custodian().equals(payment.receiver())) {
      throw mismatch("payment receiver must be the custodian " + deal.custodian());
    }
    return new ApprovedTransfer(
        deal.dealId(), TransferKind.DEPOSIT, payment.sender(), payment.receiver(), payment.amount());
  }

  /** custodian から seller への payout を検証する。 */
  public ApprovedTransfer validatePayout(
      DealRecord deal, String caller, TransactionBundle bundle) {
    requireSize(bundle, PAYMENT_BUNDLE_SIZE);
    requireAppCall(bundle, caller, DealAction.CONFIRM_TRANSFER);
    final BundleTransaction payment = requireSinglePayment(bundle);
    requireCustodianPayment(deal, payment, deal.seller(), "seller");
    return new ApprovedTransfer(
        deal.dealId(), TransferKind.PAYOUT, payment.sender(), payment.receiver(), payment.amount());
  }

  /**
   * buyer が記録済みなら custodian から buyer への返金を、未記録なら呼び出しのみのバンドルを検証する。
   *
   * @return 返金がある場合のみ承認済みの移動
   */
  public Optional<ApprovedTransfer> validateCancellation(
      DealRecord deal, String caller, TransactionBundle bundle) {
    if (!deal.hasBuyer()) {
      requireSize(bundle, CALL_ONLY_BUNDLE_SIZE);
      requireAppCall(bundle, caller, DealAction.CANCEL_DEAL);
      return Optional.empty();
    }
    requireSize(bundle, PAYMENT_BUNDLE_SIZE);
    requireAppCall(bundle, caller, DealAction.CANCEL_DEAL);
    final BundleTransaction payment = requireSinglePayment(bundle);
    requireCustodianPayment(deal, payment, deal.buyer(), "buyer");
    return Optional.of(
        new ApprovedTransfer(
            deal.dealId(),
            TransferKind.REFUND,
            payment.sender(),
            payment.receiver(),
            payment.amount()));
  }

  private void requireCustodianPayment(
      DealRecord deal, BundleTransaction payment, String expectedReceiver, String receiverRole) {
    if (!deal.custodian().equals(payment.sender())) {
      throw mismatch("payment sender must be the custodian " + deal.custodian());
    }
    if (!expectedReceiver.equals(payment.receiver())) {
      throw mismatch("payment receiver must be the " + receiverRole);
    }
    final long expected = deal.payoutAmount();
    if (payment.amount() <= 0) {
      throw mismatch("custodian payment amount must be positive but was " + payment.amount());
    }
    if (payment.amount() != expected) {
      throw mismatch(
          "payment amount must equal price minus reserve " + expected + " but was " + payment.amount());
    }
  }

  private void requireSize(TransactionBundle bundle, int expected) {
    if (bundle.size() != expected) {
      throw mismatch("bundle size must be " + expected + " but was " + bundle.size());
    }
  }

  private void requireAppCall(TransactionBundle bundle, String caller, DealAction action) {
    final List<BundleTransaction> appCalls = bundle.appCalls();
    if (appCalls.size() != 1) {
      throw mismatch("bundle must contain exactly one app call");
    }
    final BundleTransaction appCall = appCalls.get(0);
    if (!caller.equals(appCall.sender())) {
      throw mismatch("app call sender must be the caller");
    }
    if (!action.wireName().equals(appCall.method())) {
      throw mismatch("app call method must be " + action.wireName());
    }
  }

  private BundleTransaction requireSinglePayment(TransactionBundle bundle) {
    final List<BundleTransaction> payments = bundle.payments();
    if (payments.size() != 1) {
      throw mismatch("bundle must contain exactly one payment");
    }
    return payments.get(0);
  }

  private BundleMismatchException mismatch(String message) {
    return new BundleMismatchException(message);
  }
}

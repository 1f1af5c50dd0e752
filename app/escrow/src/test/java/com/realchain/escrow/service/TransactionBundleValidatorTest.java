/*
 * どこで: TransactionBundleValidator の単体テスト
 * 何を: バンドルの件数・呼び出し・相手先・金額の検証ルールを確認する
 * なぜ: 資金移動と状態遷移の対応が崩れたバンドルを確実に拒否するため
 */
package com.realchain.escrow.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.realchain.escrow.api.BundleMismatchException;
import com.realchain.escrow.model.BundleTransaction;
import com.realchain.escrow.model.DealRecord;
import com.realchain.escrow.model.DealStatus;
import com.realchain.escrow.model.TransactionBundle;
import com.realchain.escrow.model.TransferKind;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TransactionBundleValidatorTest {

  private static final UUID DEAL_ID = UUID.fromString("7d1f8a64-4c1e-4f39-9d43-0c6a9e3a2b11");
  private static final String CUSTODIAN = "escrow-custodian-" + DEAL_ID;
  private static final Instant CREATED_AT = Instant.parse("2026-01-17T00:00:00Z");

  private final TransactionBundleValidator validator = new TransactionBundleValidator();

  @Test
  void validateOfferApprovesDepositToCustodian() {
    final ApprovedTransfer transfer =
        validator.validateOffer(
            deal(null, DealStatus.ACTIVE),
            "buyer",
            TransactionBundle.of(
                BundleTransaction.appCall("buyer", "make_offer"),
                BundleTransaction.payment("buyer", CUSTODIAN, 1000L)));

    assertThat(transfer.kind()).isEqualTo(TransferKind.DEPOSIT);
    assertThat(transfer.dealId()).isEqualTo(DEAL_ID);
    assertThat(transfer.amount()).isEqualTo(1000L);
  }

  @Test
  void validateOfferRejectsMissingPayment() {
    assertMismatch(
        () ->
            validator.validateOffer(
                deal(null, DealStatus.ACTIVE),
                "buyer",
                TransactionBundle.of(BundleTransaction.appCall("buyer", "make_offer"))),
        "bundle size must be 2");
  }

  @Test
  void validateOfferRejectsTwoPayments() {
    assertMismatch(
        () ->
            validator.validateOffer(
                deal(null, DealStatus.ACTIVE),
                "buyer",
                TransactionBundle.of(
                    BundleTransaction.payment("buyer", CUSTODIAN, 500L),
                    BundleTransaction.payment("buyer", CUSTODIAN, 500L))),
        "exactly one app call");
  }

  @Test
  void validateOfferRejectsPaymentFromSomeoneElse() {
    assertMismatch(
        () ->
            validator.validateOffer(
                deal(null, DealStatus.ACTIVE),
                "buyer",
                TransactionBundle.of(
                    BundleTransaction.payment("sponsor", CUSTODIAN, 1000L),
                    BundleTransaction.appCall("buyer", "make_offer"))),
        "payment sender must be the caller");
  }

  @Test
  void validateOfferRejectsPaymentToOtherReceiver() {
    assertMismatch(
        () ->
            validator.validateOffer(
                deal(null, DealStatus.ACTIVE),
                "buyer",
                TransactionBundle.of(
                    BundleTransaction.payment("buyer", "seller", 1000L),
                    BundleTransaction.appCall("buyer", "make_offer"))),
        "receiver must be the custodian");
  }

  @Test
  void validateOfferRejectsCallForOtherMethod() {
    assertMismatch(
        () ->
            validator.validateOffer(
                deal(null, DealStatus.ACTIVE),
                "buyer",
                TransactionBundle.of(
                    BundleTransaction.payment("buyer", CUSTODIAN, 1000L),
                    BundleTransaction.appCall("buyer", "cancel_deal"))),
        "method must be make_offer");
  }

  @Test
  void validateOfferRejectsCallSignedByAnotherAccount() {
    assertMismatch(
        () ->
            validator.validateOffer(
                deal(null, DealStatus.ACTIVE),
                "buyer",
                TransactionBundle.of(
                    BundleTransaction.payment("buyer", CUSTODIAN, 1000L),
                    BundleTransaction.appCall("someone", "make_offer"))),
        "app call sender must be the caller");
  }

  @Test
  void validatePayoutRequiresPriceMinusReserve() {
    final DealRecord pending = deal("buyer", DealStatus.PENDING);

    assertMismatch(
        () ->
            validator.validatePayout(
                pending,
                "seller",
                TransactionBundle.of(
                    BundleTransaction.payment(CUSTODIAN, "seller", 1000L),
                    BundleTransaction.appCall("seller", "confirm_transfer"))),
        "price minus reserve 900");

    final ApprovedTransfer transfer =
        validator.validatePayout(
            pending,
            "seller",
            TransactionBundle.of(
                BundleTransaction.payment(CUSTODIAN, "seller", 900L),
                BundleTransaction.appCall("seller", "confirm_transfer")));
    assertThat(transfer.kind()).isEqualTo(TransferKind.PAYOUT);
    assertThat(transfer.receiver()).isEqualTo("seller");
  }

  @Test
  void validatePayoutRejectsPaymentNotFromCustodian() {
    assertMismatch(
        () ->
            validator.validatePayout(
                deal("buyer", DealStatus.PENDING),
                "seller",
                TransactionBundle.of(
                    BundleTransaction.payment("buyer", "seller", 900L),
                    BundleTransaction.appCall("seller", "confirm_transfer"))),
        "sender must be the custodian");
  }

  @Test
  void validateCancellationWithoutBuyerAcceptsCallOnly() {
    final Optional<ApprovedTransfer> refund =
        validator.validateCancellation(
            deal(null, DealStatus.ACTIVE),
            "seller",
            TransactionBundle.of(BundleTransaction.appCall("seller", "cancel_deal")));

    assertThat(refund).isEmpty();
  }

  @Test
  void validateCancellationWithoutBuyerRejectsPayment() {
    assertMismatch(
        () ->
            validator.validateCancellation(
                deal(null, DealStatus.ACTIVE),
                "seller",
                TransactionBundle.of(
                    BundleTransaction.payment(CUSTODIAN, "seller", 900L),
                    BundleTransaction.appCall("seller", "cancel_deal"))),
        "bundle size must be 1");
  }

  @Test
  void validateCancellationWithBuyerRequiresRefundToBuyer() {
    final DealRecord pending = deal("buyer", DealStatus.PENDING);

    assertMismatch(
        () ->
            validator.validateCancellation(
                pending,
                "buyer",
                TransactionBundle.of(BundleTransaction.appCall("buyer", "cancel_deal"))),
        "bundle size must be 2");
    assertMismatch(
        () ->
            validator.validateCancellation(
                pending,
                "seller",
                TransactionBundle.of(
                    BundleTransaction.payment(CUSTODIAN, "seller", 900L),
                    BundleTransaction.appCall("seller", "cancel_deal"))),
        "receiver must be the buyer");

    final Optional<ApprovedTransfer> refund =
        validator.validateCancellation(
            pending,
            "seller",
            TransactionBundle.of(
                BundleTransaction.payment(CUSTODIAN, "buyer", 900L),
                BundleTransaction.appCall("seller", "cancel_deal")));
    assertThat(refund).hasValueSatisfying(t -> assertThat(t.kind()).isEqualTo(TransferKind.REFUND));
  }

  @Test
  void payoutAmountWithholdsReserve() {
    assertThat(deal("buyer", DealStatus.PENDING).payoutAmount()).isEqualTo(900L);
  }

  @Test
  void custodianPaymentsFollowTheReserveStoredWithTheDeal() {
    final DealRecord pending = withReserve(deal("buyer", DealStatus.PENDING), 400L);

    final Optional<ApprovedTransfer> refund =
        validator.validateCancellation(
            pending,
            "buyer",
            TransactionBundle.of(
                BundleTransaction.payment(CUSTODIAN, "buyer", 600L),
                BundleTransaction.appCall("buyer", "cancel_deal")));

    assertThat(refund).hasValueSatisfying(t -> assertThat(t.amount()).isEqualTo(600L));
  }

  @Test
  void custodianPaymentRejectsNonPositiveAmount() {
    // reserve が price 以上の壊れた state でも負の払い出しは承認しない
    final DealRecord pending = withReserve(deal("buyer", DealStatus.PENDING), 1050L);

    assertMismatch(
        () ->
            validator.validateCancellation(
                pending,
                "buyer",
                TransactionBundle.of(
                    BundleTransaction.payment(CUSTODIAN, "buyer", -50L),
                    BundleTransaction.appCall("buyer", "cancel_deal"))),
        "must be positive");
    assertMismatch(
        () ->
            validator.validatePayout(
                pending,
                "seller",
                TransactionBundle.of(
                    BundleTransaction.payment(CUSTODIAN, "seller", 0L),
                    BundleTransaction.appCall("seller", "confirm_transfer"))),
        "must be positive");
  }

  private DealRecord withReserve(DealRecord deal, long reserve) {
    return new DealRecord(
        deal.dealId(),
        deal.seller(),
        deal.buyer(),
        deal.price(),
        reserve,
        deal.propertyHash(),
        deal.custodian(),
        deal.createdAt(),
        deal.deadline(),
        deal.status(),
        deal.version(),
        deal.updatedAt());
  }

  private void assertMismatch(Runnable action, String expectedMessage) {
    assertThatThrownBy(action::run)
        .isInstanceOf(BundleMismatchException.class)
        .hasMessageContaining(expectedMessage);
  }

  private DealRecord deal(String buyer, DealStatus status) {
    return new DealRecord(
        DEAL_ID,
        "seller",
        buyer,
        1000L,
        100L,
        "sha256:docs",
        CUSTODIAN,
        CREATED_AT,
        CREATED_AT.plus(Duration.ofDays(30)),
        status,
        1L,
        CREATED_AT);
  }
}

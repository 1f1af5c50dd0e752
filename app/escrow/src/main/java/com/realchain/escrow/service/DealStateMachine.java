/*
 * どこで: Escrow サービス層
 * 何を: Deal のライフサイクル遷移 (ACTIVE -> PENDING -> COMPLETED/CANCELLED) を実行する
 * なぜ: 全ガードを書き込み前に評価し、失敗時に state を一切変更しないため
 */
package com.realchain.escrow.service;

import com.realchain.escrow.api.DealExpiredException;
import com.realchain.escrow.api.DealNotActiveException;
import com.realchain.escrow.api.DealNotCancellableException;
import com.realchain.escrow.api.DealNotFoundException;
import com.realchain.escrow.api.DealNotPendingException;
import com.realchain.escrow.api.PropertyHashMismatchException;
import com.realchain.escrow.config.EscrowDealProperties;
import com.realchain.escrow.model.DealRecord;
import com.realchain.escrow.model.DealRole;
import com.realchain.escrow.model.DealStatus;
import com.realchain.escrow.model.StateKey;
import com.realchain.escrow.model.StateValue;
import com.realchain.escrow.model.TransactionBundle;
import com.realchain.escrow.repository.DealStateStore;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Deal の状態遷移を担う唯一のコンポーネント。
 *
 * <p>各操作は Deal のヘッダ行をロックしてから state を読み、ガードを全て評価した後にのみ書き込む。
 * そのため型付き失敗が送出された場合、state は呼び出し前と同一のまま残る。ガードの評価順は操作ごとに
 * 固定されている。
 *
 * <ul>
 *   <li>make_offer: status, deadline, role, bundle
 *   <li>confirm_transfer: role, status, deadline, property hash, bundle
 *   <li>cancel_deal: status, role (deadline 到達後は誰でも可), bundle
 * </ul>
 *
 * <p>トランザクション境界は呼び出し元 ({@link EscrowFacade}) が持つ。
 */
@Component
@RequiredArgsConstructor
public class DealStateMachine {

  private final DealStateStore stateStore;
  private final DealStateCodec codec;
  private final AuthorizationGuard authorizationGuard;
  private final TransactionBundleValidator bundleValidator;
  private final EscrowDealProperties properties;

  public TransitionResult createListing(
      UUID dealId, String caller, long price, String propertyHash, Instant now) {
    if (caller == null || caller.isBlank()) {
      throw new IllegalArgumentException("caller is required");
    }
    if (propertyHash == null || propertyHash.isBlank()) {
      throw new IllegalArgumentException("property_hash is required");
    }
    // reserve は出品時点の値で固定し、以降の設定変更で payout が変わらないようにする
    final long reserve = properties.reserve();
    if (price <= reserve) {
      throw new IllegalArgumentException("price must be greater than reserve " + reserve);
    }
    // state は epoch 秒で保持する
    final Instant createdAt = now.truncatedTo(ChronoUnit.SECONDS);
    final Instant deadline = createdAt.plus(properties.window());
    final String custodian = properties.custodianPrefix() + dealId;
    stateStore.create(dealId, createdAt);
    final Map<StateKey, StateValue> values =
        codec.encodeListing(caller, price, reserve, propertyHash, custodian, createdAt, deadline);
    values.forEach((key, value) -> stateStore.put(dealId, key, value));
    stateStore.touch(dealId, createdAt);
    return new TransitionResult(null, read(dealId), List.of());
  }

  public TransitionResult makeOffer(
      UUID dealId, String caller, TransactionBundle bundle, Instant now) {
    final DealRecord deal = lockAndLoad(dealId);
    if (deal.status() != DealStatus.ACTIVE) {
      throw new DealNotActiveException("deal " + dealId + " is " + deal.status());
    }
    if (deal.isExpired(now)) {
      throw new DealExpiredException("deal " + dealId + " expired at " + deal.deadline());
    }
    authorizationGuard.authorizeOffer(deal, caller);
    final ApprovedTransfer deposit = bundleValidator.validateOffer(deal, caller, bundle);

    stateStore.put(dealId, StateKey.BUYER, StateValue.ofBytes(caller));
    stateStore.put(dealId, StateKey.STATUS, codec.encodeStatus(DealStatus.PENDING));
    stateStore.touch(dealId, now);
    return new TransitionResult(deal.status(), read(dealId), List.of(deposit));
  }

  public TransitionResult confirmTransfer(
      UUID dealId, String caller, TransactionBundle bundle, String propertyHash, Instant now) {
    final DealRecord deal = lockAndLoad(dealId);
    authorizationGuard.authorize(deal, caller, DealRole.SELLER);
    if (deal.status() != DealStatus.PENDING) {
      throw new DealNotPendingException("deal " + dealId + " is " + deal.status());
    }
    // deadline 後の PENDING はキャンセルでしか解消できない
    if (deal.isExpired(now)) {
      throw new DealExpiredException("deal " + dealId + " expired at " + deal.deadline());
    }
    if (propertyHash != null && !propertyHash.equals(deal.propertyHash())) {
      throw new PropertyHashMismatchException("property_hash does not match the listing");
    }
    final ApprovedTransfer payout = bundleValidator.validatePayout(deal, caller, bundle);

    stateStore.put(dealId, StateKey.STATUS, codec.encodeStatus(DealStatus.COMPLETED));
    stateStore.touch(dealId, now);
    return new TransitionResult(deal.status(), read(dealId), List.of(payout));
  }

  public TransitionResult cancelDeal(
      UUID dealId, String caller, TransactionBundle bundle, Instant now) {
    final DealRecord deal = lockAndLoad(dealId);
    if (deal.status().isTerminal()) {
      throw new DealNotCancellableException("deal " + dealId + " is " + deal.status());
    }
    authorizationGuard.authorizeCancellation(deal, caller, now);
    final Optional<ApprovedTransfer> refund =
        bundleValidator.validateCancellation(deal, caller, bundle);

    stateStore.put(dealId, StateKey.STATUS, codec.encodeStatus(DealStatus.CANCELLED));
    stateStore.touch(dealId, now);
    return new TransitionResult(deal.status(), read(dealId), refund.stream().toList());
  }

  /** ロックを取らずに現在のスナップショットを返す。 */
  public DealRecord read(UUID dealId) {
    return stateStore
        .load(dealId)
        .map(codec::decode)
        .orElseThrow(() -> notFound(dealId));
  }

  private DealRecord lockAndLoad(UUID dealId) {
    if (!stateStore.lock(dealId)) {
      throw notFound(dealId);
    }
    return read(dealId);
  }

  private DealNotFoundException notFound(UUID dealId) {
    return new DealNotFoundException("deal not found: " + dealId);
  }
}

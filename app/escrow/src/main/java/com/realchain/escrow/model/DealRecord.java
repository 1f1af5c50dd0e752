/*
 * どこで: Escrow ドメインモデル
 * 何を: Deal の型付きスナップショットを表す
 * なぜ: ガード評価・API 応答・イベント生成で共通化するため
 */
package com.realchain.escrow.model;

import java.time.Instant;
import java.util.UUID;

public record DealRecord(
        UUID dealId,
        String seller,
        String buyer,
        long price,
        long reserve,
        String propertyHash,
        String custodian,
        Instant createdAt,
        Instant deadline,
        DealStatus status,
        long version,
        Instant updatedAt) {

    // custodian から払い出す額。reserve は出品時に固定される。
    public long payoutAmount() {
        return price - reserve;
    }

    public boolean hasBuyer() {
        return buyer != null;
    }

    // deadline ちょうどは期限切れとして扱う。
    public boolean isExpired(Instant now) {
        return !now.isBefore(deadline);
    }
}

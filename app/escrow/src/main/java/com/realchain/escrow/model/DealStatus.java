/*
 * どこで: Escrow ドメインモデル
 * 何を: Deal の状態と StateStore 上の数値コードを定義する
 * なぜ: 状態遷移と永続化の整合性を保つため
 */
package com.realchain.escrow.model;

public enum DealStatus {
    ACTIVE(0),
    PENDING(1),
    COMPLETED(2),
    CANCELLED(3);

    private final long code;

    DealStatus(long code) {
        this.code = code;
    }

    public long code() {
        return code;
    }

    // COMPLETED/CANCELLED からはどの操作でも遷移しない。
    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public static DealStatus fromCode(long code) {
        for (DealStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown deal status code: " + code);
    }
}

/*
 * どこで: Escrow ドメインモデル
 * 何を: 外部公開する操作名と対応するイベント種別を定義する
 * なぜ: dispatch のルーティングと outbox の event_type を一致させるため
 */
package com.realchain.escrow.model;

public enum DealAction {
    CREATE_LISTING("create_listing", "DealListed"),
    MAKE_OFFER("make_offer", "OfferMade"),
    CONFIRM_TRANSFER("confirm_transfer", "TransferConfirmed"),
    CANCEL_DEAL("cancel_deal", "DealCancelled");

    private final String wireName;
    private final String eventType;

    DealAction(String wireName, String eventType) {
        this.wireName = wireName;
        this.eventType = eventType;
    }

    public String wireName() {
        return wireName;
    }

    public String eventType() {
        return eventType;
    }

    public static DealAction fromWireName(String wireName) {
        for (DealAction action : values()) {
            if (action.wireName.equals(wireName)) {
                return action;
            }
        }
        throw new IllegalArgumentException("unsupported action: " + wireName);
    }
}

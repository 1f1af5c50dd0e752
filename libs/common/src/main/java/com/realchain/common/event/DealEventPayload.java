/*
 * どこで: common のイベント payload 定義
 * 何を: Deal 状態遷移の outbox payload を共通レコードとして提供する
 * なぜ: escrow と購読側で同一のペイロード形状を共有するため
 */
package com.realchain.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DealEventPayload(
        String eventId,
        String eventType,
        String occurredAt,
        String dealId,
        String callerId,
        String seller,
        String buyer,
        String status,
        long price,
        String propertyHash,
        long version,
        List<Transfer> transfers,
        String traceId) {

    public DealEventPayload {
        transfers = transfers == null ? List.of() : List.copyOf(transfers);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Transfer(String kind, String sender, String receiver, long amount) {}
}

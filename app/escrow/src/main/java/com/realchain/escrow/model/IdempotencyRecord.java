/*
 * どこで: Escrow ドメインモデル
 * 何を: 呼び出し元ごとの Idempotency-Key に保存した Deal 操作の応答を表す
 * なぜ: 成功/失敗どちらの応答も再送時に同じ内容で返すため
 */
package com.realchain.escrow.model;

import java.time.Instant;
import java.util.UUID;

/**
 * @param dealId 操作対象の Deal。create_listing が失敗した場合のみ null
 */
public record IdempotencyRecord(
        String callerId,
        String idempotencyKey,
        DealAction action,
        UUID dealId,
        String requestHash,
        int responseCode,
        String responseBodyJson,
        Instant createdAt,
        Instant expiresAt) {
}

/*
 * どこで: Escrow ドメインモデル
 * 何を: claim 済み outbox_events の 1 行を表す
 * なぜ: Publisher が Deal と配信順序 (deal_version) を合わせて扱えるようにするため
 */
package com.realchain.escrow.model;

import java.time.Instant;
import java.util.UUID;

public record OutboxEventRecord(
    UUID eventId,
    String eventType,
    UUID dealId,
    long dealVersion,
    String payloadJson,
    int attemptCount,
    Instant createdAt) {}

/*
 * どこで: Escrow ドメインモデル
 * 何を: deal_audit の登録用データを表す
 * なぜ: 監査ログの構築を呼び出し側から隠蔽するため
 */
package com.realchain.escrow.model;

import java.time.Instant;
import java.util.UUID;

public record DealAuditRecord(
    UUID auditId,
    Instant occurredAt,
    UUID dealId,
    String action,
    String callerId,
    String fromStatus,
    String toStatus,
    String requestId,
    String detailJson) {}

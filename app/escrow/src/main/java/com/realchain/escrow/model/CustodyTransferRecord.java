/*
 * どこで: Escrow ドメインモデル
 * 何を: custody_transfers テーブルの 1 行を表す
 * なぜ: 状態遷移と対になる資金移動を監査できるようにするため
 */
package com.realchain.escrow.model;

import java.time.Instant;
import java.util.UUID;

public record CustodyTransferRecord(
    UUID transferId,
    UUID dealId,
    TransferKind kind,
    String sender,
    String receiver,
    long amount,
    Instant appliedAt) {}

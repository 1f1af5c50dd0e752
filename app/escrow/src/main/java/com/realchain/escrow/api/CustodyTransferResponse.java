package com.realchain.escrow.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.realchain.escrow.model.CustodyTransferRecord;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CustodyTransferResponse(
    UUID transferId, String kind, String sender, String receiver, long amount, Instant appliedAt) {

  public static CustodyTransferResponse from(CustodyTransferRecord record) {
    return new CustodyTransferResponse(
        record.transferId(),
        record.kind().name(),
        record.sender(),
        record.receiver(),
        record.amount(),
        record.appliedAt());
  }
}

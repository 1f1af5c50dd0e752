/*
 * どこで: Escrow API
 * 何を: Deal スナップショットのレスポンスを表す
 * なぜ: 操作結果と read_state を同じ JSON で返すため
 */
package com.realchain.escrow.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.realchain.escrow.model.DealRecord;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DealResponse(
    UUID dealId,
    String seller,
    String buyer,
    long price,
    long reserve,
    String propertyHash,
    String custodian,
    Instant createdAt,
    Instant deadline,
    String status,
    long version,
    Instant updatedAt) {

  public static DealResponse from(DealRecord record) {
    return new DealResponse(
        record.dealId(),
        record.seller(),
        record.buyer(),
        record.price(),
        record.reserve(),
        record.propertyHash(),
        record.custodian(),
        record.createdAt(),
        record.deadline(),
        record.status().name(),
        record.version(),
        record.updatedAt());
  }
}

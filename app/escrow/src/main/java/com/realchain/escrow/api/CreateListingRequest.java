/*
 * どこで: Escrow API
 * 何を: 出品 (create_listing) リクエストの入力を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.realchain.escrow.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateListingRequest(
    @NotNull(message = "price is required") @Positive(message = "price must be positive") Long price,
    @NotBlank(message = "property_hash is required") String propertyHash) {}

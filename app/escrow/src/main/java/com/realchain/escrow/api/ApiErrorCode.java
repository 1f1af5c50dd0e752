/*
 * どこで: Escrow API
 * 何を: エラー応答のコードと HTTP ステータスを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.realchain.escrow.api;

import org.springframework.http.HttpStatus;

public enum ApiErrorCode {
    BAD_REQUEST(HttpStatus.BAD_REQUEST),
    IDEMPOTENCY_KEY_CONFLICT(HttpStatus.CONFLICT),
    UNAUTHORIZED(HttpStatus.FORBIDDEN),
    DEAL_NOT_ACTIVE(HttpStatus.CONFLICT),
    DEAL_NOT_PENDING(HttpStatus.CONFLICT),
    DEAL_NOT_CANCELLABLE(HttpStatus.CONFLICT),
    DEAL_EXPIRED(HttpStatus.CONFLICT),
    PROPERTY_HASH_MISMATCH(HttpStatus.CONFLICT),
    BUNDLE_MISMATCH(HttpStatus.UNPROCESSABLE_ENTITY),
    NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus httpStatus;

    ApiErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }
}

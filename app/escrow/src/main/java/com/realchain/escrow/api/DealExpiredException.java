/*
 * どこで: Escrow API
 * 何を: deadline 経過後のオファー/受渡し確定(409)を表す
 * なぜ: 期限後はキャンセルだけを許可するため
 */
package com.realchain.escrow.api;

public class DealExpiredException extends DealOperationException {

    public DealExpiredException(String message) {
        super(message);
    }

    @Override
    public ApiErrorCode code() {
        return ApiErrorCode.DEAL_EXPIRED;
    }
}

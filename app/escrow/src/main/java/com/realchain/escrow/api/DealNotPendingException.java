/*
 * どこで: Escrow API
 * 何を: PENDING 以外の Deal への受渡し確定(409)を表す
 * なぜ: 入金前や終了後の payout を防ぐため
 */
package com.realchain.escrow.api;

public class DealNotPendingException extends DealOperationException {

    public DealNotPendingException(String message) {
        super(message);
    }

    @Override
    public ApiErrorCode code() {
        return ApiErrorCode.DEAL_NOT_PENDING;
    }
}

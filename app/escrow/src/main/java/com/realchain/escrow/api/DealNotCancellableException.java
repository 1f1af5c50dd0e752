/*
 * どこで: Escrow API
 * 何を: 終了済み Deal へのキャンセル(409)を表す
 * なぜ: COMPLETED/CANCELLED を終端状態に保つため
 */
package com.realchain.escrow.api;

public class DealNotCancellableException extends DealOperationException {

    public DealNotCancellableException(String message) {
        super(message);
    }

    @Override
    public ApiErrorCode code() {
        return ApiErrorCode.DEAL_NOT_CANCELLABLE;
    }
}

/*
 * どこで: Escrow API
 * 何を: ACTIVE 以外の Deal へのオファー(409)を表す
 * なぜ: 先着 1 名だけが buyer になれることを保証するため
 */
package com.realchain.escrow.api;

public class DealNotActiveException extends DealOperationException {

    public DealNotActiveException(String message) {
        super(message);
    }

    @Override
    public ApiErrorCode code() {
        return ApiErrorCode.DEAL_NOT_ACTIVE;
    }
}

/*
 * どこで: Escrow API
 * 何を: 呼び出し元が操作に必要な役割を持たないこと(403)を表す
 * なぜ: seller/buyer の取り違えや第三者の操作を拒否するため
 */
package com.realchain.escrow.api;

public class UnauthorizedDealActionException extends DealOperationException {

    public UnauthorizedDealActionException(String message) {
        super(message);
    }

    @Override
    public ApiErrorCode code() {
        return ApiErrorCode.UNAUTHORIZED;
    }
}

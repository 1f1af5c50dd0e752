/*
 * どこで: Escrow API
 * 何を: 存在しない Deal への操作/参照(404)を表す
 * なぜ: 未作成の Deal とゼロ値の Deal を区別するため
 */
package com.realchain.escrow.api;

public class DealNotFoundException extends DealOperationException {

    public DealNotFoundException(String message) {
        super(message);
    }

    @Override
    public ApiErrorCode code() {
        return ApiErrorCode.NOT_FOUND;
    }
}

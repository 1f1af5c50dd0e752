/*
 * どこで: Escrow API
 * 何を: 受渡し確定時に提示された物件ハッシュの不一致(409)を表す
 * なぜ: 登録時と異なる書類での決済を防ぐため
 */
package com.realchain.escrow.api;

public class PropertyHashMismatchException extends DealOperationException {

    public PropertyHashMismatchException(String message) {
        super(message);
    }

    @Override
    public ApiErrorCode code() {
        return ApiErrorCode.PROPERTY_HASH_MISMATCH;
    }
}

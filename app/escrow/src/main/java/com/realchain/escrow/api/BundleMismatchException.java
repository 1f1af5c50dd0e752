/*
 * どこで: Escrow API
 * 何を: バンドルの形状・相手先・金額の不一致(422)を表す
 * なぜ: 資金移動と状態遷移の 1 対 1 対応を崩さないため
 */
package com.realchain.escrow.api;

public class BundleMismatchException extends DealOperationException {

    public BundleMismatchException(String message) {
        super(message);
    }

    @Override
    public ApiErrorCode code() {
        return ApiErrorCode.BUNDLE_MISMATCH;
    }
}

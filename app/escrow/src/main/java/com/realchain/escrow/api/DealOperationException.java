/*
 * どこで: Escrow API
 * 何を: Deal 操作の型付き失敗の基底クラスを定義する
 * なぜ: 失敗種別ごとの HTTP 応答と冪等レスポンス保存を 1 か所で扱うため
 */
package com.realchain.escrow.api;

/**
 * Deal 操作がガード評価で拒否されたことを表す。
 *
 * <p>送出された時点で Deal の state は一切変更されていない。{@link #code()} がエラー応答の
 * コードと HTTP ステータスを決める。
 */
public abstract class DealOperationException extends RuntimeException {

    protected DealOperationException(String message) {
        super(message);
    }

    public abstract ApiErrorCode code();

    /** 保存済みのエラー応答から同じ種別の例外を復元する。 */
    public static DealOperationException fromErrorResponse(ApiErrorResponse response) {
        return switch (response.code()) {
            case UNAUTHORIZED -> new UnauthorizedDealActionException(response.message());
            case DEAL_NOT_ACTIVE -> new DealNotActiveException(response.message());
            case DEAL_NOT_PENDING -> new DealNotPendingException(response.message());
            case DEAL_NOT_CANCELLABLE -> new DealNotCancellableException(response.message());
            case DEAL_EXPIRED -> new DealExpiredException(response.message());
            case PROPERTY_HASH_MISMATCH -> new PropertyHashMismatchException(response.message());
            case BUNDLE_MISMATCH -> new BundleMismatchException(response.message());
            case NOT_FOUND -> new DealNotFoundException(response.message());
            default -> throw new IllegalStateException("unsupported error code: " + response.code());
        };
    }
}

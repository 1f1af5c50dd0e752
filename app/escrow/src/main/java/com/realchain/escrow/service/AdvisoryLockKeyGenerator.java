/*
 * どこで: Escrow サービス補助
 * 何を: 名前空間付きの文字列キーから 64-bit advisory lock のキーを生成する
 * なぜ: hashtext(32-bit) の衝突による不要な直列化を避けるため
 */
package com.realchain.escrow.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import org.springframework.stereotype.Component;

@Component
public class AdvisoryLockKeyGenerator {

  static final String IDEMPOTENCY_NAMESPACE = "escrow.idempotency";

  // 64-bit advisory lock 用に SHA-256 の先頭 8byte を使う。
  static final int LOCK_KEY_BYTES = 8;

  public long generate(String namespace, String key) {
    // 名前空間を区切り文字付きで前置し、用途の異なるキー同士が同じロックを共有しないようにする。
    // 文字コードは環境差を避けるため UTF-8 を固定で使用する。
    final byte[] hashed = hash(namespace + '\u0000' + key);
    // ByteBuffer は Big Endian が既定。
    return ByteBuffer.wrap(hashed, 0, LOCK_KEY_BYTES).getLong();
  }

  /** Idempotency-Key は呼び出し元ごとに独立しているため、ロックも呼び出し元で分ける。 */
  public long forIdempotencyKey(String callerId, String idempotencyKey) {
    return generate(IDEMPOTENCY_NAMESPACE, callerId + '\u0000' + idempotencyKey);
  }

  private byte[] hash(String value) {
    try {
      final MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return digest.digest(value.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException ex) {
      // JVM が SHA-256 を提供しない場合は実行環境の前提が崩れているため即失敗させる。
      throw new IllegalStateException("SHA-256 algorithm not available", ex);
    }
  }
}

/*
 * どこで: Escrow アプリの設定バインド
 * 何を: Deal イベント outbox のポーリング/リトライ設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.realchain.escrow.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param retryBackoff 1 回目の再送待ち。以降は倍々で retryBackoffMax まで伸ばす
 * @param lease claim したイベントを他ワーカーから隠す時間
 * @param publishedTtl publish 済みイベントを残す期間
 */
@ConfigurationProperties(prefix = "escrow.outbox")
public record EscrowOutboxProperties(
                boolean enabled,
                Duration pollInterval,
                int batchSize,
                int maxAttempts,
                Duration retryBackoff,
                Duration retryBackoffMax,
                int errorMessageMaxLength,
                Duration lease,
                Duration publishedTtl) {
}

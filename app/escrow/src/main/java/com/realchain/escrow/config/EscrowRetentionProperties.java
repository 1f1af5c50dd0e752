/*
 * どこで: Escrow アプリの設定バインド
 * 何を: retention cleanup のスケジュール設定を保持する
 * なぜ: 削除間隔と有効/無効を運用で調整できるようにするため
 */
package com.realchain.escrow.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "escrow.retention")
public record EscrowRetentionProperties(boolean enabled, Duration cleanupInterval) {}

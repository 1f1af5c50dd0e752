/*
 * どこで: Escrow アプリの設定バインド
 * 何を: Deal イベントの publish 先 subject と JetStream stream 設定を保持する
 * なぜ: publish と重複排除の前提となる stream を環境で揃えるため
 */
package com.realchain.escrow.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "escrow.nats")
public record EscrowNatsProperties(
                @NotBlank String subject,
                @NotBlank String stream,
                @NotNull Duration duplicateWindow) {

        @AssertTrue(message = "escrow.nats.duplicate-window must be positive")
        public boolean isDuplicateWindowPositive() {
                return duplicateWindow == null
                                || (!duplicateWindow.isZero() && !duplicateWindow.isNegative());
        }
}

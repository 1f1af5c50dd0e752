/*
 * どこで: Escrow アプリの設定バインド
 * 何を: Deal の有効期間・payout 時の reserve・custodian アドレスの接頭辞を保持する
 * なぜ: 取引条件の定数を環境ごとに揃えて外部化するため
 */
package com.realchain.escrow.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * @param window 出品から deadline までの期間
 * @param reserve 新規出品に適用する reserve。出品時に Deal へ固定され、既存 Deal には影響しない
 * @param custodianPrefix dealId に付与して custodian アドレスを作る接頭辞
 */
@Validated
@ConfigurationProperties(prefix = "escrow.deal")
public record EscrowDealProperties(
    @NotNull Duration window, @PositiveOrZero long reserve, @NotBlank String custodianPrefix) {

  @AssertTrue(message = "escrow.deal.window must be positive")
  public boolean isWindowPositive() {
    // ゼロ/負値だと出品直後から期限切れになる。null は @NotNull で検出する。
    return window == null || (!window.isZero() && !window.isNegative());
  }
}

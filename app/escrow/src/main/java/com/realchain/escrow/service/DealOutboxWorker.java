/*
 * どこで: Escrow outbox ワーカー
 * 何を: スケジュールで Deal イベントの outbox publish を起動する
 * なぜ: 定期的に未送信イベントを処理するため
 */
package com.realchain.escrow.service;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

@Component
// outbox と NATS の両方が有効な場合のみ登録する
@ConditionalOnProperty(
    name = {"escrow.outbox.enabled", "nats.enabled"},
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class DealOutboxWorker {

    private final DealOutboxPublisher publisher;

    @Scheduled(fixedDelayString = "${escrow.outbox.poll-interval}")
    public void run() {
        publisher.publishPendingBatch();
    }
}

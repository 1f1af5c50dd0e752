/*
 * どこで: Escrow NATS 初期化
 * 何を: Deal イベント用の JetStream stream を起動時に確認し、足りない設定だけ作成/更新する
 * なぜ: outbox の再 claim で同じ event_id が再送されても、stream の重複排除で 1 件に畳めるようにするため
 */
package com.realchain.escrow.nats;

import com.realchain.escrow.config.EscrowNatsProperties;
import com.realchain.escrow.config.EscrowOutboxProperties;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;

@Component
// outbox と NATS の両方が有効な場合のみ登録する
@ConditionalOnProperty(
    name = {"escrow.outbox.enabled", "nats.enabled"},
    havingValue = "true",
    matchIfMissing = true)
@RequiredArgsConstructor
public class DealJetStreamBootstrap {

    private static final Logger logger = LoggerFactory.getLogger(DealJetStreamBootstrap.class);

    private final Connection connection;
    private final EscrowNatsProperties natsProperties;
    private final EscrowOutboxProperties outboxProperties;

    @PostConstruct
    public void start() {
        // リース切れの再 claim は lease 経過後に同じ event_id を再送する
        if (natsProperties.duplicateWindow().compareTo(outboxProperties.lease()) < 0) {
            throw new IllegalStateException(
                    "escrow.nats.duplicate-window must cover escrow.outbox.lease duplicateWindow="
                            + natsProperties.duplicateWindow() + " lease=" + outboxProperties.lease());
        }
        try {
            final JetStreamManagement management = connection.jetStreamManagement();
            if (management.getStreamNames().contains(natsProperties.stream())) {
                reconcile(management);
            } else {
                management.addStream(StreamConfiguration.builder()
                        .name(natsProperties.stream())
                        .subjects(natsProperties.subject())
                        .duplicateWindow(natsProperties.duplicateWindow())
                        .build());
                logger.info("deal event stream created stream={} subject={} duplicateWindow={}",
                        natsProperties.stream(),
                        natsProperties.subject(),
                        natsProperties.duplicateWindow());
            }
        } catch (IOException | JetStreamApiException ex) {
            throw new IllegalStateException(
                    "failed to ensure deal event stream " + natsProperties.stream(), ex);
        }
    }

    private void reconcile(JetStreamManagement management)
            throws IOException, JetStreamApiException {
        final StreamConfiguration current =
                management.getStreamInfo(natsProperties.stream()).getConfiguration();
        final boolean hasSubject = current.getSubjects().contains(natsProperties.subject());
        final boolean sameWindow =
                natsProperties.duplicateWindow().equals(current.getDuplicateWindow());
        if (hasSubject && sameWindow) {
            logger.info("deal event stream already matches stream={}", natsProperties.stream());
            return;
        }
        // 他の購読用に足された subject は残す
        final List<String> subjects = new ArrayList<>(current.getSubjects());
        if (!hasSubject) {
            subjects.add(natsProperties.subject());
        }
        management.updateStream(StreamConfiguration.builder(current)
                .subjects(subjects)
                .duplicateWindow(natsProperties.duplicateWindow())
                .build());
        logger.info("deal event stream updated stream={} subjects={} duplicateWindow={}",
                natsProperties.stream(),
                subjects,
                natsProperties.duplicateWindow());
    }
}

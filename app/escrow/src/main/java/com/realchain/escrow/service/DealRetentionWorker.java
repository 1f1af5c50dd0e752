package com.realchain.escrow.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "escrow.retention.enabled", havingValue = "true")
public class DealRetentionWorker {

  private final DealRetentionService retentionService;

  @Scheduled(fixedDelayString = "${escrow.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}

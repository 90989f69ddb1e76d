/*
 * Where: Compliance cleanup worker
 * What: Triggers email job retention cleanup on a schedule
 * Why: Automate deletion without manual intervention
 */
package com.machinerental.compliance.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "compliance.retention.enabled", havingValue = "true")
public class EmailJobRetentionWorker {

  private final EmailJobRetentionService retentionService;

  @Scheduled(fixedDelayString = "${compliance.retention.cleanup-interval}")
  public void run() {
    retentionService.cleanup();
  }
}

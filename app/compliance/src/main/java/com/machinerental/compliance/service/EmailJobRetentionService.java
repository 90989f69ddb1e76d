/*
 * Where: Compliance service layer
 * What: Applies retention policy for finished email jobs
 * Why: Prevent unbounded growth while keeping anomalous pending jobs
 */
package com.machinerental.compliance.service;

import com.machinerental.compliance.config.EmailJobRetentionProperties;
import com.machinerental.compliance.repository.EmailJobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EmailJobRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(EmailJobRetentionService.class);

  private final EmailJobRepository emailJobRepository;
  private final EmailJobRetentionProperties properties;
  private final Clock clock;

  public int cleanup() {
    final Instant threshold = Instant.now(clock).minus(Duration.ofDays(properties.retentionDays()));
    final int staleActiveCount = emailJobRepository.countStaleActive(threshold);
    if (staleActiveCount > 0) {
      logger.error(
          "email job retention found stale active jobs count={} threshold={}",
          staleActiveCount,
          threshold);
    }
    final int deleted = emailJobRepository.deleteCompletedOrFailedOlderThan(threshold);
    logger.info("email job retention cleanup deleted jobs={} threshold={}", deleted, threshold);
    return deleted;
  }
}

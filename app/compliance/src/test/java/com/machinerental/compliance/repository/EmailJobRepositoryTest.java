/*
 * どこで: Compliance テスト
 * 何を: Postgres での送信ジョブ claim/lease/状態遷移を検証する
 * なぜ: UPDATE ... RETURNING + SKIP LOCKED と jsonb の方言差異を統合テストで検証するため
 */
package com.machinerental.compliance.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.machinerental.compliance.AbstractPostgresContainerTest;
import com.machinerental.compliance.config.EmailJobProperties;
import com.machinerental.compliance.model.EmailJobRecord;
import com.machinerental.compliance.model.EmailJobStatus;
import com.machinerental.compliance.model.EmailJobType;
import com.machinerental.compliance.support.ComplianceFixtures;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class EmailJobRepositoryTest extends AbstractPostgresContainerTest {

  private static final String PAYLOAD = "{\"document_id\": 7, \"machine_number\": \"MR-001\"}";

  @Autowired private EmailJobRepository emailJobRepository;
  @Autowired private EmailJobProperties properties;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    ComplianceFixtures.cleanup(jdbcTemplate);
  }

  @Test
  void claimMovesDuePendingToProcessingWithLock() {
    final Instant now = Instant.now();
    final long dueId = emailJobRepository.insert(pending("7", now.minusSeconds(1), now));
    emailJobRepository.insert(pending("8", now.plus(Duration.ofHours(1)), now));

    final Instant leaseUntil = now.plus(properties.lease());
    final List<EmailJobRecord> claimed =
        emailJobRepository.claimPendingForUpdate(properties.batchSize(), now, leaseUntil, "host-a");

    assertThat(claimed).hasSize(1);
    final EmailJobRecord record = claimed.get(0);
    assertThat(record.id()).isEqualTo(dueId);
    assertThat(record.status()).isEqualTo(EmailJobStatus.PROCESSING);
    assertThat(record.lockedBy()).isEqualTo("host-a");
    assertThat(record.payloadJson()).contains("\"machine_number\"");
    assertInstantCloseToMicros(leaseUntil, record.leaseUntil());
  }

  @Test
  void claimRecoversExpiredProcessingLease() {
    final Instant now = Instant.now();
    final long jobId = emailJobRepository.insert(pending("7", now.minusSeconds(60), now));
    final Instant expiredLease = now.minus(properties.lease());
    emailJobRepository.claimPendingById(jobId, expiredLease.minusSeconds(1), expiredLease, "old-host");

    final List<EmailJobRecord> claimed =
        emailJobRepository.claimPendingForUpdate(
            properties.batchSize(), now, now.plus(properties.lease()), "new-host");

    assertThat(claimed).extracting(EmailJobRecord::lockedBy).containsExactly("new-host");
  }

  @Test
  void markRetryRequiresLockOwnerAndFailedCanBeReset() {
    final Instant now = Instant.now();
    final long jobId = emailJobRepository.insert(pending("7", now, now));
    emailJobRepository.claimPendingById(jobId, now, now.plus(properties.lease()), "host-a");

    assertThat(emailJobRepository.markRetry(jobId, 3, null, true, "smtp down", now, "host-b"))
        .isZero();
    assertThat(emailJobRepository.markRetry(jobId, 3, null, true, "smtp down", now, "host-a"))
        .isEqualTo(1);

    final EmailJobRecord failed = emailJobRepository.findById(jobId).orElseThrow();
    assertThat(failed.status()).isEqualTo(EmailJobStatus.FAILED);
    assertThat(failed.attempts()).isEqualTo(3);
    assertThat(failed.error()).isEqualTo("smtp down");
    assertThat(failed.processedAt()).isNotNull();
    assertThat(failed.lockedBy()).isNull();

    assertThat(emailJobRepository.resetFailed(jobId, now)).isEqualTo(1);
    final EmailJobRecord reset = emailJobRepository.findById(jobId).orElseThrow();
    assertThat(reset.status()).isEqualTo(EmailJobStatus.PENDING);
    assertThat(reset.attempts()).isZero();
    assertThat(reset.error()).isNull();
    // PENDING は FAILED ではないため再度のリセットは対象外
    assertThat(emailJobRepository.resetFailed(jobId, now)).isZero();
  }

  @Test
  void claimByIdIgnoresNonPendingJobs() {
    final Instant now = Instant.now();
    final long jobId = emailJobRepository.insert(pending("7", now, now));
    emailJobRepository.claimPendingById(jobId, now, now.plus(properties.lease()), "host-a");

    final Optional<EmailJobRecord> second =
        emailJobRepository.claimPendingById(jobId, now, now.plus(properties.lease()), "host-b");

    assertThat(second).isEmpty();
  }

  @Test
  void existsCompletedBetweenUsesProcessedAtWindow() {
    final Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    emailJobRepository.insert(
        new EmailJobRecord(
            null,
            EmailJobType.DOCUMENT_EXPIRY,
            "7",
            PAYLOAD,
            EmailJobStatus.COMPLETED,
            1,
            1,
            null,
            now,
            now,
            null,
            null,
            null,
            now,
            now));

    assertThat(
            emailJobRepository.existsCompletedBetween(
                EmailJobType.DOCUMENT_EXPIRY, "7", now.minusSeconds(60), now.plusSeconds(60)))
        .isTrue();
    assertThat(
            emailJobRepository.existsCompletedBetween(
                EmailJobType.DOCUMENT_EXPIRY, "7", now.plusSeconds(1), now.plusSeconds(60)))
        .isFalse();
    assertThat(
            emailJobRepository.existsCompletedBetween(
                EmailJobType.DOCUMENT_EXPIRY, "8", now.minusSeconds(60), now.plusSeconds(60)))
        .isFalse();
  }

  @Test
  void findByTypeAndStatusFiltersOptionally() {
    final Instant now = Instant.now();
    emailJobRepository.insert(pending("7", now, now));
    emailJobRepository.insert(pending("8", now, now));

    assertThat(
            emailJobRepository.findByTypeAndStatus(
                EmailJobType.DOCUMENT_EXPIRY, null, null, properties.statusListLimit()))
        .hasSize(2);
    assertThat(
            emailJobRepository.findByTypeAndStatus(
                EmailJobType.DOCUMENT_EXPIRY, EmailJobStatus.PENDING, "8", 10))
        .extracting(EmailJobRecord::entityId)
        .containsExactly("8");
    assertThat(
            emailJobRepository.findByTypeAndStatus(
                EmailJobType.DOCUMENT_EXPIRY, EmailJobStatus.FAILED, null, 10))
        .isEmpty();
    assertThat(emailJobRepository.countPending()).isEqualTo(2);
  }

  private EmailJobRecord pending(String entityId, Instant scheduledFor, Instant createdAt) {
    return new EmailJobRecord(
        null,
        EmailJobType.DOCUMENT_EXPIRY,
        entityId,
        PAYLOAD,
        EmailJobStatus.PENDING,
        0,
        properties.maxAttempts(),
        null,
        scheduledFor,
        null,
        null,
        null,
        null,
        createdAt,
        createdAt);
  }

  private void assertInstantCloseToMicros(Instant expected, Instant actual) {
    final Duration delta = Duration.between(expected, actual).abs();
    assertThat(delta).isLessThanOrEqualTo(ChronoUnit.MICROS.getDuration());
  }
}

/*
 * どこで: Compliance 送信ジョブの統合テスト
 * 何を: 失敗注入 Sender で 即時送信失敗 -> リトライ -> FAILED -> 手動リセット を Postgres 上で再現する
 * なぜ: FAILED が自動では再送されず、手動リセットでのみ戻ることを担保するため
 */
package com.machinerental.compliance.service;

import static com.machinerental.compliance.support.ComplianceFixtures.insertMachine;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.machinerental.compliance.AbstractPostgresContainerTest;
import com.machinerental.compliance.api.ResourceNotFoundException;
import com.machinerental.compliance.model.AlertRunSummary;
import com.machinerental.compliance.model.DeliveryOutcome;
import com.machinerental.compliance.model.DocumentType;
import com.machinerental.compliance.model.EmailJobRecord;
import com.machinerental.compliance.model.EmailJobStatus;
import com.machinerental.compliance.model.EmailJobType;
import com.machinerental.compliance.support.ComplianceFixtures;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest(
    properties = {
      "compliance.mail.failure-injection.enabled=true",
      "compliance.mail.failure-injection.machine-number-prefix=FAIL-"
    })
@ActiveProfiles("test")
class EmailJobDeliveryFlowIntegrationTest extends AbstractPostgresContainerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-10T03:30:00Z");
  private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

  @TestConfiguration
  static class FixedClockConfig {
    @Bean(name = "testClock")
    @Primary
    Clock clock() {
      return Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    }
  }

  @Autowired private DocumentRegistryService documentRegistryService;
  @Autowired private ExpiryAlertScheduler expiryAlertScheduler;
  @Autowired private EmailJobQueueService emailJobQueueService;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void setUp() {
    ComplianceFixtures.cleanup(jdbcTemplate);
  }

  @Test
  void failedSendRetriesUntilFailedAndManualResetRequeues() {
    final long documentId = createDocument("FAIL-001");

    final AlertRunSummary summary = expiryAlertScheduler.sendNow(documentId, false);

    assertThat(summary.sent()).isZero();
    assertThat(summary.failed()).isEqualTo(1);
    final EmailJobRecord queued = singleJob(documentId);
    assertThat(queued.status()).isEqualTo(EmailJobStatus.PENDING);
    assertThat(queued.attempts()).isZero();
    assertThat(queued.scheduledFor()).isAfter(FIXED_NOW);
    assertThat(queued.error()).contains("failure injection");

    final DeliveryOutcome first = emailJobQueueService.attempt(queued.id());
    final DeliveryOutcome second = emailJobQueueService.attempt(queued.id());
    assertThat(first.success()).isFalse();
    assertThat(second.success()).isFalse();
    assertThat(singleJob(documentId).status()).isEqualTo(EmailJobStatus.PENDING);
    assertThat(singleJob(documentId).attempts()).isEqualTo(2);

    emailJobQueueService.attempt(queued.id());
    final EmailJobRecord failed = singleJob(documentId);
    assertThat(failed.status()).isEqualTo(EmailJobStatus.FAILED);
    assertThat(failed.attempts()).isEqualTo(3);
    assertThat(failed.processedAt()).isEqualTo(FIXED_NOW);

    // FAILED はバッチでも claim されない
    assertThat(emailJobQueueService.processPendingBatch()).isZero();
    assertThat(emailJobQueueService.attempt(queued.id()).error())
        .isEqualTo(EmailJobQueueService.NOT_PENDING_ERROR);

    emailJobQueueService.retryFailed(queued.id());
    final EmailJobRecord reset = singleJob(documentId);
    assertThat(reset.status()).isEqualTo(EmailJobStatus.PENDING);
    assertThat(reset.attempts()).isZero();
    assertThat(reset.error()).isNull();
    assertThat(reset.scheduledFor()).isEqualTo(FIXED_NOW);
  }

  @Test
  void retryFailedRejectsJobsThatAreNotFailed() {
    final long documentId = createDocument("FAIL-002");
    expiryAlertScheduler.sendNow(documentId, false);
    final long jobId = singleJob(documentId).id();

    assertThatThrownBy(() -> emailJobQueueService.retryFailed(jobId))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void successfulSendIsRecordedAndSkippedUntilForced() {
    final long documentId = createDocument("MR-200");

    final AlertRunSummary first = expiryAlertScheduler.sendNow(documentId, false);
    final AlertRunSummary second = expiryAlertScheduler.sendNow(documentId, false);
    final AlertRunSummary forced = expiryAlertScheduler.sendNow(documentId, true);

    assertThat(first.sent()).isEqualTo(1);
    assertThat(second.skipped()).isEqualTo(1);
    assertThat(forced.sent()).isEqualTo(1);
    final List<EmailJobRecord> jobs = jobs(documentId);
    assertThat(jobs).hasSize(2);
    assertThat(jobs).extracting(EmailJobRecord::status).containsOnly(EmailJobStatus.COMPLETED);
    assertThat(emailJobQueueService.stats(EmailJobType.DOCUMENT_EXPIRY).completed()).isEqualTo(2);
  }

  private long createDocument(String machineNumber) {
    final long machineId = insertMachine(jdbcTemplate, machineNumber, true);
    return documentRegistryService
        .upsert(machineId, DocumentType.INSURANCE.wireName(), TODAY.plusDays(3), null, null)
        .id();
  }

  private EmailJobRecord singleJob(long documentId) {
    final List<EmailJobRecord> jobs = jobs(documentId);
    assertThat(jobs).hasSize(1);
    return jobs.get(0);
  }

  private List<EmailJobRecord> jobs(long documentId) {
    return emailJobQueueService.listByStatus(
        EmailJobType.DOCUMENT_EXPIRY, null, Long.toString(documentId));
  }
}

/*
 * どこで: Compliance サービス層
 * 何を: メール送信ジョブの登録/送信試行/リトライ/手動再送/集計を扱う
 * なぜ: 送信失敗を試行回数とバックオフで回収し、上限到達後は FAILED で止めるため
 */
package com.machinerental.compliance.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.machinerental.compliance.api.ResourceNotFoundException;
import com.machinerental.compliance.config.EmailJobProperties;
import com.machinerental.compliance.model.DeliveryOutcome;
import com.machinerental.compliance.model.EmailJobPayload;
import com.machinerental.compliance.model.EmailJobRecord;
import com.machinerental.compliance.model.EmailJobStats;
import com.machinerental.compliance.model.EmailJobStatus;
import com.machinerental.compliance.model.EmailJobType;
import com.machinerental.compliance.repository.EmailJobRepository;
import com.machinerental.compliance.service.mail.MailDeliveryResult;
import com.machinerental.compliance.service.mail.MailMessage;
import com.machinerental.compliance.service.mail.MailSender;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class EmailJobQueueService {

  private static final Logger logger = LoggerFactory.getLogger(EmailJobQueueService.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";
  static final String NOT_PENDING_ERROR = "job is not pending";
  static final String NO_RECIPIENTS_ERROR = "no admin emails configured";
  private static final Duration STATS_WINDOW = Duration.ofDays(7);
  private static final Duration RECENT_WINDOW = Duration.ofHours(24);

  private final EmailJobRepository emailJobRepository;
  private final MailSender mailSender;
  private final DocumentExpiryAlertComposer composer;
  private final EmailJobProperties properties;
  private final ComplianceMetrics metrics;
  private final ObjectMapper objectMapper;
  private final BusinessCalendar calendar;

  /** 即時送信可能な PENDING ジョブを登録する。 */
  public long enqueue(EmailJobPayload payload) {
    final Instant now = calendar.now();
    return insert(payload, EmailJobStatus.PENDING, 0, properties.maxAttempts(), null, now, null);
  }

  /** 即時送信に失敗したアラートを、初回バックオフ後に再送する PENDING ジョブとして登録する。 */
  public long enqueueRetry(EmailJobPayload payload, String error) {
    final Instant now = calendar.now();
    final Instant scheduledFor = now.plus(computeBackoffDuration(1));
    final long jobId =
        insert(
            payload,
            EmailJobStatus.PENDING,
            0,
            properties.maxAttempts(),
            truncateError(error),
            scheduledFor,
            null);
    logger.warn(
        "email job queued for retry id={} type={} entityId={} scheduledFor={}",
        jobId,
        payload.jobType().code(),
        payload.entityId(),
        scheduledFor);
    return jobId;
  }

  /** 送信済みアラートの監査行を COMPLETED で残す。 */
  public long recordCompleted(EmailJobPayload payload) {
    final Instant now = calendar.now();
    return insert(payload, EmailJobStatus.COMPLETED, 1, 1, null, now, now);
  }

  /** ジョブとしては登録せず、その場で 1 回だけ送信する。 */
  public DeliveryOutcome sendImmediately(EmailJobPayload payload) {
    final MailDeliveryResult result = send(composer.compose(payload));
    if (result.success()) {
      return DeliveryOutcome.delivered();
    }
    return DeliveryOutcome.failed(result.error());
  }

  /** PENDING のジョブを 1 件 claim して送信を試みる。 */
  public DeliveryOutcome attempt(long jobId) {
    if (emailJobRepository.findById(jobId).isEmpty()) {
      throw new ResourceNotFoundException("email job not found id=" + jobId);
    }
    final Instant now = calendar.now();
    final String lockedBy = resolveLockedBy();
    return emailJobRepository
        .claimPendingById(jobId, now, now.plus(properties.lease()), lockedBy)
        .map(record -> deliverGuarded(record, now, lockedBy))
        .orElseGet(() -> DeliveryOutcome.failed(NOT_PENDING_ERROR));
  }

  public int processPendingBatch() {
    final Instant now = calendar.now();
    final String lockedBy = resolveLockedBy();
    final Instant leaseUntil = now.plus(properties.lease());
    // claim を単一 SQL で行い、送信 IO を長期トランザクションに載せない
    final List<EmailJobRecord> pending =
        emailJobRepository.claimPendingForUpdate(properties.batchSize(), now, leaseUntil, lockedBy);
    for (EmailJobRecord record : pending) {
      deliverGuarded(record, now, lockedBy);
    }
    metrics.updateBacklogCurrent(emailJobRepository.countPending());
    if (!pending.isEmpty()) {
      logger.info("email job batch processed claimed={}", pending.size());
    }
    return pending.size();
  }

  public List<EmailJobRecord> listByStatus(
      EmailJobType type, EmailJobStatus status, String entityId) {
    return emailJobRepository.findByTypeAndStatus(
        type, status, entityId, properties.statusListLimit());
  }

  /** 業務タイムゾーンの本日中に COMPLETED となったジョブがあるか。 */
  public boolean hasCompletedToday(EmailJobType type, String entityId) {
    return emailJobRepository.existsCompletedBetween(
        type, entityId, calendar.startOfToday(), calendar.startOfTomorrow());
  }

  /** FAILED のジョブを試行回数 0 の PENDING に戻す。自動では FAILED を再送しない。 */
  public void retryFailed(long jobId) {
    final int updated = emailJobRepository.resetFailed(jobId, calendar.now());
    if (updated == 0) {
      throw new ResourceNotFoundException("failed email job not found id=" + jobId);
    }
    logger.info("email job reset for manual retry id={}", jobId);
  }

  public EmailJobStats stats(EmailJobType type) {
    final Instant now = calendar.now();
    return emailJobRepository.stats(type, now.minus(STATS_WINDOW), now.minus(RECENT_WINDOW));
  }

  /** 1 件分の想定外の例外も試行回数へ計上し、バッチ内の後続ジョブを止めない。 */
  private DeliveryOutcome deliverGuarded(EmailJobRecord record, Instant now, String lockedBy) {
    try {
      return deliver(record, now, lockedBy);
    } catch (RuntimeException ex) {
      logger.error(
          "email job delivery threw id={} attempts={}", record.id(), record.attempts(), ex);
      final String error = ex.getMessage() == null ? ex.toString() : ex.getMessage();
      metrics.recordDeliveryResult(ComplianceMetrics.RESULT_FAILED);
      try {
        handleFailure(record, error, now, lockedBy);
      } catch (DataAccessException updateEx) {
        // 状態を更新できなかったジョブは lease 切れ後に再 claim される
        logger.error("email job update failed id={}", record.id(), updateEx);
      }
      return DeliveryOutcome.failed(error);
    }
  }

  private DeliveryOutcome deliver(EmailJobRecord record, Instant now, String lockedBy) {
    final MailMessage message;
    try {
      message =
          composer.compose(
              objectMapper.readValue(record.payloadJson(), record.type().payloadType()));
    } catch (JsonProcessingException ex) {
      // 解釈できない/必須項目の欠けたペイロードは再送しても結果が変わらないため即 FAILED にする
      final String error = "payload parse failure: " + ex.getOriginalMessage();
      markFailed(record, record.attempts() + 1, error, now, lockedBy);
      return DeliveryOutcome.failed(error);
    }
    final MailDeliveryResult result = send(message);
    final int attempts = record.attempts() + 1;
    if (result.success()) {
      final int updated = emailJobRepository.markCompleted(record.id(), attempts, now, lockedBy);
      if (updated == 0) {
        logger.warn(
            "email job sent but lock was lost id={} entityId={}", record.id(), record.entityId());
      }
      metrics.recordDeliveryResult(ComplianceMetrics.RESULT_SENT);
      return DeliveryOutcome.delivered();
    }
    metrics.recordDeliveryResult(ComplianceMetrics.RESULT_FAILED);
    handleFailure(record, result.error(), now, lockedBy);
    return DeliveryOutcome.failed(result.error());
  }

  @VisibleForTesting
  void handleFailure(EmailJobRecord record, String error, Instant now, String lockedBy) {
    final int nextAttempt = record.attempts() + 1;
    if (nextAttempt >= record.maxAttempts()) {
      markFailed(record, nextAttempt, error, now, lockedBy);
      return;
    }
    final Instant scheduledFor = now.plus(computeBackoffDuration(nextAttempt));
    final int updated =
        emailJobRepository.markRetry(
            record.id(), nextAttempt, scheduledFor, false, truncateError(error), now, lockedBy);
    if (updated == 0) {
      logger.warn(
          "email job retry skipped because lock was lost id={} attempt={}",
          record.id(),
          nextAttempt);
      return;
    }
    logger.warn(
        "email job retry scheduled id={} attempt={} scheduledFor={} error={}",
        record.id(),
        nextAttempt,
        scheduledFor,
        error);
  }

  private void markFailed(
      EmailJobRecord record, int attempts, String error, Instant now, String lockedBy) {
    final int updated =
        emailJobRepository.markRetry(
            record.id(), attempts, null, true, truncateError(error), now, lockedBy);
    if (updated == 0) {
      logger.warn(
          "email job failure skipped because lock was lost id={} attempt={}", record.id(), attempts);
      return;
    }
    metrics.recordEmailJobFailed();
    logger.error(
        "email job failed permanently id={} type={} entityId={} attempts={} error={}",
        record.id(),
        record.type().code(),
        record.entityId(),
        attempts,
        error);
  }

  private MailDeliveryResult send(MailMessage message) {
    if (message.to().isEmpty()) {
      return MailDeliveryResult.failed(NO_RECIPIENTS_ERROR);
    }
    try {
      return mailSender.send(message);
    } catch (RuntimeException ex) {
      // Sender 実装の想定外の例外も送信失敗として扱い、試行回数で回収する
      logger.warn("mail sender threw subject={}", message.subject(), ex);
      return MailDeliveryResult.failed(ex.getMessage() == null ? ex.toString() : ex.getMessage());
    }
  }

  private long insert(
      EmailJobPayload payload,
      EmailJobStatus status,
      int attempts,
      int maxAttempts,
      String error,
      Instant scheduledFor,
      Instant processedAt) {
    final Instant now = calendar.now();
    final EmailJobRecord record =
        new EmailJobRecord(
            null,
            payload.jobType(),
            payload.entityId(),
            serialize(payload),
            status,
            attempts,
            maxAttempts,
            error,
            scheduledFor,
            processedAt,
            null,
            null,
            null,
            now,
            now);
    return emailJobRepository.insert(record);
  }

  private String serialize(EmailJobPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("email job payload serialize failure", ex);
    }
  }

  @VisibleForTesting
  Duration computeBackoffDuration(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double exp = baseMillis * Math.pow(properties.backoffExponentBase(), (attempt - 1));
    final double capped = Math.min(exp, properties.backoffMax().toMillis());
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(capped * jitter);
    final long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }

  @VisibleForTesting
  String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    final int maxLength = properties.errorMessageMaxLength();
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  @VisibleForTesting
  String resolveLockedBy() {
    final String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}

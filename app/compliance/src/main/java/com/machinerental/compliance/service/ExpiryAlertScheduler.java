/*
 * どこで: Compliance サービス層
 * 何を: 期限到達の評価 -> 即時送信 -> 失敗分のキュー投入 -> PENDING ジョブ処理 を 1 回分実行する
 * なぜ: 定期実行と手動トリガーで同じ手順を使い、結果を件数で返すため
 */
package com.machinerental.compliance.service;

import com.machinerental.common.TraceIds;
import com.machinerental.compliance.config.ComplianceSchedulerProperties;
import com.machinerental.compliance.model.AlertRunSummary;
import com.machinerental.compliance.model.DeliveryOutcome;
import com.machinerental.compliance.model.DocumentExpiryPayload;
import com.machinerental.compliance.model.DueNotification;
import com.machinerental.compliance.model.EmailJobType;
import com.machinerental.compliance.model.MachineDocumentView;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ExpiryAlertScheduler {

  private static final Logger logger = LoggerFactory.getLogger(ExpiryAlertScheduler.class);

  private final DueNotificationEvaluator evaluator;
  private final EmailJobQueueService emailJobQueueService;
  private final DocumentRegistryService documentRegistryService;
  private final ComplianceMetrics metrics;
  private final ComplianceSchedulerProperties properties;

  /** 定期実行の入口。例外は外へ出さずログに残す。 */
  public void runScheduled() {
    try (TraceIds.MdcScope scope = TraceIds.openScope()) {
      try {
        final AlertRunSummary summary = checkNotificationsDue();
        logger.info(
            "expiry alert run finished due={} sent={} failed={}",
            summary.total(),
            summary.sent(),
            summary.failed());
      } catch (RuntimeException ex) {
        logger.error("expiry alert run failed traceId={}", scope.traceId(), ex);
      }
    }
  }

  /** 期限到達分の評価と送信を行い、続けて再送待ちのジョブを処理する。 */
  public AlertRunSummary checkNotificationsDue() {
    final List<DueNotification> due = evaluator.evaluate();
    int sent = 0;
    int failed = 0;
    for (DueNotification notification : due) {
      if (deliver(DocumentExpiryPayload.from(notification))) {
        sent++;
      } else {
        failed++;
      }
    }
    try {
      emailJobQueueService.processPendingBatch();
    } catch (RuntimeException ex) {
      logger.error("email job batch failed after expiry evaluation", ex);
    }
    return new AlertRunSummary(due, sent, failed, 0, due.size());
  }

  /**
   * 手動送信。documentIds 未指定なら期限が近い全書類が対象。forceSend でなければ本日送信済みの書類は読み飛ばす。
   */
  public AlertRunSummary sendExpiryAlerts(List<Long> documentIds, boolean forceSend) {
    final List<MachineDocumentView> documents =
        documentIds == null || documentIds.isEmpty()
            ? documentRegistryService.listExpiring(properties.expiringWindowDays())
            : documentRegistryService.findByIds(documentIds);
    return sendDocuments(documents, forceSend);
  }

  public AlertRunSummary sendNow(long documentId, boolean force) {
    return sendDocuments(List.of(documentRegistryService.get(documentId)), force);
  }

  private AlertRunSummary sendDocuments(List<MachineDocumentView> documents, boolean forceSend) {
    int sent = 0;
    int failed = 0;
    int skipped = 0;
    for (MachineDocumentView document : documents) {
      if (!forceSend
          && emailJobQueueService.hasCompletedToday(
              EmailJobType.DOCUMENT_EXPIRY, Long.toString(document.id()))) {
        skipped++;
        metrics.recordDeliveryResult(ComplianceMetrics.RESULT_SKIPPED);
        continue;
      }
      if (deliver(DocumentExpiryPayload.from(document))) {
        sent++;
      } else {
        failed++;
      }
    }
    logger.info(
        "manual expiry alerts finished total={} sent={} failed={} skipped={} force={}",
        documents.size(),
        sent,
        failed,
        skipped,
        forceSend);
    return new AlertRunSummary(List.of(), sent, failed, skipped, documents.size());
  }

  private boolean deliver(DocumentExpiryPayload payload) {
    try {
      final DeliveryOutcome outcome = emailJobQueueService.sendImmediately(payload);
      if (outcome.success()) {
        emailJobQueueService.recordCompleted(payload);
        metrics.recordDeliveryResult(ComplianceMetrics.RESULT_SENT);
        return true;
      }
      emailJobQueueService.enqueueRetry(payload, outcome.error());
      metrics.recordDeliveryResult(ComplianceMetrics.RESULT_FAILED);
      return false;
    } catch (RuntimeException ex) {
      // 1 件の失敗で残りの書類を止めない
      logger.error(
          "expiry alert delivery failed documentId={} daysBefore={}",
          payload.documentId(),
          payload.daysBefore(),
          ex);
      metrics.recordDeliveryResult(ComplianceMetrics.RESULT_FAILED);
      return false;
    }
  }
}

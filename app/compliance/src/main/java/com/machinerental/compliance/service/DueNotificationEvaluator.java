/*
 * どこで: Compliance サービス層
 * 何を: 本日通知すべき (書類, 閾値) を抽出し、通知ログへの登録で claim する
 * なぜ: 抽出と claim を同一トランザクションで行い、同日同閾値の通知を 1 回に限るため
 */
package com.machinerental.compliance.service;

import com.google.common.annotations.VisibleForTesting;
import com.machinerental.compliance.api.ResourceNotFoundException;
import com.machinerental.compliance.model.DueNotification;
import com.machinerental.compliance.model.NotificationLogView;
import com.machinerental.compliance.repository.MachineDocumentRepository;
import com.machinerental.compliance.repository.NotificationLogRepository;
import com.machinerental.compliance.repository.NotificationRuleRepository;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class DueNotificationEvaluator {

  private static final Logger logger = LoggerFactory.getLogger(DueNotificationEvaluator.class);
  private static final int HISTORY_LIMIT = 100;

  private final NotificationRuleRepository ruleRepository;
  private final NotificationLogRepository logRepository;
  private final MachineDocumentRepository documentRepository;
  private final BusinessCalendar calendar;
  private final ComplianceMetrics metrics;
  private final PlatformTransactionManager transactionManager;

  /**
   * 残日数が有効な閾値と一致する組を返す。返した組は本日分の通知ログとして登録済みであり、同じ日に再評価しても再び返ることはない。
   */
  public List<DueNotification> evaluate() {
    final LocalDate today = calendar.today();
    final Instant now = calendar.now();
    final List<DueNotification> claimed =
        transactionTemplate()
            .execute(
                status -> {
                  final List<DueNotification> candidates = ruleRepository.findMatchingRules(today);
                  final List<DueNotification> result = new ArrayList<>(candidates.size());
                  for (DueNotification candidate : candidates) {
                    // 並行実行で先に登録された組は一意制約で弾かれ、ここでは返さない
                    if (logRepository.claim(
                        candidate.documentId(), candidate.daysBefore(), today, now)) {
                      result.add(candidate);
                    }
                  }
                  return result;
                });
    final List<DueNotification> due = claimed == null ? List.of() : claimed;
    metrics.recordNotificationsDue(due.size());
    logger.info("due notifications evaluated date={} due={}", today, due.size());
    return due;
  }

  /** documentId が null なら全書類の通知履歴を返す。 */
  public List<NotificationLogView> getNotificationHistory(Long documentId) {
    if (documentId != null && documentRepository.findById(documentId).isEmpty()) {
      throw ResourceNotFoundException.document(documentId);
    }
    return logRepository.findHistory(documentId, HISTORY_LIMIT);
  }

  @VisibleForTesting
  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }
}

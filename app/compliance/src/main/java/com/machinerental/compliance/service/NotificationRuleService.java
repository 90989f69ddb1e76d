/*
 * どこで: Compliance サービス層
 * 何を: 書類ごとの通知日数の設定と、既定通知設定の参照/更新/一括適用を扱う
 * なぜ: 通知設定の全置換を 1 トランザクションで行い、未設定書類へ既定値を配るため
 */
package com.machinerental.compliance.service;

import static com.machinerental.compliance.service.DocumentRequestValidator.normalizeDefaultDays;
import static com.machinerental.compliance.service.DocumentRequestValidator.normalizeRuleDays;
import static com.machinerental.compliance.service.DocumentRequestValidator.requireDocumentType;
import static com.machinerental.compliance.service.DocumentRequestValidator.requireScope;
import static com.machinerental.compliance.service.DocumentRequestValidator.trimToNull;

import com.google.common.annotations.VisibleForTesting;
import com.machinerental.compliance.api.ResourceNotFoundException;
import com.machinerental.compliance.model.DocumentType;
import com.machinerental.compliance.model.NotificationDefault;
import com.machinerental.compliance.model.NotificationRuleRecord;
import com.machinerental.compliance.model.NotificationScope;
import com.machinerental.compliance.repository.MachineDocumentRepository;
import com.machinerental.compliance.repository.NotificationDefaultRepository;
import com.machinerental.compliance.repository.NotificationRuleRepository;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class NotificationRuleService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRuleService.class);
  private static final String DEFAULT_ACTOR = "system";

  private final NotificationRuleRepository ruleRepository;
  private final NotificationDefaultRepository defaultRepository;
  private final MachineDocumentRepository documentRepository;
  private final NotificationDefaultsSource defaultsSource;
  private final BusinessCalendar calendar;
  private final PlatformTransactionManager transactionManager;

  /** 既存の通知設定を消してから指定日数で作り直す。戻り値は重複を除いた降順の日数。 */
  public List<Integer> configure(long documentId, List<Integer> daysBefore) {
    final List<Integer> normalized = normalizeRuleDays(daysBefore);
    transactionTemplate()
        .executeWithoutResult(
            status -> {
              // 書類行をロックし、既定値の一括適用と同じ書類で交錯させない
              if (!documentRepository.lockById(documentId)) {
                throw ResourceNotFoundException.document(documentId);
              }
              ruleRepository.deleteByDocumentId(documentId);
              ruleRepository.insertAll(documentId, normalized, calendar.now());
            });
    logger.info("notification rules configured documentId={} days={}", documentId, normalized);
    return normalized;
  }

  public List<NotificationRuleRecord> getNotificationSettings(long documentId) {
    if (documentRepository.findById(documentId).isEmpty()) {
      throw ResourceNotFoundException.document(documentId);
    }
    return ruleRepository.findByDocumentId(documentId);
  }

  /** documentType 指定時は種別固有と ALL の既定だけを返す。 */
  public List<NotificationDefault> getDefaults(String documentType) {
    final List<NotificationDefault> defaults = defaultRepository.findAll();
    if (documentType == null) {
      return defaults;
    }
    final NotificationScope scope = NotificationScope.of(requireDocumentType(documentType));
    return defaults.stream()
        .filter(item -> item.scope() == scope || item.scope() == NotificationScope.ALL)
        .toList();
  }

  public NotificationDefault updateDefaults(
      String scopeName, List<Integer> daysBefore, String actor) {
    final NotificationScope scope = requireScope(scopeName);
    final List<Integer> normalized = normalizeDefaultDays(daysBefore);
    final String resolvedActor = trimToNull(actor) == null ? DEFAULT_ACTOR : actor.trim();
    transactionTemplate()
        .executeWithoutResult(
            status -> defaultRepository.replace(scope, normalized, resolvedActor, calendar.now()));
    logger.info(
        "notification defaults updated scope={} days={} actor={}",
        scope.wireName(),
        normalized,
        resolvedActor);
    return defaultRepository
        .findByScope(scope)
        .orElseThrow(
            () -> new IllegalStateException("notification default vanished scope=" + scope));
  }

  /** 通知設定が 1 件もない指定種別の書類にだけ既定日数を設定し、その書類数を返す。 */
  public int applyDefaults(String documentType) {
    return applyDefaults(requireDocumentType(documentType));
  }

  /** documentType 未指定なら全種別へ既定日数を適用する。 */
  public int initializeDefaults(String documentType) {
    if (documentType != null) {
      return applyDefaults(requireDocumentType(documentType));
    }
    return Arrays.stream(DocumentType.values()).mapToInt(this::applyDefaults).sum();
  }

  private int applyDefaults(DocumentType type) {
    final List<Integer> days = defaultsSource.resolveDays(type);
    final List<Long> candidates = documentRepository.findIdsByTypeWithoutRules(type);
    int configured = 0;
    for (Long documentId : candidates) {
      if (applyIfStillUnconfigured(documentId, days)) {
        configured++;
      }
    }
    logger.info(
        "notification defaults applied type={} days={} configured={} candidates={}",
        type.wireName(),
        days,
        configured,
        candidates.size());
    return configured;
  }

  /** 抽出後に個別設定された書類や削除された書類は上書きせずに読み飛ばす。 */
  private boolean applyIfStillUnconfigured(long documentId, List<Integer> days) {
    final Boolean applied =
        transactionTemplate()
            .execute(
                status -> {
                  if (!documentRepository.lockById(documentId)
                      || ruleRepository.countByDocumentId(documentId) > 0) {
                    return false;
                  }
                  ruleRepository.insertAll(documentId, days, calendar.now());
                  return true;
                });
    return Boolean.TRUE.equals(applied);
  }

  @VisibleForTesting
  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }
}

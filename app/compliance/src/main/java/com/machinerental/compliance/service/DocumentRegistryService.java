/*
 * どこで: Compliance サービス層
 * 何を: 機械書類の登録/更新/更新手続き/削除/参照を扱う
 * なぜ: 1 機械 1 種別 1 書類の不変条件と、更新手続き時の通知ログ消去を一箇所で保証するため
 */
package com.machinerental.compliance.service;

import static com.machinerental.compliance.service.DocumentRequestValidator.requireDocumentType;
import static com.machinerental.compliance.service.DocumentRequestValidator.requireStatusFilter;
import static com.machinerental.compliance.service.DocumentRequestValidator.trimToNull;

import com.google.common.annotations.VisibleForTesting;
import com.machinerental.compliance.api.InvalidDocumentRequestException;
import com.machinerental.compliance.api.ResourceNotFoundException;
import com.machinerental.compliance.model.DocumentFilter;
import com.machinerental.compliance.model.DocumentStats;
import com.machinerental.compliance.model.DocumentStatusFilter;
import com.machinerental.compliance.model.DocumentType;
import com.machinerental.compliance.model.MachineDocumentView;
import com.machinerental.compliance.model.UpsertResult;
import com.machinerental.compliance.repository.MachineDocumentRepository;
import com.machinerental.compliance.repository.MachineRepository;
import com.machinerental.compliance.repository.NotificationLogRepository;
import java.time.LocalDate;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class DocumentRegistryService {

  private static final Logger logger = LoggerFactory.getLogger(DocumentRegistryService.class);
  private static final int DEFAULT_EXPIRING_DAYS_AHEAD = 14;

  private final MachineRepository machineRepository;
  private final MachineDocumentRepository documentRepository;
  private final NotificationLogRepository notificationLogRepository;
  private final BusinessCalendar calendar;
  private final PlatformTransactionManager transactionManager;

  public UpsertResult upsert(
      long machineId,
      String documentType,
      LocalDate expiryDate,
      LocalDate lastRenewedDate,
      String remarks) {
    final DocumentType type = requireDocumentType(documentType);
    if (expiryDate == null) {
      throw new InvalidDocumentRequestException("expiry_date is required");
    }
    if (lastRenewedDate != null && lastRenewedDate.isAfter(expiryDate)) {
      throw new InvalidDocumentRequestException(
          "last_renewed_date must not be after expiry_date");
    }
    final String normalizedRemarks = trimToNull(remarks);
    final UpsertResult result =
        transactionTemplate()
            .execute(
                status -> {
                  if (machineRepository.findById(machineId).isEmpty()) {
                    throw new ResourceNotFoundException("machine not found id=" + machineId);
                  }
                  return documentRepository.upsert(
                      machineId,
                      type,
                      expiryDate,
                      lastRenewedDate,
                      normalizedRemarks,
                      calendar.now());
                });
    logger.info(
        "document upserted id={} machineId={} type={} action={}",
        result.id(),
        machineId,
        type.wireName(),
        result.action());
    return result;
  }

  public MachineDocumentView renew(long documentId, LocalDate newExpiryDate, String remarks) {
    final LocalDate today = calendar.today();
    validateRenewalDate(newExpiryDate, today);
    final boolean renewed = renewInTransaction(documentId, newExpiryDate, trimToNull(remarks), today);
    if (!renewed) {
      throw ResourceNotFoundException.document(documentId);
    }
    return get(documentId);
  }

  /**
   * i 番目の書類に i 番目の期限日を適用する。期限日が足りない場合は先頭の期限日を使う。
   * 存在しない書類は読み飛ばし、件数に含めない。書類ごとに別トランザクションで更新する。
   */
  public int bulkRenew(List<Long> documentIds, List<LocalDate> newExpiryDates, String remarks) {
    if (documentIds == null || documentIds.isEmpty()) {
      throw new InvalidDocumentRequestException("document_ids must not be empty");
    }
    if (newExpiryDates == null || newExpiryDates.isEmpty()) {
      throw new InvalidDocumentRequestException("new_expiry_dates must not be empty");
    }
    final LocalDate today = calendar.today();
    for (LocalDate date : newExpiryDates) {
      validateRenewalDate(date, today);
    }
    final String normalizedRemarks = trimToNull(remarks);
    int updatedCount = 0;
    for (int i = 0; i < documentIds.size(); i++) {
      final Long documentId = documentIds.get(i);
      if (documentId == null) {
        continue;
      }
      final LocalDate expiryDate =
          i < newExpiryDates.size() ? newExpiryDates.get(i) : newExpiryDates.get(0);
      if (renewInTransaction(documentId, expiryDate, normalizedRemarks, today)) {
        updatedCount++;
      } else {
        logger.warn("bulk renewal skipped unknown document id={}", documentId);
      }
    }
    logger.info("bulk renewal finished requested={} updated={}", documentIds.size(), updatedCount);
    return updatedCount;
  }

  public void delete(long documentId) {
    final int deleted = documentRepository.delete(documentId);
    if (deleted == 0) {
      throw ResourceNotFoundException.document(documentId);
    }
    logger.info("document deleted id={}", documentId);
  }

  public MachineDocumentView get(long documentId) {
    return documentRepository
        .findViewById(documentId, calendar.today())
        .orElseThrow(() -> ResourceNotFoundException.document(documentId));
  }

  public List<MachineDocumentView> list(
      Long machineId, String documentType, String status, Integer expiringWithinDays) {
    final DocumentType type = documentType == null ? null : requireDocumentType(documentType);
    final DocumentStatusFilter statusFilter = status == null ? null : requireStatusFilter(status);
    return documentRepository.findViews(
        new DocumentFilter(machineId, type, statusFilter, expiringWithinDays), calendar.today());
  }

  public List<MachineDocumentView> listByMachine(long machineId) {
    if (machineRepository.findById(machineId).isEmpty()) {
      throw new ResourceNotFoundException("machine not found id=" + machineId);
    }
    return documentRepository.findViews(
        new DocumentFilter(machineId, null, null, null), calendar.today());
  }

  /** 指定 ID の書類を返す。存在しない ID は結果に含めない。 */
  public List<MachineDocumentView> findByIds(List<Long> documentIds) {
    return documentRepository.findViewsByIds(documentIds, calendar.today());
  }

  public List<MachineDocumentView> listExpiring() {
    return listExpiring(DEFAULT_EXPIRING_DAYS_AHEAD);
  }

  public List<MachineDocumentView> listExpiring(int daysAhead) {
    if (daysAhead < 0) {
      throw new InvalidDocumentRequestException("days must not be negative");
    }
    return documentRepository.findExpiringOnActiveMachines(calendar.today(), daysAhead);
  }

  public DocumentStats stats() {
    return documentRepository.stats(calendar.today());
  }

  private boolean renewInTransaction(
      long documentId, LocalDate newExpiryDate, String remarks, LocalDate today) {
    // 期限更新と通知ログ消去は同一トランザクション。消去しないと同じ閾値が二度と発火しない
    final Boolean renewed =
        transactionTemplate()
            .execute(
                status -> {
                  final int updated =
                      documentRepository.update(
                          documentId, newExpiryDate, today, remarks, calendar.now());
                  if (updated == 0) {
                    return false;
                  }
                  final int purged = notificationLogRepository.deleteByDocumentId(documentId);
                  logger.info(
                      "document renewed id={} newExpiryDate={} purgedLogs={}",
                      documentId,
                      newExpiryDate,
                      purged);
                  return true;
                });
    return Boolean.TRUE.equals(renewed);
  }

  private void validateRenewalDate(LocalDate newExpiryDate, LocalDate today) {
    if (newExpiryDate == null) {
      throw new InvalidDocumentRequestException("new_expiry_date is required");
    }
    if (newExpiryDate.isBefore(today)) {
      throw new InvalidDocumentRequestException("new_expiry_date must not be before today");
    }
  }

  @VisibleForTesting
  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }
}

/*
 * どこで: Compliance サービス層
 * 何を: 書類種別/既定範囲/状態フィルタ/通知日数の入力値を検証して型に変換する
 * なぜ: 不正値を書き込み前に 400 として弾き、各サービスで同じ文言を返すため
 */
package com.machinerental.compliance.service;

import com.machinerental.compliance.api.InvalidDocumentRequestException;
import com.machinerental.compliance.model.DocumentStatusFilter;
import com.machinerental.compliance.model.DocumentType;
import com.machinerental.compliance.model.NotificationScope;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

final class DocumentRequestValidator {

  static final int MIN_RULE_DAYS = -365;
  static final int MAX_RULE_DAYS = 3650;

  private DocumentRequestValidator() {}

  static DocumentType requireDocumentType(String value) {
    return DocumentType.fromWireName(value)
        .orElseThrow(
            () ->
                new InvalidDocumentRequestException(
                    "document_type must be one of "
                        + Arrays.stream(DocumentType.values())
                            .map(DocumentType::wireName)
                            .collect(Collectors.joining(", "))));
  }

  static NotificationScope requireScope(String value) {
    return NotificationScope.fromWireName(value)
        .orElseThrow(
            () ->
                new InvalidDocumentRequestException(
                    "document_type must be one of "
                        + Arrays.stream(NotificationScope.values())
                            .map(NotificationScope::wireName)
                            .collect(Collectors.joining(", "))));
  }

  static DocumentStatusFilter requireStatusFilter(String value) {
    return DocumentStatusFilter.fromParam(value)
        .orElseThrow(
            () ->
                new InvalidDocumentRequestException(
                    "status must be one of expired, critical, warning, notice, ok, expiring_soon"));
  }

  /** 通知日数を検証し、重複を除いた降順リストにする。 */
  static List<Integer> normalizeRuleDays(Collection<Integer> daysBefore) {
    if (daysBefore == null) {
      throw new InvalidDocumentRequestException("notification_days is required");
    }
    for (Integer days : daysBefore) {
      if (days == null || days < MIN_RULE_DAYS || days > MAX_RULE_DAYS) {
        throw new InvalidDocumentRequestException(
            "notification_days must be between " + MIN_RULE_DAYS + " and " + MAX_RULE_DAYS);
      }
    }
    return sortedDistinctDesc(daysBefore);
  }

  /** 既定日数は正の整数のみ。空リストは受け付けない。 */
  static List<Integer> normalizeDefaultDays(Collection<Integer> daysBefore) {
    if (daysBefore == null || daysBefore.isEmpty()) {
      throw new InvalidDocumentRequestException("notification_days must not be empty");
    }
    for (Integer days : daysBefore) {
      if (days == null || days <= 0 || days > MAX_RULE_DAYS) {
        throw new InvalidDocumentRequestException(
            "notification_days must be positive integers up to " + MAX_RULE_DAYS);
      }
    }
    return sortedDistinctDesc(daysBefore);
  }

  static String trimToNull(String value) {
    if (value == null) {
      return null;
    }
    final String trimmed = value.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }

  private static List<Integer> sortedDistinctDesc(Collection<Integer> daysBefore) {
    return daysBefore.stream().distinct().sorted(Comparator.reverseOrder()).toList();
  }
}

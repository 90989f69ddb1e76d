/*
 * どこで: Compliance ドメインモデル
 * 何を: 一覧検索で使う残日数帯のフィルタ
 * なぜ: ExpiryStatus の境界と SQL 条件を同じ定義から組み立てるため
 */
package com.machinerental.compliance.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum DocumentStatusFilter {
  EXPIRED(null, 0),
  CRITICAL(1, 3),
  WARNING(4, 7),
  NOTICE(8, 14),
  OK(15, null),
  EXPIRING_SOON(null, 14);

  private final Integer minDays;
  private final Integer maxDays;

  DocumentStatusFilter(Integer minDays, Integer maxDays) {
    this.minDays = minDays;
    this.maxDays = maxDays;
  }

  /** 下限 (含む)。null は下限なし。 */
  public Integer minDays() {
    return minDays;
  }

  /** 上限 (含む)。null は上限なし。 */
  public Integer maxDays() {
    return maxDays;
  }

  public static Optional<DocumentStatusFilter> fromParam(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    final String normalized = value.trim().toUpperCase(Locale.ROOT);
    return Arrays.stream(values()).filter(filter -> filter.name().equals(normalized)).findFirst();
  }
}

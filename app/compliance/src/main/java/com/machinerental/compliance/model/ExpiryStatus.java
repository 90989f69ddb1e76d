/*
 * どこで: Compliance ドメインモデル
 * 何を: 期限までの残日数から導出する書類の状態
 * なぜ: 「今日」は毎日変わるため保存せず、参照時に算出するため
 */
package com.machinerental.compliance.model;

public enum ExpiryStatus {
  EXPIRED,
  CRITICAL,
  WARNING,
  NOTICE,
  OK;

  public static ExpiryStatus fromDaysUntilExpiry(long daysUntilExpiry) {
    if (daysUntilExpiry <= 0) {
      return EXPIRED;
    }
    if (daysUntilExpiry <= 3) {
      return CRITICAL;
    }
    if (daysUntilExpiry <= 7) {
      return WARNING;
    }
    if (daysUntilExpiry <= 14) {
      return NOTICE;
    }
    return OK;
  }
}

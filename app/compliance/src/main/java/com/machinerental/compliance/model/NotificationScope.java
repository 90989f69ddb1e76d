/*
 * どこで: Compliance ドメインモデル
 * 何を: 既定通知設定の適用範囲 (書類種別または ALL)
 * なぜ: 種別固有の既定と全種別共通の既定を型で区別するため
 */
package com.machinerental.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

public enum NotificationScope {
  RC_BOOK("RC_Book"),
  PUC("PUC"),
  FITNESS("Fitness"),
  INSURANCE("Insurance"),
  ALL("ALL");

  private final String wireName;

  NotificationScope(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public static NotificationScope of(DocumentType documentType) {
    return switch (documentType) {
      case RC_BOOK -> RC_BOOK;
      case PUC -> PUC;
      case FITNESS -> FITNESS;
      case INSURANCE -> INSURANCE;
    };
  }

  public static Optional<NotificationScope> fromWireName(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(scope -> scope.wireName.equals(value)).findFirst();
  }
}

/*
 * どこで: Compliance ドメインモデル
 * 何を: 機械に紐づく法定書類の種別を表す列挙
 * なぜ: DB の CHECK 制約と API 表記 (RC_Book など) を一箇所で対応付けるため
 */
package com.machinerental.compliance.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

public enum DocumentType {
  RC_BOOK("RC_Book"),
  PUC("PUC"),
  FITNESS("Fitness"),
  INSURANCE("Insurance");

  private final String wireName;

  DocumentType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public static Optional<DocumentType> fromWireName(String value) {
    if (value == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(type -> type.wireName.equals(value)).findFirst();
  }

  public static DocumentType fromDatabase(String value) {
    return fromWireName(value)
        .orElseThrow(() -> new IllegalStateException("unknown document_type in database: " + value));
  }
}

/*
 * どこで: Compliance ドメインモデル
 * 何を: 共有ジョブテーブルに載るメール種別と、そのペイロード型の対応
 * なぜ: type 文字列と JSON の場当たり的な解釈を避け、種別を閉じた集合として扱うため
 */
package com.machinerental.compliance.model;

import java.util.Arrays;

public enum EmailJobType {
  DOCUMENT_EXPIRY("document_expiry", DocumentExpiryPayload.class);

  private final String code;
  private final Class<? extends EmailJobPayload> payloadType;

  EmailJobType(String code, Class<? extends EmailJobPayload> payloadType) {
    this.code = code;
    this.payloadType = payloadType;
  }

  public String code() {
    return code;
  }

  public Class<? extends EmailJobPayload> payloadType() {
    return payloadType;
  }

  public static EmailJobType fromCode(String code) {
    return Arrays.stream(values())
        .filter(type -> type.code.equals(code))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown email job type: " + code));
  }
}

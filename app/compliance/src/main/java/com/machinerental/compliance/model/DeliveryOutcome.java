package com.machinerental.compliance.model;

/** 1 回の送信試行の結果。失敗理由は呼び出し元へそのまま返す。 */
public record DeliveryOutcome(boolean success, String error) {

  public static DeliveryOutcome delivered() {
    return new DeliveryOutcome(true, null);
  }

  public static DeliveryOutcome failed(String error) {
    return new DeliveryOutcome(false, error);
  }
}

/*
 * どこで: Compliance メール送信
 * 何を: 1 回の送信結果 (成功/メッセージ ID/失敗理由)
 * なぜ: 送信失敗を例外ではなく値で返し、リトライ判断を呼び出し側に任せるため
 */
package com.machinerental.compliance.service.mail;

public record MailDeliveryResult(boolean success, String messageId, String error) {

  public static MailDeliveryResult delivered(String messageId) {
    return new MailDeliveryResult(true, messageId, null);
  }

  public static MailDeliveryResult failed(String error) {
    return new MailDeliveryResult(false, null, error);
  }
}

/*
 * どこで: Compliance メール送信
 * 何を: メール送信の抽象化インターフェース
 * なぜ: 実送信/テスト差し替えを容易にするため
 */
package com.machinerental.compliance.service.mail;

public interface MailSender {

  /** 実装は送信失敗を例外にせず {@link MailDeliveryResult#failed} で返す。 */
  MailDeliveryResult send(MailMessage message);
}

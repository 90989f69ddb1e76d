/*
 * どこで: Compliance メール送信
 * 何を: メール送信を模擬する実装
 * なぜ: SMTP を使わない環境でも配信/ジョブの状態遷移を確認するため
 */
package com.machinerental.compliance.service.mail;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "compliance.mail",
    name = "smtp-enabled",
    havingValue = "false",
    matchIfMissing = true)
public class LocalMailSender implements MailSender {

  private static final Logger logger = LoggerFactory.getLogger(LocalMailSender.class);

  @Override
  public MailDeliveryResult send(MailMessage message) {
    // 実送信は行わず、ログに残すだけとする
    final String messageId = "local-" + UUID.randomUUID();
    logger.info(
        "mail simulated send messageId={} to={} subject={}",
        messageId,
        message.to(),
        message.subject());
    return MailDeliveryResult.delivered(messageId);
  }
}

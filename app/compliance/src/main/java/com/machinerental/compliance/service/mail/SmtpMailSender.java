/*
 * どこで: Compliance メール送信
 * 何を: JavaMailSender 経由で SMTP 送信する実装
 * なぜ: 本番環境で管理者宛てにアラートを届けるため
 */
package com.machinerental.compliance.service.mail;

import com.machinerental.compliance.config.ComplianceMailProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "compliance.mail", name = "smtp-enabled", havingValue = "true")
public class SmtpMailSender implements MailSender {

  private static final Logger logger = LoggerFactory.getLogger(SmtpMailSender.class);

  private final JavaMailSender javaMailSender;
  private final ComplianceMailProperties properties;

  @Override
  public MailDeliveryResult send(MailMessage message) {
    try {
      final MimeMessage mimeMessage = javaMailSender.createMimeMessage();
      final MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, false, "UTF-8");
      helper.setFrom(properties.from());
      helper.setTo(message.to().toArray(String[]::new));
      helper.setSubject(message.subject());
      helper.setText(message.body(), false);
      // 優先度は高 (X-Priority: 1)
      helper.setPriority(1);
      javaMailSender.send(mimeMessage);
      final String messageId = mimeMessage.getMessageID();
      logger.info("mail sent messageId={} to={}", messageId, message.to());
      return MailDeliveryResult.delivered(messageId);
    } catch (MailException | MessagingException ex) {
      logger.warn("mail send failed to={} subject={}", message.to(), message.subject(), ex);
      return MailDeliveryResult.failed(ex.getMessage());
    }
  }
}

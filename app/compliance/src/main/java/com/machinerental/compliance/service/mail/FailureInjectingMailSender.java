/*
 * どこで: Compliance メール送信
 * 何を: CI/Test 専用でメール送信失敗を注入する Sender
 * なぜ: 実コード経路を汚さずに E2E で retry -> FAILED を再現するため
 */
package com.machinerental.compliance.service.mail;

import com.machinerental.compliance.config.ComplianceMailProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "compliance.mail.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingMailSender implements MailSender {

  private final LocalMailSender delegate;
  private final ComplianceMailProperties properties;

  @Override
  public MailDeliveryResult send(MailMessage message) {
    if (shouldInjectFailure(message.subject())) {
      return MailDeliveryResult.failed(
          "mail delivery failure injection matched subject=" + message.subject());
    }
    return delegate.send(message);
  }

  private boolean shouldInjectFailure(String subject) {
    final ComplianceMailProperties.FailureInjection injection = properties.failureInjection();
    if (injection == null
        || injection.machineNumberPrefix() == null
        || injection.machineNumberPrefix().isBlank()) {
      return false;
    }
    // 件名は "Document Expiry Alert - {machine_number} ({type})" 形式
    return subject != null && subject.contains("- " + injection.machineNumberPrefix());
  }
}

/*
 * どこで: Compliance SMTP 送信のユニットテスト
 * 何を: MIME 組み立てと、SMTP 例外が失敗結果に変わることを検証する
 * なぜ: 送信失敗を例外で漏らさず、ジョブのリトライ判断へ値で渡すため
 */
package com.machinerental.compliance.service.mail;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.machinerental.compliance.config.ComplianceMailProperties;
import jakarta.mail.Message;
import jakarta.mail.Session;
import jakarta.mail.internet.MimeMessage;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mail.MailSendException;
import org.springframework.mail.javamail.JavaMailSender;

@ExtendWith(MockitoExtension.class)
class SmtpMailSenderTest {

  @Mock private JavaMailSender javaMailSender;

  private SmtpMailSender sender;

  @BeforeEach
  void setUp() {
    sender =
        new SmtpMailSender(
            javaMailSender,
            new ComplianceMailProperties(
                true,
                "no-reply@example.com",
                List.of("fleet-admin@example.com"),
                new ComplianceMailProperties.FailureInjection(false, null)));
    when(javaMailSender.createMimeMessage()).thenReturn(new MimeMessage((Session) null));
  }

  @Test
  void sendsHighPriorityPlainTextMailAndReturnsMessageId() throws Exception {
    doAnswer(
            invocation -> {
              invocation.<MimeMessage>getArgument(0).setHeader("Message-ID", "<m-1@example.com>");
              return null;
            })
        .when(javaMailSender)
        .send(any(MimeMessage.class));

    final MailDeliveryResult result =
        sender.send(
            new MailMessage(
                List.of("fleet-admin@example.com", "ops@example.com"),
                "Document Expiry Alert - MR-001 (PUC)",
                "PUC expires in 7 days"));

    assertThat(result.success()).isTrue();
    assertThat(result.messageId()).isEqualTo("<m-1@example.com>");
    assertThat(result.error()).isNull();

    final ArgumentCaptor<MimeMessage> captor = ArgumentCaptor.forClass(MimeMessage.class);
    verify(javaMailSender).send(captor.capture());
    final MimeMessage sent = captor.getValue();
    assertThat(sent.getFrom()[0].toString()).isEqualTo("no-reply@example.com");
    assertThat(sent.getRecipients(Message.RecipientType.TO))
        .extracting(Object::toString)
        .containsExactly("fleet-admin@example.com", "ops@example.com");
    assertThat(sent.getSubject()).isEqualTo("Document Expiry Alert - MR-001 (PUC)");
    assertThat(sent.getHeader("X-Priority")[0]).startsWith("1");
  }

  @Test
  void convertsMailExceptionIntoFailedResult() {
    doThrow(new MailSendException("smtp unavailable"))
        .when(javaMailSender)
        .send(any(MimeMessage.class));

    final MailDeliveryResult result =
        sender.send(
            new MailMessage(
                List.of("fleet-admin@example.com"), "Document Expiry Alert - MR-002 (FITNESS)", "x"));

    assertThat(result.success()).isFalse();
    assertThat(result.messageId()).isNull();
    assertThat(result.error()).contains("smtp unavailable");
  }
}

/*
 * どこで: Compliance サービス層
 * 何を: ジョブペイロードから管理者宛てのアラートメールを組み立てる
 * なぜ: 即時送信とジョブ再送で同じ件名/本文を使うため
 */
package com.machinerental.compliance.service;

import com.machinerental.compliance.config.ComplianceMailProperties;
import com.machinerental.compliance.model.DocumentExpiryPayload;
import com.machinerental.compliance.model.EmailJobPayload;
import com.machinerental.compliance.service.mail.MailMessage;
import java.time.format.DateTimeFormatter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DocumentExpiryAlertComposer {

  private static final DateTimeFormatter EXPIRY_DATE_FORMAT = DateTimeFormatter.ofPattern("dd/MM/yyyy");

  private final ComplianceMailProperties mailProperties;

  public MailMessage compose(EmailJobPayload payload) {
    if (payload instanceof DocumentExpiryPayload expiry) {
      return composeDocumentExpiry(expiry);
    }
    throw new IllegalArgumentException("unsupported email job payload: " + payload.jobType());
  }

  private MailMessage composeDocumentExpiry(DocumentExpiryPayload payload) {
    final String documentType = payload.documentType().wireName();
    final String subject =
        "Document Expiry Alert - " + payload.machineNumber() + " (" + documentType + ")";
    final String machineName =
        payload.machineName() == null || payload.machineName().isBlank()
            ? "N/A"
            : payload.machineName();
    final String urgency =
        payload.daysUntilExpiry() <= 0
            ? "This document has EXPIRED!"
            : "This document expires in " + payload.daysUntilExpiry() + " days!";
    final String body =
        String.join(
            "\n",
            "Document Expiry Alert",
            "",
            "Machine: " + payload.machineNumber(),
            "Machine Name: " + machineName,
            "Document Type: " + documentType,
            "Expiry Date: " + payload.expiryDate().format(EXPIRY_DATE_FORMAT),
            "",
            urgency,
            "",
            "Please renew this document immediately to avoid compliance issues"
                + " and ensure uninterrupted operations.",
            "",
            "This is an automated notification from the machine rental management system.");
    return new MailMessage(mailProperties.adminEmails(), subject, body);
  }
}

/*
 * どこで: Compliance API
 * 何を: 期限アラートの手動実行とメール送信ジョブの確認/再送エンドポイントを提供する
 * なぜ: 定期実行を待たずに運用者が送信状況を確認・介入できるようにするため
 */
package com.machinerental.compliance.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.machinerental.compliance.api.request.SendExpiryAlertsRequest;
import com.machinerental.compliance.api.response.AlertRunResponse;
import com.machinerental.compliance.api.response.DeliveryOutcomeResponse;
import com.machinerental.compliance.api.response.EmailJobStatsResponse;
import com.machinerental.compliance.api.response.EmailJobSummary;
import com.machinerental.compliance.api.response.EmailJobsResponse;
import com.machinerental.compliance.model.EmailJobRecord;
import com.machinerental.compliance.model.EmailJobStatus;
import com.machinerental.compliance.model.EmailJobType;
import com.machinerental.compliance.service.EmailJobQueueService;
import com.machinerental.compliance.service.ExpiryAlertScheduler;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class ExpiryAlertController {

  private final ExpiryAlertScheduler expiryAlertScheduler;
  private final EmailJobQueueService emailJobQueueService;
  private final ObjectMapper objectMapper;

  @PostMapping("/expiry-alerts/check")
  public AlertRunResponse check() {
    return AlertRunResponse.from(expiryAlertScheduler.checkNotificationsDue());
  }

  @PostMapping("/expiry-alerts/send")
  public AlertRunResponse send(@RequestBody(required = false) SendExpiryAlertsRequest request) {
    final List<Long> documentIds = request == null ? null : request.documentIds();
    final boolean forceSend = request != null && request.forceSend();
    return AlertRunResponse.from(expiryAlertScheduler.sendExpiryAlerts(documentIds, forceSend));
  }

  @PostMapping("/documents/{id}/expiry-alert")
  public AlertRunResponse sendNow(
      @PathVariable("id") long documentId,
      @RequestParam(name = "force", defaultValue = "false") boolean force) {
    return AlertRunResponse.from(expiryAlertScheduler.sendNow(documentId, force));
  }

  @GetMapping("/email-jobs")
  public EmailJobsResponse jobs(
      @RequestParam(name = "type", defaultValue = "document_expiry") String type,
      @RequestParam(name = "status", required = false) String status,
      @RequestParam(name = "entity_id", required = false) String entityId) {
    final List<EmailJobSummary> jobs =
        emailJobQueueService
            .listByStatus(parseType(type), parseStatus(status), entityId)
            .stream()
            .map(this::toSummary)
            .toList();
    return new EmailJobsResponse(jobs.size(), jobs);
  }

  @GetMapping("/email-jobs/stats")
  public EmailJobStatsResponse stats(
      @RequestParam(name = "type", defaultValue = "document_expiry") String type) {
    return EmailJobStatsResponse.from(emailJobQueueService.stats(parseType(type)));
  }

  @PostMapping("/email-jobs/{id}/attempt")
  public DeliveryOutcomeResponse attempt(@PathVariable("id") long jobId) {
    return DeliveryOutcomeResponse.from(jobId, emailJobQueueService.attempt(jobId));
  }

  @PostMapping("/email-jobs/{id}/retry")
  public ResponseEntity<Void> retry(@PathVariable("id") long jobId) {
    emailJobQueueService.retryFailed(jobId);
    return ResponseEntity.accepted().build();
  }

  private EmailJobType parseType(String type) {
    try {
      return EmailJobType.fromCode(type);
    } catch (IllegalArgumentException ex) {
      throw new InvalidDocumentRequestException("type must be one of document_expiry");
    }
  }

  private EmailJobStatus parseStatus(String status) {
    if (status == null || status.isBlank()) {
      return null;
    }
    try {
      return EmailJobStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new InvalidDocumentRequestException(
          "status must be one of pending, processing, completed, failed");
    }
  }

  private EmailJobSummary toSummary(EmailJobRecord record) {
    try {
      final JsonNode payload = objectMapper.readTree(record.payloadJson());
      return new EmailJobSummary(
          record.id(),
          record.type().code(),
          record.entityId(),
          record.status(),
          record.attempts(),
          record.maxAttempts(),
          record.error(),
          record.scheduledFor(),
          record.processedAt(),
          record.createdAt(),
          payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("email job payload parse failure id=" + record.id(), ex);
    }
  }
}

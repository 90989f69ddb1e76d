/*
 * どこで: Compliance API
 * 何を: 書類ごとの通知設定、既定通知設定、通知履歴のエンドポイントを提供する
 * なぜ: 通知閾値の運用変更と送信済み履歴の確認を API から行うため
 */
package com.machinerental.compliance.api;

import com.machinerental.compliance.api.request.ApplyDefaultsRequest;
import com.machinerental.compliance.api.request.ConfigureNotificationsRequest;
import com.machinerental.compliance.api.request.UpdateNotificationDefaultsRequest;
import com.machinerental.compliance.api.response.ConfiguredCountResponse;
import com.machinerental.compliance.api.response.NotificationDefaultsResponse;
import com.machinerental.compliance.api.response.NotificationHistoryResponse;
import com.machinerental.compliance.api.response.NotificationSettingsResponse;
import com.machinerental.compliance.model.NotificationDefault;
import com.machinerental.compliance.service.DueNotificationEvaluator;
import com.machinerental.compliance.service.NotificationRuleService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class DocumentNotificationController {

  private final NotificationRuleService notificationRuleService;
  private final DueNotificationEvaluator dueNotificationEvaluator;

  @PutMapping("/documents/{id}/notifications")
  public NotificationSettingsResponse configure(
      @PathVariable("id") long documentId,
      @Valid @RequestBody ConfigureNotificationsRequest request) {
    final List<Integer> days =
        notificationRuleService.configure(documentId, request.notificationDays());
    return NotificationSettingsResponse.fromDays(documentId, days);
  }

  @GetMapping("/documents/{id}/notifications")
  public NotificationSettingsResponse settings(@PathVariable("id") long documentId) {
    return NotificationSettingsResponse.fromRules(
        documentId, notificationRuleService.getNotificationSettings(documentId));
  }

  @GetMapping("/notification-history")
  public NotificationHistoryResponse history(
      @RequestParam(name = "document_id", required = false) Long documentId) {
    return NotificationHistoryResponse.from(
        dueNotificationEvaluator.getNotificationHistory(documentId));
  }

  @GetMapping("/documents/{id}/notification-history")
  public NotificationHistoryResponse documentHistory(@PathVariable("id") long documentId) {
    return NotificationHistoryResponse.from(
        dueNotificationEvaluator.getNotificationHistory(documentId));
  }

  @GetMapping("/notification-defaults")
  public NotificationDefaultsResponse defaults(
      @RequestParam(name = "document_type", required = false) String documentType) {
    return NotificationDefaultsResponse.from(notificationRuleService.getDefaults(documentType));
  }

  @PutMapping("/notification-defaults")
  public NotificationDefaultsResponse updateDefaults(
      @Valid @RequestBody UpdateNotificationDefaultsRequest request) {
    final NotificationDefault updated =
        notificationRuleService.updateDefaults(
            request.documentType(), request.notificationDays(), request.updatedBy());
    return NotificationDefaultsResponse.from(List.of(updated));
  }

  @PostMapping("/notification-defaults/apply")
  public ConfiguredCountResponse applyDefaults(@Valid @RequestBody ApplyDefaultsRequest request) {
    return new ConfiguredCountResponse(
        request.documentType(), notificationRuleService.applyDefaults(request.documentType()));
  }

  @PostMapping("/notification-defaults/initialize")
  public ConfiguredCountResponse initializeDefaults(
      @RequestParam(name = "document_type", required = false) String documentType) {
    return new ConfiguredCountResponse(
        documentType, notificationRuleService.initializeDefaults(documentType));
  }
}

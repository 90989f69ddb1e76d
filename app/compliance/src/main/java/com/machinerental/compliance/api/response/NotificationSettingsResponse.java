/*
 * どこで: Compliance API レスポンス DTO
 * 何を: 書類 1 件の通知設定 (日数の降順)
 * なぜ: 設定 API と参照 API で同じ形を返すため
 */
package com.machinerental.compliance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machinerental.compliance.model.NotificationRuleRecord;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSettingsResponse(long documentId, List<Rule> notifications) {

  public NotificationSettingsResponse {
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }

  public static NotificationSettingsResponse fromRules(
      long documentId, List<NotificationRuleRecord> rules) {
    return new NotificationSettingsResponse(
        documentId, rules.stream().map(rule -> new Rule(rule.daysBefore(), rule.active())).toList());
  }

  public static NotificationSettingsResponse fromDays(long documentId, List<Integer> days) {
    return new NotificationSettingsResponse(
        documentId, days.stream().map(day -> new Rule(day, true)).toList());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record Rule(int daysBefore, boolean active) {}
}

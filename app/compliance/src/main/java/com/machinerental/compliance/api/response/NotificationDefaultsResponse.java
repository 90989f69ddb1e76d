package com.machinerental.compliance.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.machinerental.compliance.model.NotificationDefault;
import com.machinerental.compliance.model.NotificationScope;
import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationDefaultsResponse(List<DefaultSetting> defaults) {

  public NotificationDefaultsResponse {
    defaults = defaults == null ? List.of() : List.copyOf(defaults);
  }

  public static NotificationDefaultsResponse from(List<NotificationDefault> defaults) {
    return new NotificationDefaultsResponse(
        defaults.stream().map(DefaultSetting::from).toList());
  }

  /** document_type は書類種別か ALL。 */
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record DefaultSetting(
      NotificationScope documentType,
      List<Integer> notificationDays,
      boolean active,
      String createdBy,
      Instant updatedAt) {

    public DefaultSetting {
      notificationDays = notificationDays == null ? List.of() : List.copyOf(notificationDays);
    }

    public static DefaultSetting from(NotificationDefault notificationDefault) {
      return new DefaultSetting(
          notificationDefault.scope(),
          notificationDefault.daysBefore(),
          notificationDefault.active(),
          notificationDefault.createdBy(),
          notificationDefault.updatedAt());
    }
  }
}

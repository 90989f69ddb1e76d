/*
 * どこで: Compliance アプリの設定バインド
 * 何を: 「今日」を決める業務タイムゾーンを保持する
 * なぜ: サーバの既定タイムゾーンに依らず期限日数を一定にするため
 */
package com.machinerental.compliance.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import java.time.DateTimeException;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "compliance.calendar")
@Validated
public record ComplianceCalendarProperties(@NotBlank String zone) {

  @AssertTrue(message = "compliance.calendar.zone must be a valid zone id")
  public boolean isZoneValid() {
    if (zone == null || zone.isBlank()) {
      // 未設定は @NotBlank で検出する
      return true;
    }
    try {
      ZoneId.of(zone);
      return true;
    } catch (DateTimeException ex) {
      return false;
    }
  }

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }
}

/*
 * どこで: Compliance アプリの設定バインド
 * 何を: DB 上の既定通知設定が使えない場合の最終フォールバック日数
 * なぜ: 既定設定の欠落や不正値でも通知閾値を必ず決定できるようにするため
 */
package com.machinerental.compliance.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "compliance.notification-defaults")
@Validated
public record NotificationDefaultsProperties(@NotEmpty List<Integer> fallbackDays) {

  @AssertTrue(message = "compliance.notification-defaults.fallback-days must be positive")
  public boolean isFallbackDaysPositive() {
    return fallbackDays == null
        || fallbackDays.stream().allMatch(days -> days != null && days > 0);
  }
}

/*
 * どこで: Compliance アプリの設定バインド
 * 何を: 期限アラートの定期実行設定を保持する
 * なぜ: 実行間隔と対象期間を環境ごとに調整するため
 */
package com.machinerental.compliance.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "compliance.scheduler")
@Validated
public record ComplianceSchedulerProperties(
    boolean enabled, @NotNull Duration pollInterval, @Positive int expiringWindowDays) {}

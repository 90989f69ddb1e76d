/*
 * どこで: Compliance アプリの設定バインド
 * 何を: メール送信ジョブのバッチ/リトライ/lease 設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.machinerental.compliance.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "compliance.email-job")
@Validated
public record EmailJobProperties(
    @Positive int batchSize,
    @Positive int maxAttempts,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    @NotNull Duration backoffMin,
    @Positive int errorMessageMaxLength,
    @NotNull Duration lease,
    @Positive int statusListLimit) {

  @AssertTrue(message = "compliance.email-job.backoff-jitter-min must not exceed backoff-jitter-max")
  public boolean isJitterRangeValid() {
    return backoffJitterMin > 0 && backoffJitterMin <= backoffJitterMax;
  }

  @AssertTrue(message = "compliance.email-job.lease must be positive")
  public boolean isLeasePositive() {
    return lease == null || (!lease.isZero() && !lease.isNegative());
  }
}

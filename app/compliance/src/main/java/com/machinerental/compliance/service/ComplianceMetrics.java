/*
 * どこで: Compliance サービス層
 * 何を: 期限到達件数/アラート配信結果/ジョブ失敗/backlog のアプリ固有メトリクスを記録する
 * なぜ: 通知が止まっていないかを Prometheus から直接観測できるようにするため
 */
package com.machinerental.compliance.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class ComplianceMetrics {

  public static final String RESULT_SENT = "sent";
  public static final String RESULT_FAILED = "failed";
  public static final String RESULT_SKIPPED = "skipped";

  private static final String METRIC_NOTIFICATION_DUE_TOTAL = "compliance.notification.due.total";
  private static final String METRIC_ALERT_DELIVERY_TOTAL = "compliance.alert.delivery.total";
  private static final String METRIC_EMAIL_JOB_FAILED_TOTAL = "compliance.email_job.failed.total";
  private static final String METRIC_EMAIL_JOB_BACKLOG_CURRENT =
      "compliance.email_job.backlog.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger backlogCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final Counter notificationDueCounter;
  private final Counter emailJobFailedCounter;

  public ComplianceMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_EMAIL_JOB_BACKLOG_CURRENT, backlogCurrent, AtomicInteger::get)
        .description("Current number of pending email jobs")
        .register(meterRegistry);
    this.notificationDueCounter =
        Counter.builder(METRIC_NOTIFICATION_DUE_TOTAL)
            .description("Total number of claimed due notifications")
            .register(meterRegistry);
    this.emailJobFailedCounter =
        Counter.builder(METRIC_EMAIL_JOB_FAILED_TOTAL)
            .description("Total number of email jobs that exhausted their attempts")
            .register(meterRegistry);
  }

  public void recordNotificationsDue(int count) {
    if (count > 0) {
      notificationDueCounter.increment(count);
    }
  }

  public void recordDeliveryResult(String result) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_ALERT_DELIVERY_TOTAL)
                    .description("Document expiry alert delivery outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordEmailJobFailed() {
    emailJobFailedCounter.increment();
  }

  public void updateBacklogCurrent(int backlogCount) {
    backlogCurrent.set(Math.max(backlogCount, 0));
  }
}

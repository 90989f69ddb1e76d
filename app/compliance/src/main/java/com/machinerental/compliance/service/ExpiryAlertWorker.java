/*
 * どこで: Compliance 定期実行ワーカー
 * 何を: スケジュールで期限アラート処理を起動する
 * なぜ: 期限到達の判定とジョブ再送を一定間隔で行うため
 */
package com.machinerental.compliance.service;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "compliance.scheduler.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ExpiryAlertWorker {

  private final ExpiryAlertScheduler scheduler;

  @Scheduled(fixedDelayString = "${compliance.scheduler.poll-interval}")
  public void run() {
    scheduler.runScheduled();
  }
}

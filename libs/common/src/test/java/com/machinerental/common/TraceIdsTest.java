/*
 * どこで: Common ユーティリティのテスト
 * 何を: MDC スコープの設定と復元を検証する
 * なぜ: スケジュール実行後に trace_id が残留しないことを保証するため
 */
package com.machinerental.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class TraceIdsTest {

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void scopePutsTraceIdAndRemovesItOnClose() {
    try (TraceIds.MdcScope scope = TraceIds.openScope()) {
      assertThat(MDC.get(TraceIds.MDC_KEY)).isEqualTo(scope.traceId());
    }

    assertThat(MDC.get(TraceIds.MDC_KEY)).isNull();
  }

  @Test
  void scopeRestoresPreviousTraceId() {
    MDC.put(TraceIds.MDC_KEY, "outer");

    try (TraceIds.MdcScope scope = TraceIds.openScope()) {
      assertThat(scope.traceId()).isNotEqualTo("outer");
    }

    assertThat(MDC.get(TraceIds.MDC_KEY)).isEqualTo("outer");
  }
}

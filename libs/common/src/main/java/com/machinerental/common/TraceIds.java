package com.machinerental.common;

import java.util.UUID;
import org.slf4j.MDC;

public final class TraceIds {

  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /**
   * 新しい trace_id を MDC に載せ、close で元の値へ戻す。スケジュール実行のように HTTP
   * リクエストを伴わない処理のログを 1 回の実行単位で束ねるために使う。
   */
  public static MdcScope openScope() {
    final String previous = MDC.get(MDC_KEY);
    final String traceId = newTraceId();
    MDC.put(MDC_KEY, traceId);
    return new MdcScope(traceId, previous);
  }

  public static final class MdcScope implements AutoCloseable {

    private final String traceId;
    private final String previous;

    private MdcScope(String traceId, String previous) {
      this.traceId = traceId;
      this.previous = previous;
    }

    public String traceId() {
      return traceId;
    }

    @Override
    public void close() {
      if (previous == null) {
        MDC.remove(MDC_KEY);
        return;
      }
      MDC.put(MDC_KEY, previous);
    }
  }
}

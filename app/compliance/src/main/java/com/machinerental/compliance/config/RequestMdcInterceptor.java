/*
 * どこで: Compliance Web 設定
 * 何を: 手動トリガー/設定 API のログに trace_id・request_id・ルート・対象 ID を載せる
 * なぜ: 定期実行と同じ trace_id 軸で、操作者が起動した 1 リクエスト分のログを追えるようにするため
 */
package com.machinerental.compliance.config;

import com.machinerental.common.TraceIds;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String REQUEST_ID_HEADER = "X-Request-Id";
  static final String TRACE_ID_HEADER = "X-Trace-Id";
  static final String RESOURCE_ID_KEY = "resource_id";

  private static final String SAVED_CONTEXT = RequestMdcInterceptor.class.getName() + ".SAVED";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<String, String> saved = MDC.getCopyOfContextMap();
    request.setAttribute(SAVED_CONTEXT, saved == null ? Map.of() : saved);

    if (MDC.get(TraceIds.MDC_KEY) == null) {
      MDC.put(TraceIds.MDC_KEY, headerOrNewId(request, TRACE_ID_HEADER));
    }
    MDC.put("request_id", headerOrNewId(request, REQUEST_ID_HEADER));
    MDC.put("http_method", request.getMethod());
    // 書類 ID ごとに別系列にならないよう、生の URI ではなくルートのパターンを記録する
    final Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
    MDC.put("http_path", pattern instanceof String route ? route : request.getRequestURI());
    if (request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE)
            instanceof Map<?, ?> variables
        && variables.get("id") instanceof String id) {
      MDC.put(RESOURCE_ID_KEY, id);
    }
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (!(request.getAttribute(SAVED_CONTEXT) instanceof Map<?, ?> saved)) {
      return;
    }
    MDC.clear();
    saved.forEach((key, value) -> MDC.put((String) key, (String) value));
  }

  private String headerOrNewId(HttpServletRequest request, String header) {
    final String value = request.getHeader(header);
    return value == null || value.isBlank() ? TraceIds.newTraceId() : value.trim();
  }
}

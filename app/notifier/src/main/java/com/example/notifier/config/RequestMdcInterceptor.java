/*
 * どこで: Notifier Web 設定
 * 何を: 管理 API の操作者と操作対象 (job_id/username/override 対象) を MDC に積む
 * なぜ: ジョブ実行や通知停止のログから、どの管理操作が起点かを辿れるようにするため
 */
package com.example.notifier.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String HEADER_REQUEST_ID = "X-Request-Id";
  static final String HEADER_ACTOR_USER_ID = "X-Actor-User-Id";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  // パス変数名 -> MDC キー
  private static final Map<String, String> PATH_VARIABLE_KEYS =
      Map.of(
          "jobId", "job_id",
          "username", "target_username",
          "targetType", "override_target_type",
          "targetKey", "override_target_key",
          "trigger", "trigger");

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    final String requestId = resolveRequestId(request);
    put(keys, "request_id", requestId);
    response.setHeader(HEADER_REQUEST_ID, requestId);
    put(keys, "admin_operation", request.getMethod() + " " + request.getRequestURI());
    put(keys, "actor_user_id", request.getHeader(HEADER_ACTOR_USER_ID));
    final Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    if (variables instanceof Map<?, ?> pathVariables) {
      PATH_VARIABLE_KEYS.forEach(
          (variable, key) -> {
            final Object value = pathVariables.get(variable);
            put(keys, key, value == null ? null : value.toString());
          });
    }
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> keys) {
      keys.forEach(key -> MDC.remove(String.valueOf(key)));
    }
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(HEADER_REQUEST_ID);
    return requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}

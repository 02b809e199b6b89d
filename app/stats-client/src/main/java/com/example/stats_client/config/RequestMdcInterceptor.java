/*
 * どこで: Stats クライアント Web 設定
 * 何を: 受信リクエストごとに request_id / HTTP 情報 / mode / ランキング種別を MDC へ載せる
 * なぜ: 上流呼び出しのログと受信リクエストを同じ request_id で追跡するため
 */
package com.example.stats_client.config;

import com.example.common.TraceIds;
import com.google.common.base.Splitter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String HTTP_METHOD = "http_method";
  static final String HTTP_PATH = "http_path";
  static final String CLIENT_IP = "client_ip";
  static final String STATS_MODE = "stats_mode";
  static final String STATS_RANKING_TYPE = "stats_ranking_type";

  static final List<String> MDC_KEYS =
      List.of(
          TraceIds.REQUEST_ID_MDC_KEY,
          HTTP_METHOD,
          HTTP_PATH,
          CLIENT_IP,
          STATS_MODE,
          STATS_RANKING_TYPE);

  private static final Splitter FORWARDED_FOR = Splitter.on(',').trimResults().omitEmptyStrings();

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final Map<?, ?> pathVariables = pathVariables(request);
    putIfPresent(TraceIds.REQUEST_ID_MDC_KEY, requestId(request));
    putIfPresent(HTTP_METHOD, request.getMethod());
    putIfPresent(HTTP_PATH, request.getRequestURI());
    putIfPresent(CLIENT_IP, clientIp(request));
    putIfPresent(STATS_MODE, pathVariables.get("mode"));
    putIfPresent(STATS_RANKING_TYPE, pathVariables.get("type"));
    return true;
  }

  // 設定していないキーの remove は何もしない
  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    MDC_KEYS.forEach(MDC::remove);
  }

  private String requestId(HttpServletRequest request) {
    final String inbound = request.getHeader(TraceIds.REQUEST_ID_HEADER);
    return inbound == null || inbound.isBlank() ? TraceIds.newTraceId() : inbound;
  }

  /** プロキシ経由の場合は X-Forwarded-For の先頭 (元クライアント) を採用する。 */
  private String clientIp(HttpServletRequest request) {
    final String forwardedFor = request.getHeader("X-Forwarded-For");
    if (forwardedFor != null) {
      final Iterator<String> hops = FORWARDED_FOR.split(forwardedFor).iterator();
      if (hops.hasNext()) {
        return hops.next();
      }
    }
    return request.getRemoteAddr();
  }

  // パス変数はハンドラ解決後にだけ request 属性へ格納される
  private Map<?, ?> pathVariables(HttpServletRequest request) {
    final Object attribute =
        request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
    return attribute instanceof Map<?, ?> variables ? variables : Map.of();
  }

  private void putIfPresent(String key, @Nullable Object value) {
    if (value instanceof String text && !text.isBlank()) {
      MDC.put(key, text);
    }
  }
}

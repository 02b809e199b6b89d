/*
 * どこで: Stats サービス層
 * 何を: 上流呼び出し結果/所要時間、ページ終端、API エラーのメトリクスを記録する
 * なぜ: 上流の失敗率とページ送りの打ち切り状況を Prometheus から直接観測できるようにするため
 */
package com.example.stats_client.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class StatsMetrics {

  private static final String METRIC_REQUEST_TOTAL = "stats.request.total";
  private static final String METRIC_REQUEST_DURATION = "stats.request.duration";
  private static final String METRIC_PAGINATION_EXHAUSTED_TOTAL =
      "stats.pagination.exhausted.total";
  private static final String METRIC_API_ERROR_TOTAL = "stats.api.error.total";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Timer> requestTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> exhaustedCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> apiErrorCounters = new ConcurrentHashMap<>();

  public StatsMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordRequest(String resource, String result, Duration duration) {
    final String key = resource + "|" + result;
    requestCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_REQUEST_TOTAL)
                    .description("Stats upstream request outcomes")
                    .tags(Tags.of("resource", resource, "result", result))
                    .register(meterRegistry))
        .increment();
    requestTimers
        .computeIfAbsent(
            key,
            ignored ->
                Timer.builder(METRIC_REQUEST_DURATION)
                    .description("Stats upstream request duration")
                    .tags(Tags.of("resource", resource, "result", result))
                    .register(meterRegistry))
        .record(duration);
  }

  public void recordPaginationExhausted(String resource) {
    exhaustedCounters
        .computeIfAbsent(
            resource,
            ignored ->
                Counter.builder(METRIC_PAGINATION_EXHAUSTED_TOTAL)
                    .description("Next page requests answered without an upstream call")
                    .tags(Tags.of("resource", resource))
                    .register(meterRegistry))
        .increment();
  }

  public void recordApiError(String code) {
    apiErrorCounters
        .computeIfAbsent(
            code,
            ignored ->
                Counter.builder(METRIC_API_ERROR_TOTAL)
                    .description("Stats API errors by code")
                    .tags(Tags.of("code", code))
                    .register(meterRegistry))
        .increment();
  }
}

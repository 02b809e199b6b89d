/*
 * どこで: Stats サービス層
 * 何を: 論理リクエストを RestClient で上流へ送り、応答本文を JSON ツリーで返す
 * なぜ: 呼び出しを専用プールで非同期化し、失敗理由を StatsIntegrationException に揃えるため
 */
package com.example.stats_client.service;

import com.example.common.TraceIds;
import com.example.stats_client.config.StatsApiProperties;
import com.example.stats_client.model.StatsRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriBuilder;

@Service
public class RestClientStatsTransport implements StatsTransport {

  private static final Logger logger = LoggerFactory.getLogger(RestClientStatsTransport.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final RestClient statsRestClient;

  private final StatsApiProperties properties;
  private final StatsRouting routing;
  private final StatsMetrics metrics;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Executor は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final Executor executor;

  public RestClientStatsTransport(
      RestClient statsRestClient,
      StatsApiProperties properties,
      StatsRouting routing,
      StatsMetrics metrics,
      @Qualifier("statsTransportExecutor") Executor executor) {
    this.statsRestClient = statsRestClient;
    this.properties = properties;
    this.routing = routing;
    this.metrics = metrics;
    this.executor = executor;
  }

  @Override
  public CompletableFuture<JsonNode> submit(StatsRequest request) {
    final StatsRoute route = routing.route(request);
    final String requestId = resolveRequestId();
    final String resource = request.resource().value();
    final long startedAt = System.nanoTime();
    return CompletableFuture.supplyAsync(() -> execute(resource, route, requestId), executor)
        .whenComplete(
            (body, error) ->
                metrics.recordRequest(
                    resource, outcome(error), Duration.ofNanos(System.nanoTime() - startedAt)));
  }

  private JsonNode execute(String resource, StatsRoute route, String requestId) {
    MDC.put(TraceIds.REQUEST_ID_MDC_KEY, requestId);
    try {
      logger.debug("stats {} request started path={}", resource, route.pathTemplate());
      return requireBody(
          statsRestClient
              .get()
              .uri(uriBuilder -> buildUri(uriBuilder, route))
              .headers(headers -> applyHeaders(headers, requestId))
              .retrieve()
              .body(JsonNode.class));
    } catch (RestClientResponseException ex) {
      throw mapResponseException(ex, resource);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(ex, resource);
    } catch (StatsIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("stats {} response parse failed", resource, ex);
      throw new StatsIntegrationException(
          StatsIntegrationException.Reason.INVALID_RESPONSE, "stats response parse failed", ex);
    } finally {
      MDC.remove(TraceIds.REQUEST_ID_MDC_KEY);
    }
  }

  // クエリ値はテンプレート変数として渡し、カーソル値に含まれる記号をそのまま送らない
  private URI buildUri(UriBuilder uriBuilder, StatsRoute route) {
    final Map<String, Object> variables = new HashMap<>(route.uriVariables());
    uriBuilder.path(route.pathTemplate());
    int index = 0;
    for (Map.Entry<String, List<String>> param : route.queryParams().entrySet()) {
      for (String value : param.getValue()) {
        final String name = "q" + index++;
        uriBuilder.queryParam(param.getKey(), "{" + name + "}");
        variables.put(name, value);
      }
    }
    return uriBuilder.build(variables);
  }

  private void applyHeaders(HttpHeaders headers, String requestId) {
    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
    headers.set(TraceIds.REQUEST_ID_HEADER, requestId);
    if (!properties.accessToken().isBlank()) {
      headers.setBearerAuth(properties.accessToken());
    }
  }

  private JsonNode requireBody(JsonNode body) {
    if (body == null || body.isNull() || body.isMissingNode()) {
      throw new StatsIntegrationException(
          StatsIntegrationException.Reason.INVALID_RESPONSE, "stats response body is empty");
    }
    return body;
  }

  private StatsIntegrationException mapResponseException(
      RestClientResponseException ex, String resource) {
    logger.warn(
        "stats {} failed with http status={} statusText={}",
        resource,
        ex.getStatusCode().value(),
        ex.getStatusText());
    final int status = ex.getStatusCode().value();
    if (status == 401 || status == 403) {
      return new StatsIntegrationException(
          StatsIntegrationException.Reason.UNAUTHORIZED, "stats api rejected credentials", ex);
    }
    if (status == 404) {
      return new StatsIntegrationException(
          StatsIntegrationException.Reason.NOT_FOUND, "stats resource not found", ex);
    }
    if (ex.getStatusCode().is5xxServerError()) {
      return new StatsIntegrationException(
          StatsIntegrationException.Reason.BAD_GATEWAY, "stats server error", ex);
    }
    return new StatsIntegrationException(
        StatsIntegrationException.Reason.BAD_GATEWAY, "stats request failed", ex);
  }

  private StatsIntegrationException mapResourceException(
      ResourceAccessException ex, String resource) {
    if (isTimeout(ex)) {
      logger.warn("stats {} timed out", resource);
      return new StatsIntegrationException(
          StatsIntegrationException.Reason.TIMEOUT, "stats request timeout", ex);
    }
    logger.warn("stats {} connection failed", resource, ex);
    return new StatsIntegrationException(
        StatsIntegrationException.Reason.BAD_GATEWAY, "stats connection failed", ex);
  }

  // 受信リクエスト由来の request_id があれば上流へ引き継ぐ
  private String resolveRequestId() {
    final String current = MDC.get(TraceIds.REQUEST_ID_MDC_KEY);
    return current == null || current.isBlank() ? TraceIds.newTraceId() : current;
  }

  @VisibleForTesting
  static String outcome(Throwable error) {
    if (error == null) {
      return "success";
    }
    final Throwable cause = error instanceof CompletionException ? error.getCause() : error;
    if (cause instanceof StatsIntegrationException integration) {
      return integration.reason().name();
    }
    return "error";
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}

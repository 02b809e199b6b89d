/*
 * どこで: Stats サービス層テスト
 * 何を: RestClient transport の URL 組み立て/ヘッダー/失敗分類を検証する
 * なぜ: 上流の失敗を一貫した Reason へ変換できないと API 層のステータス変換が崩れるため
 */
package com.example.stats_client.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.http.HttpMethod.GET;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.stats_client.config.StatsApiProperties;
import com.example.stats_client.model.GameMode;
import com.example.stats_client.model.OpaqueCursor;
import com.example.stats_client.model.RankingKind;
import com.example.stats_client.model.StatsRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.RequestMatcher;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

class RestClientStatsTransportTest {

  private static final String RANKINGS_URL = "http://stats.test/api/v2/rankings/osu/performance";

  @AfterEach
  void cleanup() {
    MDC.clear();
  }

  @Test
  void submitSendsRankingsRequestWithPageAndBearerToken() {
    final ClientFixture fixture = newFixture("token-1");
    fixture
        .server
        .expect(requestTo(startsWith(RANKINGS_URL)))
        .andExpect(method(GET))
        .andExpect(decodedQuery("cursor[page]=3"))
        .andExpect(header("Authorization", "Bearer token-1"))
        .andExpect(header("Accept", MediaType.APPLICATION_JSON_VALUE))
        .andExpect(
            request -> assertThat(request.getHeaders().getFirst("X-Request-Id")).isNotBlank())
        .andRespond(withSuccess("{\"ranking\":[],\"total\":0}", MediaType.APPLICATION_JSON));

    final JsonNode body =
        fixture
            .transport
            .submit(StatsRequest.rankings(RankingKind.PERFORMANCE, GameMode.OSU, 3))
            .join();

    assertThat(body.get("total").asInt()).isZero();
    fixture.server.verify();
    assertThat(
            fixture
                .registry
                .get("stats.request.total")
                .tags("resource", "performance_rankings", "result", "success")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void submitOmitsAuthorizationWhenTokenIsBlank() {
    final ClientFixture fixture = newFixture("");
    fixture
        .server
        .expect(requestTo(RANKINGS_URL))
        .andExpect(
            request -> assertThat(request.getHeaders().containsKey("Authorization")).isFalse())
        .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    fixture
        .transport
        .submit(StatsRequest.rankings(RankingKind.PERFORMANCE, GameMode.OSU, null))
        .join();

    fixture.server.verify();
  }

  @Test
  void submitPropagatesInboundRequestId() {
    final ClientFixture fixture = newFixture("");
    MDC.put("request_id", "req-1");
    fixture
        .server
        .expect(requestTo(RANKINGS_URL))
        .andExpect(header("X-Request-Id", "req-1"))
        .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    fixture
        .transport
        .submit(StatsRequest.rankings(RankingKind.PERFORMANCE, GameMode.OSU, null))
        .join();

    fixture.server.verify();
  }

  @Test
  void submitSendsOpaqueNewsCursorAsQueryParameter() {
    final ClientFixture fixture = newFixture("");
    fixture
        .server
        .expect(requestTo(startsWith("http://stats.test/api/v2/news")))
        .andExpect(decodedQuery("cursor_string={\"id\":41}"))
        .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

    final OpaqueCursor cursor =
        new OpaqueCursor(JsonNodeFactory.instance.textNode("{\"id\":41}"));
    fixture.transport.submit(StatsRequest.news(cursor, null)).join();

    fixture.server.verify();
  }

  @Test
  void submitMaps401ToUnauthorized() {
    final ClientFixture fixture = newFixture("expired");
    fixture.server.expect(requestTo(RANKINGS_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertReason(fixture, StatsIntegrationException.Reason.UNAUTHORIZED);
    assertThat(
            fixture
                .registry
                .get("stats.request.total")
                .tags("resource", "performance_rankings", "result", "UNAUTHORIZED")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void submitMaps404ToNotFound() {
    final ClientFixture fixture = newFixture("");
    fixture.server.expect(requestTo(RANKINGS_URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

    assertReason(fixture, StatsIntegrationException.Reason.NOT_FOUND);
  }

  @Test
  void submitMaps5xxToBadGateway() {
    final ClientFixture fixture = newFixture("");
    fixture.server.expect(requestTo(RANKINGS_URL)).andRespond(withServerError());

    assertReason(fixture, StatsIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void submitMapsMalformedBodyToInvalidResponse() {
    final ClientFixture fixture = newFixture("");
    fixture
        .server
        .expect(requestTo(RANKINGS_URL))
        .andRespond(withSuccess("{not json", MediaType.APPLICATION_JSON));

    assertReason(fixture, StatsIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void submitMapsEmptyBodyToInvalidResponse() {
    final ClientFixture fixture = newFixture("");
    fixture.server.expect(requestTo(RANKINGS_URL)).andRespond(withSuccess());

    assertReason(fixture, StatsIntegrationException.Reason.INVALID_RESPONSE);
  }

  @Test
  void submitMapsTimeoutToTimeout() {
    final ClientFixture fixture = newFixture("");
    fixture
        .server
        .expect(requestTo(RANKINGS_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "read timeout", new SocketTimeoutException("Read timed out"));
            });

    assertReason(fixture, StatsIntegrationException.Reason.TIMEOUT);
  }

  @Test
  void submitMapsConnectionFailureToBadGateway() {
    final ClientFixture fixture = newFixture("");
    fixture
        .server
        .expect(requestTo(RANKINGS_URL))
        .andRespond(
            request -> {
              throw new ResourceAccessException(
                  "connection refused", new ConnectException("Connection refused"));
            });

    assertReason(fixture, StatsIntegrationException.Reason.BAD_GATEWAY);
  }

  @Test
  void outcomeUnwrapsCompletionException() {
    final StatsIntegrationException failure =
        new StatsIntegrationException(StatsIntegrationException.Reason.NOT_FOUND, "missing");

    assertThat(RestClientStatsTransport.outcome(null)).isEqualTo("success");
    assertThat(RestClientStatsTransport.outcome(new CompletionException(failure)))
        .isEqualTo("NOT_FOUND");
    assertThat(RestClientStatsTransport.outcome(new IllegalStateException("boom")))
        .isEqualTo("error");
  }

  private void assertReason(ClientFixture fixture, StatsIntegrationException.Reason reason) {
    final CompletableFuture<JsonNode> future =
        fixture
            .transport
            .submit(StatsRequest.rankings(RankingKind.PERFORMANCE, GameMode.OSU, null));

    assertThatThrownBy(future::join)
        .isInstanceOf(CompletionException.class)
        .hasCauseInstanceOf(StatsIntegrationException.class)
        .extracting(ex -> ((StatsIntegrationException) ex.getCause()).reason())
        .isEqualTo(reason);
  }

  private static RequestMatcher decodedQuery(String expected) {
    return request ->
        assertThat(URLDecoder.decode(request.getURI().getRawQuery(), StandardCharsets.UTF_8))
            .isEqualTo(expected);
  }

  private ClientFixture newFixture(String accessToken) {
    final RestClient.Builder builder = RestClient.builder();
    final MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
    final RestClient restClient = builder.baseUrl("http://stats.test").build();
    final StatsApiProperties properties =
        new StatsApiProperties(
            "http://stats.test",
            "/api/v2/rankings/{mode}/{type}",
            "/api/v2/news",
            accessToken,
            null,
            null,
            1,
            null);
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final RestClientStatsTransport transport =
        new RestClientStatsTransport(
            restClient,
            properties,
            new StatsRouting(properties),
            new StatsMetrics(registry),
            Runnable::run);
    return new ClientFixture(transport, server, registry);
  }

  private record ClientFixture(
      RestClientStatsTransport transport,
      MockRestServiceServer server,
      SimpleMeterRegistry registry) {}
}

/*
 * どこで: Stats API
 * 何を: 入力不正/上流応答の構造不備/上流呼び出し失敗を標準エラー形式へ変換する
 * なぜ: 失敗時の契約を一定に保ち、エラー増加をメトリクスから観測できるようにするため
 */
package com.example.stats_client.api;

import com.example.stats_client.codec.StatsDecodeException;
import com.example.stats_client.service.StatsIntegrationException;
import com.example.stats_client.service.StatsMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@RequiredArgsConstructor
public class StatsApiExceptionHandler {

  private final StatsMetrics statsMetrics;

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    statsMetrics.recordApiError("INVALID_REQUEST");
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("INVALID_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler(StatsDecodeException.class)
  public ResponseEntity<ApiErrorResponse> handleDecode(StatsDecodeException ex) {
    statsMetrics.recordApiError("STATS_INVALID_RESPONSE");
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(new ApiErrorResponse("STATS_INVALID_RESPONSE", ex.getMessage()));
  }

  @ExceptionHandler(StatsIntegrationException.class)
  public ResponseEntity<ApiErrorResponse> handleStatsIntegration(StatsIntegrationException ex) {
    final String code =
        switch (ex.reason()) {
          case UNAUTHORIZED -> "STATS_UNAUTHORIZED";
          case NOT_FOUND -> "STATS_NOT_FOUND";
          case TIMEOUT -> "STATS_TIMEOUT";
          case INVALID_RESPONSE -> "STATS_INVALID_RESPONSE";
          case BAD_GATEWAY -> "STATS_BAD_GATEWAY";
        };
    final HttpStatus status =
        switch (ex.reason()) {
          case UNAUTHORIZED, INVALID_RESPONSE, BAD_GATEWAY -> HttpStatus.BAD_GATEWAY;
          case NOT_FOUND -> HttpStatus.NOT_FOUND;
          case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
        };
    statsMetrics.recordApiError(code);
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, ex.getMessage()));
  }
}

/*
 * どこで: Stats サービス層
 * 何を: 統計 API 呼び出しの失敗 (HTTP 応答/接続/本文不正) を表現する
 * なぜ: API 層で HTTP ステータスへ一貫変換するため
 */
package com.example.stats_client.service;

public class StatsIntegrationException extends RuntimeException {

  public enum Reason {
    UNAUTHORIZED,
    NOT_FOUND,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public StatsIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public StatsIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}

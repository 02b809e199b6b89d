/*
 * どこで: 共通ユーティリティ
 * 何を: 下流呼び出し 1 回ごとの request_id を採番する
 * なぜ: 送信ヘッダーとログの MDC を同じ ID で突き合わせるため
 */
package com.example.common;

import java.util.UUID;

public final class TraceIds {

  public static final String REQUEST_ID_HEADER = "X-Request-Id";
  public static final String REQUEST_ID_MDC_KEY = "request_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }
}

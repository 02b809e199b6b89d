package com.example.stats_client.service;

import com.example.stats_client.model.StatsRequest;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.concurrent.CompletableFuture;

/**
 * 論理リクエストを上流へ送り、応答本文を JSON ツリーとして返す。
 *
 * <p>失敗は StatsIntegrationException で例外完了する。再試行やレート制限は実装側の責務。
 * 返された future を完了前に cancel した場合、呼び出し側はその応答を観測しない。
 */
public interface StatsTransport {

  CompletableFuture<JsonNode> submit(StatsRequest request);
}

/*
 * どこで: Stats クライアント設定
 * 何を: 統計 API 呼び出しの接続先/パス/認証/実行プール設定を保持する
 * なぜ: 上流 URL やタイムアウトを環境ごとに外部化するため
 */
package com.example.stats_client.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "stats")
public record StatsApiProperties(
    String baseUrl,
    String rankingsPath,
    String newsPath,
    String accessToken,
    Duration connectTimeout,
    Duration readTimeout,
    Integer transportPoolSize,
    Integer maxPages) {

  public StatsApiProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://osu.ppy.sh" : baseUrl;
    rankingsPath =
        rankingsPath == null || rankingsPath.isBlank()
            ? "/api/v2/rankings/{mode}/{type}"
            : rankingsPath;
    newsPath = newsPath == null || newsPath.isBlank() ? "/api/v2/news" : newsPath;
    accessToken = accessToken == null ? "" : accessToken;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(30) : readTimeout;
    transportPoolSize =
        transportPoolSize == null || transportPoolSize < 1 ? 4 : transportPoolSize;
    maxPages = maxPages == null || maxPages < 1 ? 10 : maxPages;
  }
}

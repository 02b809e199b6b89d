/*
 * どこで: Stats クライアント設定
 * 何を: 統計 API 呼び出し専用 RestClient と transport 実行プールを提供する
 * なぜ: 上流呼び出しのタイムアウトと同時実行数を他の処理から分離するため
 */
package com.example.stats_client.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(StatsApiProperties.class)
public class StatsClientConfig {

  @Bean
  RestClient statsRestClient(RestClient.Builder builder, StatsApiProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.connectTimeout());
    requestFactory.setReadTimeout(properties.readTimeout());
    return builder.baseUrl(properties.baseUrl()).requestFactory(requestFactory).build();
  }

  @Bean
  ThreadPoolTaskExecutor statsTransportExecutor(StatsApiProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.transportPoolSize());
    executor.setMaxPoolSize(properties.transportPoolSize());
    executor.setThreadNamePrefix("stats-transport-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    return executor;
  }
}

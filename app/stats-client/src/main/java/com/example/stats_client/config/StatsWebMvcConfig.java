/*
 * どこで: Stats クライアント Web 設定
 * 何を: 受信リクエストの MDC 付与を /v1 配下の API へ登録する
 * なぜ: ランキング/ニュース API のログに request_id と mode を必ず含めるため
 */
package com.example.stats_client.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class StatsWebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns("/v1/**");
  }
}

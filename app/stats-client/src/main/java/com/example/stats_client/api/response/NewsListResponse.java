/*
 * どこで: Stats API DTO
 * 何を: ニュース一覧 API 応答を定義する
 * なぜ: 不透明カーソルを外部へ出さず、続きの有無だけを公開するため
 */
package com.example.stats_client.api.response;

import com.example.stats_client.model.NewsPost;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NewsListResponse(List<NewsPost> newsPosts, boolean hasMore) {}

package com.example.stats_client.model;

import org.springframework.lang.Nullable;

/** 検索条件のエコーバック。cursor は一覧側の cursor と同じく不透明値。 */
public record NewsSearch(int limit, @Nullable OpaqueCursor cursor) {}

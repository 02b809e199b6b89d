package com.example.stats_client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import org.springframework.lang.Nullable;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NewsPost(
    @JsonProperty("id") long postId,
    String author,
    String editUrl,
    String firstImage,
    Instant publishedAt,
    @JsonInclude(JsonInclude.Include.NON_NULL) @Nullable Instant updatedAt,
    String slug,
    String title,
    @JsonInclude(JsonInclude.Include.NON_NULL) @Nullable String preview) {}

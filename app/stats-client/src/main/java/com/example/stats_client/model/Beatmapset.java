package com.example.stats_client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Beatmapset(
    @JsonProperty("id") long mapsetId,
    String artist,
    String title,
    String creator,
    @JsonProperty("user_id") long creatorId,
    String status,
    long playCount,
    long favouriteCount) {}

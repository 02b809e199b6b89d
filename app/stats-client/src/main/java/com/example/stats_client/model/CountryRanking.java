package com.example.stats_client.model;

import com.example.stats_client.codec.CountryNameDeserializer;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** 国単位の集計値。play_count / performance はその国のユーザー合計。 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CountryRanking(
    int activeUsers,
    @JsonDeserialize(using = CountryNameDeserializer.class) String country,
    @JsonProperty("code") String countryCode,
    long playCount,
    @JsonProperty("performance") double pp,
    long rankedScore) {}

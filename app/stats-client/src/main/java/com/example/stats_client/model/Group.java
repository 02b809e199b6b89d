package com.example.stats_client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import org.springframework.lang.Nullable;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Group(
    int id,
    String identifier,
    String name,
    String shortName,
    @Nullable String colour,
    @Nullable String description,
    @JsonProperty("has_listing") boolean hasListing,
    @JsonProperty("has_playmodes") boolean hasPlaymodes,
    @JsonProperty("is_probationary") boolean isProbationary,
    @Nullable List<GameMode> playmodes) {}

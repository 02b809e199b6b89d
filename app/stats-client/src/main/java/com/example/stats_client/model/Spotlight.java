package com.example.stats_client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import org.springframework.lang.Nullable;

/** participant_count は単一スポットライト取得時にのみ返る。 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Spotlight(
    Instant endDate,
    boolean modeSpecific,
    String name,
    @JsonInclude(JsonInclude.Include.NON_NULL) @Nullable Integer participantCount,
    @JsonProperty("id") int spotlightId,
    @JsonProperty("type") String spotlightType,
    Instant startDate) {}

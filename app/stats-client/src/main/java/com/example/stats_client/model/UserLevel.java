package com.example.stats_client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** progress は次レベルまでの進捗率 (0-100)。 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserLevel(int current, int progress) {}

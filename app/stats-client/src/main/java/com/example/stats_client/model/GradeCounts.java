package com.example.stats_client.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GradeCounts(int ss, int ssh, int s, int sh, int a) {}

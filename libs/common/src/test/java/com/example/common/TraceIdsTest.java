package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void newTraceIdReturnsDistinctUuids() {
    final String first = TraceIds.newTraceId();
    final String second = TraceIds.newTraceId();

    assertThat(UUID.fromString(first).toString()).isEqualTo(first);
    assertThat(first).isNotEqualTo(second);
  }
}

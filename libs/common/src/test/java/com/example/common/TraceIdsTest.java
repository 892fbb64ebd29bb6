package com.example.common;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.UUID;
import org.junit.jupiter.api.Test;

class TraceIdsTest {

  @Test
  void newTraceIdIsAUuid() {
    final String id = TraceIds.newTraceId();

    assertThat(UUID.fromString(id).toString()).isEqualTo(id);
  }

  @Test
  void keepsTokenLikeClientIds() {
    assertThat(TraceIds.orNew("  req-42.a:b_c ")).isEqualTo("req-42.a:b_c");
  }

  @Test
  void replacesMissingOrUnsafeClientIds() {
    assertThat(TraceIds.orNew(null)).hasSize(36);
    assertThat(TraceIds.orNew("   ")).hasSize(36);
    assertThat(TraceIds.orNew("line\nbreak")).isNotEqualTo("line\nbreak").hasSize(36);
    assertThat(TraceIds.orNew("x".repeat(TraceIds.MAX_LENGTH + 1))).hasSize(36);
    assertThat(TraceIds.orNew("x".repeat(TraceIds.MAX_LENGTH))).hasSize(TraceIds.MAX_LENGTH);
  }
}

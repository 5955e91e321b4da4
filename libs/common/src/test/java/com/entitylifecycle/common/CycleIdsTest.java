package com.entitylifecycle.common;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CycleIdsTest {

  @Test
  void newCycleIdIsUniquePerCall() {
    assertThat(CycleIds.newCycleId()).isNotBlank().isNotEqualTo(CycleIds.newCycleId());
  }
}

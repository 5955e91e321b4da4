package com.entitylifecycle.common;

import java.util.UUID;

/** Updater の 1 サイクル分のログと publish メッセージを結び付ける ID。 */
public final class CycleIds {

  public static final String MDC_KEY = "cycle_id";

  private CycleIds() {}

  public static String newCycleId() {
    return UUID.randomUUID().toString();
  }
}

package com.entitylifecycle.updater.dispatch;

public record DispatchSummary(int updates, int deletes, int failed) {

  public static final DispatchSummary EMPTY = new DispatchSummary(0, 0, 0);
}

/*
 * どこで: Updater サービス層
 * 何を: エンティティ 1 件のリース評価結果
 * なぜ: プランナーがこれを削除項目かリース書き込みへ変換するため
 */
package com.entitylifecycle.updater.service;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record LeaseDecision(
    boolean delete, Map<String, Instant> survivingLeases, boolean leaseUpdateRequired) {

  public LeaseDecision {
    survivingLeases = Collections.unmodifiableMap(new LinkedHashMap<>(survivingLeases));
  }

  public static LeaseDecision evict() {
    return new LeaseDecision(true, Map.of(), false);
  }
}

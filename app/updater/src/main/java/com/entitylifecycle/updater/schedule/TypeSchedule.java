/*
 * どこで: Updater のスケジュールモデル
 * 何を: エンティティタイプ 1 つ分の解決済み events/leases
 * なぜ: 処理経路では解析済みの型付き間隔だけを扱うため
 */
package com.entitylifecycle.updater.schedule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

public record TypeSchedule(
    String entityType, Map<String, Long> events, Map<String, ScheduleInterval> leases) {

  public TypeSchedule {
    if (entityType == null || entityType.isBlank()) {
      throw new IllegalArgumentException("entityType is required");
    }
    // 発火イベントはこの順序で報告する。
    events = Collections.unmodifiableMap(new LinkedHashMap<>(events == null ? Map.of() : events));
    leases = Collections.unmodifiableMap(new LinkedHashMap<>(leases == null ? Map.of() : leases));
  }

  public boolean hasLeases() {
    return !leases.isEmpty();
  }

  /** 全イベント間隔と有限リース間隔の GCD。何も設定がなければ空。 */
  public OptionalLong cadenceMinutes() {
    final List<Long> intervals = new ArrayList<>(events.values());
    for (ScheduleInterval lease : leases.values()) {
      if (!lease.indefinite()) {
        intervals.add(lease.minutes());
      }
    }
    return CadenceReducer.reduce(intervals);
  }
}

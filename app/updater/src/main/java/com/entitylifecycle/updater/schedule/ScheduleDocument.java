/*
 * どこで: Updater のスケジュール設定
 * 何を: スケジュール文書の生の形(エンティティタイプごとの events/leases)
 * なぜ: 間隔を解決する前に Jackson で YAML をここへバインドするため
 */
package com.entitylifecycle.updater.schedule;

import com.fasterxml.jackson.annotation.JsonAlias;
import java.util.Map;

public record ScheduleDocument(
    Map<String, Map<String, String>> events,
    @JsonAlias("ttl_tokens") Map<String, Map<String, String>> leases) {

  public ScheduleDocument {
    events = events == null ? Map.of() : events;
    leases = leases == null ? Map.of() : leases;
  }
}

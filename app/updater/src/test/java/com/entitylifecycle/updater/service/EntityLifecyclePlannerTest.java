/*
 * どこで: Updater プランナーのテスト
 * 何を: 保持/削除されるエンティティに対して組み立てるディスパッチ項目を検証する
 * なぜ: リース/最終更新の書き込みとイベントを 1 項目で運ぶため
 */
package com.entitylifecycle.updater.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.entitylifecycle.updater.model.AttributeUpdate;
import com.entitylifecycle.updater.model.DispatchItem;
import com.entitylifecycle.updater.model.EntityCandidate;
import com.entitylifecycle.updater.schedule.ScheduleInterval;
import com.entitylifecycle.updater.schedule.TypeSchedule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EntityLifecyclePlannerTest {

  private static final Instant ADDED = Instant.parse("2026-03-01T00:00:00Z");
  private static final TypeSchedule IP =
      new TypeSchedule(
          "ip",
          Map.of("!every1h", 60L),
          Map.of("default", ScheduleInterval.ofMinutes(Duration.ofDays(14).toMinutes())));

  private final EntityLifecyclePlanner planner =
      new EntityLifecyclePlanner(
          new LeaseEvaluator(new UpdaterMetrics(new SimpleMeterRegistry())), new EventDeterminer());

  @Test
  void evictedEntityBecomesADeleteItemWithoutEvents() {
    final Instant now = ADDED.plus(Duration.ofDays(15));
    final EntityCandidate candidate =
        new EntityCandidate("1.2.3.4", now.minus(Duration.ofHours(2)), ADDED);

    final DispatchItem item =
        planner.plan(IP, 60L, candidate, Map.of("default", ADDED), List.of(), now);

    assertThat(item.delete()).isTrue();
    assertThat(item.events()).isEmpty();
    assertThat(item.attributeUpdates()).isEmpty();
    assertThat(item.source()).isEqualTo(DispatchItem.SOURCE_UPDATER);
  }

  @Test
  void keptEntityCarriesEventsLeasesAndQuantizedLastUpdate() {
    final Instant now = ADDED.plus(Duration.ofMinutes(125));
    final EntityCandidate candidate = new EntityCandidate("1.2.3.4", ADDED, ADDED);

    final DispatchItem item =
        planner.plan(IP, 60L, candidate, Map.of("default", ADDED), List.of(), now);

    assertThat(item.delete()).isFalse();
    assertThat(item.entityType()).isEqualTo("ip");
    assertThat(item.entityKey()).isEqualTo("1.2.3.4");
    assertThat(item.events()).containsExactly("!every1h");
    assertThat(item.attributeUpdates())
        .containsExactly(
            AttributeUpdate.set(DispatchItem.ATTR_LEASES, Map.of("default", ADDED)),
            AttributeUpdate.set(
                DispatchItem.ATTR_LAST_REGULAR_UPDATE, ADDED.plus(Duration.ofMinutes(120))));
  }

  @Test
  void typeWithoutLeasesOnlyWritesLastUpdate() {
    final TypeSchedule domain = new TypeSchedule("domain", Map.of("!refresh", 60L), Map.of());
    final Instant now = ADDED.plus(Duration.ofMinutes(61));
    final EntityCandidate candidate = new EntityCandidate("example.org", ADDED, ADDED);

    final DispatchItem item = planner.plan(domain, 60L, candidate, Map.of(), List.of(), now);

    assertThat(item.delete()).isFalse();
    assertThat(item.attributeUpdates())
        .extracting(AttributeUpdate::attribute)
        .containsExactly(DispatchItem.ATTR_LAST_REGULAR_UPDATE);
    assertThat(item.attributeValue(DispatchItem.ATTR_LAST_REGULAR_UPDATE))
        .contains(ADDED.plus(Duration.ofMinutes(60)));
  }
}

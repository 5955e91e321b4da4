/*
 * どこで: Updater リース評価のテスト
 * 何を: 保持/削除の判断と、残るリースを検証する
 * なぜ: 判断を誤ると生きているエンティティを消すか、不要なものを残し続けるため
 */
package com.entitylifecycle.updater.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.entitylifecycle.updater.schedule.ScheduleInterval;
import com.entitylifecycle.updater.schedule.TypeSchedule;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LeaseEvaluatorTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
  private static final TypeSchedule IP =
      new TypeSchedule(
          "ip",
          Map.of("!every1h", 60L),
          Map.of(
              "default", ScheduleInterval.ofMinutes(Duration.ofDays(14).toMinutes()),
              "pinned", ScheduleInterval.INDEFINITE));

  private SimpleMeterRegistry registry;
  private LeaseEvaluator evaluator;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    evaluator = new LeaseEvaluator(new UpdaterMetrics(registry));
  }

  @Test
  void expiredOnlyLeaseDeletesTheEntity() {
    final LeaseDecision decision =
        evaluator.evaluate(IP, "1.2.3.4", Map.of("default", NOW.minus(Duration.ofDays(15))), NOW);

    assertThat(decision.delete()).isTrue();
    assertThat(decision.survivingLeases()).isEmpty();
  }

  @Test
  void indefiniteLeaseRetainsEntityRegardlessOfExpiredLease() {
    final Map<String, Instant> leases = new LinkedHashMap<>();
    leases.put("default", NOW.minus(Duration.ofDays(15)));
    leases.put("pinned", NOW.minus(Duration.ofDays(400)));

    final LeaseDecision decision = evaluator.evaluate(IP, "1.2.3.4", leases, NOW);

    assertThat(decision.delete()).isFalse();
    assertThat(decision.leaseUpdateRequired()).isTrue();
    // 同じ名前のまま、評価時刻で更新される。
    assertThat(decision.survivingLeases()).containsExactly(Map.entry("pinned", NOW));
  }

  @Test
  void validLeaseIsCarriedForwardUnchanged() {
    final Instant createdAt = NOW.minus(Duration.ofDays(3));

    final LeaseDecision decision =
        evaluator.evaluate(IP, "1.2.3.4", Map.of("default", createdAt), NOW);

    assertThat(decision.delete()).isFalse();
    assertThat(decision.survivingLeases()).containsExactly(Map.entry("default", createdAt));
  }

  @Test
  void leaseEndingExactlyNowIsExpired() {
    final LeaseDecision decision =
        evaluator.evaluate(IP, "1.2.3.4", Map.of("default", NOW.minus(Duration.ofDays(14))), NOW);

    assertThat(decision.delete()).isTrue();
  }

  @Test
  void noLeasesWhileLeasesAreConfiguredDeletesTheEntity() {
    final LeaseDecision decision = evaluator.evaluate(IP, "1.2.3.4", Map.of(), NOW);

    assertThat(decision.delete()).isTrue();
  }

  @Test
  void unknownLeaseIsDroppedAndReported() {
    final Map<String, Instant> leases = new LinkedHashMap<>();
    leases.put("legacy", NOW.minus(Duration.ofDays(1)));
    leases.put("default", NOW.minus(Duration.ofDays(1)));

    final LeaseDecision decision = evaluator.evaluate(IP, "1.2.3.4", leases, NOW);

    assertThat(decision.delete()).isFalse();
    assertThat(decision.survivingLeases()).containsOnlyKeys("default");
    assertThat(configErrors()).isEqualTo(1.0d);
  }

  @Test
  void onlyUnknownLeasesDeleteTheEntity() {
    final LeaseDecision decision =
        evaluator.evaluate(IP, "1.2.3.4", Map.of("legacy", NOW.minus(Duration.ofDays(1))), NOW);

    assertThat(decision.delete()).isTrue();
    assertThat(configErrors()).isEqualTo(1.0d);
  }

  @Test
  void typeWithoutLeasesIsNeverDeletedButStaleLeasesAreCleared() {
    final TypeSchedule domain = new TypeSchedule("domain", Map.of("!refresh", 60L), Map.of());

    final LeaseDecision withStale =
        evaluator.evaluate(domain, "example.org", Map.of("default", NOW.minus(Duration.ofDays(90))), NOW);
    final LeaseDecision withoutLeases = evaluator.evaluate(domain, "example.org", Map.of(), NOW);

    assertThat(withStale.delete()).isFalse();
    assertThat(withStale.leaseUpdateRequired()).isTrue();
    assertThat(withStale.survivingLeases()).isEmpty();
    assertThat(withoutLeases.delete()).isFalse();
    assertThat(withoutLeases.leaseUpdateRequired()).isFalse();
    assertThat(configErrors()).isEqualTo(1.0d);
  }

  private double configErrors() {
    return registry
        .get("updater.config.errors.total")
        .tag("kind", LeaseEvaluator.ERROR_KIND_UNKNOWN_LEASE)
        .counter()
        .count();
  }
}

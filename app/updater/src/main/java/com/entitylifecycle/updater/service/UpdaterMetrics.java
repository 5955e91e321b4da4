/*
 * どこで: Updater サービス層
 * 何を: Updater 固有の Micrometer メトリクスを記録する
 * なぜ: ディスパッチ量/設定の食い違い/サイクル遅延を Prometheus で監視するため
 */
package com.entitylifecycle.updater.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class UpdaterMetrics {

  private static final String METRIC_DISPATCH_TOTAL = "updater.dispatch.total";
  private static final String METRIC_EVENTS_FIRED_TOTAL = "updater.events.fired.total";
  private static final String METRIC_CONFIG_ERRORS_TOTAL = "updater.config.errors.total";
  private static final String METRIC_SUPPLEMENTAL_REJECTED_TOTAL =
      "updater.supplemental.rejected.total";
  private static final String METRIC_ENTITY_FAILURES_TOTAL = "updater.entity.failures.total";
  private static final String METRIC_CYCLE_DURATION = "updater.cycle.duration";
  private static final String METRIC_WATERMARK_LAG = "updater.watermark.lag.seconds";

  private final MeterRegistry meterRegistry;
  private final AtomicLong watermarkLagSeconds = new AtomicLong(0L);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final Counter supplementalRejected;
  private final Timer cycleDuration;

  public UpdaterMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_WATERMARK_LAG, watermarkLagSeconds, AtomicLong::get)
        .description("Seconds between now and the watermark after the last completed cycle")
        .register(meterRegistry);
    this.supplementalRejected =
        Counter.builder(METRIC_SUPPLEMENTAL_REJECTED_TOTAL)
            .description("Side-channel lines skipped because they were malformed or expired")
            .register(meterRegistry);
    this.cycleDuration =
        Timer.builder(METRIC_CYCLE_DURATION)
            .description("Wall-clock duration of one full updater cycle")
            .register(meterRegistry);
  }

  public void recordDispatch(boolean delete, String result) {
    final String kind = delete ? "delete" : "update";
    counter(
            METRIC_DISPATCH_TOTAL,
            "Dispatch items handed to the queue",
            Tags.of("kind", kind, "result", result))
        .increment();
  }

  public void recordEventsFired(String entityType, int count) {
    if (count <= 0) {
      return;
    }
    counter(
            METRIC_EVENTS_FIRED_TOTAL,
            "Periodic and supplemental events fired",
            Tags.of("entity_type", entityType))
        .increment(count);
  }

  public void recordConfigurationError(String kind) {
    counter(
            METRIC_CONFIG_ERRORS_TOTAL,
            "Live data referencing names absent from the schedule",
            Tags.of("kind", kind))
        .increment();
  }

  public void recordEntityFailure(String entityType) {
    counter(
            METRIC_ENTITY_FAILURES_TOTAL,
            "Entities whose evaluation failed and was skipped",
            Tags.of("entity_type", entityType))
        .increment();
  }

  public void recordSupplementalRejected() {
    supplementalRejected.increment();
  }

  public void recordCycle(Duration elapsed, Instant watermark, Instant observedAt) {
    if (elapsed != null && !elapsed.isNegative()) {
      cycleDuration.record(elapsed);
    }
    if (watermark != null && observedAt != null && !observedAt.isBefore(watermark)) {
      watermarkLagSeconds.set(Duration.between(watermark, observedAt).toSeconds());
    }
  }

  private Counter counter(String name, String description, Tags tags) {
    final String key = name + tags;
    return counters.computeIfAbsent(
        key,
        ignored ->
            Counter.builder(name).description(description).tags(tags).register(meterRegistry));
  }
}

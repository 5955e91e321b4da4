/*
 * どこで: Updater のサイクルワーカー
 * 何を: 固定周期でサイクルを回し、サイクル間のウォーターマークを保持する
 * なぜ: サイクルを重ねず、1 周を終えた後にだけウォーターマークを進めるため
 */
package com.entitylifecycle.updater.worker;

import com.entitylifecycle.common.CycleIds;
import com.entitylifecycle.updater.config.UpdaterProperties;
import com.entitylifecycle.updater.model.CycleReport;
import com.entitylifecycle.updater.service.LifecycleCycleService;
import com.entitylifecycle.updater.service.UpdaterMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

@Component
public class CycleDriver {

  private static final Logger logger = LoggerFactory.getLogger(CycleDriver.class);

  private final LifecycleCycleService cycleService;
  private final UpdaterMetrics metrics;
  private final Clock clock;
  private final Duration cyclePeriod;

  // 書き込みはサイクルスレッドがサイクルの合間に行うだけ。状態エンドポイントから読むため volatile にする。
  private volatile Instant watermark = Instant.EPOCH;
  private volatile CycleReport lastReport;

  public CycleDriver(
      LifecycleCycleService cycleService,
      UpdaterMetrics metrics,
      Clock clock,
      UpdaterProperties properties) {
    this.cycleService = cycleService;
    this.metrics = metrics;
    this.clock = clock;
    this.cyclePeriod = properties.cyclePeriod();
  }

  /** {@code signal} が取り消されるまでサイクルを回す。実行中のサイクルが終わってから戻る。 */
  public void run(CancellationSignal signal) {
    logger.info("updater cycle loop started period={}", cyclePeriod);
    Instant nextStart = clock.instant();
    while (!signal.isCancelled()) {
      runOnceSafely();
      nextStart = nextStart.plus(cyclePeriod);
      final Instant now = clock.instant();
      if (!nextStart.isAfter(now)) {
        logger.warn(
            "updater cycle overran its period, starting the next one now period={} overrun={}",
            cyclePeriod,
            Duration.between(nextStart, now));
        nextStart = now;
        continue;
      }
      try {
        if (signal.await(Duration.between(now, nextStart))) {
          break;
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        logger.warn("updater cycle loop interrupted while waiting, stopping");
        break;
      }
    }
    logger.info("updater cycle loop stopped watermark={}", watermark);
  }

  /**
   * 役割:
   * - サイクルを 1 周実行し、ウォーターマークをその開始時刻へ進める。
   *
   * 例外:
   * - タイプの取得や publish が失敗したとき、サイクル自体が実行できなかったとき
   *   (このメソッドが例外を送出する)はウォーターマークを動かさない。
   */
  public CycleReport runOnce() {
    final Instant cycleStart = clock.instant();
    final Instant previousWatermark = watermark;
    MDC.put(CycleIds.MDC_KEY, CycleIds.newCycleId());
    try {
      final CycleReport report = cycleService.runCycle(cycleStart, previousWatermark);
      if (!report.fullyProcessed()) {
        // 次回も同じウィンドウを取得する。再 publish される項目は同じ message id を持つ。
        logger.warn(
            "updater cycle incomplete, watermark kept typesFailed={} failedItems={} watermark={}",
            report.typesFailed(),
            report.failedItems(),
            previousWatermark);
      } else if (cycleStart.isAfter(previousWatermark)) {
        watermark = cycleStart;
      } else {
        logger.warn(
            "clock went backwards, watermark kept cycleStart={} watermark={}",
            cycleStart,
            previousWatermark);
      }
      lastReport = report;
      metrics.recordCycle(report.elapsed(), watermark, clock.instant());
      logger.info(
          "updater cycle completed cycleStart={} typesProcessed={} typesSkipped={} typesFailed={}"
              + " candidates={} updates={} deletes={} events={} failedEntities={} failedItems={}"
              + " elapsed={}",
          report.cycleStart(),
          report.typesProcessed(),
          report.typesSkipped(),
          report.typesFailed(),
          report.candidates(),
          report.updateItems(),
          report.deleteItems(),
          report.firedEvents(),
          report.failedEntities(),
          report.failedItems(),
          report.elapsed());
      return report;
    } finally {
      MDC.remove(CycleIds.MDC_KEY);
    }
  }

  public Instant watermark() {
    return watermark;
  }

  public Optional<CycleReport> lastReport() {
    return Optional.ofNullable(lastReport);
  }

  private void runOnceSafely() {
    try {
      runOnce();
    } catch (RuntimeException ex) {
      logger.error("updater cycle failed, watermark kept watermark={}", watermark, ex);
    }
  }
}

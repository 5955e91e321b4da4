/*
 * どこで: Updater サービス層
 * 何を: 全エンティティタイプを 1 周し、期限到来分を取得/計画/ディスパッチする
 * なぜ: 一部のエンティティやタイプの失敗でサイクル全体を止めないため
 */
package com.entitylifecycle.updater.service;

import com.entitylifecycle.updater.dispatch.DispatchSummary;
import com.entitylifecycle.updater.dispatch.RateLimitedDispatcher;
import com.entitylifecycle.updater.model.CycleReport;
import com.entitylifecycle.updater.model.DispatchItem;
import com.entitylifecycle.updater.model.EntityCandidate;
import com.entitylifecycle.updater.model.SupplementalEvent;
import com.entitylifecycle.updater.repository.EntityRecordRepository;
import com.entitylifecycle.updater.schedule.ScheduleCatalog;
import com.entitylifecycle.updater.schedule.TypeSchedule;
import com.entitylifecycle.updater.supplemental.SupplementalEventSource;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class LifecycleCycleService {

  private static final Logger logger = LoggerFactory.getLogger(LifecycleCycleService.class);

  private final ScheduleCatalog catalog;
  private final EntityRecordRepository entityRecordRepository;
  private final SupplementalEventSource supplementalEventSource;
  private final EntityLifecyclePlanner planner;
  private final RateLimitedDispatcher dispatcher;
  private final UpdaterMetrics metrics;
  private final Clock clock;

  /**
   * 設定された全エンティティタイプを 1 回ずつ処理する。
   *
   * @param cycleStart このサイクルの評価時刻。次のウォーターマークになる
   * @param previousWatermark 最後に完了したサイクルの開始時刻。なければエポック
   */
  public CycleReport runCycle(Instant cycleStart, Instant previousWatermark) {
    final Tally tally = new Tally();
    final List<SupplementalEvent> supplementalEvents = readSupplementalEvents(cycleStart);
    for (TypeSchedule schedule : catalog.schedules()) {
      final OptionalLong cadence = schedule.cadenceMinutes();
      if (cadence.isEmpty()) {
        logger.debug(
            "entity type has no finite interval, skipped entityType={}", schedule.entityType());
        tally.typesSkipped++;
        continue;
      }
      try {
        processType(
            schedule,
            cadence.getAsLong(),
            cycleStart,
            previousWatermark,
            supplementalEvents,
            tally);
        tally.typesProcessed++;
      } catch (RuntimeException ex) {
        // DataAccessException も含め、次のタイプの処理は続ける。
        logger.error("entity type processing failed entityType={}", schedule.entityType(), ex);
        tally.typesFailed++;
      }
    }
    final Duration elapsed = Duration.between(cycleStart, clock.instant());
    return new CycleReport(
        cycleStart,
        previousWatermark,
        tally.typesProcessed,
        tally.typesSkipped,
        tally.typesFailed,
        tally.candidates,
        tally.updateItems,
        tally.deleteItems,
        tally.firedEvents,
        tally.failedEntities,
        tally.failedItems,
        elapsed);
  }

  private void processType(
      TypeSchedule schedule,
      long cadenceMinutes,
      Instant cycleStart,
      Instant previousWatermark,
      List<SupplementalEvent> supplementalEvents,
      Tally tally) {
    final String entityType = schedule.entityType();
    final Duration cadence = Duration.ofMinutes(cadenceMinutes);
    final Instant before = cycleStart.minus(cadence);
    final Instant after = previousWatermark.minus(cadence);
    final List<EntityCandidate> candidates =
        entityRecordRepository.fetchDue(entityType, before, after);
    tally.candidates += candidates.size();

    final List<DispatchItem> items = new ArrayList<>(candidates.size());
    int firedEvents = 0;
    for (EntityCandidate candidate : candidates) {
      try {
        final Map<String, Instant> leases =
            entityRecordRepository.getLeases(entityType, candidate.key());
        final DispatchItem item =
            planner.plan(
                schedule, cadenceMinutes, candidate, leases, supplementalEvents, cycleStart);
        firedEvents += item.events().size();
        items.add(item);
      } catch (RuntimeException ex) {
        logger.warn(
            "entity evaluation failed, skipped entityType={} entityKey={}",
            entityType,
            candidate.key(),
            ex);
        metrics.recordEntityFailure(entityType);
        tally.failedEntities++;
      }
    }
    metrics.recordEventsFired(entityType, firedEvents);
    tally.firedEvents += firedEvents;

    final DispatchSummary summary =
        items.isEmpty() ? DispatchSummary.EMPTY : dispatcher.dispatch(items);
    tally.updateItems += summary.updates();
    tally.deleteItems += summary.deletes();
    tally.failedItems += summary.failed();
    logger.info(
        "entity type processed entityType={} cadenceMinutes={} window=({}, {}] candidates={}"
            + " updates={} deletes={} events={} failed={}",
        entityType,
        cadenceMinutes,
        after,
        before,
        candidates.size(),
        summary.updates(),
        summary.deletes(),
        firedEvents,
        summary.failed());
  }

  private List<SupplementalEvent> readSupplementalEvents(Instant now) {
    try {
      return supplementalEventSource.read(catalog.entityTypes(), now);
    } catch (RuntimeException ex) {
      logger.error("supplemental events unavailable for this cycle", ex);
      return List.of();
    }
  }

  private static final class Tally {
    private int typesProcessed;
    private int typesSkipped;
    private int typesFailed;
    private int candidates;
    private int updateItems;
    private int deleteItems;
    private int firedEvents;
    private int failedEntities;
    private int failedItems;
  }
}

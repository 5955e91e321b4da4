/*
 * どこで: Updater サービス層
 * 何を: 候補エンティティ 1 件に対するディスパッチ項目を 1 つ組み立てる
 * なぜ: リース/最終更新の書き込みと発火イベントをまとめてワーカーへ届けるため
 */
package com.entitylifecycle.updater.service;

import com.entitylifecycle.updater.model.AttributeUpdate;
import com.entitylifecycle.updater.model.DispatchItem;
import com.entitylifecycle.updater.model.EntityCandidate;
import com.entitylifecycle.updater.model.SupplementalEvent;
import com.entitylifecycle.updater.schedule.TypeSchedule;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class EntityLifecyclePlanner {

  private static final Logger logger = LoggerFactory.getLogger(EntityLifecyclePlanner.class);

  private final LeaseEvaluator leaseEvaluator;
  private final EventDeterminer eventDeterminer;

  public DispatchItem plan(
      TypeSchedule schedule,
      long cadenceMinutes,
      EntityCandidate candidate,
      Map<String, Instant> leases,
      List<SupplementalEvent> supplementalEvents,
      Instant now) {
    final String entityType = schedule.entityType();
    final LeaseDecision decision = leaseEvaluator.evaluate(schedule, candidate.key(), leases, now);
    if (decision.delete()) {
      logger.debug(
          "entity has no live lease, deleting entityType={} entityKey={}",
          entityType,
          candidate.key());
      return DispatchItem.delete(entityType, candidate.key());
    }

    final List<String> events =
        eventDeterminer.firedEvents(schedule, candidate, supplementalEvents, now);
    final List<AttributeUpdate> updates = new ArrayList<>(2);
    if (decision.leaseUpdateRequired()) {
      updates.add(AttributeUpdate.set(DispatchItem.ATTR_LEASES, decision.survivingLeases()));
    }
    final Instant nextUpdate =
        eventDeterminer.nextLastRegularUpdate(candidate, cadenceMinutes, now);
    updates.add(AttributeUpdate.set(DispatchItem.ATTR_LAST_REGULAR_UPDATE, nextUpdate));
    logger.debug(
        "entity planned entityType={} entityKey={} events={} lastRegularUpdate={}",
        entityType,
        candidate.key(),
        events,
        nextUpdate);
    return DispatchItem.update(entityType, candidate.key(), events, updates);
  }
}

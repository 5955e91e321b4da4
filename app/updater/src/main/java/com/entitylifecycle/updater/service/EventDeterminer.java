/*
 * どこで: Updater サービス層
 * 何を: エンティティ 1 件について新たに到来した定期/補助イベントを求める
 * なぜ: イベントはエンティティ作成時刻から数えた間隔境界で発火するため
 */
package com.entitylifecycle.updater.service;

import com.entitylifecycle.updater.model.EntityCandidate;
import com.entitylifecycle.updater.model.SupplementalEvent;
import com.entitylifecycle.updater.schedule.TypeSchedule;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class EventDeterminer {

  static final Duration SUPPLEMENTAL_INTERVAL = Duration.ofDays(1);

  /**
   * 役割:
   * - 最終定期更新から now までの間に間隔境界を越えたイベントを返す。
   *
   * 前提:
   * - 越えた境界がいくつあっても 1 回の呼び出しで発火するのは 1 回だけ。
   *   ワーカーが現在の状態を計算し直すため、取りこぼした周期は再生しない。
   */
  public List<String> firedEvents(
      TypeSchedule schedule,
      EntityCandidate candidate,
      List<SupplementalEvent> supplementalEvents,
      Instant now) {
    final List<String> fired = new ArrayList<>();
    for (Map.Entry<String, Long> event : schedule.events().entrySet()) {
      if (crossedBoundary(candidate, now, Duration.ofMinutes(event.getValue()))) {
        fired.add(event.getKey());
      }
    }
    for (SupplementalEvent supplemental : supplementalEvents) {
      if (!schedule.entityType().equals(supplemental.entityType())
          || !supplemental.isActiveAt(now)) {
        continue;
      }
      if (crossedBoundary(candidate, now, SUPPLEMENTAL_INTERVAL)) {
        fired.add(supplemental.eventName());
      }
    }
    return fired;
  }

  /** now 以前で最大の、ts_added を起点とするケイデンス格子上の時刻。 */
  public Instant nextLastRegularUpdate(
      EntityCandidate candidate, long cadenceMinutes, Instant now) {
    final long cadenceMillis = Duration.ofMinutes(cadenceMinutes).toMillis();
    final long steps = elapsedPeriods(candidate.tsAdded(), now, cadenceMillis);
    return candidate.tsAdded().plusMillis(Math.multiplyExact(steps, cadenceMillis));
  }

  static boolean crossedBoundary(EntityCandidate candidate, Instant now, Duration interval) {
    final long intervalMillis = interval.toMillis();
    final long oldCount =
        elapsedPeriods(candidate.tsAdded(), candidate.lastRegularUpdate(), intervalMillis);
    final long newCount = elapsedPeriods(candidate.tsAdded(), now, intervalMillis);
    return newCount > oldCount;
  }

  private static long elapsedPeriods(Instant from, Instant to, long periodMillis) {
    return Math.floorDiv(Duration.between(from, to).toMillis(), periodMillis);
  }
}

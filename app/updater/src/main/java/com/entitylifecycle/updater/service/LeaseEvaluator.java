/*
 * どこで: Updater サービス層
 * 何を: 名前付きリースからエンティティ 1 件の保持/削除を決める
 * なぜ: 期限内または無期限のリースが 1 つでもあればエンティティを残すため
 */
package com.entitylifecycle.updater.service;

import com.entitylifecycle.updater.schedule.ScheduleInterval;
import com.entitylifecycle.updater.schedule.TypeSchedule;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LeaseEvaluator {

  private static final Logger logger = LoggerFactory.getLogger(LeaseEvaluator.class);
  static final String ERROR_KIND_UNKNOWN_LEASE = "unknown_lease";

  private final UpdaterMetrics metrics;

  public LeaseDecision evaluate(
      TypeSchedule schedule, String entityKey, Map<String, Instant> leases, Instant now) {
    final Map<String, ScheduleInterval> configured = schedule.leases();
    if (!schedule.hasLeases()) {
      // リース設定がなければ削除しない。古い設定由来のリースは消す。
      for (String leaseName : leases.keySet()) {
        reportUnknownLease(schedule.entityType(), entityKey, leaseName);
      }
      return new LeaseDecision(false, Map.of(), !leases.isEmpty());
    }

    boolean delete = true;
    final Map<String, Instant> surviving = new LinkedHashMap<>();
    for (Map.Entry<String, Instant> lease : leases.entrySet()) {
      final String leaseName = lease.getKey();
      final ScheduleInterval interval = configured.get(leaseName);
      if (interval == null) {
        reportUnknownLease(schedule.entityType(), entityKey, leaseName);
        continue;
      }
      if (interval.indefinite()) {
        delete = false;
        surviving.put(leaseName, now);
        continue;
      }
      final Instant createdAt = lease.getValue();
      if (createdAt != null && createdAt.plus(interval.toDuration()).isAfter(now)) {
        delete = false;
        surviving.put(leaseName, createdAt);
      } else {
        logger.debug(
            "lease expired entityType={} entityKey={} lease={} createdAt={}",
            schedule.entityType(),
            entityKey,
            leaseName,
            createdAt);
      }
    }
    if (delete) {
      return LeaseDecision.evict();
    }
    return new LeaseDecision(false, surviving, true);
  }

  private void reportUnknownLease(String entityType, String entityKey, String leaseName) {
    logger.error(
        "lease is not configured for entity type, dropping it entityType={} entityKey={} lease={}",
        entityType,
        entityKey,
        leaseName);
    metrics.recordConfigurationError(ERROR_KIND_UNKNOWN_LEASE);
  }
}

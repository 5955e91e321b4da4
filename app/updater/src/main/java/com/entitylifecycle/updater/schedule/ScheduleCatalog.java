/*
 * どこで: Updater のスケジュールモデル
 * 何を: 全エンティティタイプと解決済みスケジュールを保持する
 * なぜ: 起動時に 1 度だけ組み立て、不正な設定をサイクル中でなく起動時に失敗させるため
 */
package com.entitylifecycle.updater.schedule;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

public final class ScheduleCatalog {

  private final Map<String, TypeSchedule> schedules;

  private ScheduleCatalog(Map<String, TypeSchedule> schedules) {
    this.schedules = Collections.unmodifiableMap(new LinkedHashMap<>(schedules));
  }

  public static ScheduleCatalog of(Collection<TypeSchedule> schedules) {
    final Map<String, TypeSchedule> byType = new LinkedHashMap<>();
    for (TypeSchedule schedule : schedules) {
      if (byType.putIfAbsent(schedule.entityType(), schedule) != null) {
        throw new ScheduleConfigurationException(
            "duplicate schedule for entity type: " + schedule.entityType());
      }
    }
    return new ScheduleCatalog(byType);
  }

  public static ScheduleCatalog from(ScheduleDocument document) {
    final Set<String> entityTypes = new LinkedHashSet<>(document.events().keySet());
    entityTypes.addAll(document.leases().keySet());

    final Map<String, TypeSchedule> byType = new LinkedHashMap<>();
    for (String entityType : entityTypes) {
      if (entityType == null || entityType.isBlank()) {
        throw new ScheduleConfigurationException("entity type name must not be blank");
      }
      final Map<String, Long> events = new LinkedHashMap<>();
      final Map<String, String> rawEvents = document.events().get(entityType);
      if (rawEvents != null) {
        rawEvents.forEach(
            (name, interval) ->
                events.put(
                    requireName("events", entityType, name),
                    resolve(
                        "events",
                        entityType,
                        name,
                        () -> IntervalParser.parseEventInterval(interval))));
      }
      final Map<String, ScheduleInterval> leases = new LinkedHashMap<>();
      final Map<String, String> rawLeases = document.leases().get(entityType);
      if (rawLeases != null) {
        rawLeases.forEach(
            (name, interval) ->
                leases.put(
                    requireName("leases", entityType, name),
                    resolve(
                        "leases",
                        entityType,
                        name,
                        () -> IntervalParser.parseLeaseInterval(interval))));
      }
      byType.put(entityType, new TypeSchedule(entityType, events, leases));
    }
    return new ScheduleCatalog(byType);
  }

  public Set<String> entityTypes() {
    return schedules.keySet();
  }

  public Collection<TypeSchedule> schedules() {
    return schedules.values();
  }

  public Optional<TypeSchedule> schedule(String entityType) {
    return Optional.ofNullable(schedules.get(entityType));
  }

  public boolean contains(String entityType) {
    return schedules.containsKey(entityType);
  }

  private static String requireName(String section, String entityType, String name) {
    if (name == null || name.isBlank()) {
      throw new ScheduleConfigurationException(
          section + "." + entityType + " contains a blank name");
    }
    return name;
  }

  private static <T> T resolve(
      String section, String entityType, String name, Supplier<T> parser) {
    try {
      return parser.get();
    } catch (ScheduleConfigurationException ex) {
      throw new ScheduleConfigurationException(
          section + "." + entityType + "." + name + ": " + ex.getMessage(), ex);
    }
  }
}

/*
 * どこで: Updater 設定
 * 何を: 起動時にスケジュール文書と補助イベントソースを読み込む
 * なぜ: 不正なスケジュールは最初のサイクル前にプロセスを止めるため
 */
package com.entitylifecycle.updater.config;

import com.entitylifecycle.updater.schedule.ScheduleCatalog;
import com.entitylifecycle.updater.schedule.ScheduleDocumentLoader;
import com.entitylifecycle.updater.schedule.TypeSchedule;
import com.entitylifecycle.updater.service.UpdaterMetrics;
import com.entitylifecycle.updater.supplemental.FileSupplementalEventSource;
import com.entitylifecycle.updater.supplemental.SupplementalEventSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ScheduleConfig {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleConfig.class);

  @Bean
  public ScheduleCatalog scheduleCatalog(UpdaterProperties properties) {
    final ScheduleCatalog catalog =
        ScheduleCatalog.from(new ScheduleDocumentLoader().load(properties.schedulePath()));
    for (TypeSchedule schedule : catalog.schedules()) {
      logger.info(
          "entity type scheduled entityType={} events={} leases={} cadenceMinutes={}",
          schedule.entityType(),
          schedule.events(),
          schedule.leases(),
          schedule.cadenceMinutes().isPresent() ? schedule.cadenceMinutes().getAsLong() : "none");
    }
    return catalog;
  }

  @Bean
  public SupplementalEventSource supplementalEventSource(
      UpdaterProperties properties, UpdaterMetrics metrics) {
    return new FileSupplementalEventSource(properties.supplementalEventsPath(), metrics);
  }
}

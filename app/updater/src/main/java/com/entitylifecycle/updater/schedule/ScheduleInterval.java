/*
 * どこで: Updater のスケジュールモデル
 * 何を: 分単位の設定間隔、または無期限を表す値
 * なぜ: リースは無期限("*")を許すが、イベントは許さないため
 */
package com.entitylifecycle.updater.schedule;

import java.time.Duration;

public record ScheduleInterval(long minutes, boolean indefinite) {

  public static final ScheduleInterval INDEFINITE = new ScheduleInterval(0L, true);

  public ScheduleInterval {
    if (!indefinite && minutes <= 0) {
      throw new IllegalArgumentException("interval minutes must be positive: " + minutes);
    }
  }

  public static ScheduleInterval ofMinutes(long minutes) {
    return new ScheduleInterval(minutes, false);
  }

  public Duration toDuration() {
    if (indefinite) {
      throw new IllegalStateException("indefinite interval has no duration");
    }
    return Duration.ofMinutes(minutes);
  }

  @Override
  public String toString() {
    return indefinite ? "*" : minutes + "m";
  }
}

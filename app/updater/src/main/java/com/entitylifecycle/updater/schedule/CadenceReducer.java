/*
 * どこで: Updater のスケジュールモデル
 * 何を: 間隔(分)の集合を最大公約数へ畳み込む
 * なぜ: GCD 分ごとに見直せば、設定されたすべての間隔境界に当たるため
 */
package com.entitylifecycle.updater.schedule;

import java.util.Collection;
import java.util.OptionalLong;

public final class CadenceReducer {

  private CadenceReducer() {}

  public static OptionalLong reduce(Collection<Long> intervalMinutes) {
    long cadence = 0L;
    for (Long minutes : intervalMinutes) {
      if (minutes == null || minutes <= 0) {
        throw new IllegalArgumentException("interval minutes must be positive: " + minutes);
      }
      cadence = gcd(cadence, minutes);
    }
    return cadence == 0L ? OptionalLong.empty() : OptionalLong.of(cadence);
  }

  static long gcd(long a, long b) {
    while (b != 0L) {
      final long next = a % b;
      a = b;
      b = next;
    }
    return a;
  }
}

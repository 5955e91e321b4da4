/*
 * どこで: Updater のスケジュール設定
 * 何を: "<正の整数><m|h|d|w|y>" または "*" を ScheduleInterval へ変換する
 * なぜ: スケジュール計算をすべて整数の分で行うため
 */
package com.entitylifecycle.updater.schedule;

public final class IntervalParser {

  public static final String INDEFINITE_TOKEN = "*";

  private static final long MINUTES_PER_HOUR = 60L;
  private static final long MINUTES_PER_DAY = 1_440L;
  private static final long MINUTES_PER_WEEK = 10_080L;
  private static final long MINUTES_PER_YEAR = 525_600L;

  private IntervalParser() {}

  /** リース間隔を解析する。"*" は無期限を表す。 */
  public static ScheduleInterval parseLeaseInterval(String raw) {
    if (raw != null && INDEFINITE_TOKEN.equals(raw.trim())) {
      return ScheduleInterval.INDEFINITE;
    }
    return ScheduleInterval.ofMinutes(parseMinutes(raw));
  }

  /** イベント間隔を解析する。イベントには有限の周期が必要なため "*" は拒否する。 */
  public static long parseEventInterval(String raw) {
    if (raw != null && INDEFINITE_TOKEN.equals(raw.trim())) {
      throw new ScheduleConfigurationException("indefinite interval is not allowed for events");
    }
    return parseMinutes(raw);
  }

  public static long parseMinutes(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ScheduleConfigurationException("interval is empty");
    }
    final String value = raw.trim();
    int digitsEnd = 0;
    while (digitsEnd < value.length() && isAsciiDigit(value.charAt(digitsEnd))) {
      digitsEnd++;
    }
    if (digitsEnd == 0) {
      throw new ScheduleConfigurationException("interval has no leading integer: " + raw);
    }
    if (digitsEnd != value.length() - 1) {
      throw new ScheduleConfigurationException(
          "interval must be an integer followed by one unit character: " + raw);
    }
    final long amount;
    try {
      amount = Long.parseLong(value.substring(0, digitsEnd));
    } catch (NumberFormatException ex) {
      throw new ScheduleConfigurationException("interval amount out of range: " + raw, ex);
    }
    if (amount <= 0) {
      throw new ScheduleConfigurationException("interval must be positive: " + raw);
    }
    final long factor = unitFactor(value.charAt(digitsEnd), raw);
    try {
      return Math.multiplyExact(amount, factor);
    } catch (ArithmeticException ex) {
      throw new ScheduleConfigurationException("interval out of range: " + raw, ex);
    }
  }

  private static long unitFactor(char unit, String raw) {
    return switch (unit) {
      case 'm' -> 1L;
      case 'h' -> MINUTES_PER_HOUR;
      case 'd' -> MINUTES_PER_DAY;
      case 'w' -> MINUTES_PER_WEEK;
      case 'y' -> MINUTES_PER_YEAR;
      default -> throw new ScheduleConfigurationException(
          "interval has unknown unit '" + unit + "': " + raw);
    };
  }

  private static boolean isAsciiDigit(char c) {
    return c >= '0' && c <= '9';
  }
}

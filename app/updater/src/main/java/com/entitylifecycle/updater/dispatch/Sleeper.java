package com.entitylifecycle.updater.dispatch;

import java.time.Duration;

/** ディスパッチのペース制御に使う待機。テストでは差し替える。 */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper system() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}

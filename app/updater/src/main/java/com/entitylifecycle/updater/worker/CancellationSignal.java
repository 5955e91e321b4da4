/*
 * どこで: Updater のサイクルワーカー
 * 何を: 停止処理とサイクルループで共有する 1 回限りの停止要求
 * なぜ: サイクルの合間にだけ確認し、実行中のディスパッチを途中で切らないため
 */
package com.entitylifecycle.updater.worker;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class CancellationSignal {

  private final CountDownLatch cancelled = new CountDownLatch(1);

  public void cancel() {
    cancelled.countDown();
  }

  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  /** 最大 {@code timeout} 待つ。取り消された時点で true を返す。 */
  public boolean await(Duration timeout) throws InterruptedException {
    if (timeout.isNegative() || timeout.isZero()) {
      return isCancelled();
    }
    return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }
}

/*
 * どこで: Updater のサイクルワーカー
 * 何を: 専用スレッドでサイクルループを開始し、コンテキスト終了時に止める
 * なぜ: NATS 接続を閉じる前に実行中のサイクルの完了を待つため
 */
package com.entitylifecycle.updater.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "updater.enabled", havingValue = "true", matchIfMissing = true)
public class UpdaterCycleLifecycle implements SmartLifecycle {

  private static final Logger logger = LoggerFactory.getLogger(UpdaterCycleLifecycle.class);
  private static final String THREAD_NAME = "updater-cycle";

  private final CycleDriver driver;
  private CancellationSignal signal;
  private Thread thread;

  public UpdaterCycleLifecycle(CycleDriver driver) {
    this.driver = driver;
  }

  @Override
  public synchronized void start() {
    if (thread != null) {
      return;
    }
    final CancellationSignal newSignal = new CancellationSignal();
    final Thread newThread = new Thread(() -> driver.run(newSignal), THREAD_NAME);
    newThread.start();
    signal = newSignal;
    thread = newThread;
  }

  @Override
  public synchronized void stop() {
    if (thread == null) {
      return;
    }
    signal.cancel();
    try {
      // 実行中のサイクルは最後まで走らせる。サイクル途中での中断はしない。
      thread.join();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      logger.warn("interrupted while waiting for the updater cycle to finish");
    }
    thread = null;
    signal = null;
  }

  @Override
  public synchronized boolean isRunning() {
    return thread != null;
  }
}

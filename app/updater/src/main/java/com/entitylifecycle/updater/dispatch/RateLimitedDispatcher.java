/*
 * どこで: Updater のディスパッチ
 * 何を: ディスパッチ項目を毎秒 N 件以下で publish する
 * なぜ: 長時間の停止明けにワーカーとブローカーへ負荷が集中しないようにするため
 */
package com.entitylifecycle.updater.dispatch;

import com.entitylifecycle.updater.model.DispatchItem;
import com.entitylifecycle.updater.service.UpdaterMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RateLimitedDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(RateLimitedDispatcher.class);
  private static final Duration BATCH_WINDOW = Duration.ofSeconds(1);
  static final String RESULT_PUBLISHED = "published";
  static final String RESULT_FAILED = "failed";

  private final DispatchPublisher publisher;
  private final UpdaterMetrics metrics;
  private final Clock clock;
  private final Sleeper sleeper;
  private final int ratePerSecond;

  public RateLimitedDispatcher(
      DispatchPublisher publisher,
      UpdaterMetrics metrics,
      Clock clock,
      Sleeper sleeper,
      int ratePerSecond) {
    if (ratePerSecond <= 0) {
      throw new IllegalArgumentException("ratePerSecond must be positive: " + ratePerSecond);
    }
    this.publisher = publisher;
    this.metrics = metrics;
    this.clock = clock;
    this.sleeper = sleeper;
    this.ratePerSecond = ratePerSecond;
  }

  /**
   * 役割:
   * - 全項目を publish し、{@code ratePerSecond} 件ごとに、その区切りが始まった 1 秒の残りだけ待つ。
   * - 失敗した項目はログとメトリクスに残し、残りの処理は続ける。
   *
   * 割り込み:
   * - 待機中に割り込まれた場合、この呼び出しではペース制御をやめる。
   * - 割り込みフラグが立っていると publisher 側の待機が失敗するため、フラグは最後の項目の後で戻す。
   */
  public DispatchSummary dispatch(List<DispatchItem> items) {
    int updates = 0;
    int deletes = 0;
    int failed = 0;
    boolean pacing = true;
    boolean interrupted = false;
    Instant batchStart = clock.instant();
    int inBatch = 0;
    for (DispatchItem item : items) {
      if (publishOne(item)) {
        if (item.delete()) {
          deletes++;
        } else {
          updates++;
        }
      } else {
        failed++;
      }
      inBatch++;
      if (inBatch < ratePerSecond) {
        continue;
      }
      final Duration remaining = BATCH_WINDOW.minus(Duration.between(batchStart, clock.instant()));
      if (pacing && !remaining.isNegative() && !remaining.isZero()) {
        try {
          sleeper.sleep(remaining);
        } catch (InterruptedException ex) {
          interrupted = true;
          pacing = false;
          logger.warn(
              "dispatch pacing interrupted, publishing the rest unpaced remaining={}",
              items.size() - updates - deletes - failed);
        }
      }
      batchStart = clock.instant();
      inBatch = 0;
    }
    if (interrupted) {
      Thread.currentThread().interrupt();
    }
    return new DispatchSummary(updates, deletes, failed);
  }

  private boolean publishOne(DispatchItem item) {
    try {
      publisher.publish(item);
      metrics.recordDispatch(item.delete(), RESULT_PUBLISHED);
      return true;
    } catch (RuntimeException ex) {
      logger.error(
          "dispatch failed entityType={} entityKey={} delete={}",
          item.entityType(),
          item.entityKey(),
          item.delete(),
          ex);
      metrics.recordDispatch(item.delete(), RESULT_FAILED);
      return false;
    }
  }
}

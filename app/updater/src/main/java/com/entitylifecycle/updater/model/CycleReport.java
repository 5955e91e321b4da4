/*
 * どこで: Updater のドメインモデル
 * 何を: 全エンティティタイプを 1 周したサイクルの集計値
 * なぜ: サイクル終了時のログと状態エンドポイントで使うため
 */
package com.entitylifecycle.updater.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Duration;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CycleReport(
    Instant cycleStart,
    Instant previousWatermark,
    int typesProcessed,
    int typesSkipped,
    int typesFailed,
    int candidates,
    int updateItems,
    int deleteItems,
    int firedEvents,
    int failedEntities,
    int failedItems,
    Duration elapsed) {

  /**
   * 全タイプを取得でき、全項目をキューへ渡せたときに true。
   * 自身のレコードを評価できずに飛ばしたエンティティはここに含めない。
   */
  public boolean fullyProcessed() {
    return typesFailed == 0 && failedItems == 0;
  }
}

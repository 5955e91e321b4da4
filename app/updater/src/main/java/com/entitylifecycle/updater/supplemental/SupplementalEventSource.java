/*
 * どこで: Updater のサイドチャネル
 * 何を: 運用者が要求した補助イベントの取得元(サイクルごとに 1 回読む)
 * なぜ: イベントの出どころがファイルかテストかをサイクル側で意識しないため
 */
package com.entitylifecycle.updater.supplemental;

import com.entitylifecycle.updater.model.SupplementalEvent;
import java.time.Instant;
import java.util.List;
import java.util.Set;

public interface SupplementalEventSource {

  /** {@code now} 時点で有効なイベントを、指定エンティティタイプに絞って返す。 */
  List<SupplementalEvent> read(Set<String> entityTypes, Instant now);
}

/*
 * どこで: Updater のサイドチャネル
 * 何を: メモリ上に保持する補助イベント
 * なぜ: テストやローカル実行でファイルなしにイベントを与えるため
 */
package com.entitylifecycle.updater.supplemental;

import com.entitylifecycle.updater.model.SupplementalEvent;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

public class InMemorySupplementalEventSource implements SupplementalEventSource {

  private final List<SupplementalEvent> events = new CopyOnWriteArrayList<>();

  public InMemorySupplementalEventSource add(SupplementalEvent event) {
    events.add(event);
    return this;
  }

  public void clear() {
    events.clear();
  }

  @Override
  public List<SupplementalEvent> read(Set<String> entityTypes, Instant now) {
    return events.stream()
        .filter(event -> entityTypes.contains(event.entityType()))
        .filter(event -> event.isActiveAt(now))
        .toList();
  }
}

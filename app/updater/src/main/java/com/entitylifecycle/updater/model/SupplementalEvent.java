/*
 * どこで: Updater のドメインモデル
 * 何を: 運用者が要求したエンティティタイプ全体への日次イベント(expiresAt まで有効)
 * なぜ: 静的スケジュールを触らずに再処理を起こせるようにするため
 */
package com.entitylifecycle.updater.model;

import java.time.Instant;

public record SupplementalEvent(String entityType, String eventName, Instant expiresAt) {

  public boolean isActiveAt(Instant now) {
    return expiresAt.isAfter(now);
  }
}

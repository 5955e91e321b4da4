/*
 * どこで: Updater のドメインモデル
 * 何を: 期限到来ウィンドウの取得で返るエンティティ 1 件
 * なぜ: リースとイベントの評価にはキーと 2 つの時刻だけが必要なため
 */
package com.entitylifecycle.updater.model;

import java.time.Instant;

public record EntityCandidate(String key, Instant lastRegularUpdate, Instant tsAdded) {}

/*
 * どこで: Updater のディスパッチモデル
 * 何を: ワーカーがエンティティへ適用する属性書き込み 1 件
 * なぜ: リースと最終更新の書き込みをディスパッチ項目に載せて運ぶため
 */
package com.entitylifecycle.updater.model;

public record AttributeUpdate(String op, String attribute, Object value) {

  public static final String OP_SET = "set";

  public static AttributeUpdate set(String attribute, Object value) {
    return new AttributeUpdate(OP_SET, attribute, value);
  }
}

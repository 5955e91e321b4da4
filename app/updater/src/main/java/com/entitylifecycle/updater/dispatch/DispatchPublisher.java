/*
 * どこで: Updater のディスパッチ
 * 何を: ディスパッチ項目を 1 件キューへ渡す
 * なぜ: ペース制御のループを背後の転送手段から切り離すため
 */
package com.entitylifecycle.updater.dispatch;

import com.entitylifecycle.updater.model.DispatchItem;

public interface DispatchPublisher {

  /** 項目を publish する。失敗時は {@link DispatchPublishException} を送出する。 */
  void publish(DispatchItem item);
}

/*
 * どこで: Updater のスケジュール設定
 * 何を: 不正な間隔文字列やスケジュール文書で送出する
 * なぜ: 不正なスケジュールでは設定エラーの終了コードで止めるため
 */
package com.entitylifecycle.updater.schedule;

import com.entitylifecycle.updater.config.StartupFailure;
import com.entitylifecycle.updater.config.UpdaterStartupException;

public class ScheduleConfigurationException extends UpdaterStartupException {

  public ScheduleConfigurationException(String message) {
    super(StartupFailure.CONFIGURATION, message);
  }

  public ScheduleConfigurationException(String message, Throwable cause) {
    super(StartupFailure.CONFIGURATION, message, cause);
  }
}

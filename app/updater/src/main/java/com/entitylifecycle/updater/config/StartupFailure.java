/*
 * どこで: Updater 起動処理
 * 何を: 起動時に致命的となる依存先と、その終了コードを定義する
 * なぜ: どの依存先で起動に失敗したかを終了コードで判別できるようにするため
 */
package com.entitylifecycle.updater.config;

public enum StartupFailure {
  CONFIGURATION(2),
  QUEUE(3),
  DATASTORE(4);

  private final int exitCode;

  StartupFailure(int exitCode) {
    this.exitCode = exitCode;
  }

  public int exitCode() {
    return exitCode;
  }
}

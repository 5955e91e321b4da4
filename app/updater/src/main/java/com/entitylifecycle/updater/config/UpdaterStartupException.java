/*
 * どこで: Updater 起動処理
 * 何を: 依存先ごとの終了コードを持つ起動時の致命的エラー
 * なぜ: コンテキスト起動失敗時に SpringApplication が cause を辿って ExitCodeGenerator を探すため
 */
package com.entitylifecycle.updater.config;

import org.springframework.boot.ExitCodeGenerator;

public class UpdaterStartupException extends IllegalStateException implements ExitCodeGenerator {

  private final StartupFailure failure;

  public UpdaterStartupException(StartupFailure failure, String message) {
    super(message);
    this.failure = failure;
  }

  public UpdaterStartupException(StartupFailure failure, String message, Throwable cause) {
    super(message, cause);
    this.failure = failure;
  }

  public StartupFailure failure() {
    return failure;
  }

  @Override
  public int getExitCode() {
    return failure.exitCode();
  }
}

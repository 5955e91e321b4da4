/*
 * どこで: Updater の設定バインド
 * 何を: ディスパッチ項目を運ぶ JetStream の subject/stream を保持する
 * なぜ: ワーカーと subject を一致させ、重複排除に stream の窓を使うため
 */
package com.entitylifecycle.updater.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "updater.nats")
public record UpdaterNatsProperties(
    @NotBlank String subject, @NotBlank String stream, @NotNull Duration duplicateWindow) {

  @AssertTrue(message = "updater.nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return duplicateWindow != null && !duplicateWindow.isZero() && !duplicateWindow.isNegative();
  }
}

/*
 * どこで: Updater の設定バインド
 * 何を: サイクル周期/ディスパッチレート/設定ディレクトリを保持する
 * なぜ: 調整値とファイルの場所が環境ごとに異なるため
 */
package com.entitylifecycle.updater.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.nio.file.Path;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "updater")
public record UpdaterProperties(
    boolean enabled,
    // 単位なしの数値は秒として扱う。
    @NotNull @DurationUnit(ChronoUnit.SECONDS) Duration cyclePeriod,
    @NotNull @Positive Integer dispatchRate,
    @NotBlank String configDir,
    @NotBlank String scheduleFile,
    @NotBlank String supplementalEventsFile) {

  @AssertTrue(message = "updater.cycle-period must be positive")
  public boolean isCyclePeriodPositive() {
    // null は @NotNull で検出する前提。
    return cyclePeriod != null && !cyclePeriod.isZero() && !cyclePeriod.isNegative();
  }

  public Path schedulePath() {
    return Path.of(configDir).resolve(scheduleFile);
  }

  public Path supplementalEventsPath() {
    return Path.of(configDir).resolve(supplementalEventsFile);
  }
}

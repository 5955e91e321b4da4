/*
 * どこで: Updater 設定バインドのテスト
 * 何を: Duration のバインド、導出されるファイルパス、不正な調整値の拒否を検証する
 * なぜ: 周期やレートが 0 のときはループを空回り/停止させず起動を止めるため
 */
package com.entitylifecycle.updater.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class UpdaterPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
          .withUserConfiguration(TestConfiguration.class)
          .withPropertyValues(
              "updater.enabled=true",
              "updater.cycle-period=90s",
              "updater.dispatch-rate=250",
              "updater.config-dir=/etc/updater",
              "updater.schedule-file=updater.yml",
              "updater.supplemental-events-file=supplemental_events.txt",
              "updater.nats.subject=updater.tasks",
              "updater.nats.stream=updater-tasks",
              "updater.nats.duplicate-window=2m");

  @Test
  void contextStartsAndBindsDurationFields() {
    contextRunner.run(
        context -> {
          assertThat(context).hasNotFailed();
          final UpdaterProperties properties = context.getBean(UpdaterProperties.class);
          final UpdaterNatsProperties natsProperties = context.getBean(UpdaterNatsProperties.class);

          assertThat(properties.cyclePeriod()).isEqualTo(Duration.ofSeconds(90));
          assertThat(properties.dispatchRate()).isEqualTo(250);
          assertThat(properties.schedulePath()).isEqualTo(Path.of("/etc/updater/updater.yml"));
          assertThat(properties.supplementalEventsPath())
              .isEqualTo(Path.of("/etc/updater/supplemental_events.txt"));
          assertThat(natsProperties.duplicateWindow()).isEqualTo(Duration.ofMinutes(2));
        });
  }

  @Test
  void bareCyclePeriodIsReadAsSeconds() {
    contextRunner
        .withPropertyValues("updater.cycle-period=60")
        .run(
            context ->
                assertThat(context.getBean(UpdaterProperties.class).cyclePeriod())
                    .isEqualTo(Duration.ofMinutes(1)));
  }

  @Test
  void cyclePeriodKeepsExplicitUnits() {
    contextRunner
        .withPropertyValues("updater.cycle-period=2m")
        .run(
            context ->
                assertThat(context.getBean(UpdaterProperties.class).cyclePeriod())
                    .isEqualTo(Duration.ofMinutes(2)));
  }

  @Test
  void zeroCyclePeriodFailsTheContext() {
    contextRunner
        .withPropertyValues("updater.cycle-period=0s")
        .run(context -> assertThat(context).hasFailed());
  }

  @Test
  void zeroDispatchRateFailsTheContext() {
    contextRunner
        .withPropertyValues("updater.dispatch-rate=0")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration
  @EnableConfigurationProperties({UpdaterProperties.class, UpdaterNatsProperties.class})
  static class TestConfiguration {
    // バインドだけを検証する最小構成
  }
}

/*
 * どこで: Updater アプリの起動エントリ
 * 何を: Spring を起動し、設定プロパティを走査する
 * なぜ: サイクルループ/NATS 接続/データストアをここから組み立てるため
 */
package com.entitylifecycle.updater;

import com.entitylifecycle.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class UpdaterApplication {

  public static void main(String[] args) {
    SpringApplication.run(UpdaterApplication.class, args);
  }
}

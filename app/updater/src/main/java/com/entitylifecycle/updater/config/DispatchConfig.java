/*
 * どこで: Updater 設定
 * 何を: 設定されたレートでレート制限付きディスパッチャを組み立てる
 * なぜ: ディスパッチャを素のコンストラクタ引数で作り、テストから時計を操作できるようにするため
 */
package com.entitylifecycle.updater.config;

import com.entitylifecycle.updater.dispatch.DispatchPublisher;
import com.entitylifecycle.updater.dispatch.RateLimitedDispatcher;
import com.entitylifecycle.updater.dispatch.Sleeper;
import com.entitylifecycle.updater.service.UpdaterMetrics;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DispatchConfig {

  @Bean
  public RateLimitedDispatcher rateLimitedDispatcher(
      DispatchPublisher publisher,
      UpdaterMetrics metrics,
      Clock clock,
      UpdaterProperties properties) {
    return new RateLimitedDispatcher(
        publisher, metrics, clock, Sleeper.system(), properties.dispatchRate());
  }
}

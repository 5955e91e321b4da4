/*
 * どこで: Updater のインフラ設定
 * 何を: 長寿命の NATS 接続と JetStream コンテキストを保持する
 * なぜ: 全サイクルで 1 本の接続を使い回し、接続できなければ起動を止めるため
 */
package com.entitylifecycle.updater.config;

import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  private static final Logger logger = LoggerFactory.getLogger(NatsConfig.class);

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties) {
    final Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
            .build();
    try {
      final Connection connection = Nats.connect(options);
      logger.info("nats connected url={}", properties.url());
      return connection;
    } catch (IOException ex) {
      throw new UpdaterStartupException(
          StartupFailure.QUEUE, "failed to connect to NATS url=" + properties.url(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new UpdaterStartupException(
          StartupFailure.QUEUE, "interrupted while connecting to NATS url=" + properties.url(), ex);
    }
  }

  @Bean
  public JetStream jetStream(Connection natsConnection) {
    try {
      return natsConnection.jetStream();
    } catch (IOException ex) {
      throw new UpdaterStartupException(
          StartupFailure.QUEUE, "failed to open JetStream context", ex);
    }
  }
}

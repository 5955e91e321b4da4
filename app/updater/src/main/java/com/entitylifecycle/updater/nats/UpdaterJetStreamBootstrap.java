/*
 * どこで: Updater の NATS 初期化
 * 何を: 起動時にディスパッチ項目用の JetStream stream を作成/更新する
 * なぜ: Nats-Msg-Id による重複排除は stream と窓が存在して初めて効くため
 */
package com.entitylifecycle.updater.nats;

import com.entitylifecycle.updater.config.StartupFailure;
import com.entitylifecycle.updater.config.UpdaterNatsProperties;
import com.entitylifecycle.updater.config.UpdaterStartupException;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class UpdaterJetStreamBootstrap {

  private static final Logger logger = LoggerFactory.getLogger(UpdaterJetStreamBootstrap.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final UpdaterNatsProperties properties;

  @PostConstruct
  public void start() {
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    try {
      upsertStream(connection.jetStreamManagement(), streamConfiguration);
    } catch (IOException | JetStreamApiException ex) {
      throw new UpdaterStartupException(
          StartupFailure.QUEUE, "failed to ensure JetStream stream " + properties.stream(), ex);
    }
    logger.info(
        "updater stream ensured stream={} subject={} duplicateWindow={}",
        properties.stream(),
        properties.subject(),
        properties.duplicateWindow());
  }

  private void upsertStream(
      JetStreamManagement jetStreamManagement, StreamConfiguration streamConfiguration)
      throws IOException, JetStreamApiException {
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }
}

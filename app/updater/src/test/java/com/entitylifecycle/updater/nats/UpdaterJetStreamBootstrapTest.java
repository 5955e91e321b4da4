/*
 * どこで: Updater JetStream 初期化のテスト
 * 何を: stream があれば更新、なければ作成し、失敗時は起動を止めることを検証する
 * なぜ: ディスパッチの重複排除は重複窓付きの stream が前提のため
 */
package com.entitylifecycle.updater.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.entitylifecycle.updater.config.StartupFailure;
import com.entitylifecycle.updater.config.UpdaterNatsProperties;
import com.entitylifecycle.updater.config.UpdaterStartupException;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.Error;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UpdaterJetStreamBootstrapTest {

  private static final UpdaterNatsProperties PROPERTIES =
      new UpdaterNatsProperties("updater.tasks", "updater-tasks", Duration.ofMinutes(2));

  @Mock private Connection connection;

  @Mock private JetStreamManagement jetStreamManagement;

  @Test
  void startCreatesStreamWithDuplicateWindowWhenMissing() throws Exception {
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);
    when(jetStreamManagement.updateStream(any(StreamConfiguration.class)))
        .thenThrow(new StreamNotFoundException());

    new UpdaterJetStreamBootstrap(connection, PROPERTIES).start();

    final ArgumentCaptor<StreamConfiguration> captor =
        ArgumentCaptor.forClass(StreamConfiguration.class);
    verify(jetStreamManagement).addStream(captor.capture());
    assertThat(captor.getValue().getName()).isEqualTo("updater-tasks");
    assertThat(captor.getValue().getSubjects()).containsExactly("updater.tasks");
    assertThat(captor.getValue().getDuplicateWindow()).isEqualTo(Duration.ofMinutes(2));
  }

  @Test
  void startUpdatesExistingStream() throws Exception {
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);

    new UpdaterJetStreamBootstrap(connection, PROPERTIES).start();

    verify(jetStreamManagement).updateStream(any(StreamConfiguration.class));
    verify(jetStreamManagement, never()).addStream(any(StreamConfiguration.class));
  }

  @Test
  void unreachableBrokerFailsStartupWithQueueExitCode() throws Exception {
    when(connection.jetStreamManagement()).thenThrow(new IOException("connection closed"));

    final UpdaterJetStreamBootstrap bootstrap = new UpdaterJetStreamBootstrap(connection, PROPERTIES);

    assertThatThrownBy(bootstrap::start)
        .isInstanceOfSatisfying(
            UpdaterStartupException.class,
            ex -> {
              assertThat(ex.failure()).isEqualTo(StartupFailure.QUEUE);
              assertThat(ex.getExitCode()).isEqualTo(3);
            });
  }

  private static final class StreamNotFoundException extends JetStreamApiException {
    private StreamNotFoundException() {
      super(Error.JsBadRequestErr);
    }

    @Override
    public int getApiErrorCode() {
      return 10059;
    }

    @Override
    public int getErrorCode() {
      return 404;
    }
  }
}

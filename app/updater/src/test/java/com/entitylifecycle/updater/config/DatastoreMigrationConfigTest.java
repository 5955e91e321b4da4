/*
 * どこで: Updater データストア起動のテスト
 * 何を: データストアに到達できないとき、データストア用の終了コードで起動が失敗することを検証する
 * なぜ: キュー/データストア/設定の失敗を終了コードで見分けられるようにするため
 */
package com.entitylifecycle.updater.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class DatastoreMigrationConfigTest {

  @Mock private DataSource dataSource;

  @Mock private Connection connection;

  @Test
  void unreachableDatastoreFailsWithDatastoreExitCode() throws SQLException {
    when(dataSource.getConnection()).thenThrow(new SQLException("connection refused"));

    assertThatThrownBy(() -> DatastoreMigrationConfig.ensureReachable(dataSource))
        .isInstanceOf(UpdaterStartupException.class)
        .hasCauseInstanceOf(SQLException.class)
        .extracting(ex -> ((UpdaterStartupException) ex).getExitCode())
        .isEqualTo(4);
  }

  @Test
  void invalidConnectionFailsWithDatastoreExitCode() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.isValid(5)).thenReturn(false);

    assertThatThrownBy(() -> DatastoreMigrationConfig.ensureReachable(dataSource))
        .isInstanceOf(UpdaterStartupException.class)
        .extracting(ex -> ((UpdaterStartupException) ex).failure())
        .isEqualTo(StartupFailure.DATASTORE);
  }

  @Test
  void reachableDatastorePasses() throws SQLException {
    final DatabaseMetaData metaData = mock(DatabaseMetaData.class);
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.isValid(5)).thenReturn(true);
    when(connection.getMetaData()).thenReturn(metaData);
    when(metaData.getURL()).thenReturn("jdbc:postgresql://localhost:5432/entities");

    assertThatCode(() -> DatastoreMigrationConfig.ensureReachable(dataSource))
        .doesNotThrowAnyException();
  }
}

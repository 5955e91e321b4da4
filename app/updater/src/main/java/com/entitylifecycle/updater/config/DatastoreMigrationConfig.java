/*
 * どこで: Updater のインフラ設定
 * 何を: Flyway の migration 前にデータストアへ到達できることを確認する
 * なぜ: データストアに到達できない場合は専用の終了コードで起動を止めるため
 */
package com.entitylifecycle.updater.config;

import com.google.common.annotations.VisibleForTesting;
import java.sql.Connection;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.flywaydb.core.api.FlywayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.flyway.FlywayMigrationStrategy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class DatastoreMigrationConfig {

  private static final Logger logger = LoggerFactory.getLogger(DatastoreMigrationConfig.class);
  private static final int VALIDATION_TIMEOUT_SECONDS = 5;

  @Bean
  public FlywayMigrationStrategy flywayMigrationStrategy() {
    return flyway -> {
      ensureReachable(flyway.getConfiguration().getDataSource());
      try {
        flyway.migrate();
      } catch (FlywayException ex) {
        throw new UpdaterStartupException(
            StartupFailure.DATASTORE, "failed to migrate datastore schema", ex);
      }
    };
  }

  @VisibleForTesting
  static void ensureReachable(DataSource dataSource) {
    try (Connection connection = dataSource.getConnection()) {
      if (!connection.isValid(VALIDATION_TIMEOUT_SECONDS)) {
        throw new UpdaterStartupException(
            StartupFailure.DATASTORE, "datastore connection is not valid");
      }
      logger.info("datastore reachable url={}", connection.getMetaData().getURL());
    } catch (SQLException ex) {
      throw new UpdaterStartupException(
          StartupFailure.DATASTORE, "failed to connect to datastore", ex);
    }
  }
}

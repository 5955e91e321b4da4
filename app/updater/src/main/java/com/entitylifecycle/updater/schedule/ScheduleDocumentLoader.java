/*
 * どこで: Updater のスケジュール設定
 * 何を: 設定ディレクトリから YAML のスケジュール文書を読む
 * なぜ: スケジュールは運用者が編集し、サイドチャネルのファイルと同じ場所に置くため
 */
package com.entitylifecycle.updater.schedule;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ScheduleDocumentLoader {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleDocumentLoader.class);

  private final ObjectMapper yamlMapper;

  public ScheduleDocumentLoader() {
    this.yamlMapper =
        new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
  }

  public ScheduleDocument load(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ScheduleConfigurationException("schedule file not found: " + path);
    }
    try (InputStream in = Files.newInputStream(path)) {
      final ScheduleDocument document = yamlMapper.readValue(in, ScheduleDocument.class);
      if (document == null) {
        throw new ScheduleConfigurationException("schedule file is empty: " + path);
      }
      logger.info(
          "schedule document loaded path={} eventTypes={} leaseTypes={}",
          path,
          document.events().keySet(),
          document.leases().keySet());
      return document;
    } catch (IOException ex) {
      throw new ScheduleConfigurationException("failed to read schedule file: " + path, ex);
    }
  }
}

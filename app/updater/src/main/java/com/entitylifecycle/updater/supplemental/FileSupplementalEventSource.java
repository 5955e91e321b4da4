/*
 * どこで: Updater のサイドチャネル
 * 何を: 運用者が編集するファイルから "<entity_type> <event_name> <rfc3339-expiry>" 行を読む
 * なぜ: Updater を再起動せずに一時的な日次イベントを指示できるようにするため
 */
package com.entitylifecycle.updater.supplemental;

import com.entitylifecycle.updater.model.SupplementalEvent;
import com.entitylifecycle.updater.service.UpdaterMetrics;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FileSupplementalEventSource implements SupplementalEventSource {

  private static final Logger logger = LoggerFactory.getLogger(FileSupplementalEventSource.class);
  private static final String COMMENT_PREFIX = "#";
  private static final int FIELD_COUNT = 3;

  private final Path path;
  private final UpdaterMetrics metrics;

  public FileSupplementalEventSource(Path path, UpdaterMetrics metrics) {
    this.path = path;
    this.metrics = metrics;
  }

  public Path path() {
    return path;
  }

  @Override
  public List<SupplementalEvent> read(Set<String> entityTypes, Instant now) {
    final List<String> lines;
    try {
      lines = readLines();
    } catch (NoSuchFileException ex) {
      logger.debug("supplemental event file absent path={}", path);
      return List.of();
    } catch (IOException ex) {
      throw new UncheckedIOException("failed to read supplemental event file " + path, ex);
    }

    final List<SupplementalEvent> events = new ArrayList<>();
    int lineNumber = 0;
    for (String rawLine : lines) {
      lineNumber++;
      final String line = rawLine.strip();
      if (line.isEmpty() || line.startsWith(COMMENT_PREFIX)) {
        continue;
      }
      final SupplementalEvent event = parseLine(line, lineNumber, entityTypes, now);
      if (event != null) {
        events.add(event);
      }
    }
    if (!events.isEmpty()) {
      logger.info("supplemental events loaded path={} count={}", path, events.size());
    }
    return events;
  }

  // 復号できないバイトは U+FFFD に置き換え、影響をその行だけに留める。
  private List<String> readLines() throws IOException {
    final CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPLACE)
            .onUnmappableCharacter(CodingErrorAction.REPLACE);
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(Files.newInputStream(path), decoder))) {
      return reader.lines().toList();
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    }
  }

  private SupplementalEvent parseLine(
      String line, int lineNumber, Set<String> entityTypes, Instant now) {
    final String[] fields = line.split("\\s+");
    if (fields.length != FIELD_COUNT) {
      return reject(lineNumber, line, "expected <entity_type> <event_name> <expiry>");
    }
    final String entityType = fields[0];
    if (!entityTypes.contains(entityType)) {
      return reject(lineNumber, line, "unknown entity type " + entityType);
    }
    final Instant expiresAt;
    try {
      expiresAt =
          OffsetDateTime.parse(fields[2], DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    } catch (DateTimeParseException ex) {
      return reject(lineNumber, line, "expiry is not an RFC 3339 timestamp");
    }
    if (!expiresAt.isAfter(now)) {
      return reject(lineNumber, line, "expiry already passed");
    }
    return new SupplementalEvent(entityType, fields[1], expiresAt);
  }

  private SupplementalEvent reject(int lineNumber, String line, String reason) {
    logger.error(
        "supplemental event line skipped path={} line={} reason={} content=\"{}\"",
        path,
        lineNumber,
        reason,
        line);
    metrics.recordSupplementalRejected();
    return null;
  }
}

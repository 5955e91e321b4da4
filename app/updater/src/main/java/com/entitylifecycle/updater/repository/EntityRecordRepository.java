/*
 * どこで: Updater のデータアクセス
 * 何を: 属性データストアから期限到来エンティティとそのリースを読む
 * なぜ: Updater は読み取りのみで、書き込みはすべてディスパッチ項目経由とするため
 */
package com.entitylifecycle.updater.repository;

import static com.entitylifecycle.common.JdbcTimestampUtils.toInstant;
import static com.entitylifecycle.common.JdbcTimestampUtils.toTimestamp;

import com.entitylifecycle.updater.model.EntityCandidate;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class EntityRecordRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 役割:
   * - 最終定期更新が {@code (after, before]} に入るエンティティを返す。
   *
   * 前提:
   * - 連続するサイクルは隣接したウィンドウを渡すため、最終定期更新が動かない限り
   *   エンティティはいずれか 1 つのウィンドウでだけ返る。
   */
  public List<EntityCandidate> fetchDue(String entityType, Instant before, Instant after) {
    final String sql =
        """
        SELECT entity_key, last_regular_update, ts_added
        FROM entities
        WHERE entity_type = :entityType
          AND last_regular_update > :after
          AND last_regular_update <= :before
        ORDER BY last_regular_update, entity_key
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("entityType", entityType)
            .addValue("before", toTimestamp(before))
            .addValue("after", toTimestamp(after));
    return jdbcTemplate.query(sql, params, this::mapCandidate);
  }

  public Map<String, Instant> getLeases(String entityType, String entityKey) {
    final String sql =
        """
        SELECT lease_name, created_at
        FROM entity_leases
        WHERE entity_type = :entityType
          AND entity_key = :entityKey
        ORDER BY lease_name
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("entityType", entityType)
            .addValue("entityKey", entityKey);
    final Map<String, Instant> leases = new LinkedHashMap<>();
    final RowCallbackHandler collector =
        rs -> leases.put(rs.getString("lease_name"), toInstant(rs.getTimestamp("created_at")));
    jdbcTemplate.query(sql, params, collector);
    return leases;
  }

  private EntityCandidate mapCandidate(ResultSet rs, int rowNum) throws SQLException {
    return new EntityCandidate(
        rs.getString("entity_key"),
        toInstant(rs.getTimestamp("last_regular_update")),
        toInstant(rs.getTimestamp("ts_added")));
  }
}

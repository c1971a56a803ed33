/*
 * どこで: Game データアクセス
 * 何を: players の登録/検索/集計更新を行う
 * なぜ: 永続化ワーカーとプレイヤー API で一貫した DB 操作を提供するため
 */
package com.kingtable.game.repository;

import static com.kingtable.common.JdbcTimestampUtils.toTimestamp;

import com.kingtable.game.model.PlayerRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "persistence.enabled", havingValue = "true")
@RequiredArgsConstructor
public class PlayerRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int[] upsertSeen(Collection<String> names, Instant seenAt) {
    // 既存名は last_seen のみ更新し、集計値には触れない
    final String sql =
        """
        INSERT INTO players (name, last_seen)
        VALUES (:name, :lastSeen)
        ON CONFLICT (name)
        DO UPDATE SET last_seen = EXCLUDED.last_seen
        """;
    final SqlParameterSource[] batch =
        names.stream()
            .map(
                name ->
                    new MapSqlParameterSource()
                        .addValue("name", name)
                        .addValue("lastSeen", toTimestamp(seenAt)))
            .toArray(SqlParameterSource[]::new);
    return jdbcTemplate.batchUpdate(sql, batch);
  }

  public Map<String, Long> findIdsByNames(Collection<String> names) {
    final Map<String, Long> ids = new HashMap<>();
    if (names.isEmpty()) {
      return ids;
    }
    final String sql = "SELECT id, name FROM players WHERE name IN (:names)";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("names", names);
    final List<Map.Entry<String, Long>> rows =
        jdbcTemplate.query(
            sql, params, (rs, rowNum) -> Map.entry(rs.getString("name"), rs.getLong("id")));
    rows.forEach(row -> ids.put(row.getKey(), row.getValue()));
    return ids;
  }

  public List<PlayerRecord> search(String query, int limit) {
    final String sql =
        """
        SELECT id, name, wins, survives, full_rotations
        FROM players
        WHERE name LIKE :pattern
        ORDER BY wins DESC, survives DESC, name ASC
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("pattern", "%" + query + "%")
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int incrementWins(Collection<Long> playerIds) {
    return increment("wins", playerIds);
  }

  public int incrementSurvives(Collection<Long> playerIds) {
    return increment("survives", playerIds);
  }

  public int incrementFullRotations(Collection<Long> playerIds) {
    return increment("full_rotations", playerIds);
  }

  private int increment(String column, Collection<Long> playerIds) {
    if (playerIds.isEmpty()) {
      return 0;
    }
    // column は本クラス内の固定値のみを渡す
    final String sql =
        "UPDATE players SET " + column + " = " + column + " + 1 WHERE id IN (:ids)";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("ids", playerIds));
  }

  private PlayerRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new PlayerRecord(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getLong("wins"),
        rs.getLong("survives"),
        rs.getLong("full_rotations"));
  }
}

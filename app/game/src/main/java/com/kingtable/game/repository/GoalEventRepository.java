/*
 * どこで: Game データアクセス
 * 何を: games / goal_events の登録を行う
 * なぜ: 得点ごとの交代結果を監査・集計用に残すため
 */
package com.kingtable.game.repository;

import static com.kingtable.common.JdbcTimestampUtils.toTimestamp;

import com.google.common.annotations.VisibleForTesting;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@ConditionalOnProperty(name = "persistence.enabled", havingValue = "true")
@RequiredArgsConstructor
public class GoalEventRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int ensureGame(String gameId, Instant createdAt) {
    final String sql =
        """
        INSERT INTO games (id, created_at)
        VALUES (:id, :createdAt)
        ON CONFLICT (id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", gameId)
            .addValue("createdAt", toTimestamp(createdAt));
    return jdbcTemplate.update(sql, params);
  }

  /** 空枠だったロールは null を渡す。 */
  public int insert(GoalEventRow row) {
    final String sql =
        """
        INSERT INTO goal_events (
          game_id,
          scoring_team,
          red_forward_id,
          red_goalkeeper_id,
          blue_forward_id,
          blue_goalkeeper_id,
          benched_player_id,
          moved_to_goalkeeper_id,
          new_forward_id,
          full_rotation,
          created_at
        ) VALUES (
          :gameId,
          :scoringTeam,
          :redForwardId,
          :redGoalkeeperId,
          :blueForwardId,
          :blueGoalkeeperId,
          :benchedId,
          :movedToGoalkeeperId,
          :newForwardId,
          :fullRotation,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("gameId", row.gameId())
            .addValue("scoringTeam", row.scoringTeam())
            .addValue("redForwardId", row.redForwardId())
            .addValue("redGoalkeeperId", row.redGoalkeeperId())
            .addValue("blueForwardId", row.blueForwardId())
            .addValue("blueGoalkeeperId", row.blueGoalkeeperId())
            .addValue("benchedId", row.benchedId())
            .addValue("movedToGoalkeeperId", row.movedToGoalkeeperId())
            .addValue("newForwardId", row.newForwardId())
            .addValue("fullRotation", row.fullRotation())
            .addValue("createdAt", toTimestamp(row.createdAt()));
    return jdbcTemplate.update(sql, params);
  }

  @VisibleForTesting
  public int countByGameId(String gameId) {
    final String sql = "SELECT COUNT(*) FROM goal_events WHERE game_id = :gameId";
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource().addValue("gameId", gameId), Integer.class);
    return count == null ? 0 : count;
  }

  public record GoalEventRow(
      String gameId,
      String scoringTeam,
      Long redForwardId,
      Long redGoalkeeperId,
      Long blueForwardId,
      Long blueGoalkeeperId,
      Long benchedId,
      Long movedToGoalkeeperId,
      Long newForwardId,
      boolean fullRotation,
      Instant createdAt) {}
}

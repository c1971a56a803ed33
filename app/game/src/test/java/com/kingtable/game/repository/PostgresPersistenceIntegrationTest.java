package com.kingtable.game.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.kingtable.game.model.GameSnapshot;
import com.kingtable.game.model.GoalEventRecord;
import com.kingtable.game.model.PlayerRecord;
import com.kingtable.game.model.RotationSummary;
import com.kingtable.game.model.Score;
import com.kingtable.game.model.Team;
import com.kingtable.game.model.TeamSlot;
import com.kingtable.game.persistence.PersistenceStore;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@ActiveProfiles("postgres")
@Testcontainers(disabledWithoutDocker = true)
class PostgresPersistenceIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

  @DynamicPropertySource
  static void registerProperties(DynamicPropertyRegistry registry) {
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("spring.flyway.enabled", () -> "true");
    registry.add("spring.flyway.locations", () -> "classpath:db/migration");
  }

  @Autowired private PersistenceStore persistenceStore;
  @Autowired private PlayerRepository playerRepository;
  @Autowired private GoalEventRepository goalEventRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM goal_events", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM games", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM players", new MapSqlParameterSource());
  }

  @Test
  void ensurePlayersIsIdempotent() {
    final Map<String, Long> first = persistenceStore.ensurePlayers(List.of("alice", " bob "));
    final Map<String, Long> second = persistenceStore.ensurePlayers(List.of("bob", "alice"));

    assertThat(first).containsOnlyKeys("alice", "bob");
    assertThat(second).isEqualTo(first);
  }

  @Test
  void recordGoalUpdatesCountersAndLeaderboardOrder() {
    final GameSnapshot preRotation =
        new GameSnapshot(
            new TeamSlot("p1", "p2"),
            new TeamSlot("p3", "p4"),
            List.of("p5", "p6"),
            Score.ZERO,
            true,
            null);
    final GoalEventRecord event =
        new GoalEventRecord(
            "game-1",
            Team.RED,
            preRotation,
            new RotationSummary("p4", "p3", "p5"),
            true,
            Instant.parse("2026-03-01T10:00:00Z"));

    persistenceStore.recordGoal(event);

    assertThat(goalEventRepository.countByGameId("game-1")).isEqualTo(1);
    final List<PlayerRecord> board = playerRepository.search("", 50);
    assertThat(board).extracting(PlayerRecord::name).startsWith("p1", "p2", "p3");
    final PlayerRecord p1 = board.get(0);
    assertThat(p1.wins()).isEqualTo(1);
    assertThat(p1.survives()).isEqualTo(1);
    assertThat(p1.fullRotations()).isEqualTo(1);
    final PlayerRecord p3 = board.get(2);
    assertThat(p3.wins()).isZero();
    assertThat(p3.survives()).isEqualTo(1);
    assertThat(playerRepository.search("p", 2)).hasSize(2);
  }
}

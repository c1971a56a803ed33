package com.kingtable.game.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.kingtable.game.config.PersistenceProperties;
import com.kingtable.game.model.GameSnapshot;
import com.kingtable.game.model.GoalEventRecord;
import com.kingtable.game.model.RotationSummary;
import com.kingtable.game.model.Score;
import com.kingtable.game.model.Team;
import com.kingtable.game.model.TeamSlot;
import com.kingtable.game.repository.GoalEventRepository;
import com.kingtable.game.repository.GoalEventRepository.GoalEventRow;
import com.kingtable.game.repository.PlayerRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

class JdbcPersistenceStoreTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

  private PlayerRepository playerRepository;
  private GoalEventRepository goalEventRepository;
  private JdbcPersistenceStore store;

  @BeforeEach
  void setUp() {
    playerRepository = mock(PlayerRepository.class);
    goalEventRepository = mock(GoalEventRepository.class);
    final PlatformTransactionManager transactionManager = mock(PlatformTransactionManager.class);
    when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
    final PersistenceProperties properties =
        new PersistenceProperties(
            true,
            Duration.ofSeconds(1),
            Duration.ofMinutes(1),
            2.0,
            1.0,
            1.0,
            Duration.ofSeconds(10));
    store =
        new JdbcPersistenceStore(
            playerRepository,
            goalEventRepository,
            transactionManager,
            properties,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void ensurePlayersNormalizesNamesBeforeUpsert() {
    when(playerRepository.findIdsByNames(anyCollection())).thenReturn(Map.of("a", 1L, "b", 2L));

    final Map<String, Long> ids = store.ensurePlayers(List.of("  a ", "a", " ", "b"));

    assertThat(ids).containsOnly(Map.entry("a", 1L), Map.entry("b", 2L));
    verify(playerRepository).upsertSeen(eq(Set.of("a", "b")), eq(NOW));
  }

  @Test
  void ensurePlayersSkipsStoreWhenNoNamesRemain() {
    assertThat(store.ensurePlayers(List.of(" ", ""))).isEmpty();

    verify(playerRepository, never()).upsertSeen(anyCollection(), any());
  }

  @Test
  void ensurePlayersFailsWhenIdCannotBeResolved() {
    when(playerRepository.findIdsByNames(anyCollection())).thenReturn(Map.of("a", 1L));

    assertThatThrownBy(() -> store.ensurePlayers(List.of("a", "b")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("b");
  }

  @Test
  void recordGoalInsertsPreRotationRolesAndUpdatesCounters() {
    when(playerRepository.findIdsByNames(anyCollection()))
        .thenReturn(Map.of("p1", 1L, "p2", 2L, "p3", 3L, "p4", 4L, "p5", 5L));
    final GoalEventRecord event =
        goal(new TeamSlot("p3", "p4"), new RotationSummary("p4", "p3", "p5"), true);

    store.recordGoal(event);

    verify(goalEventRepository).ensureGame("game-1", NOW);
    final ArgumentCaptor<GoalEventRow> row = ArgumentCaptor.forClass(GoalEventRow.class);
    verify(goalEventRepository).insert(row.capture());
    assertThat(row.getValue())
        .isEqualTo(new GoalEventRow("game-1", "red", 1L, 2L, 3L, 4L, 4L, 3L, 5L, true, NOW));
    verify(playerRepository).incrementWins(List.of(1L, 2L));
    verify(playerRepository).incrementSurvives(Set.of(1L, 2L, 3L));
    verify(playerRepository).incrementFullRotations(List.of(1L, 2L));
  }

  @Test
  void recordGoalStoresNullForEmptySlots() {
    when(playerRepository.findIdsByNames(anyCollection()))
        .thenReturn(Map.of("p1", 1L, "p2", 2L, "p3", 3L, "p5", 5L));
    final GoalEventRecord event =
        goal(
            new TeamSlot("p3", TeamSlot.EMPTY),
            new RotationSummary(TeamSlot.EMPTY, "p3", "p5"),
            false);

    store.recordGoal(event);

    final ArgumentCaptor<GoalEventRow> row = ArgumentCaptor.forClass(GoalEventRow.class);
    verify(goalEventRepository).insert(row.capture());
    assertThat(row.getValue().blueGoalkeeperId()).isNull();
    assertThat(row.getValue().benchedId()).isNull();
    assertThat(row.getValue().movedToGoalkeeperId()).isEqualTo(3L);
    verify(playerRepository).upsertSeen(eq(Set.of("p1", "p2", "p3", "p5")), eq(NOW));
    verify(playerRepository, never()).incrementFullRotations(anyCollection());
  }

  private static GoalEventRecord goal(
      TeamSlot bluePreRotation, RotationSummary rotation, boolean fullRotation) {
    final GameSnapshot preRotation =
        new GameSnapshot(
            new TeamSlot("p1", "p2"), bluePreRotation, List.of("p5"), Score.ZERO, true, null);
    return new GoalEventRecord("game-1", Team.RED, preRotation, rotation, fullRotation, NOW);
  }
}

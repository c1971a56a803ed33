/*
 * どこで: Game 永続化層
 * 何を: PersistenceStore の PostgreSQL 実装
 * なぜ: プレイヤー登録と得点記録をトランザクション単位で外部ストアへ書き込むため
 */
package com.kingtable.game.persistence;

import com.kingtable.game.config.PersistenceProperties;
import com.kingtable.game.model.GoalEventRecord;
import com.kingtable.game.model.TeamSlot;
import com.kingtable.game.repository.GoalEventRepository;
import com.kingtable.game.repository.GoalEventRepository.GoalEventRow;
import com.kingtable.game.repository.PlayerRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Component
@ConditionalOnProperty(name = "persistence.enabled", havingValue = "true")
public class JdbcPersistenceStore implements PersistenceStore {

  private final PlayerRepository playerRepository;
  private final GoalEventRepository goalEventRepository;
  private final TransactionTemplate transactionTemplate;
  private final Clock clock;

  public JdbcPersistenceStore(
      PlayerRepository playerRepository,
      GoalEventRepository goalEventRepository,
      PlatformTransactionManager transactionManager,
      PersistenceProperties properties,
      Clock clock) {
    this.playerRepository = playerRepository;
    this.goalEventRepository = goalEventRepository;
    this.clock = clock;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
    // 1 回の試行の上限。超過した文はドライバ側で打ち切られ、ワーカーが再試行する
    final long timeoutSeconds = Math.max(1L, properties.attemptTimeout().toSeconds());
    this.transactionTemplate.setTimeout((int) Math.min(Integer.MAX_VALUE, timeoutSeconds));
  }

  @Override
  public Map<String, Long> ensurePlayers(Collection<String> names) {
    final Set<String> unique = normalize(names);
    if (unique.isEmpty()) {
      return Map.of();
    }
    return transactionTemplate.execute(status -> ensurePlayersInTransaction(unique));
  }

  @Override
  public void recordGoal(GoalEventRecord event) {
    transactionTemplate.executeWithoutResult(status -> recordGoalInTransaction(event));
  }

  private Map<String, Long> ensurePlayersInTransaction(Set<String> names) {
    playerRepository.upsertSeen(names, Instant.now(clock));
    final Map<String, Long> ids = playerRepository.findIdsByNames(names);
    for (String name : names) {
      if (!ids.containsKey(name)) {
        throw new IllegalStateException("player not found after ensure: " + name);
      }
    }
    return ids;
  }

  private void recordGoalInTransaction(GoalEventRecord event) {
    goalEventRepository.ensureGame(event.gameId(), event.occurredAt());
    final Set<String> involved = normalize(event.involvedPlayers());
    final Map<String, Long> ids =
        involved.isEmpty() ? Map.of() : ensurePlayersInTransaction(involved);

    final TeamSlot red = event.preRotation().red();
    final TeamSlot blue = event.preRotation().blue();
    goalEventRepository.insert(
        new GoalEventRow(
            event.gameId(),
            event.scoringTeam().value(),
            idOf(ids, red.forward()),
            idOf(ids, red.goalkeeper()),
            idOf(ids, blue.forward()),
            idOf(ids, blue.goalkeeper()),
            idOf(ids, event.rotation().benched()),
            idOf(ids, event.rotation().movedToGoalkeeper()),
            idOf(ids, event.rotation().newForward()),
            event.fullRotation(),
            event.occurredAt()));

    // wins: 得点側の 2 人。survives: 得点側 + GK へ下がって卓に残った失点側 FW
    final TeamSlot scoringPair = event.scoringPair();
    final List<Long> winners =
        idsOf(ids, List.of(scoringPair.forward(), scoringPair.goalkeeper()));
    final Set<Long> survivors = new LinkedHashSet<>(winners);
    final Long survivingLoser = idOf(ids, event.losingPairBeforeRotation().forward());
    if (survivingLoser != null) {
      survivors.add(survivingLoser);
    }
    playerRepository.incrementWins(winners);
    playerRepository.incrementSurvives(survivors);
    if (event.fullRotation()) {
      playerRepository.incrementFullRotations(winners);
    }
  }

  private Set<String> normalize(Collection<String> names) {
    final Set<String> unique = new LinkedHashSet<>();
    for (String name : names) {
      if (name == null || name.isBlank()) {
        continue;
      }
      unique.add(name.trim());
    }
    return unique;
  }

  private Long idOf(Map<String, Long> ids, String name) {
    if (name == null || name.isBlank()) {
      return null;
    }
    return ids.get(name.trim());
  }

  private List<Long> idsOf(Map<String, Long> ids, List<String> names) {
    final List<Long> out = new ArrayList<>();
    for (String name : names) {
      final Long id = idOf(ids, name);
      if (id != null && !out.contains(id)) {
        out.add(id);
      }
    }
    return List.copyOf(out);
  }
}

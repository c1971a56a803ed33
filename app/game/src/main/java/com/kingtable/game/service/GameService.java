/*
 * どこで: Game サービス層
 * 何を: GameStore のロック内でルールを適用し、ロック解放後に永続化を投入する
 * なぜ: ゲーム操作の応答を外部ストアの遅延から切り離しつつ、記録に必要な状態をロック内で確定させるため
 */
package com.kingtable.game.service;

import com.kingtable.common.TraceIds;
import com.kingtable.game.config.GameProperties;
import com.kingtable.game.engine.RotationEngine;
import com.kingtable.game.model.CreatedGame;
import com.kingtable.game.model.GameState;
import com.kingtable.game.model.GameSummary;
import com.kingtable.game.model.GameView;
import com.kingtable.game.model.GoalEventRecord;
import com.kingtable.game.model.GoalOutcome;
import com.kingtable.game.model.GoalResult;
import com.kingtable.game.model.TeamSlot;
import com.kingtable.game.persistence.EnsurePlayersOperation;
import com.kingtable.game.persistence.PersistenceQueue;
import com.kingtable.game.persistence.RecordGoalOperation;
import com.kingtable.game.store.GameStore;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
public class GameService {

  private static final Logger logger = LoggerFactory.getLogger(GameService.class);
  private static final String MDC_TRACE_KEY = "request_id";

  private final GameStore gameStore;
  private final RotationEngine rotationEngine;
  private final PersistenceQueue persistenceQueue;
  private final GameMetrics metrics;
  private final GameProperties properties;
  private final Clock clock;

  public GameService(
      GameStore gameStore,
      RotationEngine rotationEngine,
      PersistenceQueue persistenceQueue,
      GameMetrics metrics,
      GameProperties properties,
      Clock clock) {
    this.gameStore = gameStore;
    this.rotationEngine = rotationEngine;
    this.persistenceQueue = persistenceQueue;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * 役割: 新しいゲームを開始する。
   * 動作: 入力を検証してゲームを登録し、ロック解放後に全参加者のプレイヤー登録を投入する。
   * 前提: 検証エラー時は何も登録せず、何も投入しない。
   */
  public CreatedGame createGame(TeamSlot red, TeamSlot blue, List<String> waiting) {
    final CreatedGame created =
        command(
            "start",
            () -> {
              final GameState state =
                  rotationEngine.newGame(red, blue, waiting, properties.initialQueueCapacity());
              return gameStore.create(state, (id, game) -> new CreatedGame(id, game.toView()));
            });
    final GameView view = created.state();
    final List<String> names = new ArrayList<>();
    names.add(view.red().forward());
    names.add(view.red().goalkeeper());
    names.add(view.blue().forward());
    names.add(view.blue().goalkeeper());
    names.addAll(view.waiting());
    persistenceQueue.submit(new EnsurePlayersOperation(names, currentTraceId()));
    logger.info("game started gameId={} waiting={}", created.id(), view.waiting().size());
    return created;
  }

  public GameView getGame(String gameId) {
    return gameStore.read(gameId, GameState::toView);
  }

  public List<GameSummary> listGames() {
    return gameStore.list();
  }

  public GameView enqueuePlayer(String gameId, String playerId) {
    final PlayerChange queued =
        command(
            "queue",
            () ->
                gameStore.mutate(
                    gameId,
                    game -> {
                      final String added = rotationEngine.enqueue(game, playerId);
                      return new PlayerChange(added, game.toView());
                    }));
    persistenceQueue.submit(
        new EnsurePlayersOperation(List.of(queued.playerId()), currentTraceId()));
    logger.info("player queued gameId={} playerId={}", gameId, queued.playerId());
    return queued.view();
  }

  /**
   * 役割: 得点を記録して失点チームを交代させる。
   * 動作: 排他ロック内で交代と交代前状態の取得を行い、ロック解放後に得点イベントを投入する。
   * 前提: 拒否された得点は記録も投入もしない。
   */
  public GoalOutcome applyGoal(String gameId, String team) {
    final Scored scored =
        command(
            "goal",
            () ->
                gameStore.mutate(
                    gameId,
                    game -> new Scored(rotationEngine.applyGoal(game, team), game.toView())));
    final GoalResult goal = scored.result();
    final GameView view = scored.view();
    if (goal.completedFullRotation()) {
      metrics.recordFullRotation();
      logger.info(
          "full rotation completed gameId={} team={} players={}",
          gameId,
          goal.scoringTeam().value(),
          goal.fullRotation().players());
    }
    final GoalEventRecord event =
        new GoalEventRecord(
            gameId,
            goal.scoringTeam(),
            goal.preRotation(),
            goal.rotation(),
            goal.completedFullRotation(),
            Instant.now(clock));
    persistenceQueue.submit(new RecordGoalOperation(event, currentTraceId()));
    logger.info(
        "goal recorded gameId={} team={} score={}:{}",
        gameId,
        goal.scoringTeam().value(),
        view.score().red(),
        view.score().blue());
    return new GoalOutcome(view, goal.rotation(), goal.fullRotation());
  }

  public GameView removePlayer(String gameId, String playerId) {
    final PlayerChange removed =
        command(
            "remove",
            () ->
                gameStore.mutate(
                    gameId,
                    game -> {
                      final String target = rotationEngine.removePlayer(game, playerId);
                      return new PlayerChange(target, game.toView());
                    }));
    logger.info("player removed gameId={} playerId={}", gameId, removed.playerId());
    return removed.view();
  }

  public GameView undo(String gameId) {
    final GameView view =
        command(
            "undo",
            () ->
                gameStore.mutate(
                    gameId,
                    game -> {
                      rotationEngine.undo(game);
                      return game.toView();
                    }));
    logger.info("action undone gameId={}", gameId);
    return view;
  }

  private <T> T command(String action, Supplier<T> body) {
    final T result;
    try {
      result = body.get();
    } catch (RuntimeException ex) {
      metrics.recordCommand(action, "rejected");
      throw ex;
    }
    metrics.recordCommand(action, "ok");
    return result;
  }

  private String currentTraceId() {
    return TraceIds.orNew(MDC.get(MDC_TRACE_KEY));
  }

  // ロック内で確定した値をロック外へ運ぶ
  private record PlayerChange(String playerId, GameView view) {}

  private record Scored(GoalResult result, GameView view) {}
}

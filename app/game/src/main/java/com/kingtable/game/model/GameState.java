/*
 * どこで: Game ドメインモデル
 * 何を: 1 ゲーム分の可変状態（4 枠・待機列・スコア・undo 履歴）を保持する
 * なぜ: GameStore のロック内でのみ変更される単一の事実源とするため
 */
package com.kingtable.game.model;

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * 1 ゲームの状態。
 *
 * <p>スレッドセーフではない。GameStore の外へ参照を出さず、応答には {@link #toView()} を使う。
 */
public final class GameState {

  private final int minQueueCapacity;
  private final Deque<GameSnapshot> history = new ArrayDeque<>();

  private TeamSlot red;
  private TeamSlot blue;
  private WaitingQueue waiting;
  private Score score;
  private boolean started;
  private StreakState streak;

  public GameState(TeamSlot red, TeamSlot blue, List<String> waiting, int minQueueCapacity) {
    this.minQueueCapacity = Math.max(1, minQueueCapacity);
    this.red = red;
    this.blue = blue;
    this.waiting = WaitingQueue.of(waiting, this.minQueueCapacity);
    this.score = Score.ZERO;
    this.started = true;
  }

  public TeamSlot slot(Team team) {
    return team == Team.RED ? red : blue;
  }

  public void setSlot(Team team, TeamSlot slot) {
    if (team == Team.RED) {
      red = slot;
    } else {
      blue = slot;
    }
  }

  public WaitingQueue waiting() {
    return waiting;
  }

  public Score score() {
    return score;
  }

  public void recordGoal(Team team) {
    score = score.increment(team);
  }

  public boolean started() {
    return started;
  }

  @VisibleForTesting
  public void setStarted(boolean started) {
    this.started = started;
  }

  public StreakState streak() {
    return streak;
  }

  public void setStreak(StreakState streak) {
    this.streak = streak;
  }

  public boolean containsPlayer(String playerId) {
    return red.contains(playerId) || blue.contains(playerId) || waiting.contains(playerId);
  }

  public GameSnapshot snapshot() {
    return new GameSnapshot(red, blue, waiting.snapshot(), score, started, streak);
  }

  /** 変更前のスナップショットを履歴末尾へ積む。変更操作の先頭で同じロック内から呼ぶこと。 */
  public GameSnapshot pushHistory() {
    final GameSnapshot snapshot = snapshot();
    history.addLast(snapshot);
    return snapshot;
  }

  public Optional<GameSnapshot> popHistory() {
    return Optional.ofNullable(history.pollLast());
  }

  @VisibleForTesting
  public int historySize() {
    return history.size();
  }

  public void restore(GameSnapshot snapshot) {
    red = snapshot.red();
    blue = snapshot.blue();
    waiting = WaitingQueue.of(snapshot.waiting(), minQueueCapacity);
    score = snapshot.score();
    started = snapshot.started();
    streak = snapshot.streak();
  }

  public GameView toView() {
    return new GameView(red, blue, waiting.snapshot(), score, started);
  }

  public GameSummary toSummary(String gameId) {
    return new GameSummary(gameId, started, score);
  }
}

/*
 * どこで: Game ドメインモデル
 * 何を: 変更前のゲーム状態の不変コピー
 * なぜ: undo で全フィールドを元に戻すため
 */
package com.kingtable.game.model;

import java.util.List;

/** streak は null 可（連続得点が始まっていない状態）。 */
public record GameSnapshot(
    TeamSlot red,
    TeamSlot blue,
    List<String> waiting,
    Score score,
    boolean started,
    StreakState streak) {

  public GameSnapshot {
    waiting = List.copyOf(waiting);
  }

  public TeamSlot slot(Team team) {
    return team == Team.RED ? red : blue;
  }
}

/*
 * どこで: Game ドメインモデル
 * 何を: RotationEngine#applyGoal の結果をまとめる
 * なぜ: 交代結果と永続化に必要な交代前状態をロック内で一度に取り出すため
 */
package com.kingtable.game.model;

/** fullRotation は該当しない得点では null。 */
public record GoalResult(
    Team scoringTeam,
    RotationSummary rotation,
    FullRotationEvent fullRotation,
    GameSnapshot preRotation) {

  public boolean completedFullRotation() {
    return fullRotation != null;
  }
}

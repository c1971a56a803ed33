/*
 * どこで: Game ドメインモデル
 * 何を: 連続得点中のチーム/ペアと、連続開始時の相手ペアを保持する
 * なぜ: 相手ペアが一巡して元の組み合わせに戻ったこと（フルローテーション）を検出するため
 */
package com.kingtable.game.model;

public record StreakState(Team team, TeamSlot winningPair, TeamSlot opponentBaseline) {

  public boolean heldBy(Team scoringTeam, TeamSlot scoringPair) {
    return team == scoringTeam && winningPair.samePairAs(scoringPair);
  }
}

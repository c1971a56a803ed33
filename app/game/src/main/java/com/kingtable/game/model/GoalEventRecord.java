/*
 * どこで: Game ドメインモデル
 * 何を: 永続化キューへ渡す得点イベント
 * なぜ: 交代前のロールを明示的に運び、保存側で交代結果から逆算しないため
 */
package com.kingtable.game.model;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record GoalEventRecord(
    String gameId,
    Team scoringTeam,
    GameSnapshot preRotation,
    RotationSummary rotation,
    boolean fullRotation,
    Instant occurredAt) {

  /** 交代前の 4 枠と交代結果に現れる全プレイヤー名（重複なし、出現順）。 */
  public List<String> involvedPlayers() {
    final Set<String> names = new LinkedHashSet<>();
    names.add(preRotation.red().forward());
    names.add(preRotation.red().goalkeeper());
    names.add(preRotation.blue().forward());
    names.add(preRotation.blue().goalkeeper());
    names.add(rotation.benched());
    names.add(rotation.movedToGoalkeeper());
    names.add(rotation.newForward());
    return List.copyOf(names);
  }

  public TeamSlot scoringPair() {
    return preRotation.slot(scoringTeam);
  }

  public TeamSlot losingPairBeforeRotation() {
    return preRotation.slot(scoringTeam.opponent());
  }
}

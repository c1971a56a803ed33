/*
 * どこで: Game ドメインモデル
 * 何を: ロック外へ返すゲーム状態の読み取り専用ビュー
 * なぜ: GameState をロック外で参照させないため
 */
package com.kingtable.game.model;

import java.util.List;

public record GameView(
    TeamSlot red, TeamSlot blue, List<String> waiting, Score score, boolean started) {

  public GameView {
    waiting = List.copyOf(waiting);
  }
}

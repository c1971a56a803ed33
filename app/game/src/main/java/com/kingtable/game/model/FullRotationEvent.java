package com.kingtable.game.model;

import java.util.List;

/** 勝ち続けているペアが、連続開始時と同じ相手ペアに戻ったことを表す。 */
public record FullRotationEvent(Team team, List<String> players) {

  public FullRotationEvent {
    players = List.copyOf(players);
  }
}

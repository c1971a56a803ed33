/*
 * どこで: Game ドメインモデル
 * 何を: 1 チーム分の forward / goalkeeper 枠を表現する
 * なぜ: 交代やスナップショットで値として受け渡すため
 */
package com.kingtable.game.model;

import java.util.Objects;

public record TeamSlot(String forward, String goalkeeper) {

  public static final String EMPTY = "";

  public TeamSlot {
    forward = forward == null ? EMPTY : forward;
    goalkeeper = goalkeeper == null ? EMPTY : goalkeeper;
  }

  public boolean contains(String playerId) {
    return forward.equals(playerId) || goalkeeper.equals(playerId);
  }

  public TeamSlot withForward(String playerId) {
    return new TeamSlot(playerId, goalkeeper);
  }

  public TeamSlot withGoalkeeper(String playerId) {
    return new TeamSlot(forward, playerId);
  }

  /** ポジションを問わず同じ 2 人の組か判定する。 */
  public boolean samePairAs(TeamSlot other) {
    if (other == null) {
      return false;
    }
    return (Objects.equals(forward, other.forward) && Objects.equals(goalkeeper, other.goalkeeper))
        || (Objects.equals(forward, other.goalkeeper) && Objects.equals(goalkeeper, other.forward));
  }
}

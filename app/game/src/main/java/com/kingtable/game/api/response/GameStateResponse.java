/*
 * どこで: Game API レスポンス DTO
 * 何を: ゲーム状態の応答を定義する
 * なぜ: 参照/変更/得点の各 API で同じ構造を返し、得点時のみ交代情報を付けるため
 */
package com.kingtable.game.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.kingtable.game.model.GameView;
import com.kingtable.game.model.GoalOutcome;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GameStateResponse(
    SlotPayload red,
    SlotPayload blue,
    List<String> waiting,
    ScorePayload score,
    boolean started,
    RotationPayload rotation,
    FullRotationPayload fullRotation) {

  public GameStateResponse {
    waiting = List.copyOf(waiting);
  }

  public static GameStateResponse from(GameView view) {
    return new GameStateResponse(
        SlotPayload.from(view.red()),
        SlotPayload.from(view.blue()),
        view.waiting(),
        ScorePayload.from(view.score()),
        view.started(),
        null,
        null);
  }

  public static GameStateResponse from(GoalOutcome outcome) {
    final GameView view = outcome.state();
    return new GameStateResponse(
        SlotPayload.from(view.red()),
        SlotPayload.from(view.blue()),
        view.waiting(),
        ScorePayload.from(view.score()),
        view.started(),
        RotationPayload.from(outcome.rotation()),
        outcome.fullRotation() == null ? null : FullRotationPayload.from(outcome.fullRotation()));
  }
}

package com.kingtable.game.api.response;

import com.kingtable.game.model.GameSummary;

public record GameSummaryResponse(String id, boolean started, ScorePayload score) {

  public static GameSummaryResponse from(GameSummary summary) {
    return new GameSummaryResponse(
        summary.id(), summary.started(), ScorePayload.from(summary.score()));
  }
}

package com.kingtable.game.api.response;

import com.kingtable.game.model.Score;

public record ScorePayload(int red, int blue) {

  public static ScorePayload from(Score score) {
    return new ScorePayload(score.red(), score.blue());
  }
}

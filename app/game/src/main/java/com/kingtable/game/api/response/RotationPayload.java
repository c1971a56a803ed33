package com.kingtable.game.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.kingtable.game.model.RotationSummary;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RotationPayload(String benched, String movedToGoalkeeper, String newForward) {

  public static RotationPayload from(RotationSummary rotation) {
    return new RotationPayload(
        rotation.benched(), rotation.movedToGoalkeeper(), rotation.newForward());
  }
}

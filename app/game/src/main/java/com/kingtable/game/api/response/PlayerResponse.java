package com.kingtable.game.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.kingtable.game.model.PlayerRecord;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlayerResponse(long id, String name, long wins, long survives, long fullRotations) {

  public static PlayerResponse from(PlayerRecord record) {
    return new PlayerResponse(
        record.id(), record.name(), record.wins(), record.survives(), record.fullRotations());
  }
}

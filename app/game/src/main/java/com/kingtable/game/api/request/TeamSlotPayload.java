package com.kingtable.game.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.kingtable.game.model.TeamSlot;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TeamSlotPayload(String forward, String goalkeeper) {

  public TeamSlot toSlot() {
    return new TeamSlot(forward, goalkeeper);
  }
}

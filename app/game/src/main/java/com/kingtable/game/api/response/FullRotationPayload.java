package com.kingtable.game.api.response;

import com.kingtable.game.model.FullRotationEvent;
import java.util.List;

public record FullRotationPayload(String team, List<String> players) {

  public FullRotationPayload {
    players = List.copyOf(players);
  }

  public static FullRotationPayload from(FullRotationEvent event) {
    return new FullRotationPayload(event.team().value(), event.players());
  }
}

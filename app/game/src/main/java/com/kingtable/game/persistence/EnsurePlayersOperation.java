package com.kingtable.game.persistence;

import java.util.List;

public record EnsurePlayersOperation(List<String> names, String traceId)
    implements PersistenceOperation {

  public static final String KIND = "ensure_players";

  public EnsurePlayersOperation {
    names = List.copyOf(names);
  }

  @Override
  public String kind() {
    return KIND;
  }

  @Override
  public void execute(PersistenceStore store) {
    store.ensurePlayers(names);
  }
}

package com.kingtable.game.api;

public class DuplicatePlayerException extends RuntimeException {
  public DuplicatePlayerException(String playerId) {
    super("duplicate player_id: " + playerId);
  }
}

package com.kingtable.game.api;

public class PlayerNotFoundException extends RuntimeException {
  public PlayerNotFoundException(String playerId) {
    super("player not found in game: " + playerId);
  }
}

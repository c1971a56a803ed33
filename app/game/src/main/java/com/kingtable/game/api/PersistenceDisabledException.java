package com.kingtable.game.api;

public class PersistenceDisabledException extends RuntimeException {
  public PersistenceDisabledException() {
    super("database not configured");
  }
}

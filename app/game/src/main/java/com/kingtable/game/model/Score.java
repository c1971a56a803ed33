package com.kingtable.game.model;

public record Score(int red, int blue) {

  public static final Score ZERO = new Score(0, 0);

  public Score increment(Team team) {
    return team == Team.RED ? new Score(red + 1, blue) : new Score(red, blue + 1);
  }

  public int of(Team team) {
    return team == Team.RED ? red : blue;
  }
}

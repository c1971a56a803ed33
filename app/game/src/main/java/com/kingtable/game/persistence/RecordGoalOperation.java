package com.kingtable.game.persistence;

import com.kingtable.game.model.GoalEventRecord;

public record RecordGoalOperation(GoalEventRecord event, String traceId)
    implements PersistenceOperation {

  public static final String KIND = "record_goal";

  @Override
  public String kind() {
    return KIND;
  }

  @Override
  public void execute(PersistenceStore store) {
    store.recordGoal(event);
  }
}

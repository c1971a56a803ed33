package com.kingtable.game.model;

/** 得点適用後の状態と交代結果。fullRotation は null 可。 */
public record GoalOutcome(
    GameView state, RotationSummary rotation, FullRotationEvent fullRotation) {}

/*
 * どこで: Game ドメインモデル
 * 何を: 1 回の得点で失点チームに起きた交代を表現する
 * なぜ: API 応答と goal_events 記録で同じ結果を共有するため
 */
package com.kingtable.game.model;

/**
 * 失点チームの交代結果。
 *
 * <p>フィールドと交代前ロールの対応は固定の約束事として扱う: benched = 交代前の goalkeeper、movedToGoalkeeper = 交代前の
 * forward、newForward = 交代前の待機列先頭。交代規則を変える場合はこの対応と永続化側を同時に見直すこと。
 */
public record RotationSummary(String benched, String movedToGoalkeeper, String newForward) {}

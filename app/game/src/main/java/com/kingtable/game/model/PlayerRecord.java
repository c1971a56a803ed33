/*
 * どこで: Game ドメインモデル
 * 何を: 永続化されたプレイヤーの集計値を表現する
 * なぜ: Repository と API 間で受け渡す構造を固定するため
 */
package com.kingtable.game.model;

public record PlayerRecord(long id, String name, long wins, long survives, long fullRotations) {}

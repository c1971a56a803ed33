/*
 * どこで: Game API
 * 何を: エラー応答のコードを定義する
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.kingtable.game.api;

public enum ApiErrorCode {
  BAD_REQUEST,
  EMPTY_PLAYER_ID,
  INVALID_TEAM,
  DUPLICATE_PLAYER_ID,
  GAME_NOT_FOUND,
  PLAYER_NOT_FOUND,
  GAME_NOT_STARTED,
  QUEUE_EMPTY,
  NO_HISTORY,
  PERSISTENCE_DISABLED,
  INTERNAL_ERROR
}

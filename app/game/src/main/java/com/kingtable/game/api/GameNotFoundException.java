/*
 * どこで: Game API
 * 何を: game 未検出を表現する
 * なぜ: 参照/変更 API の 404 応答へ変換するため
 */
package com.kingtable.game.api;

public class GameNotFoundException extends RuntimeException {
  public GameNotFoundException(String gameId) {
    super("game not found: " + gameId);
  }
}

/*
 * どこで: Game API
 * 何を: 入力は妥当だが現在の状態では適用できない操作を表現する
 * なぜ: 待機列が空・未開始・undo 履歴なしを 409 で返し、状態を変えないことを明示するため
 */
package com.kingtable.game.api;

public class GameStateConflictException extends RuntimeException {

  private final ApiErrorCode code;

  public GameStateConflictException(ApiErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public ApiErrorCode code() {
    return code;
  }
}

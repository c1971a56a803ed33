/*
 * どこで: Game API
 * 何を: 状態に触れる前に弾く入力エラーを表現する
 * なぜ: 空 ID や不正な team を 400 へ正規化するため
 */
package com.kingtable.game.api;

public class InvalidGameRequestException extends RuntimeException {

  private final ApiErrorCode code;

  public InvalidGameRequestException(ApiErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public ApiErrorCode code() {
    return code;
  }
}

/*
 * どこで: Game ドメインモデル
 * 何を: 卓上の 2 チームを定義する
 * なぜ: team 入力の妥当性を列挙型で固定するため
 */
package com.kingtable.game.model;

public enum Team {
  RED("red"),
  BLUE("blue");

  private final String value;

  Team(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public Team opponent() {
    return this == RED ? BLUE : RED;
  }

  /**
   * 役割: API で受け取った team 文字列を内部列挙型へ変換する。
   * 動作: 前後の空白を除去し、大文字小文字を無視して一致判定を行う。未対応値は IllegalArgumentException を送出する。
   * 前提: なし（null も未対応値として扱う）。
   */
  public static Team fromValue(String team) {
    final String normalized = team == null ? "" : team.trim();
    for (Team candidate : values()) {
      if (candidate.value.equalsIgnoreCase(normalized)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("team must be 'red' or 'blue': " + team);
  }
}

/*
 * どこで: Game 永続化層
 * 何を: 永続化操作の投入口を抽象化する
 * なぜ: 外部ストアの有無に関わらずゲーム操作側のコードを同一にするため
 */
package com.kingtable.game.persistence;

public interface PersistenceQueue {

  /**
   * 役割: 永続化操作を投入順に処理されるよう登録する。
   * 動作: 外部ストアの応答を待たずに戻る。
   * 前提: GameStore のロックを保持したまま呼ばないこと。
   */
  void submit(PersistenceOperation operation);

  /** 未処理の操作数。 */
  int backlog();
}

/*
 * どこで: Game 永続化層
 * 何を: 外部ストアへの書き込み操作を抽象化する
 * なぜ: ワーカーのリトライ制御を JDBC 実装から切り離しテスト容易性を高めるため
 */
package com.kingtable.game.persistence;

import com.kingtable.game.model.GoalEventRecord;
import java.util.Collection;
import java.util.Map;

public interface PersistenceStore {

  /**
   * 役割: プレイヤー名を登録（既存なら last_seen 更新）し、name -> id を返す。
   * 動作: 空白を除去し、空名は無視、重複は 1 件にまとめる。
   * 前提: 失敗時は例外を送出する（ワーカーが再試行する）。
   */
  Map<String, Long> ensurePlayers(Collection<String> names);

  /**
   * 役割: 得点イベントを記録し、プレイヤー集計を更新する。
   * 動作: ゲーム行とプレイヤー行を確保してから goal_events を挿入し、wins/survives/full_rotations を加算する。
   * 前提: 1 トランザクションで行い、途中失敗時は何も残さない。
   */
  void recordGoal(GoalEventRecord event);
}

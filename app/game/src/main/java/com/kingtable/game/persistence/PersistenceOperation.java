package com.kingtable.game.persistence;

/** 外部ストアへの 1 単位の書き込み。失敗時は同じインスタンスが再実行されるため、execute は再実行可能であること。 */
public interface PersistenceOperation {

  String kind();

  /** 投入元リクエストの request_id。ワーカー側のログ相関に使う。 */
  String traceId();

  void execute(PersistenceStore store);
}

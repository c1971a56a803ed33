/*
 * どこで: Game 永続化層
 * 何を: 外部ストア無効時のダミーキューを提供する
 * なぜ: DB なしでもインメモリのゲーム操作を同じ経路で動かすため
 */
package com.kingtable.game.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NoopPersistenceQueue implements PersistenceQueue {

  private static final Logger logger = LoggerFactory.getLogger(NoopPersistenceQueue.class);

  @Override
  public void submit(PersistenceOperation operation) {
    logger.debug("persistence disabled; dropping operation kind={}", operation.kind());
  }

  @Override
  public int backlog() {
    return 0;
  }
}

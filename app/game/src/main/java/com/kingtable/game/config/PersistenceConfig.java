/*
 * どこで: Game 永続化設定
 * 何を: 外部ストアの有無に応じて PersistenceQueue 実装を切り替える
 * なぜ: DB 未設定でもインメモリのゲーム操作を同じ経路で動かすため
 */
package com.kingtable.game.config;

import com.kingtable.game.persistence.AsyncPersistenceQueue;
import com.kingtable.game.persistence.BackoffPolicy;
import com.kingtable.game.persistence.NoopPersistenceQueue;
import com.kingtable.game.persistence.PersistenceQueue;
import com.kingtable.game.persistence.PersistenceStore;
import com.kingtable.game.service.GameMetrics;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class PersistenceConfig {

  @Bean(initMethod = "start", destroyMethod = "stop")
  @ConditionalOnProperty(name = "persistence.enabled", havingValue = "true")
  AsyncPersistenceQueue asyncPersistenceQueue(
      PersistenceStore store, PersistenceProperties properties, GameMetrics metrics) {
    final AsyncPersistenceQueue queue =
        new AsyncPersistenceQueue(store, new BackoffPolicy(properties), metrics);
    metrics.bindPersistenceBacklog(queue);
    return queue;
  }

  @Bean
  @ConditionalOnProperty(name = "persistence.enabled", havingValue = "false", matchIfMissing = true)
  PersistenceQueue noopPersistenceQueue() {
    return new NoopPersistenceQueue();
  }
}

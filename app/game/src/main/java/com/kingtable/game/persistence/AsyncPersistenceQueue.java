/*
 * どこで: Game 永続化層
 * 何を: 永続化操作を単一ワーカーで投入順に処理する
 * なぜ: 外部ストアの遅延や障害をゲーム操作のクリティカルパスから切り離すため
 */
package com.kingtable.game.persistence;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.kingtable.game.service.GameMetrics;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * 順序保証付きの非同期永続化キュー。
 *
 * <p>失敗した操作は成功するまで同じ操作を再試行し、後続を追い越させない。外部ストアが長時間落ちている間はキューが進まないが、
 * プレイヤー登録より前に得点が記録されたり、同一ゲームの得点順が入れ替わったりすることはない。
 *
 * <p>キューは上限を持たず、投入側をブロックも破棄もしない。停止時に未処理の操作は失われる（ベストエフォートの永続化）。
 */
public class AsyncPersistenceQueue implements PersistenceQueue {

  private static final Logger logger = LoggerFactory.getLogger(AsyncPersistenceQueue.class);
  private static final String MDC_TRACE_KEY = "request_id";

  /** ワーカーの待機。テストでは実時間を待たない実装に差し替える。 */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  enum DeliveryState {
    ATTEMPT,
    WAIT,
    DELIVERED
  }

  private final BlockingQueue<PersistenceOperation> queue;
  private final PersistenceStore store;
  private final BackoffPolicy backoffPolicy;
  private final GameMetrics metrics;
  private final Sleeper sleeper;
  private final ExecutorService worker;
  private volatile boolean running;

  public AsyncPersistenceQueue(
      PersistenceStore store,
      BackoffPolicy backoffPolicy,
      GameMetrics metrics,
      Sleeper sleeper) {
    this.queue = new LinkedBlockingQueue<>();
    this.store = store;
    this.backoffPolicy = backoffPolicy;
    this.metrics = metrics;
    this.sleeper = sleeper;
    this.worker =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder()
                .setNameFormat("persistence-worker-%d")
                .setDaemon(true)
                .build());
  }

  public AsyncPersistenceQueue(
      PersistenceStore store, BackoffPolicy backoffPolicy, GameMetrics metrics) {
    this(store, backoffPolicy, metrics, duration -> Thread.sleep(duration.toMillis()));
  }

  public void start() {
    if (running) {
      return;
    }
    running = true;
    worker.execute(this::drain);
    logger.info("persistence worker started backlog={}", queue.size());
  }

  public void stop() {
    running = false;
    worker.shutdownNow();
    try {
      if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
        logger.warn("persistence worker did not stop in time backlog={}", queue.size());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    if (!queue.isEmpty()) {
      logger.warn(
          "persistence worker stopped with undelivered operations backlog={}", queue.size());
    }
  }

  @Override
  public void submit(PersistenceOperation operation) {
    queue.add(operation);
  }

  @Override
  public int backlog() {
    return queue.size();
  }

  private void drain() {
    while (running && !Thread.currentThread().isInterrupted()) {
      final PersistenceOperation operation;
      try {
        operation = queue.take();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return;
      }
      try {
        deliver(operation);
      } catch (InterruptedException ex) {
        logger.warn(
            "persistence worker interrupted; operation abandoned kind={} traceId={}",
            operation.kind(),
            operation.traceId());
        Thread.currentThread().interrupt();
        return;
      }
    }
  }

  /**
   * 役割: 1 件の操作を成功するまで実行する。
   * 動作: ATTEMPT → (失敗) WAIT(backoff) → ATTEMPT ... → DELIVERED。操作は破棄もスキップもしない。
   * 前提: 割り込まれた場合のみ InterruptedException で抜ける。
   */
  @VisibleForTesting
  int deliver(PersistenceOperation operation) throws InterruptedException {
    MDC.put(MDC_TRACE_KEY, operation.traceId());
    try {
      DeliveryState state = DeliveryState.ATTEMPT;
      int attempt = 1;
      Duration backoff = Duration.ZERO;
      while (state != DeliveryState.DELIVERED) {
        switch (state) {
          case ATTEMPT -> {
            try {
              operation.execute(store);
              state = DeliveryState.DELIVERED;
            } catch (RuntimeException | Error ex) {
              // Error でもワーカーを終わらせない。終わると後続の操作が永久に滞留する
              backoff = backoffPolicy.delayAfter(attempt);
              logger.warn(
                  "persistence operation failed kind={} attempt={} nextBackoff={}",
                  operation.kind(),
                  attempt,
                  backoff,
                  ex);
              metrics.recordPersistenceRetry(operation.kind());
              state = DeliveryState.WAIT;
            }
          }
          case WAIT -> {
            sleeper.sleep(backoff);
            attempt++;
            state = DeliveryState.ATTEMPT;
          }
          default -> throw new IllegalStateException("unexpected delivery state: " + state);
        }
      }
      if (attempt > 1) {
        logger.info(
            "persistence operation delivered after retries kind={} attempts={}",
            operation.kind(),
            attempt);
      }
      metrics.recordPersistenceDelivered(operation.kind());
      return attempt;
    } finally {
      MDC.remove(MDC_TRACE_KEY);
    }
  }
}

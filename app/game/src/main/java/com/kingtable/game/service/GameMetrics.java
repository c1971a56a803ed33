/*
 * どこで: Game サービス層
 * 何を: ゲーム操作と永続化キューのメトリクス記録を集約する
 * なぜ: 操作の拒否率と永続化の滞留/再試行を運用で継続監視できるようにするため
 */
package com.kingtable.game.service;

import com.kingtable.game.persistence.PersistenceQueue;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class GameMetrics {

  private static final String METRIC_COMMAND_TOTAL = "game.command.total";
  private static final String METRIC_FULL_ROTATION_TOTAL = "game.full_rotation.total";
  private static final String METRIC_PERSISTENCE_BACKLOG = "game.persistence.backlog";
  private static final String METRIC_PERSISTENCE_RETRY = "game.persistence.retry.total";
  private static final String METRIC_PERSISTENCE_DELIVERED = "game.persistence.delivered.total";

  private final MeterRegistry meterRegistry;
  private final Counter fullRotationCounter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public GameMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.fullRotationCounter =
        Counter.builder(METRIC_FULL_ROTATION_TOTAL)
            .description("Goals that completed a full rotation of the opposing pair")
            .register(meterRegistry);
  }

  public void recordCommand(String action, String result) {
    counter(METRIC_COMMAND_TOTAL, Tags.of("action", action, "result", result)).increment();
  }

  public void recordFullRotation() {
    fullRotationCounter.increment();
  }

  public void recordPersistenceRetry(String operation) {
    counter(METRIC_PERSISTENCE_RETRY, Tags.of("operation", operation)).increment();
  }

  public void recordPersistenceDelivered(String operation) {
    counter(METRIC_PERSISTENCE_DELIVERED, Tags.of("operation", operation)).increment();
  }

  public void bindPersistenceBacklog(PersistenceQueue queue) {
    Gauge.builder(METRIC_PERSISTENCE_BACKLOG, queue, PersistenceQueue::backlog)
        .description("Persistence operations waiting for the worker")
        .register(meterRegistry);
  }

  private Counter counter(String name, Tags tags) {
    final String key = name + tags;
    return counters.computeIfAbsent(
        key, ignored -> Counter.builder(name).tags(tags).register(meterRegistry));
  }
}

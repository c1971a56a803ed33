package com.kingtable.game.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.kingtable.game.config.PersistenceProperties;
import com.kingtable.game.model.GoalEventRecord;
import com.kingtable.game.service.GameMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class AsyncPersistenceQueueTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final GameMetrics metrics = new GameMetrics(registry);
  private final BackoffPolicy backoffPolicy =
      new BackoffPolicy(
          new PersistenceProperties(
              true,
              Duration.ofSeconds(1),
              Duration.ofMinutes(1),
              2.0,
              1.0,
              1.0,
              Duration.ofSeconds(10)));

  @Test
  void deliverRetriesWithGrowingBackoffUntilSuccess() throws Exception {
    final PersistenceStore store = mock(PersistenceStore.class);
    doThrow(new IllegalStateException("db down"))
        .doThrow(new IllegalStateException("db down"))
        .doThrow(new IllegalStateException("db down"))
        .doReturn(Map.of("p1", 1L))
        .when(store)
        .ensurePlayers(any());
    final List<Duration> sleeps = new ArrayList<>();
    final AsyncPersistenceQueue queue =
        new AsyncPersistenceQueue(store, backoffPolicy, metrics, sleeps::add);

    final int attempts = queue.deliver(new EnsurePlayersOperation(List.of("p1"), "trace-1"));

    assertThat(attempts).isEqualTo(4);
    assertThat(sleeps)
        .containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
    verify(store, times(4)).ensurePlayers(List.of("p1"));
    assertThat(
            registry
                .get("game.persistence.retry.total")
                .tag("operation", "ensure_players")
                .counter()
                .count())
        .isEqualTo(3.0);
    assertThat(
            registry
                .get("game.persistence.delivered.total")
                .tag("operation", "ensure_players")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  void workerDeliversOperationsInSubmissionOrderDespiteFailures() throws Exception {
    final RecordingStore store = new RecordingStore(2);
    final AsyncPersistenceQueue queue =
        new AsyncPersistenceQueue(store, backoffPolicy, metrics, duration -> {});
    queue.start();
    try {
      queue.submit(new EnsurePlayersOperation(List.of("a"), "t1"));
      queue.submit(new EnsurePlayersOperation(List.of("b"), "t2"));
      queue.submit(new EnsurePlayersOperation(List.of("c"), "t3"));

      assertThat(store.done.await(10, TimeUnit.SECONDS)).isTrue();
    } finally {
      queue.stop();
    }

    assertThat(store.delivered).containsExactly("a", "b", "c");
    assertThat(store.attempts).containsExactly("a", "a", "a", "b", "c");
  }

  @Test
  void submitKeepsEveryOperationWhileWorkerIsIdle() {
    final PersistenceStore store = mock(PersistenceStore.class);
    final AsyncPersistenceQueue queue =
        new AsyncPersistenceQueue(store, backoffPolicy, metrics, duration -> {});

    for (int i = 0; i < 2000; i++) {
      queue.submit(new EnsurePlayersOperation(List.of("p" + i), "t" + i));
    }

    assertThat(queue.backlog()).isEqualTo(2000);
  }

  @Test
  void deliverRetriesWhenStoreThrowsError() throws Exception {
    final PersistenceStore store = mock(PersistenceStore.class);
    doThrow(new LinkageError("driver not loaded"))
        .doReturn(Map.of("p1", 1L))
        .when(store)
        .ensurePlayers(any());
    final List<Duration> sleeps = new ArrayList<>();
    final AsyncPersistenceQueue queue =
        new AsyncPersistenceQueue(store, backoffPolicy, metrics, sleeps::add);

    final int attempts = queue.deliver(new EnsurePlayersOperation(List.of("p1"), "trace-1"));

    assertThat(attempts).isEqualTo(2);
    assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
    verify(store, times(2)).ensurePlayers(List.of("p1"));
  }

  /** 最初の操作だけ failures 回失敗させ、試行と成功を記録する。 */
  private static final class RecordingStore implements PersistenceStore {

    private final List<String> attempts = new CopyOnWriteArrayList<>();
    private final List<String> delivered = new CopyOnWriteArrayList<>();
    private final CountDownLatch done = new CountDownLatch(3);
    private int remainingFailures;

    RecordingStore(int failures) {
      this.remainingFailures = failures;
    }

    @Override
    public Map<String, Long> ensurePlayers(Collection<String> names) {
      final String name = names.iterator().next();
      attempts.add(name);
      if (remainingFailures > 0) {
        remainingFailures--;
        throw new IllegalStateException("transient failure");
      }
      delivered.add(name);
      done.countDown();
      return Collections.singletonMap(name, (long) delivered.size());
    }

    @Override
    public void recordGoal(GoalEventRecord event) {
      throw new UnsupportedOperationException();
    }
  }
}

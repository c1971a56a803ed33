package com.kingtable.game.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.kingtable.game.api.GameNotFoundException;
import com.kingtable.game.model.GameState;
import com.kingtable.game.model.GameSummary;
import com.kingtable.game.model.Score;
import com.kingtable.game.model.TeamSlot;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class GameStoreTest {

  private static GameState newState() {
    return new GameState(new TeamSlot("p1", "p2"), new TeamSlot("p3", "p4"), List.of("p5"), 8);
  }

  @Test
  void createAssignsLowercaseHexId() {
    final GameStore store = new GameStore(new SecureRandom(), 12);

    final String gameId = store.create(newState(), (id, state) -> id);

    assertThat(gameId).hasSize(24).matches("[0-9a-f]+");
    assertThat(store.size()).isEqualTo(1);
  }

  @Test
  void createRetriesWhenIdCollides() {
    final GameStore store = new GameStore(new SequenceRandom(0, 0, 1), 2);

    final String first = store.create(newState(), (id, state) -> id);
    final String second = store.create(newState(), (id, state) -> id);

    assertThat(first).isEqualTo("0000");
    assertThat(second).isEqualTo("0101");
  }

  @Test
  void readUnknownGameThrows() {
    final GameStore store = new GameStore(new SecureRandom(), 12);

    assertThatThrownBy(() -> store.read("missing", GameState::toView))
        .isInstanceOf(GameNotFoundException.class)
        .hasMessageContaining("missing");
    assertThatThrownBy(() -> store.mutate(null, GameState::toView))
        .isInstanceOf(GameNotFoundException.class);
  }

  @Test
  void listReturnsSummariesInCreationOrder() {
    final GameStore store = new GameStore(new SecureRandom(), 12);
    final String first = store.create(newState(), (id, state) -> id);
    final String second = store.create(newState(), (id, state) -> id);

    assertThat(store.list())
        .containsExactly(
            new GameSummary(first, true, Score.ZERO), new GameSummary(second, true, Score.ZERO));
  }

  @Test
  void failedMutationReleasesLock() {
    final GameStore store = new GameStore(new SecureRandom(), 12);
    final String gameId = store.create(newState(), (id, state) -> id);

    assertThatThrownBy(
            () ->
                store.mutate(
                    gameId,
                    state -> {
                      throw new IllegalStateException("boom");
                    }))
        .isInstanceOf(IllegalStateException.class);

    assertThat(store.<Integer>mutate(gameId, state -> state.waiting().size())).isEqualTo(1);
  }

  @Test
  void concurrentMutationsAreSerialized() throws Exception {
    final GameStore store = new GameStore(new SecureRandom(), 12);
    final String gameId = store.create(newState(), (id, state) -> id);
    final int threads = 8;
    final int perThread = 50;
    final ExecutorService executor = Executors.newFixedThreadPool(threads);
    final CountDownLatch start = new CountDownLatch(1);
    final List<Future<?>> futures = new ArrayList<>();
    try {
      for (int t = 0; t < threads; t++) {
        final int worker = t;
        futures.add(
            executor.submit(
                () -> {
                  start.await();
                  for (int i = 0; i < perThread; i++) {
                    final String playerId = "w" + worker + "-" + i;
                    store.mutate(
                        gameId,
                        state -> {
                          state.waiting().enqueue(playerId);
                          return null;
                        });
                    store.read(gameId, GameState::toView);
                  }
                  return null;
                }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    final List<String> waiting = store.read(gameId, state -> state.toView().waiting());
    assertThat(waiting).hasSize(1 + threads * perThread).doesNotHaveDuplicates();
  }

  /** nextBytes の呼び出しごとに指定値でバッファを埋める。 */
  private static final class SequenceRandom extends Random {

    private final int[] values;
    private int calls;

    SequenceRandom(int... values) {
      this.values = values.clone();
    }

    @Override
    public void nextBytes(byte[] bytes) {
      final int value = values[Math.min(calls, values.length - 1)];
      calls++;
      Arrays.fill(bytes, (byte) value);
    }
  }
}

/*
 * どこで: Game ストア層
 * 何を: gameId -> GameState のレジストリと排他制御を提供する
 * なぜ: 同じゲームへの同時参照/変更を直列化し、応答が常にある瞬間の一貫した状態を反映するようにするため
 */
package com.kingtable.game.store;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.BaseEncoding;
import com.kingtable.game.api.GameNotFoundException;
import com.kingtable.game.config.GameProperties;
import com.kingtable.game.model.GameState;
import com.kingtable.game.model.GameSummary;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.BiFunction;
import java.util.function.Function;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * ゲームのレジストリ。
 *
 * <p>レジストリ全体で 1 本の読み書きロックを使う。参照は共有ロック、作成と変更は排他ロックで行い、1 回のロック取得では 1 つの論理操作だけを
 * 実行する。GameState はコールバックの外へ渡さないこと（コールバックは不変のビューを返す）。
 */
@Component
public class GameStore {

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, GameState> games = new LinkedHashMap<>();
  private final Random random;
  private final int idBytes;

  @Autowired
  public GameStore(GameProperties properties) {
    this(new SecureRandom(), properties.idBytes());
  }

  GameStore(Random random, int idBytes) {
    this.random = random;
    this.idBytes = Math.max(1, idBytes);
  }

  /**
   * 役割: 新しいゲームを登録する。
   * 動作: 未使用になるまでランダム ID を生成し直し、登録と viewer 呼び出しを同じ排他ロック内で行う。
   * 前提: state は呼び出し側で検証済み。
   */
  public <T> T create(GameState state, BiFunction<String, GameState, T> viewer) {
    lock.writeLock().lock();
    try {
      final String gameId = newGameIdLocked();
      games.put(gameId, state);
      return viewer.apply(gameId, state);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** 共有ロック内で reader を実行する。ゲームが無ければ GameNotFoundException。 */
  public <T> T read(String gameId, Function<GameState, T> reader) {
    lock.readLock().lock();
    try {
      return reader.apply(require(gameId));
    } finally {
      lock.readLock().unlock();
    }
  }

  /** 排他ロック内で mutator を実行する。mutator が例外を投げた場合も状態は mutator の責任で変更前のまま。 */
  public <T> T mutate(String gameId, Function<GameState, T> mutator) {
    lock.writeLock().lock();
    try {
      return mutator.apply(require(gameId));
    } finally {
      lock.writeLock().unlock();
    }
  }

  public List<GameSummary> list() {
    lock.readLock().lock();
    try {
      final List<GameSummary> summaries = new ArrayList<>(games.size());
      games.forEach((gameId, state) -> summaries.add(state.toSummary(gameId)));
      return summaries;
    } finally {
      lock.readLock().unlock();
    }
  }

  @VisibleForTesting
  public int size() {
    lock.readLock().lock();
    try {
      return games.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  private GameState require(String gameId) {
    final GameState state = gameId == null ? null : games.get(gameId);
    if (state == null) {
      throw new GameNotFoundException(gameId);
    }
    return state;
  }

  // 前提: 書き込みロック保持中に呼ぶ
  private String newGameIdLocked() {
    final byte[] bytes = new byte[idBytes];
    while (true) {
      random.nextBytes(bytes);
      final String gameId = BaseEncoding.base16().lowerCase().encode(bytes);
      if (!games.containsKey(gameId)) {
        return gameId;
      }
    }
  }
}

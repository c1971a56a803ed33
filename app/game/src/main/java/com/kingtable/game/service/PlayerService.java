/*
 * どこで: Game サービス層
 * 何を: プレイヤー検索/登録/リーダーボードを提供する
 * なぜ: 外部ストアが無い構成でも API が一貫したエラーで応答するようにするため
 */
package com.kingtable.game.service;

import com.kingtable.common.TraceIds;
import com.kingtable.game.api.ApiErrorCode;
import com.kingtable.game.api.InvalidGameRequestException;
import com.kingtable.game.api.PersistenceDisabledException;
import com.kingtable.game.model.PlayerRecord;
import com.kingtable.game.persistence.EnsurePlayersOperation;
import com.kingtable.game.persistence.PersistenceQueue;
import com.kingtable.game.repository.PlayerRepository;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
public class PlayerService {

  private static final Logger logger = LoggerFactory.getLogger(PlayerService.class);

  static final int DEFAULT_SEARCH_LIMIT = 20;
  static final int MAX_SEARCH_LIMIT = 100;
  static final int DEFAULT_LEADERBOARD_LIMIT = 50;
  static final int MAX_LEADERBOARD_LIMIT = 1000;

  private final Optional<PlayerRepository> playerRepository;
  private final PersistenceQueue persistenceQueue;

  public PlayerService(
      Optional<PlayerRepository> playerRepository, PersistenceQueue persistenceQueue) {
    this.playerRepository = playerRepository;
    this.persistenceQueue = persistenceQueue;
  }

  /** 名前の部分一致検索。limit が未指定または 1..100 の範囲外なら 20。 */
  public List<PlayerRecord> search(String query, Integer limit) {
    final PlayerRepository repository = requireRepository();
    final int effectiveLimit =
        limit == null || limit <= 0 || limit > MAX_SEARCH_LIMIT ? DEFAULT_SEARCH_LIMIT : limit;
    final String normalized = query == null ? "" : query.trim();
    return repository.search(normalized, effectiveLimit);
  }

  /**
   * 役割: プレイヤー登録を永続化キューへ投入する。
   * 動作: 名前を trim して投入し、ID は非同期で確定するため 0 を返す。
   * 前提: 外部ストアが無ければ PERSISTENCE_DISABLED。
   */
  public PlayerRecord createPlayer(String name) {
    requireRepository();
    final String normalized = name == null ? "" : name.trim();
    if (normalized.isEmpty()) {
      throw new InvalidGameRequestException(ApiErrorCode.BAD_REQUEST, "name is required");
    }
    persistenceQueue.submit(
        new EnsurePlayersOperation(List.of(normalized), TraceIds.orNew(MDC.get("request_id"))));
    logger.info("player registration queued name={}", normalized);
    return new PlayerRecord(0L, normalized, 0L, 0L, 0L);
  }

  /** 勝利数順の上位。limit が未指定または 1..1000 の範囲外なら 50。 */
  public List<PlayerRecord> leaderboard(Integer limit) {
    final PlayerRepository repository = requireRepository();
    final int effectiveLimit =
        limit == null || limit <= 0 || limit > MAX_LEADERBOARD_LIMIT
            ? DEFAULT_LEADERBOARD_LIMIT
            : limit;
    return repository.search("", effectiveLimit);
  }

  private PlayerRepository requireRepository() {
    return playerRepository.orElseThrow(PersistenceDisabledException::new);
  }
}

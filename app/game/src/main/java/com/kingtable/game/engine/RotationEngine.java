/*
 * どこで: Game エンジン層
 * 何を: 得点時の交代、待機列追加、プレイヤー削除、undo をゲーム状態へ適用する
 * なぜ: ルールを GameStore のロック制御や永続化から切り離して単体で検証するため
 */
package com.kingtable.game.engine;

import com.kingtable.game.api.ApiErrorCode;
import com.kingtable.game.api.DuplicatePlayerException;
import com.kingtable.game.api.GameStateConflictException;
import com.kingtable.game.api.InvalidGameRequestException;
import com.kingtable.game.api.PlayerNotFoundException;
import com.kingtable.game.model.FullRotationEvent;
import com.kingtable.game.model.GameSnapshot;
import com.kingtable.game.model.GameState;
import com.kingtable.game.model.GoalResult;
import com.kingtable.game.model.RotationSummary;
import com.kingtable.game.model.StreakState;
import com.kingtable.game.model.Team;
import com.kingtable.game.model.TeamSlot;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * ゲーム状態に対するルール適用。
 *
 * <p>すべての操作は呼び出し側が GameStore の排他ロックを保持している前提で動く。検証エラーは状態に一切触れる前に送出し、変更操作は変更前に
 * スナップショットを履歴へ積む（undo 自身は積まない）。
 */
@Component
public class RotationEngine {

  private static final Team[] SLOT_ORDER = {Team.RED, Team.BLUE};

  /**
   * 役割: 新しいゲーム状態を組み立てる。
   * 動作: 4 枠と待機列の ID を trim し、空 ID は EMPTY_PLAYER_ID、ゲーム内の重複は DUPLICATE_PLAYER_ID で拒否する。
   * 前提: 作成直後のゲームは started=true、スコア 0、履歴なし。
   */
  public GameState newGame(
      TeamSlot red, TeamSlot blue, List<String> waiting, int minQueueCapacity) {
    if (red == null || blue == null) {
      throw new InvalidGameRequestException(
          ApiErrorCode.EMPTY_PLAYER_ID, "red and blue are required");
    }
    final TeamSlot normalizedRed =
        new TeamSlot(requireActiveId(red.forward()), requireActiveId(red.goalkeeper()));
    final TeamSlot normalizedBlue =
        new TeamSlot(requireActiveId(blue.forward()), requireActiveId(blue.goalkeeper()));
    final List<String> normalizedWaiting = new ArrayList<>();
    for (String playerId : waiting == null ? List.<String>of() : waiting) {
      if (playerId == null || playerId.isBlank()) {
        throw new InvalidGameRequestException(
            ApiErrorCode.EMPTY_PLAYER_ID, "empty player_id in waiting queue");
      }
      normalizedWaiting.add(playerId.trim());
    }

    final Set<String> seen = new HashSet<>();
    final List<String> all = new ArrayList<>();
    all.add(normalizedRed.forward());
    all.add(normalizedRed.goalkeeper());
    all.add(normalizedBlue.forward());
    all.add(normalizedBlue.goalkeeper());
    all.addAll(normalizedWaiting);
    for (String playerId : all) {
      if (!seen.add(playerId)) {
        throw new DuplicatePlayerException(playerId);
      }
    }
    return new GameState(normalizedRed, normalizedBlue, normalizedWaiting, minQueueCapacity);
  }

  /**
   * 役割: 得点を記録し、失点チームを交代させる。
   * 動作: team 検証 → 未開始/待機列空の検査 → スナップショット → 交代 → スコア加算 → streak 更新 → フルローテーション判定。
   *     交代は「GK を待機列末尾へ、FW を GK へ、待機列先頭を FW へ」。
   * 前提: いずれの失敗でも状態と履歴は変わらない。
   */
  public GoalResult applyGoal(GameState game, String teamToken) {
    final Team scoringTeam = parseTeam(teamToken);
    if (!game.started()) {
      throw new GameStateConflictException(ApiErrorCode.GAME_NOT_STARTED, "game not started");
    }
    if (game.waiting().isEmpty()) {
      throw new GameStateConflictException(
          ApiErrorCode.QUEUE_EMPTY, "waiting queue empty; cannot rotate losing team");
    }
    final Team losingTeam = scoringTeam.opponent();
    final GameSnapshot before = game.pushHistory();

    final TeamSlot loser = game.slot(losingTeam);
    final String benched = loser.goalkeeper();
    game.waiting().enqueue(benched);
    final String moved = loser.forward();
    // 待機列は benched を積んだ直後なので必ず 1 件以上ある
    final String newForward = game.waiting().dequeue().orElseThrow();
    final TeamSlot rotated = new TeamSlot(newForward, moved);
    game.setSlot(losingTeam, rotated);

    game.recordGoal(scoringTeam);

    final TeamSlot scoringPair = game.slot(scoringTeam);
    StreakState streak = game.streak();
    if (streak == null || !streak.heldBy(scoringTeam, scoringPair)) {
      streak = new StreakState(scoringTeam, scoringPair, loser);
      game.setStreak(streak);
    }
    // 基準は一致してもクリアしない（次の一巡でも再検出する）
    final FullRotationEvent fullRotation =
        rotated.samePairAs(streak.opponentBaseline())
            ? new FullRotationEvent(
                scoringTeam, List.of(scoringPair.forward(), scoringPair.goalkeeper()))
            : null;

    return new GoalResult(
        scoringTeam, new RotationSummary(benched, moved, newForward), fullRotation, before);
  }

  /**
   * 役割: 待機列末尾へプレイヤーを追加する。
   * 動作: 空 ID は EMPTY_PLAYER_ID、ゲーム内のどこかに既に居れば DUPLICATE_PLAYER_ID で拒否する。
   * 前提: 戻り値は trim 済みの ID。
   */
  public String enqueue(GameState game, String playerId) {
    final String normalized = requirePlayerId(playerId);
    if (game.containsPlayer(normalized)) {
      throw new DuplicatePlayerException(normalized);
    }
    game.pushHistory();
    game.waiting().enqueue(normalized);
    return normalized;
  }

  /**
   * 役割: ゲームからプレイヤーを 1 か所だけ取り除く。
   * 動作: 待機列 → red FW → red GK → blue FW → blue GK の順で最初の一致を削除する。枠からの削除は空枠を残し、自動補充しない。
   * 前提: どこにも居なければ PLAYER_NOT_FOUND で、履歴は積まない。
   */
  public String removePlayer(GameState game, String playerId) {
    final String normalized = requirePlayerId(playerId);
    if (game.waiting().contains(normalized)) {
      game.pushHistory();
      game.waiting().removeValue(normalized);
      return normalized;
    }
    for (Team team : SLOT_ORDER) {
      final TeamSlot slot = game.slot(team);
      if (slot.forward().equals(normalized)) {
        game.pushHistory();
        game.setSlot(team, slot.withForward(TeamSlot.EMPTY));
        return normalized;
      }
      if (slot.goalkeeper().equals(normalized)) {
        game.pushHistory();
        game.setSlot(team, slot.withGoalkeeper(TeamSlot.EMPTY));
        return normalized;
      }
    }
    throw new PlayerNotFoundException(normalized);
  }

  /** 直前の変更操作を取り消す。undo 自体は履歴に積まない。 */
  public GameSnapshot undo(GameState game) {
    final GameSnapshot last =
        game.popHistory()
            .orElseThrow(
                () ->
                    new GameStateConflictException(ApiErrorCode.NO_HISTORY, "no actions to undo"));
    game.restore(last);
    return last;
  }

  private Team parseTeam(String teamToken) {
    try {
      return Team.fromValue(teamToken);
    } catch (IllegalArgumentException ex) {
      throw new InvalidGameRequestException(
          ApiErrorCode.INVALID_TEAM, "team must be 'red' or 'blue'");
    }
  }

  private String requireActiveId(String playerId) {
    if (playerId == null || playerId.isBlank()) {
      throw new InvalidGameRequestException(
          ApiErrorCode.EMPTY_PLAYER_ID, "empty player_id in active slots");
    }
    return playerId.trim();
  }

  private String requirePlayerId(String playerId) {
    if (playerId == null || playerId.isBlank()) {
      throw new InvalidGameRequestException(ApiErrorCode.EMPTY_PLAYER_ID, "player_id is required");
    }
    return playerId.trim();
  }
}

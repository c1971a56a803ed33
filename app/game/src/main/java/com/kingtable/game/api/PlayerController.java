/*
 * どこで: Game API
 * 何を: プレイヤー検索/登録とリーダーボードのエンドポイントを公開する
 * なぜ: 外部ストアに蓄積した戦績を参照する入口を提供するため
 */
package com.kingtable.game.api;

import com.kingtable.game.api.request.CreatePlayerRequest;
import com.kingtable.game.api.response.PlayerResponse;
import com.kingtable.game.model.PlayerRecord;
import com.kingtable.game.service.PlayerService;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class PlayerController {

  private final PlayerService playerService;

  @GetMapping("/players")
  public ResponseEntity<List<PlayerResponse>> searchPlayers(
      @RequestParam(name = "query", required = false) String query,
      @RequestParam(name = "limit", required = false) String limit) {
    final List<PlayerRecord> players = playerService.search(query, parseLimit(limit));
    return ResponseEntity.ok(players.stream().map(PlayerResponse::from).toList());
  }

  @PostMapping("/players")
  public ResponseEntity<PlayerResponse> createPlayer(
      @Valid @RequestBody CreatePlayerRequest request) {
    return ResponseEntity.ok(PlayerResponse.from(playerService.createPlayer(request.name())));
  }

  @GetMapping("/leaderboard/data")
  public ResponseEntity<List<PlayerResponse>> leaderboard(
      @RequestParam(name = "limit", required = false) String limit) {
    final List<PlayerRecord> players = playerService.leaderboard(parseLimit(limit));
    return ResponseEntity.ok(players.stream().map(PlayerResponse::from).toList());
  }

  // 数値でない limit は未指定扱いにして既定値へ落とす
  private static Integer parseLimit(String limit) {
    if (limit == null || limit.isBlank()) {
      return null;
    }
    try {
      return Integer.valueOf(limit.trim());
    } catch (NumberFormatException ex) {
      return null;
    }
  }
}

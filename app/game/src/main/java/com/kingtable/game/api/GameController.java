/*
 * どこで: Game API
 * 何を: ゲームの開始/参照/待機列追加/得点/取り消し/削除エンドポイントを公開する
 * なぜ: 卓の操作端末からのゲーム操作を受け付ける入口を提供するため
 */
package com.kingtable.game.api;

import com.kingtable.game.api.request.GoalRequest;
import com.kingtable.game.api.request.QueuePlayerRequest;
import com.kingtable.game.api.request.RemovePlayerRequest;
import com.kingtable.game.api.request.StartGameRequest;
import com.kingtable.game.api.request.TeamSlotPayload;
import com.kingtable.game.api.response.GameStateResponse;
import com.kingtable.game.api.response.GameSummaryResponse;
import com.kingtable.game.api.response.StartGameResponse;
import com.kingtable.game.model.CreatedGame;
import com.kingtable.game.model.TeamSlot;
import com.kingtable.game.service.GameService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/games")
@RequiredArgsConstructor
public class GameController {

  private final GameService gameService;

  @GetMapping
  public ResponseEntity<List<GameSummaryResponse>> listGames() {
    return ResponseEntity.ok(
        gameService.listGames().stream().map(GameSummaryResponse::from).toList());
  }

  @PostMapping("/start")
  public ResponseEntity<StartGameResponse> startGame(@RequestBody StartGameRequest request) {
    final CreatedGame created =
        gameService.createGame(
            toSlot(request.red()), toSlot(request.blue()), request.waiting());
    return ResponseEntity.ok(
        new StartGameResponse(created.id(), GameStateResponse.from(created.state())));
  }

  @GetMapping("/{gameId}")
  public ResponseEntity<GameStateResponse> getGame(@PathVariable("gameId") String gameId) {
    return ResponseEntity.ok(GameStateResponse.from(gameService.getGame(gameId)));
  }

  @PostMapping("/{gameId}/queue")
  public ResponseEntity<GameStateResponse> enqueuePlayer(
      @PathVariable("gameId") String gameId, @RequestBody QueuePlayerRequest request) {
    return ResponseEntity.ok(
        GameStateResponse.from(gameService.enqueuePlayer(gameId, request.playerId())));
  }

  @PostMapping("/{gameId}/goal")
  public ResponseEntity<GameStateResponse> recordGoal(
      @PathVariable("gameId") String gameId, @RequestBody GoalRequest request) {
    return ResponseEntity.ok(GameStateResponse.from(gameService.applyGoal(gameId, request.team())));
  }

  @PostMapping("/{gameId}/undo")
  public ResponseEntity<GameStateResponse> undo(@PathVariable("gameId") String gameId) {
    return ResponseEntity.ok(GameStateResponse.from(gameService.undo(gameId)));
  }

  @PostMapping("/{gameId}/remove")
  public ResponseEntity<GameStateResponse> removePlayer(
      @PathVariable("gameId") String gameId, @RequestBody RemovePlayerRequest request) {
    return ResponseEntity.ok(
        GameStateResponse.from(gameService.removePlayer(gameId, request.playerId())));
  }

  private static TeamSlot toSlot(TeamSlotPayload payload) {
    return payload == null ? null : payload.toSlot();
  }
}

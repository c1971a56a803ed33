/*
 * どこで: Game API リクエスト DTO
 * 何を: ゲーム開始 API の入力を定義する
 * なぜ: 4 枠と待機列を 1 回の要求で受け取るため
 */
package com.kingtable.game.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP",
    justification = "API DTO record はリクエスト受け取り専用であり、防御的コピーを行わないため")
public record StartGameRequest(TeamSlotPayload red, TeamSlotPayload blue, List<String> waiting) {}

package com.kingtable.game.api.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** team は "red" / "blue"（大文字小文字と前後空白は無視）。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GoalRequest(String team) {}

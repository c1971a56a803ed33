package com.kingtable.game.api.response;

public record StartGameResponse(String id, GameStateResponse state) {}

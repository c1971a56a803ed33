package com.kingtable.game.model;

public record CreatedGame(String id, GameView state) {}

package com.kingtable.game.model;

public record GameSummary(String id, boolean started, Score score) {}

/*
 * どこで: Game 設定
 * 何を: ゲーム ID 長と待機列の初期容量を保持する
 * なぜ: 環境差分をコード外へ出し、テストで上書きしやすくするため
 */
package com.kingtable.game.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "game")
public record GameProperties(int idBytes, int initialQueueCapacity) {}

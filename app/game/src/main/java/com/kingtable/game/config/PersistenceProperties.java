/*
 * どこで: Game アプリの設定バインド
 * 何を: 永続化キューの有効/無効とリトライ設定を保持する
 * なぜ: 運用パラメータを外部化するため
 */
package com.kingtable.game.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "persistence")
public record PersistenceProperties(
    boolean enabled,
    Duration backoffBase,
    Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    Duration attemptTimeout) {}

/*
 * どこで: Game 永続化層
 * 何を: リトライ待機時間（上限付き指数バックオフ）を計算する
 * なぜ: 外部ストア障害時に再試行間隔を段階的に広げるため
 */
package com.kingtable.game.persistence;

import com.kingtable.game.config.PersistenceProperties;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public class BackoffPolicy {

  private final PersistenceProperties properties;

  public BackoffPolicy(PersistenceProperties properties) {
    this.properties = properties;
  }

  /**
   * 役割: attempt 回目の失敗後に待つ時間を返す。
   * 動作: base * exponentBase^(attempt-1) を max で頭打ちにし、ジッターを掛けた後も max を超えない。
   * 前提: attempt は 1 始まり。
   */
  public Duration delayAfter(int attempt) {
    final double baseMillis = properties.backoffBase().toMillis();
    final double maxMillis = properties.backoffMax().toMillis();
    final double exp =
        baseMillis * Math.pow(properties.backoffExponentBase(), Math.max(0, attempt - 1));
    final double capped = Math.min(exp, maxMillis);
    final double jitterMin = properties.backoffJitterMin();
    final double jitterMax = properties.backoffJitterMax();
    final double jitter =
        jitterMax <= jitterMin
            ? jitterMin
            : jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    final long backoffMillis = (long) Math.ceil(Math.min(capped * jitter, maxMillis));
    return Duration.ofMillis(Math.max(0L, backoffMillis));
  }
}

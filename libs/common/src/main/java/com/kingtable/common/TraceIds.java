package com.kingtable.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** MDC に request_id が無い経路（バックグラウンドワーカー等）向けのフォールバックを返す。 */
  public static String orNew(String traceId) {
    return traceId == null || traceId.isBlank() ? newTraceId() : traceId;
  }
}

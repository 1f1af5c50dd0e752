package com.realchain.common;

import java.util.UUID;

public final class TraceIds {
  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String resolve(String traceId) {
    if (traceId == null || traceId.isBlank()) {
      return newTraceId();
    }
    return traceId;
  }
}

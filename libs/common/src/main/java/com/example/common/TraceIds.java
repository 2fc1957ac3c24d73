package com.example.common;

import java.util.UUID;

public final class TraceIds {

  /** MDC key picked up by the JSON log encoder. */
  public static final String MDC_KEY = "trace_id";

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }
}

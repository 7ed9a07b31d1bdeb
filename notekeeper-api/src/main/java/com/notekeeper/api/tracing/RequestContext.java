package com.notekeeper.api.tracing;

/**
 * Per-request correlation id stored in a ThreadLocal, for code that does not see the servlet request.
 */
public final class RequestContext {

  private static final ThreadLocal<String> TL = new ThreadLocal<>();

  private RequestContext() {}

  public static void set(String requestId) {
    TL.set(requestId);
  }

  public static void clear() {
    TL.remove();
  }

  public static String requestId() {
    return TL.get();
  }
}

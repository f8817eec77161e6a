package com.onthegomap.zen.util;

import org.slf4j.MDC;

/**
 * Wrapper for SLF4j {@link MDC} log utility to prepend {@code [context]} to log output while code runs inside a named
 * {@link com.onthegomap.zen.expression.ZenContext}.
 */
public class LogUtil {

  private LogUtil() {}

  private static final String CONTEXT_KEY = "zen_context";

  /** Prepends {@code [context]} to all subsequent logs from this thread. */
  public static void setContext(String context) {
    MDC.put(CONTEXT_KEY, "[%s] ".formatted(context));
  }

  /** Removes {@code [context]} from subsequent logs from this thread. */
  public static void clearContext() {
    MDC.remove(CONTEXT_KEY);
  }

  /** Returns the current {@code [context]} value prepended to log for this thread. */
  public static String getContext() {
    // strip out the "[context] " wrapper
    String wrapped = MDC.get(CONTEXT_KEY);
    return wrapped == null ? null : wrapped.substring(1, wrapped.length() - 2);
  }

  /** Restores a value previously returned by {@link #getContext()}, clearing it if {@code null}. */
  public static void restoreContext(String context) {
    if (context == null) {
      clearContext();
    } else {
      setContext(context);
    }
  }
}

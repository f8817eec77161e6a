package com.onthegomap.zen.util;

/**
 * Argument checks that fail fast with a {@link ZenException} when a caller violates a construction contract.
 */
public class Contract {
  private Contract() {}

  /** Returns {@code obj} or throws if it is null. */
  public static <T> T assertNotNull(T obj) {
    if (obj == null) {
      throw new ZenException("Invalid null argument");
    }
    return obj;
  }

  public static void assertTrue(boolean condition) {
    if (!condition) {
      throw new ZenException("Assertion failed");
    }
  }

  public static void assertTrue(boolean condition, String message) {
    if (!condition) {
      throw new ZenException(message);
    }
  }

  /** Throws with {@code template} formatted with {@code args} if {@code condition} is false. */
  public static void assertTrue(boolean condition, String template, Object... args) {
    if (!condition) {
      throw new ZenException(template.formatted(args));
    }
  }
}

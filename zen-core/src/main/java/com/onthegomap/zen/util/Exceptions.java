package com.onthegomap.zen.util;

/**
 * Exception-handling utilities.
 */
public class Exceptions {
  private Exceptions() {}

  /**
   * Returns an error to throw when code reaches a state that should be impossible, like an operator with no matching
   * case.
   *
   * @param value the value that had no matching case
   */
  public static ZenUnreachableException unreachable(Object value) {
    return new ZenUnreachableException("Unexpected value: " + value);
  }

  /**
   * Internal invariant violation that indicates a bug in the expression library rather than misuse by the caller.
   */
  public static class ZenUnreachableException extends AssertionError {
    public ZenUnreachableException(String message) {
      super(message);
    }
  }
}

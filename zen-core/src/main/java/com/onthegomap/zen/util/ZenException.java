package com.onthegomap.zen.util;

/**
 * Error thrown when an expression is constructed with arguments that violate its contract, for example a {@code null}
 * child, a field that does not exist on a record type, or an operation that the operand type does not support.
 */
public class ZenException extends RuntimeException {

  public ZenException(String message) {
    super(message);
  }

  public ZenException(String message, Throwable cause) {
    super(message, cause);
  }
}

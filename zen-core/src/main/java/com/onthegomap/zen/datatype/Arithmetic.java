package com.onthegomap.zen.datatype;

import com.onthegomap.zen.util.Exceptions;
import java.math.BigInteger;

/**
 * Arithmetic, ordering and bitwise operations on values of the arithmetic {@link ZenType types}, shared by constant
 * folding and the interpreter so both agree on overflow and unsigned semantics.
 */
public final class Arithmetic {
  private Arithmetic() {}

  /** Returns true if {@code type} is {@link ZenType#BIGINT} or a fixed width integer. */
  public static boolean isInteger(ZenType<?> type) {
    return type == ZenType.BIGINT || type instanceof FixedIntType;
  }

  public static <T> T zero(ZenType<T> type) {
    return fromBigInteger(type, BigInteger.ZERO);
  }

  public static <T> T one(ZenType<T> type) {
    return fromBigInteger(type, BigInteger.ONE);
  }

  /** Returns the value of {@code type} for {@code value}, wrapping fixed width integers to their width. */
  @SuppressWarnings("unchecked")
  public static <T> T fromBigInteger(ZenType<T> type, BigInteger value) {
    if (type instanceof FixedIntType<T> fixed) {
      return fixed.fromBigInteger(value);
    } else if (type == ZenType.BIGINT) {
      return (T) value;
    } else if (type == ZenType.REAL) {
      return (T) Real.of(value, BigInteger.ONE);
    }
    throw Exceptions.unreachable(type);
  }

  /** Returns the mathematical value of an integer {@code value} of {@code type}. */
  public static <T> BigInteger toBigInteger(ZenType<T> type, T value) {
    if (type instanceof FixedIntType<T> fixed) {
      return fixed.toBigInteger(value);
    } else if (type == ZenType.BIGINT) {
      return (BigInteger) value;
    }
    throw Exceptions.unreachable(type);
  }

  public static <T> T add(ZenType<T> type, T a, T b) {
    if (type == ZenType.REAL) {
      return real(type, ((Real) a).add((Real) b));
    }
    return fromBigInteger(type, toBigInteger(type, a).add(toBigInteger(type, b)));
  }

  public static <T> T subtract(ZenType<T> type, T a, T b) {
    if (type == ZenType.REAL) {
      return real(type, ((Real) a).subtract((Real) b));
    }
    return fromBigInteger(type, toBigInteger(type, a).subtract(toBigInteger(type, b)));
  }

  public static <T> T multiply(ZenType<T> type, T a, T b) {
    if (type == ZenType.REAL) {
      return real(type, ((Real) a).multiply((Real) b));
    }
    return fromBigInteger(type, toBigInteger(type, a).multiply(toBigInteger(type, b)));
  }

  /** Compares two values of {@code type}, unsigned types compare by their non-negative magnitude. */
  public static <T> int compare(ZenType<T> type, T a, T b) {
    if (type == ZenType.REAL) {
      return ((Real) a).compareTo((Real) b);
    }
    return toBigInteger(type, a).compareTo(toBigInteger(type, b));
  }

  public static <T> T bitNot(ZenType<T> type, T a) {
    return fromBigInteger(type, toBigInteger(type, a).not());
  }

  public static <T> T bitAnd(ZenType<T> type, T a, T b) {
    return fromBigInteger(type, toBigInteger(type, a).and(toBigInteger(type, b)));
  }

  public static <T> T bitOr(ZenType<T> type, T a, T b) {
    return fromBigInteger(type, toBigInteger(type, a).or(toBigInteger(type, b)));
  }

  public static <T> T bitXor(ZenType<T> type, T a, T b) {
    return fromBigInteger(type, toBigInteger(type, a).xor(toBigInteger(type, b)));
  }

  /** Returns {@code value} as an index, {@code -1} when negative and {@link Integer#MAX_VALUE} when too large. */
  public static int clampToInt(BigInteger value) {
    if (value.signum() < 0) {
      return -1;
    }
    return value.bitLength() < Integer.SIZE ? value.intValue() : Integer.MAX_VALUE;
  }

  @SuppressWarnings("unchecked")
  private static <T> T real(ZenType<T> type, Real value) {
    return (T) value;
  }
}

package com.onthegomap.zen.datatype;

import java.math.BigInteger;
import java.util.function.Function;
import javax.annotation.concurrent.Immutable;

/**
 * A fixed width two's complement integer, signed or unsigned.
 * <p>
 * Arithmetic on these types is done on {@link BigInteger} and wrapped back to {@code bits} bits, so overflow behaves
 * the way it does for Java primitives.
 */
@Immutable
public final class FixedIntType<T> implements ZenType<T> {

  private final String name;
  private final Class<T> javaClass;
  private final int bits;
  private final boolean signed;
  private final Function<T, BigInteger> toBigInteger;
  private final Function<BigInteger, T> fromBigInteger;

  FixedIntType(String name, Class<T> javaClass, int bits, boolean signed, Function<T, BigInteger> toBigInteger,
    Function<BigInteger, T> fromBigInteger) {
    this.name = name;
    this.javaClass = javaClass;
    this.bits = bits;
    this.signed = signed;
    this.toBigInteger = toBigInteger;
    this.fromBigInteger = fromBigInteger;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Class<T> javaClass() {
    return javaClass;
  }

  @Override
  public T defaultValue() {
    return fromBigInteger(BigInteger.ZERO);
  }

  public int bits() {
    return bits;
  }

  public boolean signed() {
    return signed;
  }

  /** Returns the mathematical value of {@code value}, non-negative for unsigned types. */
  public BigInteger toBigInteger(T value) {
    return toBigInteger.apply(value);
  }

  /** Returns the low {@code bits} bits of {@code value} as a value of this type. */
  public T fromBigInteger(BigInteger value) {
    return fromBigInteger.apply(value);
  }

  public int compare(T a, T b) {
    return toBigInteger(a).compareTo(toBigInteger(b));
  }

  @Override
  public String toString() {
    return name;
  }
}

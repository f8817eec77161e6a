package com.onthegomap.zen.datatype;

import com.onthegomap.zen.util.ZenException;
import java.math.BigInteger;
import javax.annotation.concurrent.Immutable;

/**
 * An exact rational number stored as a normalized fraction with a positive denominator.
 */
@Immutable
public final class Real implements Comparable<Real> {

  public static final Real ZERO = new Real(BigInteger.ZERO, BigInteger.ONE);
  public static final Real ONE = new Real(BigInteger.ONE, BigInteger.ONE);

  private final BigInteger numerator;
  private final BigInteger denominator;

  private Real(BigInteger numerator, BigInteger denominator) {
    this.numerator = numerator;
    this.denominator = denominator;
  }

  public static Real of(long value) {
    return of(BigInteger.valueOf(value), BigInteger.ONE);
  }

  public static Real of(long numerator, long denominator) {
    return of(BigInteger.valueOf(numerator), BigInteger.valueOf(denominator));
  }

  /**
   * Returns {@code numerator / denominator} in lowest terms.
   *
   * @throws ZenException if {@code denominator} is zero
   */
  public static Real of(BigInteger numerator, BigInteger denominator) {
    if (denominator.signum() == 0) {
      throw new ZenException("Real denominator must not be zero");
    }
    if (denominator.signum() < 0) {
      numerator = numerator.negate();
      denominator = denominator.negate();
    }
    BigInteger gcd = numerator.gcd(denominator);
    if (!gcd.equals(BigInteger.ONE) && gcd.signum() != 0) {
      numerator = numerator.divide(gcd);
      denominator = denominator.divide(gcd);
    }
    return new Real(numerator, denominator);
  }

  public BigInteger numerator() {
    return numerator;
  }

  public BigInteger denominator() {
    return denominator;
  }

  public Real add(Real other) {
    return of(numerator.multiply(other.denominator).add(other.numerator.multiply(denominator)),
      denominator.multiply(other.denominator));
  }

  public Real subtract(Real other) {
    return add(other.negate());
  }

  public Real multiply(Real other) {
    return of(numerator.multiply(other.numerator), denominator.multiply(other.denominator));
  }

  public Real negate() {
    return new Real(numerator.negate(), denominator);
  }

  public int signum() {
    return numerator.signum();
  }

  @Override
  public int compareTo(Real other) {
    return numerator.multiply(other.denominator).compareTo(other.numerator.multiply(denominator));
  }

  @Override
  public boolean equals(Object o) {
    return this == o ||
      (o instanceof Real other && numerator.equals(other.numerator) && denominator.equals(other.denominator));
  }

  @Override
  public int hashCode() {
    return 31 * numerator.hashCode() + denominator.hashCode();
  }

  @Override
  public String toString() {
    return denominator.equals(BigInteger.ONE) ? numerator.toString() : numerator + "/" + denominator;
  }
}

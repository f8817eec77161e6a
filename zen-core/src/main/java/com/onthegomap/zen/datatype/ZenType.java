package com.onthegomap.zen.datatype;

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import java.math.BigInteger;

/**
 * Runtime descriptor for the type of values an expression produces.
 * <p>
 * Java generics are erased, so every expression node carries one of these to validate its operands, pick the constant
 * folding arithmetic, produce default values and print type names.
 *
 * @param <T> the Java class of values of this type
 */
public sealed interface ZenType<T> permits PrimitiveType, FixedIntType, SeqType, FSeqType, DictType, CMapType,
  RecordType {

  ZenType<Boolean> BOOL = new PrimitiveType<>("bool", Boolean.class, false);
  ZenType<Character> CHAR = new PrimitiveType<>("char", Character.class, '\0');
  ZenType<String> STRING = new PrimitiveType<>("string", String.class, "");
  ZenType<BigInteger> BIGINT = new PrimitiveType<>("bigint", BigInteger.class, BigInteger.ZERO);
  ZenType<Real> REAL = new PrimitiveType<>("real", Real.class, Real.ZERO);
  ZenType<SetUnit> UNIT = new PrimitiveType<>("unit", SetUnit.class, SetUnit.UNIT);

  FixedIntType<Byte> BYTE = new FixedIntType<>("byte", Byte.class, 8, true,
    b -> BigInteger.valueOf(b), BigInteger::byteValue);
  FixedIntType<Short> SHORT = new FixedIntType<>("short", Short.class, 16, true,
    s -> BigInteger.valueOf(s), BigInteger::shortValue);
  FixedIntType<Integer> INT = new FixedIntType<>("int", Integer.class, 32, true,
    i -> BigInteger.valueOf(i), BigInteger::intValue);
  FixedIntType<Long> LONG = new FixedIntType<>("long", Long.class, 64, true,
    BigInteger::valueOf, BigInteger::longValue);
  FixedIntType<UnsignedInteger> UINT = new FixedIntType<>("uint", UnsignedInteger.class, 32, false,
    UnsignedInteger::bigIntegerValue, v -> UnsignedInteger.fromIntBits(v.intValue()));
  FixedIntType<UnsignedLong> ULONG = new FixedIntType<>("ulong", UnsignedLong.class, 64, false,
    UnsignedLong::bigIntegerValue, v -> UnsignedLong.fromLongBits(v.longValue()));

  /** Returns the name used when printing this type. */
  String name();

  /** Returns the Java class of values of this type. */
  Class<?> javaClass();

  /** Returns the value an unassigned variable of this type takes. */
  T defaultValue();

  /** Returns true if {@code value} is a valid value of this type. */
  default boolean isInstance(Object value) {
    return javaClass().isInstance(value);
  }

  /** Returns true for types that support addition, subtraction and ordering comparisons. */
  default boolean isArithmetic() {
    return this instanceof FixedIntType || this == BIGINT || this == REAL;
  }

  /** Returns true for fixed width signed or unsigned integers. */
  default boolean isFixedInteger() {
    return this instanceof FixedIntType;
  }

  static <E> SeqType<E> seq(ZenType<E> elementType) {
    return new SeqType<>(elementType);
  }

  static <E> FSeqType<E> fseq(ZenType<E> elementType) {
    return new FSeqType<>(elementType);
  }

  static <K, V> DictType<K, V> dict(ZenType<K> keyType, ZenType<V> valueType) {
    return new DictType<>(keyType, valueType);
  }

  /** Returns the type of finite sets of {@code keyType}, a dictionary from each member to {@link SetUnit}. */
  static <K> DictType<K, SetUnit> set(ZenType<K> keyType) {
    return new DictType<>(keyType, UNIT);
  }

  static <K, V> CMapType<K, V> cmap(ZenType<K> keyType, ZenType<V> valueType) {
    return new CMapType<>(keyType, valueType);
  }
}

package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Arithmetic;
import com.onthegomap.zen.datatype.Seq;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.Contract;
import com.onthegomap.zen.util.Exceptions;

/**
 * Conversion between two representations of the same value: a string and its {@code Seq<char>}, or two integer
 * types, where narrowing to a fixed width type keeps the low bits.
 */
public final class CastExpr<S, T> extends Zen<T> {

  static final ZenType<Seq<Character>> CHAR_SEQ = ZenType.seq(ZenType.CHAR);

  private record Key(long expr, ZenType<?> targetType) {}

  private final Zen<S> expr;

  private CastExpr(Zen<S> expr, ZenType<T> targetType) {
    super(targetType);
    this.expr = expr;
  }

  /** Returns true if values of {@code sourceType} can be converted to {@code targetType}. */
  public static boolean isSupported(ZenType<?> sourceType, ZenType<?> targetType) {
    return sourceType.equals(targetType) ||
      (sourceType == ZenType.STRING && targetType.equals(CHAR_SEQ)) ||
      (sourceType.equals(CHAR_SEQ) && targetType == ZenType.STRING) ||
      (Arithmetic.isInteger(sourceType) && Arithmetic.isInteger(targetType));
  }

  public static <S, T> Zen<T> create(Zen<S> expr, ZenType<T> targetType) {
    Contract.assertNotNull(expr);
    Contract.assertNotNull(targetType);
    Contract.assertTrue(isSupported(expr.type(), targetType), "Cast from %s to %s is not supported", expr.type(),
      targetType);
    Flyweight<Key, Zen<T>> table = ZenContext.current().table(NodeKind.CAST);
    return table.getOrAdd(new Key(expr.id(), targetType), () -> simplify(expr, targetType));
  }

  @SuppressWarnings("unchecked")
  private static <S, T> Zen<T> simplify(Zen<S> expr, ZenType<T> targetType) {
    if (expr.type().equals(targetType)) {
      return (Zen<T>) expr;
    }
    if (expr instanceof CastExpr<?, ?> inner && inner.expr.type().equals(targetType) && !isNarrowing(inner)) {
      return (Zen<T>) inner.expr;
    }
    if (expr instanceof ConstantExpr<S> constant) {
      return ConstantExpr.create(targetType, convert(expr.type(), targetType, constant.value()));
    }
    return new CastExpr<>(expr, targetType);
  }

  /** Returns true for an integer cast that may lose information, so it cannot be undone by casting back. */
  private static boolean isNarrowing(CastExpr<?, ?> cast) {
    return Arithmetic.isInteger(cast.type()) && cast.type() != ZenType.BIGINT;
  }

  /** Converts {@code value} of {@code sourceType} to {@code targetType}. */
  @SuppressWarnings("unchecked")
  public static <S, T> T convert(ZenType<S> sourceType, ZenType<T> targetType, S value) {
    if (sourceType.equals(targetType)) {
      return (T) value;
    } else if (sourceType == ZenType.STRING) {
      return (T) Seq.fromString((String) value);
    } else if (targetType == ZenType.STRING) {
      return (T) Seq.asString((Seq<Character>) value);
    } else if (Arithmetic.isInteger(sourceType) && Arithmetic.isInteger(targetType)) {
      return Arithmetic.fromBigInteger(targetType, Arithmetic.toBigInteger(sourceType, value));
    }
    throw Exceptions.unreachable(sourceType + " to " + targetType);
  }

  public Zen<S> expr() {
    return expr;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CAST;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitCast(this, parameter);
  }
}

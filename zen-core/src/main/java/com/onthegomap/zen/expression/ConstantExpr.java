package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.Contract;

/** A literal value. */
public final class ConstantExpr<T> extends Zen<T> {

  public static final ConstantExpr<Boolean> TRUE = new ConstantExpr<>(ZenType.BOOL, true);
  public static final ConstantExpr<Boolean> FALSE = new ConstantExpr<>(ZenType.BOOL, false);

  private record Key(ZenType<?> type, Object value) {}

  private final T value;

  private ConstantExpr(ZenType<T> type, T value) {
    super(type);
    this.value = value;
  }

  public static <T> ConstantExpr<T> create(ZenType<T> type, T value) {
    Contract.assertNotNull(type);
    Contract.assertNotNull(value);
    Contract.assertTrue(type.isInstance(value), "Value %s is not a %s", value, type);
    Flyweight<Key, ConstantExpr<?>> table = ZenContext.current().table(NodeKind.CONSTANT);
    @SuppressWarnings("unchecked")
    ConstantExpr<T> result =
      (ConstantExpr<T>) table.getOrAdd(new Key(type, value), () -> new ConstantExpr<>(type, value));
    return result;
  }

  /** Registers the boolean singletons in a new context's constant table. */
  @SuppressWarnings("unchecked")
  static void seed(Flyweight<?, ?> table) {
    Flyweight<Key, ConstantExpr<?>> constants = (Flyweight<Key, ConstantExpr<?>>) table;
    constants.seed(new Key(ZenType.BOOL, true), TRUE);
    constants.seed(new Key(ZenType.BOOL, false), FALSE);
  }

  public T value() {
    return value;
  }

  static boolean isTrue(Zen<?> expr) {
    return expr == TRUE;
  }

  static boolean isFalse(Zen<?> expr) {
    return expr == FALSE;
  }

  /** Returns true if {@code expr} is a constant equal to {@code value}. */
  static boolean hasValue(Zen<?> expr, Object value) {
    return expr instanceof ConstantExpr<?> constant && constant.value.equals(value);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CONSTANT;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitConstant(this, parameter);
  }
}

package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.Contract;

/** Structural equality of two values of the same type. */
public final class EqualityExpr<T> extends Zen<Boolean> {

  private record Key(long expr1, long expr2) {}

  private final Zen<T> expr1;
  private final Zen<T> expr2;

  private EqualityExpr(Zen<T> expr1, Zen<T> expr2) {
    super(ZenType.BOOL);
    this.expr1 = expr1;
    this.expr2 = expr2;
  }

  public static <T> Zen<Boolean> create(Zen<T> expr1, Zen<T> expr2) {
    Contract.assertNotNull(expr1);
    Contract.assertNotNull(expr2);
    Contract.assertTrue(expr1.type().equals(expr2.type()), "Equals operands have different types %s and %s",
      expr1.type(), expr2.type());
    Flyweight<Key, Zen<Boolean>> table = ZenContext.current().table(NodeKind.EQUALITY);
    return table.getOrAdd(new Key(expr1.id(), expr2.id()), () -> simplify(expr1, expr2));
  }

  @SuppressWarnings("unchecked")
  private static <T> Zen<Boolean> simplify(Zen<T> expr1, Zen<T> expr2) {
    if (expr1 == expr2) {
      return ConstantExpr.TRUE;
    }
    if (expr1 instanceof ConstantExpr<T> c1 && expr2 instanceof ConstantExpr<T> c2) {
      return Zen.constant(c1.value().equals(c2.value()));
    }
    if (expr1.type() == ZenType.BOOL) {
      Zen<Boolean> bool1 = (Zen<Boolean>) expr1;
      Zen<Boolean> bool2 = (Zen<Boolean>) expr2;
      if (ConstantExpr.isTrue(bool1)) {
        return bool2;
      }
      if (ConstantExpr.isFalse(bool1)) {
        return NotExpr.create(bool2);
      }
      if (ConstantExpr.isTrue(bool2)) {
        return bool1;
      }
      if (ConstantExpr.isFalse(bool2)) {
        return NotExpr.create(bool1);
      }
    }
    return new EqualityExpr<>(expr1, expr2);
  }

  public Zen<T> expr1() {
    return expr1;
  }

  public Zen<T> expr2() {
    return expr2;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.EQUALITY;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitEquality(this, parameter);
  }
}

package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Arithmetic;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.Contract;

/** Ordering comparison of two values of the same arithmetic type. */
public final class ArithComparisonExpr<T> extends Zen<Boolean> {

  public enum Op {
    GEQ("Geq"),
    LEQ("Leq"),
    GT("Gt"),
    LT("Lt");

    private final String displayName;

    Op(String displayName) {
      this.displayName = displayName;
    }

    public String displayName() {
      return displayName;
    }

    /** Returns the comparison that holds exactly when this one does not. */
    public Op negate() {
      return switch (this) {
        case GEQ -> LT;
        case LEQ -> GT;
        case GT -> LEQ;
        case LT -> GEQ;
      };
    }

    /** Returns true if this comparison holds for operands that compare as {@code comparison}. */
    public boolean test(int comparison) {
      return switch (this) {
        case GEQ -> comparison >= 0;
        case LEQ -> comparison <= 0;
        case GT -> comparison > 0;
        case LT -> comparison < 0;
      };
    }
  }

  private record Key(long expr1, long expr2, Op op) {}

  private final Zen<T> expr1;
  private final Zen<T> expr2;
  private final Op op;

  private ArithComparisonExpr(Zen<T> expr1, Zen<T> expr2, Op op) {
    super(ZenType.BOOL);
    this.expr1 = expr1;
    this.expr2 = expr2;
    this.op = op;
  }

  public static <T> Zen<Boolean> create(Zen<T> expr1, Zen<T> expr2, Op op) {
    Contract.assertNotNull(expr1);
    Contract.assertNotNull(expr2);
    Contract.assertNotNull(op);
    Contract.assertTrue(expr1.type().equals(expr2.type()), "%s operands have different types %s and %s",
      op.displayName(), expr1.type(), expr2.type());
    Contract.assertTrue(expr1.type().isArithmetic(), "%s is not supported for type %s", op.displayName(),
      expr1.type());
    Flyweight<Key, Zen<Boolean>> table = ZenContext.current().table(NodeKind.ARITH_COMPARISON);
    return table.getOrAdd(new Key(expr1.id(), expr2.id(), op), () -> simplify(expr1, expr2, op));
  }

  private static <T> Zen<Boolean> simplify(Zen<T> expr1, Zen<T> expr2, Op op) {
    if (expr1 == expr2) {
      return Zen.constant(op.test(0));
    }
    if (expr1 instanceof ConstantExpr<T> c1 && expr2 instanceof ConstantExpr<T> c2) {
      return Zen.constant(op.test(Arithmetic.compare(expr1.type(), c1.value(), c2.value())));
    }
    return new ArithComparisonExpr<>(expr1, expr2, op);
  }

  public Zen<T> expr1() {
    return expr1;
  }

  public Zen<T> expr2() {
    return expr2;
  }

  public Op op() {
    return op;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ARITH_COMPARISON;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitArithComparison(this, parameter);
  }
}

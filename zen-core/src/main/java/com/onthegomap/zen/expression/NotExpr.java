package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.Contract;

/** Boolean negation. */
public final class NotExpr extends Zen<Boolean> {

  private final Zen<Boolean> expr;

  private NotExpr(Zen<Boolean> expr) {
    super(ZenType.BOOL);
    this.expr = expr;
  }

  public static Zen<Boolean> create(Zen<Boolean> expr) {
    Contract.assertNotNull(expr);
    Contract.assertTrue(expr.type() == ZenType.BOOL, "Not requires a bool operand");
    Flyweight<Long, Zen<Boolean>> table = ZenContext.current().table(NodeKind.NOT);
    return table.getOrAdd(expr.id(), expr, NotExpr::simplify);
  }

  private static Zen<Boolean> simplify(Zen<Boolean> expr) {
    if (ConstantExpr.isTrue(expr)) {
      return ConstantExpr.FALSE;
    }
    if (ConstantExpr.isFalse(expr)) {
      return ConstantExpr.TRUE;
    }
    if (expr instanceof NotExpr not) {
      return not.expr;
    }
    if (expr instanceof ArithComparisonExpr<?> comparison) {
      return negate(comparison);
    }
    return new NotExpr(expr);
  }

  private static <T> Zen<Boolean> negate(ArithComparisonExpr<T> comparison) {
    return ArithComparisonExpr.create(comparison.expr1(), comparison.expr2(), comparison.op().negate());
  }

  public Zen<Boolean> expr() {
    return expr;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.NOT;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitNot(this, parameter);
  }
}

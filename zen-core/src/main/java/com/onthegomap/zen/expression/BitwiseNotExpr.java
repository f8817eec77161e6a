package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Arithmetic;
import com.onthegomap.zen.util.Contract;

/** Bitwise complement of a fixed width integer. */
public final class BitwiseNotExpr<T> extends Zen<T> {

  private final Zen<T> expr;

  private BitwiseNotExpr(Zen<T> expr) {
    super(expr.type());
    this.expr = expr;
  }

  public static <T> Zen<T> create(Zen<T> expr) {
    Contract.assertNotNull(expr);
    Contract.assertTrue(expr.type().isFixedInteger(), "BitwiseNot is not supported for type %s", expr.type());
    Flyweight<Long, Zen<T>> table = ZenContext.current().table(NodeKind.BITWISE_NOT);
    return table.getOrAdd(expr.id(), expr, BitwiseNotExpr::simplify);
  }

  private static <T> Zen<T> simplify(Zen<T> expr) {
    if (expr instanceof ConstantExpr<T> constant) {
      return ConstantExpr.create(expr.type(), Arithmetic.bitNot(expr.type(), constant.value()));
    }
    if (expr instanceof BitwiseNotExpr<T> not) {
      return not.expr;
    }
    return new BitwiseNotExpr<>(expr);
  }

  public Zen<T> expr() {
    return expr;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.BITWISE_NOT;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitBitwiseNot(this, parameter);
  }
}

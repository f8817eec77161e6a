package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.Contract;

/** Boolean conjunction or disjunction of two expressions. */
public final class LogicalBinopExpr extends Zen<Boolean> {

  public enum Op {
    AND("And"),
    OR("Or");

    private final String displayName;

    Op(String displayName) {
      this.displayName = displayName;
    }

    public String displayName() {
      return displayName;
    }

    /** Returns the De Morgan dual of this operator. */
    public Op dual() {
      return this == AND ? OR : AND;
    }
  }

  private record Key(long expr1, long expr2, Op op) {}

  private final Zen<Boolean> expr1;
  private final Zen<Boolean> expr2;
  private final Op op;

  private LogicalBinopExpr(Zen<Boolean> expr1, Zen<Boolean> expr2, Op op) {
    super(ZenType.BOOL);
    this.expr1 = expr1;
    this.expr2 = expr2;
    this.op = op;
  }

  public static Zen<Boolean> create(Zen<Boolean> expr1, Zen<Boolean> expr2, Op op) {
    Contract.assertNotNull(expr1);
    Contract.assertNotNull(expr2);
    Contract.assertNotNull(op);
    Contract.assertTrue(expr1.type() == ZenType.BOOL && expr2.type() == ZenType.BOOL, "%s requires bool operands",
      op.displayName());
    Flyweight<Key, Zen<Boolean>> table = ZenContext.current().table(NodeKind.LOGICAL_BINOP);
    return table.getOrAdd(new Key(expr1.id(), expr2.id(), op), () -> simplify(expr1, expr2, op));
  }

  private static Zen<Boolean> simplify(Zen<Boolean> expr1, Zen<Boolean> expr2, Op op) {
    if (expr1 == expr2) {
      return expr1;
    }
    // the constant that decides the result on its own, and the one that is the identity of op
    Zen<Boolean> absorbing = op == Op.AND ? ConstantExpr.FALSE : ConstantExpr.TRUE;
    Zen<Boolean> identity = op == Op.AND ? ConstantExpr.TRUE : ConstantExpr.FALSE;
    if (expr1 == absorbing || expr2 == absorbing) {
      return absorbing;
    }
    if (expr1 == identity) {
      return expr2;
    }
    if (expr2 == identity) {
      return expr1;
    }
    if (expr1 instanceof NotExpr not1 && expr2 instanceof NotExpr not2) {
      return NotExpr.create(create(not1.expr(), not2.expr(), op.dual()));
    }
    return new LogicalBinopExpr(expr1, expr2, op);
  }

  public Zen<Boolean> expr1() {
    return expr1;
  }

  public Zen<Boolean> expr2() {
    return expr2;
  }

  public Op op() {
    return op;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.LOGICAL_BINOP;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitLogicalBinop(this, parameter);
  }
}

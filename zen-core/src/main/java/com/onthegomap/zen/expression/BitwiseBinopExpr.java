package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Arithmetic;
import com.onthegomap.zen.util.Contract;

/** Bitwise and, or or xor of two fixed width integers of the same type. */
public final class BitwiseBinopExpr<T> extends Zen<T> {

  public enum Op {
    AND("BitwiseAnd"),
    OR("BitwiseOr"),
    XOR("BitwiseXor");

    private final String displayName;

    Op(String displayName) {
      this.displayName = displayName;
    }

    public String displayName() {
      return displayName;
    }
  }

  private record Key(long expr1, long expr2, Op op) {}

  private final Zen<T> expr1;
  private final Zen<T> expr2;
  private final Op op;

  private BitwiseBinopExpr(Zen<T> expr1, Zen<T> expr2, Op op) {
    super(expr1.type());
    this.expr1 = expr1;
    this.expr2 = expr2;
    this.op = op;
  }

  public static <T> Zen<T> create(Zen<T> expr1, Zen<T> expr2, Op op) {
    Contract.assertNotNull(expr1);
    Contract.assertNotNull(expr2);
    Contract.assertNotNull(op);
    Contract.assertTrue(expr1.type().equals(expr2.type()), "%s operands have different types %s and %s",
      op.displayName(), expr1.type(), expr2.type());
    Contract.assertTrue(expr1.type().isFixedInteger(), "%s is not supported for type %s", op.displayName(),
      expr1.type());
    Flyweight<Key, Zen<T>> table = ZenContext.current().table(NodeKind.BITWISE_BINOP);
    return table.getOrAdd(new Key(expr1.id(), expr2.id(), op), () -> simplify(expr1, expr2, op));
  }

  private static <T> Zen<T> simplify(Zen<T> expr1, Zen<T> expr2, Op op) {
    var type = expr1.type();
    if (expr1 instanceof ConstantExpr<T> c1 && expr2 instanceof ConstantExpr<T> c2) {
      T result = switch (op) {
        case AND -> Arithmetic.bitAnd(type, c1.value(), c2.value());
        case OR -> Arithmetic.bitOr(type, c1.value(), c2.value());
        case XOR -> Arithmetic.bitXor(type, c1.value(), c2.value());
      };
      return ConstantExpr.create(type, result);
    }
    if (expr1 == expr2 && op != Op.XOR) {
      return expr1;
    }
    return new BitwiseBinopExpr<>(expr1, expr2, op);
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
    return NodeKind.BITWISE_BINOP;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitBitwiseBinop(this, parameter);
  }
}

package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Arithmetic;
import com.onthegomap.zen.util.Contract;
import com.onthegomap.zen.util.Exceptions;
import com.onthegomap.zen.util.ZenException;

/** Addition, subtraction or multiplication of two values of the same arithmetic type. */
public final class ArithBinopExpr<T> extends Zen<T> {

  public enum Op {
    ADD("Add"),
    SUBTRACT("Subtract"),
    MULTIPLY("Multiply");

    private final String displayName;

    Op(String displayName) {
      this.displayName = displayName;
    }

    public String displayName() {
      return displayName;
    }

    /** Returns true if {@code (a op b) op c} equals {@code a op (b op c)}. */
    public boolean isAssociative() {
      return this != SUBTRACT;
    }
  }

  private record Key(long expr1, long expr2, Op op) {}

  private final Zen<T> expr1;
  private final Zen<T> expr2;
  private final Op op;

  private ArithBinopExpr(Zen<T> expr1, Zen<T> expr2, Op op) {
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
    Contract.assertTrue(expr1.type().isArithmetic(), "%s is not supported for type %s", op.displayName(),
      expr1.type());
    if (op == Op.MULTIPLY && expr1.type().isFixedInteger()) {
      throw new ZenException("Multiplication is not supported for fixed width type " + expr1.type());
    }
    Flyweight<Key, Zen<T>> table = ZenContext.current().table(NodeKind.ARITH_BINOP);
    return table.getOrAdd(new Key(expr1.id(), expr2.id(), op), () -> simplify(expr1, expr2, op));
  }

  private static <T> Zen<T> simplify(Zen<T> expr1, Zen<T> expr2, Op op) {
    var type = expr1.type();
    if (expr1 instanceof ConstantExpr<T> c1 && expr2 instanceof ConstantExpr<T> c2) {
      T result = switch (op) {
        case ADD -> Arithmetic.add(type, c1.value(), c2.value());
        case SUBTRACT -> Arithmetic.subtract(type, c1.value(), c2.value());
        case MULTIPLY -> Arithmetic.multiply(type, c1.value(), c2.value());
      };
      return ConstantExpr.create(type, result);
    }
    T zero = Arithmetic.zero(type);
    T one = Arithmetic.one(type);
    switch (op) {
      case ADD -> {
        if (ConstantExpr.hasValue(expr2, zero)) {
          return expr1;
        }
        if (ConstantExpr.hasValue(expr1, zero)) {
          return expr2;
        }
      }
      case SUBTRACT -> {
        if (ConstantExpr.hasValue(expr2, zero)) {
          return expr1;
        }
      }
      case MULTIPLY -> {
        if (ConstantExpr.hasValue(expr1, zero)) {
          return expr1;
        }
        if (ConstantExpr.hasValue(expr2, zero)) {
          return expr2;
        }
        if (ConstantExpr.hasValue(expr1, one)) {
          return expr2;
        }
        if (ConstantExpr.hasValue(expr2, one)) {
          return expr1;
        }
      }
      default -> throw Exceptions.unreachable(op);
    }
    return new ArithBinopExpr<>(expr1, expr2, op);
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
    return NodeKind.ARITH_BINOP;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitArithBinop(this, parameter);
  }
}

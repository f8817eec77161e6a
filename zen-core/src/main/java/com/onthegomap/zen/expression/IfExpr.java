package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.Contract;

/**
 * Guarded select: {@code trueExpr} when {@code guard} holds, otherwise {@code falseExpr}.
 * <p>
 * Unless the context {@link com.onthegomap.zen.config.ZenConfig#preserveBranches() preserves branches}, a select
 * with equal branches collapses to the branch and a boolean select with a literal {@code true} then-branch or
 * {@code false} else-branch becomes an {@code Or} or {@code And}.
 */
public final class IfExpr<T> extends Zen<T> {

  private record Key(long guard, long trueExpr, long falseExpr) {}

  private final Zen<Boolean> guard;
  private final Zen<T> trueExpr;
  private final Zen<T> falseExpr;

  private IfExpr(Zen<Boolean> guard, Zen<T> trueExpr, Zen<T> falseExpr) {
    super(trueExpr.type());
    this.guard = guard;
    this.trueExpr = trueExpr;
    this.falseExpr = falseExpr;
  }

  public static <T> Zen<T> create(Zen<Boolean> guard, Zen<T> trueExpr, Zen<T> falseExpr) {
    Contract.assertNotNull(guard);
    Contract.assertNotNull(trueExpr);
    Contract.assertNotNull(falseExpr);
    Contract.assertTrue(guard.type() == ZenType.BOOL, "If requires a bool guard");
    Contract.assertTrue(trueExpr.type().equals(falseExpr.type()), "If branches have different types %s and %s",
      trueExpr.type(), falseExpr.type());
    Flyweight<Key, Zen<T>> table = ZenContext.current().table(NodeKind.IF);
    return table.getOrAdd(new Key(guard.id(), trueExpr.id(), falseExpr.id()),
      () -> simplify(guard, trueExpr, falseExpr));
  }

  private static <T> Zen<T> simplify(Zen<Boolean> guard, Zen<T> trueExpr, Zen<T> falseExpr) {
    if (ConstantExpr.isTrue(guard)) {
      return trueExpr;
    }
    if (ConstantExpr.isFalse(guard)) {
      return falseExpr;
    }
    if (guard instanceof NotExpr not) {
      return create(not.expr(), falseExpr, trueExpr);
    }
    if (!ZenContext.current().config().preserveBranches()) {
      if (trueExpr == falseExpr) {
        return trueExpr;
      }
      if (trueExpr.type() == ZenType.BOOL) {
        if (ConstantExpr.isTrue(trueExpr)) {
          return fromBool(LogicalBinopExpr.create(guard, asBool(falseExpr), LogicalBinopExpr.Op.OR));
        }
        if (ConstantExpr.isFalse(falseExpr)) {
          return fromBool(LogicalBinopExpr.create(guard, asBool(trueExpr), LogicalBinopExpr.Op.AND));
        }
      }
    }
    return new IfExpr<>(guard, trueExpr, falseExpr);
  }

  @SuppressWarnings("unchecked")
  private static <T> Zen<Boolean> asBool(Zen<T> expr) {
    return (Zen<Boolean>) expr;
  }

  @SuppressWarnings("unchecked")
  private static <T> Zen<T> fromBool(Zen<Boolean> expr) {
    return (Zen<T>) expr;
  }

  public Zen<Boolean> guard() {
    return guard;
  }

  public Zen<T> thenExpr() {
    return trueExpr;
  }

  public Zen<T> elseExpr() {
    return falseExpr;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.IF;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitIf(this, parameter);
  }
}

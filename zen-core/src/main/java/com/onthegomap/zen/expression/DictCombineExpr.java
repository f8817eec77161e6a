package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Dict;
import com.onthegomap.zen.datatype.DictType;
import com.onthegomap.zen.datatype.SetUnit;
import com.onthegomap.zen.util.Contract;

/** Union, intersection or difference of two sets. */
public final class DictCombineExpr<K> extends Zen<Dict<K, SetUnit>> {

  public enum Op {
    UNION("Union"),
    INTERSECT("Intersect"),
    DIFFERENCE("Difference");

    private final String displayName;

    Op(String displayName) {
      this.displayName = displayName;
    }

    public String displayName() {
      return displayName;
    }

    public <K> Dict<K, SetUnit> apply(Dict<K, SetUnit> set1, Dict<K, SetUnit> set2) {
      return switch (this) {
        case UNION -> set1.union(set2);
        case INTERSECT -> set1.intersect(set2);
        case DIFFERENCE -> set1.difference(set2);
      };
    }
  }

  private record Key(long set1, long set2, Op op) {}

  private final Zen<Dict<K, SetUnit>> set1;
  private final Zen<Dict<K, SetUnit>> set2;
  private final Op op;

  private DictCombineExpr(Zen<Dict<K, SetUnit>> set1, Zen<Dict<K, SetUnit>> set2, Op op) {
    super(set1.type());
    this.set1 = set1;
    this.set2 = set2;
    this.op = op;
  }

  public static <K> Zen<Dict<K, SetUnit>> create(Zen<Dict<K, SetUnit>> set1, Zen<Dict<K, SetUnit>> set2, Op op) {
    Contract.assertNotNull(set1);
    Contract.assertNotNull(set2);
    Contract.assertNotNull(op);
    Contract.assertTrue(set1.type() instanceof DictType<?, ?> dictType && dictType.isSet(),
      "%s requires a set, not %s", op.displayName(), set1.type());
    Contract.assertTrue(set1.type().equals(set2.type()), "%s operands have different types %s and %s",
      op.displayName(), set1.type(), set2.type());
    Flyweight<Key, Zen<Dict<K, SetUnit>>> table = ZenContext.current().table(NodeKind.DICT_COMBINE);
    return table.getOrAdd(new Key(set1.id(), set2.id(), op), () -> simplify(set1, set2, op));
  }

  private static <K> Zen<Dict<K, SetUnit>> simplify(Zen<Dict<K, SetUnit>> set1, Zen<Dict<K, SetUnit>> set2, Op op) {
    if (set1 == set2) {
      return op == Op.DIFFERENCE ? empty(set1) : set1;
    }
    if (isEmptyConstant(set1)) {
      return op == Op.UNION ? set2 : set1;
    }
    if (isEmptyConstant(set2)) {
      return op == Op.INTERSECT ? set2 : set1;
    }
    if (op != Op.DIFFERENCE) {
      // a op (a op b) and (a op b) op b
      if (set1 instanceof DictCombineExpr<K> inner && inner.op == op && (inner.set1 == set2 || inner.set2 == set2)) {
        return set1;
      }
      if (set2 instanceof DictCombineExpr<K> inner && inner.op == op && (inner.set1 == set1 || inner.set2 == set1)) {
        return set2;
      }
    } else if (set1 instanceof DictCombineExpr<K> inner && inner.op == Op.DIFFERENCE) {
      if (inner.set1 == set2) {
        return empty(set1);
      }
      if (inner.set2 == set2) {
        return set1;
      }
    }
    if (set1 instanceof ConstantExpr<Dict<K, SetUnit>> c1 && set2 instanceof ConstantExpr<Dict<K, SetUnit>> c2) {
      return ConstantExpr.create(set1.type(), op.apply(c1.value(), c2.value()));
    }
    return new DictCombineExpr<>(set1, set2, op);
  }

  private static boolean isEmptyConstant(Zen<? extends Dict<?, ?>> set) {
    return set instanceof ConstantExpr<?> constant && ((Dict<?, ?>) constant.value()).isEmpty();
  }

  private static <K> Zen<Dict<K, SetUnit>> empty(Zen<Dict<K, SetUnit>> set) {
    return ConstantExpr.create(set.type(), Dict.empty());
  }

  public Zen<Dict<K, SetUnit>> set1() {
    return set1;
  }

  public Zen<Dict<K, SetUnit>> set2() {
    return set2;
  }

  public Op op() {
    return op;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.DICT_COMBINE;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitDictCombine(this, parameter);
  }
}

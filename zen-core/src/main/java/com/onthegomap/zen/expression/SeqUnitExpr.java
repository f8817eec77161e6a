package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Seq;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.Contract;

/** A sequence of exactly one element. */
public final class SeqUnitExpr<T> extends Zen<Seq<T>> {

  private final Zen<T> value;

  private SeqUnitExpr(Zen<T> value) {
    super(ZenType.seq(value.type()));
    this.value = value;
  }

  public static <T> Zen<Seq<T>> create(Zen<T> value) {
    Contract.assertNotNull(value);
    Flyweight<Long, Zen<Seq<T>>> table = ZenContext.current().table(NodeKind.SEQ_UNIT);
    return table.getOrAdd(value.id(), value, SeqUnitExpr::simplify);
  }

  private static <T> Zen<Seq<T>> simplify(Zen<T> value) {
    if (value instanceof ConstantExpr<T> constant) {
      return ConstantExpr.create(ZenType.seq(value.type()), Seq.of(constant.value()));
    }
    return new SeqUnitExpr<>(value);
  }

  public Zen<T> value() {
    return value;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.SEQ_UNIT;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitSeqUnit(this, parameter);
  }
}

package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Seq;
import com.onthegomap.zen.util.Contract;
import java.math.BigInteger;

/** The sequence holding the element at an index, empty when the index is out of range. */
public final class SeqAtExpr<T> extends Zen<Seq<T>> {

  private record Key(long seq, long index) {}

  private final Zen<Seq<T>> seq;
  private final Zen<BigInteger> index;

  private SeqAtExpr(Zen<Seq<T>> seq, Zen<BigInteger> index) {
    super(seq.type());
    this.seq = seq;
    this.index = index;
  }

  public static <T> Zen<Seq<T>> create(Zen<Seq<T>> seq, Zen<BigInteger> index) {
    Contract.assertNotNull(seq);
    SeqExprs.assertSeqType("At", seq);
    SeqExprs.assertIndex("At", index);
    Flyweight<Key, Zen<Seq<T>>> table = ZenContext.current().table(NodeKind.SEQ_AT);
    return table.getOrAdd(new Key(seq.id(), index.id()), () -> simplify(seq, index));
  }

  private static <T> Zen<Seq<T>> simplify(Zen<Seq<T>> seq, Zen<BigInteger> index) {
    if (seq instanceof ConstantExpr<Seq<T>> s && index instanceof ConstantExpr<BigInteger> i) {
      return ConstantExpr.create(seq.type(), s.value().at(SeqExprs.index(i)));
    }
    return new SeqAtExpr<>(seq, index);
  }

  public Zen<Seq<T>> seq() {
    return seq;
  }

  public Zen<BigInteger> index() {
    return index;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.SEQ_AT;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitSeqAt(this, parameter);
  }
}

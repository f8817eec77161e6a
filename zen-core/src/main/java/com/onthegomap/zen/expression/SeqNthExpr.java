package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Seq;
import com.onthegomap.zen.util.Contract;
import java.math.BigInteger;

/** The element at an index, the default value of the element type when the index is out of range. */
public final class SeqNthExpr<T> extends Zen<T> {

  private record Key(long seq, long index) {}

  private final Zen<Seq<T>> seq;
  private final Zen<BigInteger> index;

  private SeqNthExpr(Zen<Seq<T>> seq, Zen<BigInteger> index) {
    super(Zen.seqType(seq).elementType());
    this.seq = seq;
    this.index = index;
  }

  public static <T> Zen<T> create(Zen<Seq<T>> seq, Zen<BigInteger> index) {
    Contract.assertNotNull(seq);
    SeqExprs.assertSeqType("Nth", seq);
    SeqExprs.assertIndex("Nth", index);
    Flyweight<Key, Zen<T>> table = ZenContext.current().table(NodeKind.SEQ_NTH);
    return table.getOrAdd(new Key(seq.id(), index.id()), () -> simplify(seq, index));
  }

  private static <T> Zen<T> simplify(Zen<Seq<T>> seq, Zen<BigInteger> index) {
    if (seq instanceof ConstantExpr<Seq<T>> s && index instanceof ConstantExpr<BigInteger> i) {
      var elementType = Zen.seqType(seq).elementType();
      return ConstantExpr.create(elementType, s.value().nth(SeqExprs.index(i)).orElse(elementType.defaultValue()));
    }
    return new SeqNthExpr<>(seq, index);
  }

  public Zen<Seq<T>> seq() {
    return seq;
  }

  public Zen<BigInteger> index() {
    return index;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.SEQ_NTH;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitSeqNth(this, parameter);
  }
}

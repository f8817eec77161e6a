package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Seq;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.Contract;
import java.math.BigInteger;

/** First index at or after an offset where a subsequence occurs, or {@code -1}. */
public final class SeqIndexOfExpr<T> extends Zen<BigInteger> {

  private record Key(long seq, long subseq, long offset) {}

  private final Zen<Seq<T>> seq;
  private final Zen<Seq<T>> subseq;
  private final Zen<BigInteger> offset;

  private SeqIndexOfExpr(Zen<Seq<T>> seq, Zen<Seq<T>> subseq, Zen<BigInteger> offset) {
    super(ZenType.BIGINT);
    this.seq = seq;
    this.subseq = subseq;
    this.offset = offset;
  }

  public static <T> Zen<BigInteger> create(Zen<Seq<T>> seq, Zen<Seq<T>> subseq, Zen<BigInteger> offset) {
    Contract.assertNotNull(seq);
    Contract.assertNotNull(subseq);
    SeqExprs.assertSameSeqType("IndexOf", seq, subseq);
    SeqExprs.assertIndex("IndexOf", offset);
    Flyweight<Key, Zen<BigInteger>> table = ZenContext.current().table(NodeKind.SEQ_INDEX_OF);
    return table.getOrAdd(new Key(seq.id(), subseq.id(), offset.id()), () -> simplify(seq, subseq, offset));
  }

  private static <T> Zen<BigInteger> simplify(Zen<Seq<T>> seq, Zen<Seq<T>> subseq, Zen<BigInteger> offset) {
    if (seq instanceof ConstantExpr<Seq<T>> s && subseq instanceof ConstantExpr<Seq<T>> sub &&
      offset instanceof ConstantExpr<BigInteger> o) {
      return Zen.constant(BigInteger.valueOf(s.value().indexOf(sub.value(), SeqExprs.index(o))));
    }
    return new SeqIndexOfExpr<>(seq, subseq, offset);
  }

  public Zen<Seq<T>> seq() {
    return seq;
  }

  public Zen<Seq<T>> subseq() {
    return subseq;
  }

  public Zen<BigInteger> offset() {
    return offset;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.SEQ_INDEX_OF;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitSeqIndexOf(this, parameter);
  }
}

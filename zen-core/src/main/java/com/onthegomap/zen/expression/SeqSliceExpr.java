package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Seq;
import com.onthegomap.zen.util.Contract;
import java.math.BigInteger;

/** Up to {@code length} elements of a sequence starting at {@code offset}. */
public final class SeqSliceExpr<T> extends Zen<Seq<T>> {

  private record Key(long seq, long offset, long length) {}

  private final Zen<Seq<T>> seq;
  private final Zen<BigInteger> offset;
  private final Zen<BigInteger> length;

  private SeqSliceExpr(Zen<Seq<T>> seq, Zen<BigInteger> offset, Zen<BigInteger> length) {
    super(seq.type());
    this.seq = seq;
    this.offset = offset;
    this.length = length;
  }

  public static <T> Zen<Seq<T>> create(Zen<Seq<T>> seq, Zen<BigInteger> offset, Zen<BigInteger> length) {
    Contract.assertNotNull(seq);
    SeqExprs.assertSeqType("Slice", seq);
    SeqExprs.assertIndex("Slice", offset);
    SeqExprs.assertIndex("Slice", length);
    Flyweight<Key, Zen<Seq<T>>> table = ZenContext.current().table(NodeKind.SEQ_SLICE);
    return table.getOrAdd(new Key(seq.id(), offset.id(), length.id()), () -> simplify(seq, offset, length));
  }

  private static <T> Zen<Seq<T>> simplify(Zen<Seq<T>> seq, Zen<BigInteger> offset, Zen<BigInteger> length) {
    if (seq instanceof ConstantExpr<Seq<T>> s && offset instanceof ConstantExpr<BigInteger> o &&
      length instanceof ConstantExpr<BigInteger> l) {
      return ConstantExpr.create(seq.type(), s.value().slice(SeqExprs.index(o), SeqExprs.index(l)));
    }
    return new SeqSliceExpr<>(seq, offset, length);
  }

  public Zen<Seq<T>> seq() {
    return seq;
  }

  public Zen<BigInteger> offset() {
    return offset;
  }

  public Zen<BigInteger> length() {
    return length;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.SEQ_SLICE;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitSeqSlice(this, parameter);
  }
}

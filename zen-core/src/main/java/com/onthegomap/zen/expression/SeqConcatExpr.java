package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Seq;
import com.onthegomap.zen.util.Contract;

/** Concatenation of two sequences. */
public final class SeqConcatExpr<T> extends Zen<Seq<T>> {

  private record Key(long seq1, long seq2) {}

  private final Zen<Seq<T>> seq1;
  private final Zen<Seq<T>> seq2;

  private SeqConcatExpr(Zen<Seq<T>> seq1, Zen<Seq<T>> seq2) {
    super(seq1.type());
    this.seq1 = seq1;
    this.seq2 = seq2;
  }

  public static <T> Zen<Seq<T>> create(Zen<Seq<T>> seq1, Zen<Seq<T>> seq2) {
    Contract.assertNotNull(seq1);
    Contract.assertNotNull(seq2);
    SeqExprs.assertSameSeqType("Concat", seq1, seq2);
    Flyweight<Key, Zen<Seq<T>>> table = ZenContext.current().table(NodeKind.SEQ_CONCAT);
    return table.getOrAdd(new Key(seq1.id(), seq2.id()), () -> simplify(seq1, seq2));
  }

  private static <T> Zen<Seq<T>> simplify(Zen<Seq<T>> seq1, Zen<Seq<T>> seq2) {
    if (SeqExprs.isEmptyConstant(seq1)) {
      return seq2;
    }
    if (SeqExprs.isEmptyConstant(seq2)) {
      return seq1;
    }
    if (seq1 instanceof ConstantExpr<Seq<T>> c1 && seq2 instanceof ConstantExpr<Seq<T>> c2) {
      return ConstantExpr.create(seq1.type(), c1.value().concat(c2.value()));
    }
    return new SeqConcatExpr<>(seq1, seq2);
  }

  public Zen<Seq<T>> seq1() {
    return seq1;
  }

  public Zen<Seq<T>> seq2() {
    return seq2;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.SEQ_CONCAT;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitSeqConcat(this, parameter);
  }
}

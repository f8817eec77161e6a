package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Seq;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.Contract;
import java.math.BigInteger;

/** Number of elements in a sequence. */
public final class SeqLengthExpr<T> extends Zen<BigInteger> {

  private final Zen<Seq<T>> seq;

  private SeqLengthExpr(Zen<Seq<T>> seq) {
    super(ZenType.BIGINT);
    this.seq = seq;
  }

  public static <T> Zen<BigInteger> create(Zen<Seq<T>> seq) {
    Contract.assertNotNull(seq);
    SeqExprs.assertSeqType("Length", seq);
    Flyweight<Long, Zen<BigInteger>> table = ZenContext.current().table(NodeKind.SEQ_LENGTH);
    return table.getOrAdd(seq.id(), seq, SeqLengthExpr::simplify);
  }

  private static <T> Zen<BigInteger> simplify(Zen<Seq<T>> seq) {
    if (seq instanceof ConstantExpr<Seq<T>> constant) {
      return Zen.constant(BigInteger.valueOf(constant.value().length()));
    }
    return new SeqLengthExpr<>(seq);
  }

  public Zen<Seq<T>> seq() {
    return seq;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.SEQ_LENGTH;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitSeqLength(this, parameter);
  }
}

package com.onthegomap.zen.expression;

import com.onthegomap.zen.datatype.Arithmetic;
import com.onthegomap.zen.datatype.Seq;
import com.onthegomap.zen.datatype.SeqType;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.Contract;
import java.math.BigInteger;

/** Argument checks and constant tests shared by the sequence node kinds. */
final class SeqExprs {
  private SeqExprs() {}

  static <T> SeqType<T> assertSeqType(String operation, Zen<Seq<T>> seq) {
    Contract.assertTrue(seq.type() instanceof SeqType, "%s requires a sequence, not %s", operation, seq.type());
    return Zen.seqType(seq);
  }

  static <T> void assertSameSeqType(String operation, Zen<Seq<T>> seq1, Zen<Seq<T>> seq2) {
    assertSeqType(operation, seq1);
    Contract.assertTrue(seq1.type().equals(seq2.type()), "%s operands have different types %s and %s", operation,
      seq1.type(), seq2.type());
  }

  static void assertIndex(String operation, Zen<BigInteger> index) {
    Contract.assertNotNull(index);
    Contract.assertTrue(index.type() == ZenType.BIGINT, "%s requires a bigint index, not %s", operation,
      index.type());
  }

  static boolean isEmptyConstant(Zen<? extends Seq<?>> seq) {
    return seq instanceof ConstantExpr<?> constant && ((Seq<?>) constant.value()).isEmpty();
  }

  /** Returns the value of a constant index clamped to the int range, see {@link Arithmetic#clampToInt}. */
  static int index(ConstantExpr<BigInteger> index) {
    return Arithmetic.clampToInt(index.value());
  }
}

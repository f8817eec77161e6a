package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Seq;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.Contract;

/** Tests whether a sequence contains, starts with or ends with another. */
public final class SeqContainsExpr<T> extends Zen<Boolean> {

  public enum Containment {
    CONTAINS("Contains"),
    HAS_PREFIX("HasPrefix"),
    HAS_SUFFIX("HasSuffix");

    private final String displayName;

    Containment(String displayName) {
      this.displayName = displayName;
    }

    public String displayName() {
      return displayName;
    }

    public <T> boolean test(Seq<T> seq, Seq<T> subseq) {
      return switch (this) {
        case CONTAINS -> seq.contains(subseq);
        case HAS_PREFIX -> seq.hasPrefix(subseq);
        case HAS_SUFFIX -> seq.hasSuffix(subseq);
      };
    }
  }

  private record Key(long seq, long subseq, Containment containment) {}

  private final Zen<Seq<T>> seq;
  private final Zen<Seq<T>> subseq;
  private final Containment containment;

  private SeqContainsExpr(Zen<Seq<T>> seq, Zen<Seq<T>> subseq, Containment containment) {
    super(ZenType.BOOL);
    this.seq = seq;
    this.subseq = subseq;
    this.containment = containment;
  }

  public static <T> Zen<Boolean> create(Zen<Seq<T>> seq, Zen<Seq<T>> subseq, Containment containment) {
    Contract.assertNotNull(seq);
    Contract.assertNotNull(subseq);
    Contract.assertNotNull(containment);
    SeqExprs.assertSameSeqType(containment.displayName(), seq, subseq);
    Flyweight<Key, Zen<Boolean>> table = ZenContext.current().table(NodeKind.SEQ_CONTAINS);
    return table.getOrAdd(new Key(seq.id(), subseq.id(), containment), () -> simplify(seq, subseq, containment));
  }

  private static <T> Zen<Boolean> simplify(Zen<Seq<T>> seq, Zen<Seq<T>> subseq, Containment containment) {
    if (seq == subseq || SeqExprs.isEmptyConstant(subseq)) {
      return ConstantExpr.TRUE;
    }
    if (seq instanceof ConstantExpr<Seq<T>> s && subseq instanceof ConstantExpr<Seq<T>> sub) {
      return Zen.constant(containment.test(s.value(), sub.value()));
    }
    return new SeqContainsExpr<>(seq, subseq, containment);
  }

  public Zen<Seq<T>> seq() {
    return seq;
  }

  public Zen<Seq<T>> subseq() {
    return subseq;
  }

  public Containment containment() {
    return containment;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.SEQ_CONTAINS;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitSeqContains(this, parameter);
  }
}

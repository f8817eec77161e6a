package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Seq;
import com.onthegomap.zen.util.Contract;

/** A sequence with the first occurrence of {@code match} replaced, an empty match prepends the replacement. */
public final class SeqReplaceFirstExpr<T> extends Zen<Seq<T>> {

  private record Key(long seq, long match, long replacement) {}

  private final Zen<Seq<T>> seq;
  private final Zen<Seq<T>> match;
  private final Zen<Seq<T>> replacement;

  private SeqReplaceFirstExpr(Zen<Seq<T>> seq, Zen<Seq<T>> match, Zen<Seq<T>> replacement) {
    super(seq.type());
    this.seq = seq;
    this.match = match;
    this.replacement = replacement;
  }

  public static <T> Zen<Seq<T>> create(Zen<Seq<T>> seq, Zen<Seq<T>> match, Zen<Seq<T>> replacement) {
    Contract.assertNotNull(seq);
    Contract.assertNotNull(match);
    Contract.assertNotNull(replacement);
    SeqExprs.assertSameSeqType("ReplaceFirst", seq, match);
    SeqExprs.assertSameSeqType("ReplaceFirst", seq, replacement);
    Flyweight<Key, Zen<Seq<T>>> table = ZenContext.current().table(NodeKind.SEQ_REPLACE_FIRST);
    return table.getOrAdd(new Key(seq.id(), match.id(), replacement.id()), () -> simplify(seq, match, replacement));
  }

  private static <T> Zen<Seq<T>> simplify(Zen<Seq<T>> seq, Zen<Seq<T>> match, Zen<Seq<T>> replacement) {
    if (seq instanceof ConstantExpr<Seq<T>> s && match instanceof ConstantExpr<Seq<T>> m &&
      replacement instanceof ConstantExpr<Seq<T>> r) {
      return ConstantExpr.create(seq.type(), s.value().replaceFirst(m.value(), r.value()));
    }
    return new SeqReplaceFirstExpr<>(seq, match, replacement);
  }

  public Zen<Seq<T>> seq() {
    return seq;
  }

  public Zen<Seq<T>> match() {
    return match;
  }

  public Zen<Seq<T>> replacement() {
    return replacement;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.SEQ_REPLACE_FIRST;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitSeqReplaceFirst(this, parameter);
  }
}

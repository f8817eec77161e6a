package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.FSeq;
import com.onthegomap.zen.datatype.FSeqType;
import com.onthegomap.zen.util.Contract;

/** A list with one element added in front. */
public final class FSeqAddFrontExpr<T> extends Zen<FSeq<T>> {

  private record Key(long list, long element) {}

  private final Zen<FSeq<T>> list;
  private final Zen<T> element;

  private FSeqAddFrontExpr(Zen<FSeq<T>> list, Zen<T> element) {
    super(list.type());
    this.list = list;
    this.element = element;
  }

  public static <T> Zen<FSeq<T>> create(Zen<FSeq<T>> list, Zen<T> element) {
    Contract.assertNotNull(list);
    Contract.assertNotNull(element);
    Contract.assertTrue(list.type() instanceof FSeqType, "AddFront requires a list, not %s", list.type());
    Contract.assertTrue(Zen.fseqType(list).elementType().equals(element.type()),
      "Element of type %s cannot be added to %s", element.type(), list.type());
    Flyweight<Key, Zen<FSeq<T>>> table = ZenContext.current().table(NodeKind.FSEQ_ADD_FRONT);
    return table.getOrAdd(new Key(list.id(), element.id()), () -> new FSeqAddFrontExpr<>(list, element));
  }

  public Zen<FSeq<T>> list() {
    return list;
  }

  public Zen<T> element() {
    return element;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.FSEQ_ADD_FRONT;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitFSeqAddFront(this, parameter);
  }
}

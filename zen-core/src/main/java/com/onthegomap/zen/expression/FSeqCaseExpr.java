package com.onthegomap.zen.expression;

import com.google.common.base.Suppliers;
import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.FSeq;
import com.onthegomap.zen.datatype.FSeqType;
import com.onthegomap.zen.util.Contract;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * Case split on a list: {@code emptyCase} when the list is empty, otherwise the cons case built from the head and tail.
 * <p>
 * The cons case is built once, lazily, against fresh {@link ParameterExpr parameters} for the head and tail, so a
 * cons function that recurses over the tail does not build its body while the node is being interned.
 */
public final class FSeqCaseExpr<T, U> extends Zen<U> {

  private record Key(long list, long emptyCase, Object consCase) {}

  private final Zen<FSeq<T>> list;
  private final Zen<U> emptyCase;
  private final ParameterExpr<T> head;
  private final ParameterExpr<FSeq<T>> tail;
  private final Supplier<Zen<U>> consCase;

  private FSeqCaseExpr(Zen<FSeq<T>> list, Zen<U> emptyCase, BiFunction<Zen<T>, Zen<FSeq<T>>, Zen<U>> cons) {
    super(emptyCase.type());
    this.list = list;
    this.emptyCase = emptyCase;
    this.head = ParameterExpr.create(Zen.fseqType(list).elementType());
    this.tail = ParameterExpr.create(list.type());
    this.consCase = Suppliers.memoize(() -> {
      Zen<U> result = Contract.assertNotNull(cons.apply(head, tail));
      Contract.assertTrue(result.type().equals(emptyCase.type()), "Case branches have different types %s and %s",
        emptyCase.type(), result.type());
      return result;
    });
  }

  public static <T, U> Zen<U> create(Zen<FSeq<T>> list, Zen<U> emptyCase,
    BiFunction<Zen<T>, Zen<FSeq<T>>, Zen<U>> cons) {
    Contract.assertNotNull(list);
    Contract.assertNotNull(emptyCase);
    Contract.assertNotNull(cons);
    Contract.assertTrue(list.type() instanceof FSeqType, "Case requires a list, not %s", list.type());
    Flyweight<Key, Zen<U>> table = ZenContext.current().table(NodeKind.FSEQ_CASE);
    return table.getOrAdd(new Key(list.id(), emptyCase.id(), cons), () -> simplify(list, emptyCase, cons));
  }

  private static <T, U> Zen<U> simplify(Zen<FSeq<T>> list, Zen<U> emptyCase,
    BiFunction<Zen<T>, Zen<FSeq<T>>, Zen<U>> cons) {
    if (list instanceof ConstantExpr<FSeq<T>> constant) {
      FSeq<T> value = constant.value();
      if (value.isEmpty()) {
        return emptyCase;
      }
      var elementType = Zen.fseqType(list).elementType();
      return cons.apply(ConstantExpr.create(elementType, value.head()), ConstantExpr.create(list.type(), value.tail()));
    }
    if (list instanceof FSeqAddFrontExpr<T> addFront) {
      return cons.apply(addFront.element(), addFront.list());
    }
    return new FSeqCaseExpr<>(list, emptyCase, cons);
  }

  public Zen<FSeq<T>> list() {
    return list;
  }

  public Zen<U> emptyCase() {
    return emptyCase;
  }

  /** Returns the parameter standing for the first element in {@link #consCase()}. */
  public ParameterExpr<T> head() {
    return head;
  }

  /** Returns the parameter standing for the remaining elements in {@link #consCase()}. */
  public ParameterExpr<FSeq<T>> tail() {
    return tail;
  }

  public Zen<U> consCase() {
    return consCase.get();
  }

  @Override
  public NodeKind kind() {
    return NodeKind.FSEQ_CASE;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitFSeqCase(this, parameter);
  }
}

package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.util.Contract;

/** Application of a {@link ZenLambda} to an argument. */
public final class ApplyExpr<A, B> extends Zen<B> {

  private record Key(ZenLambda<?, ?> lambda, long argument) {}

  private final ZenLambda<A, B> lambda;
  private final Zen<A> argument;

  private ApplyExpr(ZenLambda<A, B> lambda, Zen<A> argument) {
    super(lambda.resultType());
    this.lambda = lambda;
    this.argument = argument;
  }

  public static <A, B> Zen<B> create(ZenLambda<A, B> lambda, Zen<A> argument) {
    Contract.assertNotNull(lambda);
    Contract.assertNotNull(argument);
    Contract.assertTrue(lambda.argumentType().equals(argument.type()), "Lambda expecting %s applied to %s",
      lambda.argumentType(), argument.type());
    Flyweight<Key, Zen<B>> table = ZenContext.current().table(NodeKind.APPLY);
    return table.getOrAdd(new Key(lambda, argument.id()), () -> new ApplyExpr<>(lambda, argument));
  }

  public ZenLambda<A, B> lambda() {
    return lambda;
  }

  public Zen<A> argument() {
    return argument;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.APPLY;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitApply(this, parameter);
  }
}

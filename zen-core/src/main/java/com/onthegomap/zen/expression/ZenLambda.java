package com.onthegomap.zen.expression;

import com.google.common.base.Suppliers;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.Contract;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A function over expressions, compared by identity.
 * <p>
 * The body is built once, on first use, by applying the Java function to a fresh {@link ParameterExpr}. Declaring the
 * result type up front with {@link #of(ZenType, ZenType, Function)} lets a recursive function apply itself before its
 * body exists.
 */
public final class ZenLambda<A, B> {

  private final ZenType<A> argumentType;
  private final ZenType<B> resultType;
  private final ParameterExpr<A> parameter;
  private final Supplier<Zen<B>> body;

  private ZenLambda(ZenType<A> argumentType, ZenType<B> resultType, Function<Zen<A>, Zen<B>> function) {
    this.argumentType = argumentType;
    this.resultType = resultType;
    this.parameter = ParameterExpr.create(argumentType);
    this.body = Suppliers.memoize(() -> {
      Zen<B> result = Contract.assertNotNull(function.apply(parameter));
      Contract.assertTrue(resultType == null || resultType.equals(result.type()),
        "Lambda declared to return %s returned %s", resultType, result.type());
      return result;
    });
  }

  public static <A, B> ZenLambda<A, B> of(ZenType<A> argumentType, Function<Zen<A>, Zen<B>> function) {
    return new ZenLambda<>(Contract.assertNotNull(argumentType), null, Contract.assertNotNull(function));
  }

  public static <A, B> ZenLambda<A, B> of(ZenType<A> argumentType, ZenType<B> resultType,
    Function<Zen<A>, Zen<B>> function) {
    return new ZenLambda<>(Contract.assertNotNull(argumentType), Contract.assertNotNull(resultType),
      Contract.assertNotNull(function));
  }

  public ZenType<A> argumentType() {
    return argumentType;
  }

  /** Returns the declared result type, or the type of the body when none was declared. */
  public ZenType<B> resultType() {
    return resultType != null ? resultType : body().type();
  }

  public ParameterExpr<A> parameter() {
    return parameter;
  }

  public Zen<B> body() {
    return body.get();
  }

  /** Returns this function applied to {@code argument}. */
  public Zen<B> apply(Zen<A> argument) {
    return ApplyExpr.create(this, argument);
  }

  @Override
  public String toString() {
    return "ZenLambda[" + parameter.name() + ": " + argumentType + "]";
  }
}

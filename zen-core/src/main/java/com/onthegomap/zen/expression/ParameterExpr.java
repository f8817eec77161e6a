package com.onthegomap.zen.expression;

import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.Contract;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Placeholder for the argument of a {@link ZenLambda} or the head and tail bound by an {@link FSeqCaseExpr}, replaced
 * by a value when the body is evaluated.
 */
public final class ParameterExpr<T> extends Zen<T> {

  private static final AtomicLong NEXT_NAME = new AtomicLong();

  private final String name;

  private ParameterExpr(ZenType<T> type, String name) {
    super(type);
    this.name = name;
  }

  public static <T> ParameterExpr<T> create(ZenType<T> type) {
    Contract.assertNotNull(type);
    return new ParameterExpr<>(type, "arg" + NEXT_NAME.incrementAndGet());
  }

  public String name() {
    return name;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.PARAMETER;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitParameter(this, parameter);
  }
}

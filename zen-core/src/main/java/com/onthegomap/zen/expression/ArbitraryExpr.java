package com.onthegomap.zen.expression;

import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.Contract;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A free symbolic variable. Every call to {@link #create} returns a distinct variable, even for the same name.
 */
public final class ArbitraryExpr<T> extends Zen<T> {

  private static final AtomicLong NEXT_NAME = new AtomicLong();

  private final String name;

  private ArbitraryExpr(ZenType<T> type, String name) {
    super(type);
    this.name = name;
  }

  public static <T> ArbitraryExpr<T> create(ZenType<T> type, String name) {
    Contract.assertNotNull(type);
    Contract.assertNotNull(name);
    return new ArbitraryExpr<>(type, name);
  }

  public static <T> ArbitraryExpr<T> create(ZenType<T> type) {
    return create(type, "arbitrary_" + NEXT_NAME.incrementAndGet());
  }

  public String name() {
    return name;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.ARBITRARY;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitArbitrary(this, parameter);
  }
}

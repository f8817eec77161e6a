package com.onthegomap.zen.interpreter;

import com.carrotsearch.hppc.LongObjectHashMap;
import com.onthegomap.zen.expression.ArbitraryExpr;
import com.onthegomap.zen.expression.ParameterExpr;
import com.onthegomap.zen.expression.Zen;
import com.onthegomap.zen.util.Contract;
import javax.annotation.concurrent.Immutable;

/**
 * Values assigned to the free variables and bound parameters of an expression, keyed by node {@link Zen#id() id}.
 */
@Immutable
public final class Environment {

  private static final Environment EMPTY = new Environment(new LongObjectHashMap<>(), new LongObjectHashMap<>());

  private final LongObjectHashMap<Object> arbitraries;
  private final LongObjectHashMap<Object> parameters;

  private Environment(LongObjectHashMap<Object> arbitraries, LongObjectHashMap<Object> parameters) {
    this.arbitraries = arbitraries;
    this.parameters = parameters;
  }

  public static Environment empty() {
    return EMPTY;
  }

  /** Returns a copy of this environment where the free variable {@code arbitrary} has {@code value}. */
  public <T> Environment with(Zen<T> arbitrary, T value) {
    Contract.assertTrue(arbitrary instanceof ArbitraryExpr, "Only free variables can be assigned, not %s",
      arbitrary.kind());
    assertValue(arbitrary, value);
    LongObjectHashMap<Object> copy = new LongObjectHashMap<>(arbitraries);
    copy.put(arbitrary.id(), value);
    return new Environment(copy, parameters);
  }

  /** Returns a copy of this environment where {@code parameter} is bound to {@code value}. */
  public <T> Environment bind(ParameterExpr<T> parameter, T value) {
    assertValue(parameter, value);
    LongObjectHashMap<Object> copy = new LongObjectHashMap<>(parameters);
    copy.put(parameter.id(), value);
    return new Environment(arbitraries, copy);
  }

  private static void assertValue(Zen<?> variable, Object value) {
    Contract.assertNotNull(value);
    Contract.assertTrue(variable.type().isInstance(value), "Value %s is not a %s", value, variable.type());
  }

  /** Returns the value assigned to {@code arbitrary}, or the default value of its type if there is none. */
  @SuppressWarnings("unchecked")
  public <T> T valueOf(ArbitraryExpr<T> arbitrary) {
    Object value = arbitraries.get(arbitrary.id());
    return value == null ? arbitrary.type().defaultValue() : (T) value;
  }

  /** Returns the value bound to {@code parameter}, or {@code null} if it is unbound. */
  @SuppressWarnings("unchecked")
  public <T> T valueOf(ParameterExpr<T> parameter) {
    return (T) parameters.get(parameter.id());
  }

  /** Returns true if {@code arbitrary} was given a value. */
  public boolean isAssigned(ArbitraryExpr<?> arbitrary) {
    return arbitraries.containsKey(arbitrary.id());
  }

  public int size() {
    return arbitraries.size() + parameters.size();
  }
}

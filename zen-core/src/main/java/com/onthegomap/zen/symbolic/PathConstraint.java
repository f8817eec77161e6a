package com.onthegomap.zen.symbolic;

import com.google.common.collect.ImmutableSet;
import com.onthegomap.zen.expression.Zen;
import com.onthegomap.zen.util.Contract;
import java.util.List;
import javax.annotation.concurrent.Immutable;

/**
 * The conjunction of branch conditions that hold along one execution path through an expression.
 */
@Immutable
public final class PathConstraint {

  private static final PathConstraint EMPTY = new PathConstraint(ImmutableSet.of());

  private final ImmutableSet<Zen<Boolean>> conjuncts;

  private PathConstraint(ImmutableSet<Zen<Boolean>> conjuncts) {
    this.conjuncts = conjuncts;
  }

  public static PathConstraint empty() {
    return EMPTY;
  }

  /** Returns this constraint with {@code condition} also required to hold. */
  public PathConstraint add(Zen<Boolean> condition) {
    Contract.assertNotNull(condition);
    if (conjuncts.contains(condition)) {
      return this;
    }
    return new PathConstraint(ImmutableSet.<Zen<Boolean>>builder().addAll(conjuncts).add(condition).build());
  }

  /** Returns the constraint requiring the conditions of both {@code this} and {@code other}. */
  public PathConstraint union(PathConstraint other) {
    if (other.conjuncts.isEmpty() || conjuncts.containsAll(other.conjuncts)) {
      return this;
    }
    if (conjuncts.isEmpty()) {
      return other;
    }
    return new PathConstraint(ImmutableSet.<Zen<Boolean>>builder().addAll(conjuncts).addAll(other.conjuncts).build());
  }

  /** Returns the conditions in the order they were added. */
  public ImmutableSet<Zen<Boolean>> conjuncts() {
    return conjuncts;
  }

  public boolean isEmpty() {
    return conjuncts.isEmpty();
  }

  /** Returns the conjunction of every condition as one expression, {@code true} if there are none. */
  public Zen<Boolean> toExpression() {
    return Zen.and(List.copyOf(conjuncts));
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof PathConstraint other && conjuncts.equals(other.conjuncts));
  }

  @Override
  public int hashCode() {
    return conjuncts.hashCode();
  }

  @Override
  public String toString() {
    return "PathConstraint" + conjuncts;
  }
}

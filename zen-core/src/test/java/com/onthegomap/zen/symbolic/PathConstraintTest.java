package com.onthegomap.zen.symbolic;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.expression.Zen;
import com.onthegomap.zen.util.ZenException;
import java.util.List;
import org.junit.jupiter.api.Test;

class PathConstraintTest {

  private final Zen<Boolean> p = Zen.arbitrary(ZenType.BOOL, "p");
  private final Zen<Boolean> q = Zen.arbitrary(ZenType.BOOL, "q");

  @Test
  void testEmpty() {
    PathConstraint empty = PathConstraint.empty();
    assertTrue(empty.isEmpty());
    assertSame(Zen.trueExpr(), empty.toExpression());
  }

  @Test
  void testAddKeepsOrderAndSkipsDuplicates() {
    PathConstraint constraint = PathConstraint.empty().add(q).add(p);
    assertEquals(List.of(q, p), List.copyOf(constraint.conjuncts()));
    assertSame(constraint, constraint.add(p));
    assertThrows(ZenException.class, () -> PathConstraint.empty().add(null));
  }

  @Test
  void testEqualityIgnoresOrder() {
    assertEquals(PathConstraint.empty().add(p).add(q), PathConstraint.empty().add(q).add(p));
    assertEquals(PathConstraint.empty().add(p).add(q).hashCode(), PathConstraint.empty().add(q).add(p).hashCode());
    assertNotEquals(PathConstraint.empty().add(p), PathConstraint.empty().add(Zen.not(p)));
  }

  @Test
  void testUnion() {
    PathConstraint onlyP = PathConstraint.empty().add(p);
    PathConstraint onlyQ = PathConstraint.empty().add(q);
    assertSame(onlyP, onlyP.union(PathConstraint.empty()));
    assertSame(onlyQ, PathConstraint.empty().union(onlyQ));
    assertSame(onlyP, onlyP.union(onlyP));
    assertEquals(List.of(p, q), List.copyOf(onlyP.union(onlyQ).conjuncts()));
  }

  @Test
  void testToExpression() {
    assertSame(p, PathConstraint.empty().add(p).toExpression());
    assertSame(Zen.and(p, q), PathConstraint.empty().add(p).add(q).toExpression());
    assertTrue(PathConstraint.empty().add(p).toString().startsWith("PathConstraint"));
  }
}

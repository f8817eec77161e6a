package com.onthegomap.zen.symbolic;

import static com.onthegomap.zen.expression.Zen.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.zen.datatype.FSeq;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.expression.Zen;
import com.onthegomap.zen.interpreter.Environment;
import com.onthegomap.zen.interpreter.ExpressionEvaluator;
import java.math.BigInteger;
import java.util.List;
import org.junit.jupiter.api.Test;

class PathExplorerTest {

  private final Zen<Boolean> p = arbitrary(ZenType.BOOL, "p");
  private final Zen<Boolean> q = arbitrary(ZenType.BOOL, "q");
  private final Zen<BigInteger> x = arbitrary(ZenType.BIGINT, "x");
  private final Zen<BigInteger> y = arbitrary(ZenType.BIGINT, "y");

  @SafeVarargs
  private static PathConstraint path(Zen<Boolean>... conditions) {
    PathConstraint result = PathConstraint.empty();
    for (Zen<Boolean> condition : conditions) {
      result = result.add(condition);
    }
    return result;
  }

  @Test
  void testLeafHasOneEmptyPath() {
    assertEquals(List.of(PathConstraint.empty()), PathExplorer.explore(x));
    assertEquals(List.of(PathConstraint.empty()), PathExplorer.explore(plus(x, y)));
    assertEquals(List.of(PathConstraint.empty()), PathExplorer.explore(constant(1)));
  }

  @Test
  void testIfForksOnGuard() {
    assertEquals(List.of(path(p), path(not(p))), PathExplorer.explore(ifThenElse(p, x, y)));
  }

  @Test
  void testNestedIf() {
    assertEquals(List.of(path(p, q), path(p, not(q)), path(not(p))),
      PathExplorer.explore(ifThenElse(p, ifThenElse(q, x, y), y)));
  }

  @Test
  void testAndShortCircuits() {
    assertEquals(List.of(path(not(p)), path(p, not(q)), path(p, q)), PathExplorer.explore(and(p, q)));
  }

  @Test
  void testOrShortCircuits() {
    assertEquals(List.of(path(p), path(not(p), q), path(not(p), not(q))), PathExplorer.explore(or(p, q)));
  }

  @Test
  void testOperandsCompose() {
    Zen<BigInteger> expression = plus(ifThenElse(p, x, y), ifThenElse(q, x, y));
    assertEquals(List.of(path(p, q), path(p, not(q)), path(not(p), q), path(not(p), not(q))),
      PathExplorer.explore(expression));
  }

  @Test
  void testGuardPathsMultiplyBranches() {
    assertEquals(6, PathExplorer.explore(ifThenElse(and(p, q), x, y)).size());
  }

  @Test
  void testApplyExploresArgument() {
    var identity = lambda(ZenType.BIGINT, (Zen<BigInteger> a) -> a);
    assertEquals(2, PathExplorer.explore(apply(identity, ifThenElse(p, x, y))).size());
  }

  @Test
  void testListCaseExploresListAndEmptyCase() {
    Zen<FSeq<BigInteger>> list = arbitrary(ZenType.fseq(ZenType.BIGINT), "list");
    Zen<BigInteger> expression = caseOf(list, ifThenElse(p, x, y), (head, tail) -> head);
    assertEquals(List.of(path(p), path(not(p))), PathExplorer.explore(expression));
  }

  @Test
  void testEvaluatedPathIsExplored() {
    Zen<BigInteger> expression = ifThenElse(p, ifThenElse(q, x, y), y);
    List<PathConstraint> paths = PathExplorer.explore(expression);
    for (boolean a : new boolean[]{false, true}) {
      for (boolean b : new boolean[]{false, true}) {
        ExpressionEvaluator evaluator = new ExpressionEvaluator(Environment.empty().with(p, a).with(q, b), true);
        evaluator.evaluate(expression);
        assertTrue(paths.contains(evaluator.pathConstraint()), evaluator.pathConstraint().toString());
      }
    }
  }
}

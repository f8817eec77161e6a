package com.onthegomap.zen.interpreter;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.expression.ArbitraryExpr;
import com.onthegomap.zen.expression.Zen;
import com.onthegomap.zen.expression.ZenLambda;
import com.onthegomap.zen.util.ZenException;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class EnvironmentTest {

  private final ArbitraryExpr<BigInteger> x = (ArbitraryExpr<BigInteger>) Zen.arbitrary(ZenType.BIGINT, "x");
  private final ArbitraryExpr<Integer> i = (ArbitraryExpr<Integer>) Zen.arbitrary(ZenType.INT, "i");

  @Test
  void testUnassignedUsesDefault() {
    Environment environment = Environment.empty();
    assertEquals(BigInteger.ZERO, environment.valueOf(x));
    assertEquals(0, environment.valueOf(i));
    assertFalse(environment.isAssigned(x));
    assertEquals(0, environment.size());
  }

  @Test
  void testWithReturnsCopy() {
    Environment empty = Environment.empty();
    Environment assigned = empty.with(x, BigInteger.TEN);
    assertEquals(BigInteger.TEN, assigned.valueOf(x));
    assertTrue(assigned.isAssigned(x));
    assertFalse(empty.isAssigned(x));

    Environment reassigned = assigned.with(x, BigInteger.TWO).with(i, 7);
    assertEquals(BigInteger.TWO, reassigned.valueOf(x));
    assertEquals(7, reassigned.valueOf(i));
    assertEquals(BigInteger.TEN, assigned.valueOf(x));
    assertEquals(2, reassigned.size());
  }

  @Test
  void testBindParameter() {
    ZenLambda<BigInteger, BigInteger> identity = Zen.lambda(ZenType.BIGINT, a -> a);
    Environment environment = Environment.empty();
    assertNull(environment.valueOf(identity.parameter()));
    Environment bound = environment.bind(identity.parameter(), BigInteger.ONE);
    assertEquals(BigInteger.ONE, bound.valueOf(identity.parameter()));
    assertEquals(1, bound.size());
  }

  @Test
  @SuppressWarnings({"unchecked", "rawtypes"})
  void testRejectsInvalidAssignments() {
    Environment environment = Environment.empty();
    Zen<BigInteger> sum = Zen.plus(x, Zen.constant(BigInteger.ONE));
    assertThrows(ZenException.class, () -> environment.with(sum, BigInteger.ONE));
    assertThrows(ZenException.class, () -> environment.with(x, null));
    assertThrows(ZenException.class, () -> environment.with((Zen) x, "not a number"));
  }
}

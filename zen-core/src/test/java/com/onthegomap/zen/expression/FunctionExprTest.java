package com.onthegomap.zen.expression;

import static com.onthegomap.zen.expression.Zen.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.zen.datatype.FSeq;
import com.onthegomap.zen.datatype.FSeqType;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.ZenException;
import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import org.junit.jupiter.api.Test;

class FunctionExprTest {

  private static final FSeqType<Integer> LIST = ZenType.fseq(ZenType.INT);
  private static final BiFunction<Zen<Integer>, Zen<FSeq<Integer>>, Zen<Integer>> HEAD = (head, tail) -> head;

  private final Zen<FSeq<Integer>> list = arbitrary(LIST, "list");
  private final Zen<Integer> v = arbitrary(ZenType.INT, "v");

  @Test
  void testCaseOfEmptyConstant() {
    assertSame(constant(-1), caseOf(fseqEmpty(ZenType.INT), constant(-1), HEAD));
  }

  @Test
  void testCaseOfNonEmptyConstant() {
    assertSame(constant(1), caseOf(constant(LIST, FSeq.of(1, 2)), constant(-1), HEAD));
    assertSame(constant(LIST, FSeq.of(2)),
      caseOf(constant(LIST, FSeq.of(1, 2)), fseqEmpty(ZenType.INT), (head, tail) -> tail));
  }

  @Test
  void testCaseOfAddFront() {
    assertSame(v, caseOf(addFront(list, v), constant(-1), HEAD));
    assertSame(list, caseOf(addFront(list, v), fseqEmpty(ZenType.INT), (head, tail) -> tail));
  }

  @Test
  void testCaseOfSymbolicList() {
    Zen<Integer> result = caseOf(list, constant(-1), HEAD);
    FSeqCaseExpr<?, ?> caseExpr = assertInstanceOf(FSeqCaseExpr.class, result);
    assertSame(caseExpr.head(), caseExpr.consCase());
    assertSame(list, caseExpr.list());
    assertSame(constant(-1), caseExpr.emptyCase());
    assertSame(result, caseOf(list, constant(-1), HEAD));
    assertNotSame(result, caseOf(list, constant(-1), (head, tail) -> head));
  }

  @Test
  void testConsCaseBuiltOnce() {
    AtomicInteger calls = new AtomicInteger();
    Zen<Integer> result = caseOf(list, constant(-1), (head, tail) -> {
      calls.incrementAndGet();
      return plus(head, constant(1));
    });
    assertEquals(0, calls.get());
    FSeqCaseExpr<?, ?> caseExpr = (FSeqCaseExpr<?, ?>) result;
    assertSame(caseExpr.consCase(), caseExpr.consCase());
    assertEquals(1, calls.get());
  }

  @Test
  @SuppressWarnings({"unchecked", "rawtypes"})
  void testCaseBranchTypesMustMatch() {
    BiFunction returnsHead = (head, tail) -> head;
    Zen<Boolean> result = caseOf(list, trueExpr(), returnsHead);
    FSeqCaseExpr<?, ?> caseExpr = assertInstanceOf(FSeqCaseExpr.class, result);
    assertThrows(ZenException.class, caseExpr::consCase);
  }

  @Test
  void testLambda() {
    AtomicInteger calls = new AtomicInteger();
    ZenLambda<BigInteger, BigInteger> increment = lambda(ZenType.BIGINT, a -> {
      calls.incrementAndGet();
      return plus(a, constant(BigInteger.ONE));
    });
    Zen<BigInteger> x = arbitrary(ZenType.BIGINT, "x");
    Zen<BigInteger> applied = apply(increment, x);
    assertSame(applied, apply(increment, x));
    assertSame(applied, increment.apply(x));
    assertEquals(ZenType.BIGINT, applied.type());
    ApplyExpr<?, ?> apply = assertInstanceOf(ApplyExpr.class, applied);
    assertSame(increment, apply.lambda());
    assertSame(x, apply.argument());

    assertSame(increment.body(), increment.body());
    assertEquals(1, calls.get());
    ArithBinopExpr<?> body = assertInstanceOf(ArithBinopExpr.class, increment.body());
    assertSame(increment.parameter(), body.expr1());
    assertTrue(increment.parameter().name().startsWith("arg"));
  }

  @Test
  void testLambdasCompareByIdentity() {
    Zen<BigInteger> x = arbitrary(ZenType.BIGINT, "x");
    ZenLambda<BigInteger, BigInteger> f = lambda(ZenType.BIGINT, a -> a);
    ZenLambda<BigInteger, BigInteger> g = lambda(ZenType.BIGINT, a -> a);
    assertNotSame(apply(f, x), apply(g, x));
  }

  @Test
  void testDeclaredResultType() {
    ZenLambda<BigInteger, Boolean> positive = ZenLambda.of(ZenType.BIGINT, ZenType.BOOL,
      a -> gt(a, constant(BigInteger.ZERO)));
    assertEquals(ZenType.BOOL, positive.resultType());
    assertInstanceOf(ArithComparisonExpr.class, positive.body());

    @SuppressWarnings("unchecked")
    ZenLambda<BigInteger, Boolean> wrong = ZenLambda.of(ZenType.BIGINT, ZenType.BOOL, a -> (Zen<Boolean>) (Zen<?>) a);
    assertEquals(ZenType.BOOL, wrong.resultType());
    assertThrows(ZenException.class, wrong::body);
  }

  @Test
  void testRecursiveLambda() {
    @SuppressWarnings("unchecked")
    ZenLambda<FSeq<Integer>, BigInteger>[] length = new ZenLambda[1];
    length[0] = ZenLambda.of(LIST, ZenType.BIGINT, l -> caseOf(l, constant(BigInteger.ZERO),
      (head, tail) -> plus(constant(BigInteger.ONE), apply(length[0], tail))));
    assertInstanceOf(FSeqCaseExpr.class, length[0].body());
    Zen<BigInteger> two = apply(length[0], addFront(addFront(fseqEmpty(ZenType.INT), v), v));
    assertInstanceOf(ApplyExpr.class, two);
  }

  @Test
  @SuppressWarnings({"unchecked", "rawtypes"})
  void testApplyValidatesArgument() {
    ZenLambda<BigInteger, BigInteger> f = lambda(ZenType.BIGINT, a -> a);
    assertThrows(ZenException.class, () -> apply(f, (Zen) constant(1)));
    assertThrows(ZenException.class, () -> apply(f, null));
  }
}

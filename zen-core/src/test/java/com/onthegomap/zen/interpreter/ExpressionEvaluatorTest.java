package com.onthegomap.zen.interpreter;

import static com.onthegomap.zen.expression.Zen.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.zen.datatype.CMap;
import com.onthegomap.zen.datatype.Dict;
import com.onthegomap.zen.datatype.FSeq;
import com.onthegomap.zen.datatype.Field;
import com.onthegomap.zen.datatype.Option;
import com.onthegomap.zen.datatype.RecordType;
import com.onthegomap.zen.datatype.Seq;
import com.onthegomap.zen.datatype.SetUnit;
import com.onthegomap.zen.datatype.ZenRecord;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.expression.Zen;
import com.onthegomap.zen.expression.ZenLambda;
import com.onthegomap.zen.expression.ZenString;
import com.onthegomap.zen.util.ZenException;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ExpressionEvaluatorTest {

  private static final Field<Integer> X = Field.of("X", ZenType.INT);
  private static final Field<Integer> Y = Field.of("Y", ZenType.INT);
  private static final RecordType POINT = RecordType.of("Point", X, Y);

  private final Zen<Boolean> p = arbitrary(ZenType.BOOL, "p");
  private final Zen<Boolean> q = arbitrary(ZenType.BOOL, "q");
  private final Zen<BigInteger> x = arbitrary(ZenType.BIGINT, "x");
  private final Zen<BigInteger> y = arbitrary(ZenType.BIGINT, "y");
  private final Zen<Integer> i = arbitrary(ZenType.INT, "i");

  private static BigInteger big(long value) {
    return BigInteger.valueOf(value);
  }

  @Test
  void testArithmetic() {
    Environment environment = Environment.empty().with(x, big(3)).with(y, big(4));
    assertEquals(big(7), ExpressionEvaluator.evaluate(plus(x, y), environment));
    assertEquals(big(-1), ExpressionEvaluator.evaluate(minus(x, y), environment));
    assertEquals(big(12), ExpressionEvaluator.evaluate(multiply(x, y), environment));
    assertEquals(big(4), ExpressionEvaluator.evaluate(max(x, y), environment));
    assertEquals(true, ExpressionEvaluator.evaluate(lt(x, y), environment));
    assertEquals(false, ExpressionEvaluator.evaluate(eq(x, y), environment));
  }

  @Test
  void testFixedWidthWraps() {
    Environment environment = Environment.empty().with(i, Integer.MAX_VALUE);
    assertEquals(Integer.MIN_VALUE, ExpressionEvaluator.evaluate(plus(i, constant(1)), environment));
    assertEquals(~Integer.MAX_VALUE, ExpressionEvaluator.evaluate(bitNot(i), environment));
    assertEquals(Integer.MAX_VALUE & 6, ExpressionEvaluator.evaluate(bitAnd(i, constant(6)), environment));
  }

  @Test
  void testUnassignedVariablesTakeDefaults() {
    assertEquals(true, ExpressionEvaluator.evaluate(lt(x, constant(big(1))), Environment.empty()));
    assertEquals(false, ExpressionEvaluator.evaluate(or(p, q), Environment.empty()));
  }

  @ParameterizedTest
  @CsvSource({
    "false, false, false, false",
    "false, true, false, true",
    "true, false, false, true",
    "true, true, true, true",
  })
  void testLogic(boolean a, boolean b, boolean and, boolean or) {
    Environment environment = Environment.empty().with(p, a).with(q, b);
    assertEquals(and, ExpressionEvaluator.evaluate(Zen.and(p, q), environment));
    assertEquals(or, ExpressionEvaluator.evaluate(Zen.or(p, q), environment));
    assertEquals(!a || b, ExpressionEvaluator.evaluate(implies(p, q), environment));
    assertEquals(!a, ExpressionEvaluator.evaluate(not(p), environment));
  }

  @Test
  void testTracksBranchesTaken() {
    Zen<BigInteger> expression = ifThenElse(p, ifThenElse(q, x, y), y);
    Environment environment = Environment.empty().with(p, true).with(q, false).with(y, big(9));
    ExpressionEvaluator evaluator = new ExpressionEvaluator(environment, true);
    assertEquals(big(9), evaluator.evaluate(expression));
    assertEquals(List.of(p, not(q)), List.copyOf(evaluator.pathConstraint().conjuncts()));

    ExpressionEvaluator untracked = new ExpressionEvaluator(environment);
    untracked.evaluate(expression);
    assertTrue(untracked.pathConstraint().isEmpty());
  }

  @Test
  void testRecords() {
    Zen<ZenRecord> o = arbitrary(POINT, "o");
    Environment environment = Environment.empty()
      .with(o, ZenRecord.of(POINT, Map.of("X", 1, "Y", 2)))
      .with(i, 5);
    assertEquals(ZenRecord.of(POINT, Map.of("X", 5, "Y", 2)),
      ExpressionEvaluator.evaluate(withField(o, X, i), environment));
    assertEquals(2, ExpressionEvaluator.evaluate(getField(o, Y), environment));
    assertEquals(ZenRecord.of(POINT, Map.of("X", 5, "Y", 3)),
      ExpressionEvaluator.evaluate(create(POINT, Map.of("X", i, "Y", constant(3))), environment));
  }

  @Test
  void testOptions() {
    Zen<ZenRecord> option = some(i);
    Environment environment = Environment.empty().with(i, 4);
    assertEquals(Option.some(ZenType.INT, 4), ExpressionEvaluator.evaluate(option, environment));
    assertEquals(true, ExpressionEvaluator.evaluate(hasValue(option), environment));
    assertEquals(4, ExpressionEvaluator.evaluate(valueOrDefault(option, constant(1)), environment));
  }

  @Test
  void testSequences() {
    Zen<Seq<BigInteger>> s = arbitrary(ZenType.seq(ZenType.BIGINT), "s");
    Environment environment = Environment.empty().with(s, Seq.of(big(1), big(2), big(3)));
    assertEquals(big(3), ExpressionEvaluator.evaluate(length(s), environment));
    assertEquals(Seq.of(big(2)), ExpressionEvaluator.evaluate(at(s, constant(big(1))), environment));
    assertEquals(big(3), ExpressionEvaluator.evaluate(nth(s, constant(big(2))), environment));
    assertEquals(big(0), ExpressionEvaluator.evaluate(nth(s, constant(big(10))), environment));
    assertEquals(Seq.of(big(1), big(2), big(3), big(4)),
      ExpressionEvaluator.evaluate(seqAdd(s, constant(big(4))), environment));
    assertEquals(big(1), ExpressionEvaluator.evaluate(indexOf(s, seqUnit(constant(big(2)))), environment));
    assertEquals(true, ExpressionEvaluator.evaluate(startsWith(s, seqUnit(constant(big(1)))), environment));
    assertEquals(Seq.of(big(2), big(3)),
      ExpressionEvaluator.evaluate(slice(s, constant(big(1)), constant(big(5))), environment));
  }

  @Test
  void testStrings() {
    Zen<String> str = arbitrary(ZenType.STRING, "str");
    Environment environment = Environment.empty().with(str, "hello");
    assertEquals(big(3), ExpressionEvaluator.evaluate(ZenString.indexOf(str, constant("lo")), environment));
    assertEquals("ell",
      ExpressionEvaluator.evaluate(ZenString.substring(str, constant(big(1)), constant(big(3))), environment));
    assertEquals("hello world", ExpressionEvaluator.evaluate(ZenString.concat(str, constant(" world")), environment));
    assertEquals("jello",
      ExpressionEvaluator.evaluate(ZenString.replaceFirst(str, constant("h"), constant("j")), environment));
    assertEquals(big(5), ExpressionEvaluator.evaluate(ZenString.length(str), environment));
  }

  @Test
  void testDictionaries() {
    Zen<Dict<String, Integer>> d = arbitrary(ZenType.dict(ZenType.STRING, ZenType.INT), "d");
    Zen<String> k = arbitrary(ZenType.STRING, "k");
    Environment environment = Environment.empty()
      .with(d, Dict.from(Map.of("a", 1)))
      .with(k, "b");
    assertEquals(Option.some(ZenType.INT, 1), ExpressionEvaluator.evaluate(dictGet(d, constant("a")), environment));
    assertEquals(Option.none(ZenType.INT), ExpressionEvaluator.evaluate(dictGet(d, k), environment));
    assertEquals(Option.some(ZenType.INT, 2),
      ExpressionEvaluator.evaluate(dictGet(dictSet(d, k, constant(2)), constant("b")), environment));
    assertEquals(Dict.empty(), ExpressionEvaluator.evaluate(dictDelete(d, constant("a")), environment));
  }

  @Test
  void testSets() {
    Zen<Dict<BigInteger, SetUnit>> s1 = arbitrary(ZenType.set(ZenType.BIGINT), "s1");
    Zen<Dict<BigInteger, SetUnit>> s2 = arbitrary(ZenType.set(ZenType.BIGINT), "s2");
    Environment environment = Environment.empty()
      .with(s1, Dict.setOf(big(1), big(2)))
      .with(s2, Dict.setOf(big(2), big(3)));
    assertEquals(Dict.setOf(big(1), big(2), big(3)), ExpressionEvaluator.evaluate(union(s1, s2), environment));
    assertEquals(Dict.setOf(big(2)), ExpressionEvaluator.evaluate(intersect(s1, s2), environment));
    assertEquals(Dict.setOf(big(1)), ExpressionEvaluator.evaluate(difference(s1, s2), environment));
    assertEquals(true, ExpressionEvaluator.evaluate(setContains(s1, constant(big(1))), environment));
    assertEquals(false, ExpressionEvaluator.evaluate(setContains(s2, constant(big(1))), environment));
  }

  @Test
  void testConstantMaps() {
    Zen<CMap<String, Integer>> m = arbitrary(ZenType.cmap(ZenType.STRING, ZenType.INT), "m");
    Environment environment = Environment.empty().with(m, CMap.<String, Integer>empty(0).set("a", 5));
    assertEquals(5, ExpressionEvaluator.evaluate(cmapGet(m, "a"), environment));
    assertEquals(0, ExpressionEvaluator.evaluate(cmapGet(m, "b"), environment));
    assertEquals(6, ExpressionEvaluator.evaluate(cmapGet(cmapSet(m, "b", constant(6)), "b"), environment));
  }

  @Test
  void testListCase() {
    Zen<FSeq<Integer>> list = arbitrary(ZenType.fseq(ZenType.INT), "list");
    Zen<Integer> first = caseOf(list, constant(-1), (head, tail) -> head);
    Zen<Boolean> singleton = caseOf(list, falseExpr(), (head, tail) -> caseOf(tail, trueExpr(), (h, t) -> falseExpr()));

    Environment empty = Environment.empty();
    assertEquals(-1, ExpressionEvaluator.evaluate(first, empty));
    assertEquals(false, ExpressionEvaluator.evaluate(singleton, empty));

    Environment two = Environment.empty().with(list, FSeq.of(5, 6));
    assertEquals(5, ExpressionEvaluator.evaluate(first, two));
    assertEquals(false, ExpressionEvaluator.evaluate(singleton, two));
    assertEquals(true, ExpressionEvaluator.evaluate(singleton, Environment.empty().with(list, FSeq.of(5))));
    assertEquals(7, ExpressionEvaluator.evaluate(caseOf(addFront(list, constant(7)), constant(0), (h, t) -> h), two));
  }

  @Test
  void testApply() {
    ZenLambda<BigInteger, BigInteger> increment = lambda(ZenType.BIGINT, a -> plus(a, constant(big(1))));
    Environment environment = Environment.empty().with(x, big(41));
    assertEquals(big(42), ExpressionEvaluator.evaluate(apply(increment, x), environment));
    assertEquals(big(43), ExpressionEvaluator.evaluate(apply(increment, apply(increment, x)), environment));
  }

  @Test
  void testUnboundParameterThrows() {
    ZenLambda<BigInteger, BigInteger> increment = lambda(ZenType.BIGINT, a -> plus(a, constant(big(1))));
    assertThrows(ZenException.class, () -> ExpressionEvaluator.evaluate(increment.body(), Environment.empty()));
  }

  @Test
  void testEvaluatorReusesValues() {
    Zen<BigInteger> shared = plus(x, y);
    Zen<BigInteger> expression = minus(multiply(shared, shared), shared);
    ExpressionEvaluator evaluator = new ExpressionEvaluator(Environment.empty().with(x, big(2)).with(y, big(3)));
    assertEquals(big(20), evaluator.evaluate(expression));
    assertEquals(big(5), evaluator.evaluate(shared));
    assertTrue(evaluator.toString().contains("cached="), evaluator.toString());
  }
}

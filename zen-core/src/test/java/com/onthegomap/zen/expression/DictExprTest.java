package com.onthegomap.zen.expression;

import static com.onthegomap.zen.expression.Zen.*;
import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.zen.datatype.CMap;
import com.onthegomap.zen.datatype.CMapType;
import com.onthegomap.zen.datatype.Dict;
import com.onthegomap.zen.datatype.DictType;
import com.onthegomap.zen.datatype.SetUnit;
import com.onthegomap.zen.datatype.ZenType;
import com.onthegomap.zen.util.ZenException;
import org.junit.jupiter.api.Test;

class DictExprTest {

  private static final DictType<String, Integer> DICT = ZenType.dict(ZenType.STRING, ZenType.INT);
  private static final DictType<Integer, SetUnit> SET = ZenType.set(ZenType.INT);
  private static final CMapType<String, Integer> CMAP = ZenType.cmap(ZenType.STRING, ZenType.INT);

  private final Zen<Dict<String, Integer>> d = arbitrary(DICT, "d");
  private final Zen<String> k = arbitrary(ZenType.STRING, "k");
  private final Zen<Integer> v1 = arbitrary(ZenType.INT, "v1");
  private final Zen<Integer> v2 = arbitrary(ZenType.INT, "v2");
  private final Zen<Dict<Integer, SetUnit>> a = arbitrary(SET, "a");
  private final Zen<Dict<Integer, SetUnit>> b = arbitrary(SET, "b");

  private static Zen<Dict<Integer, SetUnit>> set(Integer... values) {
    return constant(SET, Dict.setOf(values));
  }

  @Test
  void testGetFromSetAndDelete() {
    assertSame(none(ZenType.INT), dictGet(dictEmpty(DICT), k));
    assertSame(none(ZenType.INT), dictGet(dictDelete(d, k), k));
    assertSame(some(v1), dictGet(dictSet(d, k, v1), k));
    assertInstanceOf(DictGetExpr.class, dictGet(dictSet(d, constant("other"), v1), k));
    assertSame(v1, optionValue(dictGet(dictSet(d, k, v1), k), ZenType.INT));
  }

  @Test
  void testSetCollapsesEarlierUpdate() {
    assertSame(dictSet(d, k, v2), dictSet(dictSet(d, k, v1), k, v2));
    assertSame(dictSet(d, k, v2), dictSet(dictDelete(d, k), k, v2));
    assertInstanceOf(DictSetExpr.class, dictSet(dictSet(d, constant("x"), v1), k, v2));
    assertInstanceOf(DictDeleteExpr.class, dictDelete(dictSet(d, k, v1), k));
  }

  @Test
  void testSetMembership() {
    Zen<Integer> member = arbitrary(ZenType.INT, "member");
    assertSame(trueExpr(), setContains(setAdd(a, member), member));
    assertSame(falseExpr(), setContains(setEmpty(ZenType.INT), member));
  }

  @Test
  void testCombineSelf() {
    assertSame(a, union(a, a));
    assertSame(a, intersect(a, a));
    assertSame(setEmpty(ZenType.INT), difference(a, a));
  }

  @Test
  void testCombineEmpty() {
    Zen<Dict<Integer, SetUnit>> empty = setEmpty(ZenType.INT);
    assertSame(a, union(empty, a));
    assertSame(a, union(a, empty));
    assertSame(empty, intersect(empty, a));
    assertSame(empty, intersect(a, empty));
    assertSame(empty, difference(empty, a));
    assertSame(a, difference(a, empty));
  }

  @Test
  void testNestedCombine() {
    assertSame(union(a, b), union(a, union(a, b)));
    assertSame(union(a, b), union(union(a, b), b));
    assertSame(intersect(a, b), intersect(intersect(a, b), a));
    assertSame(setEmpty(ZenType.INT), difference(difference(a, b), a));
    assertSame(difference(a, b), difference(difference(a, b), b));
    assertInstanceOf(DictCombineExpr.class, union(a, b));
  }

  @Test
  void testCombineConstants() {
    assertSame(set(1, 2, 3), union(set(1, 2), set(2, 3)));
    assertSame(set(2), intersect(set(1, 2), set(2, 3)));
    assertSame(set(1), difference(set(1, 2), set(2, 3)));
  }

  @Test
  @SuppressWarnings("unchecked")
  void testCombineRequiresSets() {
    var notSet = (Zen<Dict<Integer, SetUnit>>) (Zen<?>) arbitrary(ZenType.dict(ZenType.INT, ZenType.INT), "m");
    assertThrows(ZenException.class, () -> union(notSet, notSet));
  }

  @Test
  void testCMap() {
    Zen<CMap<String, Integer>> m = arbitrary(CMAP, "m");
    assertSame(v1, cmapGet(cmapSet(m, "a", v1), "a"));
    assertSame(cmapGet(m, "b"), cmapGet(cmapSet(m, "a", v1), "b"));
    assertSame(cmapSet(m, "a", v2), cmapSet(cmapSet(m, "a", v1), "a", v2));
    assertInstanceOf(CMapSetExpr.class, cmapSet(cmapSet(m, "b", v1), "a", v2));
    assertSame(constant(0), cmapGet(cmapEmpty(CMAP), "a"));
    assertSame(constant(3), cmapGet(constant(CMAP, CMap.<String, Integer>empty(0).set("a", 3)), "a"));
    assertThrows(ZenException.class, () -> cmapGet(m, null));
    CMap<String, Integer> withA = CMap.<String, Integer>empty(0).set("a", 3);
    assertSame(constant(CMAP, withA), cmapSet(cmapEmpty(CMAP), "a", constant(3)));
    assertSame(constant(CMAP, withA.set("b", 4)), cmapSet(cmapSet(cmapEmpty(CMAP), "a", constant(3)), "b", constant(4)));
    assertInstanceOf(CMapSetExpr.class, cmapSet(cmapEmpty(CMAP), "a", v1));
  }

  @Test
  @SuppressWarnings({"unchecked", "rawtypes"})
  void testDictValidation() {
    assertThrows(ZenException.class, () -> dictGet(d, null));
    assertThrows(ZenException.class, () -> dictSet(d, k, null));
    assertThrows(ZenException.class, () -> dictSet(d, (Zen) constant(1), v1));
    assertThrows(ZenException.class, () -> dictSet(d, k, (Zen) constant("x")));
  }
}

package com.onthegomap.zen.datatype;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DictTest {

  @Test
  void testSetGetDelete() {
    Dict<String, Integer> dict = Dict.<String, Integer>empty().set("a", 1).set("b", 2);
    assertEquals(Optional.of(1), dict.get("a"));
    assertEquals(Optional.empty(), dict.get("c"));
    assertEquals(2, dict.size());
    assertEquals(Map.of("b", 2), dict.delete("a").values());
    assertSame(dict, dict.delete("c"));
    assertEquals(Optional.of(3), dict.set("a", 3).get("a"));
    assertEquals(Optional.of(1), dict.get("a"));
  }

  @Test
  void testSetOperations() {
    Dict<Integer, SetUnit> a = Dict.setOf(1, 2, 3);
    Dict<Integer, SetUnit> b = Dict.setOf(2, 3, 4);
    assertEquals(Dict.setOf(1, 2, 3, 4), a.union(b));
    assertEquals(Dict.setOf(2, 3), a.intersect(b));
    assertEquals(Dict.setOf(1), a.difference(b));
    assertTrue(a.difference(a).isEmpty());
  }

  @Test
  void testUnionPrefersThis() {
    Dict<String, Integer> a = Dict.from(Map.of("k", 1));
    Dict<String, Integer> b = Dict.from(Map.of("k", 2, "j", 3));
    assertEquals(Dict.from(Map.of("k", 1, "j", 3)), a.union(b));
  }

  @Test
  void testEqualityIgnoresOrder() {
    assertEquals(Dict.setOf(1, 2), Dict.setOf(2, 1));
    assertEquals(Dict.setOf(1, 2).hashCode(), Dict.setOf(2, 1).hashCode());
  }

  @Test
  void testCMapDefault() {
    CMap<String, Integer> map = CMap.empty(0);
    assertEquals(0, map.get("x"));
    CMap<String, Integer> updated = map.set("x", 5);
    assertEquals(5, updated.get("x"));
    assertEquals(0, updated.get("y"));
    assertEquals(map, updated.set("x", 0));
    assertTrue(updated.set("x", 0).values().isEmpty());
  }

  @Test
  void testFSeq() {
    FSeq<Integer> list = FSeq.<Integer>empty().addFront(2).addFront(1);
    assertEquals(FSeq.of(1, 2), list);
    assertEquals(1, list.head());
    assertEquals(FSeq.of(2), list.tail());
    assertEquals(2, list.length());
    assertTrue(list.tail().tail().isEmpty());
  }
}

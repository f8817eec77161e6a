package com.onthegomap.zen.datatype;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.zen.util.ZenException;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RecordTypeTest {

  private static final Field<Integer> X = Field.of("x", ZenType.INT);
  private static final Field<Integer> Y = Field.of("y", ZenType.INT);
  private static final RecordType POINT = RecordType.of("Point", Y, X);

  @Test
  void testFieldsSortedByName() {
    assertEquals(List.of("x", "y"), POINT.fields().keySet().asList());
    assertEquals(POINT, RecordType.of("Point", X, Y));
    assertTrue(POINT.hasField(X));
    assertFalse(POINT.hasField(Field.of("x", ZenType.LONG)));
  }

  @Test
  void testDuplicateField() {
    assertThrows(ZenException.class, () -> RecordType.of("Bad", X, X));
  }

  @Test
  void testRecordValues() {
    ZenRecord point = ZenRecord.of(POINT, Map.of("x", 1, "y", 2));
    assertEquals(1, point.get(X));
    assertEquals(ZenRecord.of(POINT, Map.of("x", 3, "y", 2)), point.with(X, 3));
    assertEquals(ZenRecord.of(POINT, Map.of("x", 0, "y", 0)), POINT.defaultValue());
    assertTrue(POINT.isInstance(point));
    assertEquals("Point(x=1, y=2)", point.toString());
  }

  @Test
  void testInvalidRecordValues() {
    assertThrows(ZenException.class, () -> ZenRecord.of(POINT, Map.of("x", 1)));
    assertThrows(ZenException.class, () -> ZenRecord.of(POINT, Map.of("x", 1, "y", 2L)));
    ZenRecord point = ZenRecord.of(POINT, Map.of("x", 1, "y", 2));
    assertThrows(ZenException.class, () -> point.get(Field.of("z", ZenType.INT)));
  }

  @Test
  void testOptionAndPair() {
    ZenRecord some = Option.some(ZenType.BIGINT, BigInteger.TEN);
    assertEquals(true, some.get(Option.HAS_VALUE_FIELD));
    assertEquals(BigInteger.TEN, some.get(Option.valueField(ZenType.BIGINT)));
    ZenRecord none = Option.none(ZenType.BIGINT);
    assertEquals(false, none.get(Option.HAS_VALUE_FIELD));
    assertEquals(BigInteger.ZERO, none.get(Option.valueField(ZenType.BIGINT)));
    assertEquals(ZenType.BIGINT, Option.valueType(Option.type(ZenType.BIGINT)));
    assertTrue(Option.isOptionType(Option.type(ZenType.BIGINT)));
    assertFalse(Option.isOptionType(Pair.type(ZenType.BOOL, ZenType.BIGINT)));
    assertFalse(Option.isOptionType(ZenType.BOOL));

    ZenRecord pair = Pair.of(ZenType.INT, 1, ZenType.BOOL, true);
    assertEquals(1, pair.get(Pair.item1(ZenType.INT)));
    assertEquals(true, pair.get(Pair.item2(ZenType.BOOL)));
    assertEquals("Pair<int, bool>", pair.type().name());
  }

  @Test
  void testTypeNames() {
    assertEquals("Seq<char>", ZenType.seq(ZenType.CHAR).name());
    assertEquals(ZenType.seq(ZenType.CHAR), ZenType.seq(ZenType.CHAR));
    assertEquals("Option<bigint>", Option.type(ZenType.BIGINT).name());
    assertEquals(Seq.empty(), ZenType.seq(ZenType.INT).defaultValue());
  }
}

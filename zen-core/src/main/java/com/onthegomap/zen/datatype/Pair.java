package com.onthegomap.zen.datatype;

import java.util.Map;

/** The predefined two-element record type with fields {@code Item1} and {@code Item2}. */
public final class Pair {

  public static final String ITEM1 = "Item1";
  public static final String ITEM2 = "Item2";

  private Pair() {}

  public static RecordType type(ZenType<?> type1, ZenType<?> type2) {
    return RecordType.of("Pair<" + type1.name() + ", " + type2.name() + ">",
      Field.of(ITEM1, type1), Field.of(ITEM2, type2));
  }

  public static <A> Field<A> item1(ZenType<A> type1) {
    return Field.of(ITEM1, type1);
  }

  public static <B> Field<B> item2(ZenType<B> type2) {
    return Field.of(ITEM2, type2);
  }

  public static <A, B> ZenRecord of(ZenType<A> type1, A value1, ZenType<B> type2, B value2) {
    return ZenRecord.of(type(type1, type2), Map.of(ITEM1, value1, ITEM2, value2));
  }
}

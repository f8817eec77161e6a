package com.onthegomap.zen.datatype;

import java.util.Map;

/**
 * The predefined optional-value record type: {@code HasValue} is true when {@code Value} holds a value, otherwise
 * {@code Value} holds the default of its type.
 */
public final class Option {

  public static final String HAS_VALUE = "HasValue";
  public static final String VALUE = "Value";
  public static final Field<Boolean> HAS_VALUE_FIELD = Field.of(HAS_VALUE, ZenType.BOOL);

  private Option() {}

  /** Returns the record type of optional {@code valueType} values. */
  public static RecordType type(ZenType<?> valueType) {
    return RecordType.of("Option<" + valueType.name() + ">", HAS_VALUE_FIELD, Field.of(VALUE, valueType));
  }

  public static <T> Field<T> valueField(ZenType<T> valueType) {
    return Field.of(VALUE, valueType);
  }

  /** Returns the type of the {@code Value} field of an option record type. */
  @SuppressWarnings("unchecked")
  public static <T> ZenType<T> valueType(ZenType<?> optionType) {
    return (ZenType<T>) ((RecordType) optionType).fieldType(VALUE);
  }

  /** Returns true if {@code type} was created by {@link #type(ZenType)}. */
  public static boolean isOptionType(ZenType<?> type) {
    return type instanceof RecordType r && r.fields().size() == 2 && r.hasField(HAS_VALUE_FIELD) &&
      r.fieldType(VALUE) != null && r.equals(type(r.fieldType(VALUE)));
  }

  public static <T> ZenRecord some(ZenType<T> valueType, T value) {
    return ZenRecord.of(type(valueType), Map.of(HAS_VALUE, true, VALUE, value));
  }

  public static <T> ZenRecord none(ZenType<T> valueType) {
    return ZenRecord.of(type(valueType), Map.of(HAS_VALUE, false, VALUE, valueType.defaultValue()));
  }
}

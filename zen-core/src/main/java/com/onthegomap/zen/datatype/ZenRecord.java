package com.onthegomap.zen.datatype;

import com.google.common.collect.ImmutableSortedMap;
import com.onthegomap.zen.util.Contract;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;
import javax.annotation.concurrent.Immutable;

/**
 * An immutable value of a {@link RecordType}, with a value for every declared field.
 */
@Immutable
public final class ZenRecord {

  private final RecordType type;
  private final ImmutableSortedMap<String, Object> values;

  private ZenRecord(RecordType type, ImmutableSortedMap<String, Object> values) {
    this.type = type;
    this.values = values;
  }

  /**
   * Returns a record of {@code type} with {@code values}.
   *
   * @throws com.onthegomap.zen.util.ZenException if a field is missing, unknown, or has a value of the wrong type
   */
  public static ZenRecord of(RecordType type, Map<String, ?> values) {
    Contract.assertNotNull(type);
    Contract.assertNotNull(values);
    Contract.assertTrue(values.keySet().equals(type.fields().keySet()), "Fields %s do not match %s %s",
      values.keySet(), type, type.fields().keySet());
    values.forEach((name, value) -> Contract.assertTrue(type.fieldType(name).isInstance(value),
      "Invalid value %s for field %s of %s", value, name, type));
    return new ZenRecord(type, ImmutableSortedMap.copyOf(values));
  }

  public RecordType type() {
    return type;
  }

  /** Returns field values sorted by field name. */
  public ImmutableSortedMap<String, Object> values() {
    return values;
  }

  public Object get(String fieldName) {
    Object value = values.get(fieldName);
    Contract.assertTrue(value != null, "Field %s does not exist on type %s", fieldName, type);
    return value;
  }

  public <F> F get(Field<F> field) {
    type.assertField(field.name(), field.type());
    @SuppressWarnings("unchecked") F value = (F) values.get(field.name());
    return value;
  }

  /** Returns a copy of this record with {@code field} set to {@code value}. */
  public <F> ZenRecord with(Field<F> field, F value) {
    type.assertField(field.name(), field.type());
    Map<String, Object> updated = new TreeMap<>(values);
    updated.put(field.name(), value);
    return of(type, updated);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof ZenRecord other && type.equals(other.type) && values.equals(other.values));
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, values);
  }

  @Override
  public String toString() {
    return type.name() + values.entrySet().stream()
      .map(e -> e.getKey() + "=" + e.getValue())
      .collect(Collectors.joining(", ", "(", ")"));
  }
}

package com.onthegomap.zen.datatype;

import com.google.common.collect.ImmutableSortedMap;
import com.onthegomap.zen.util.Contract;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Schema of a record: a name and a set of typed fields, kept sorted by field name so that every traversal over the
 * fields of a record sees them in the same order.
 */
public record RecordType(String name, ImmutableSortedMap<String, ZenType<?>> fields) implements ZenType<ZenRecord> {

  public RecordType {
    Contract.assertNotNull(name);
    Contract.assertNotNull(fields);
  }

  /** Returns a record type named {@code name} with {@code fields}. */
  public static RecordType of(String name, Field<?>... fields) {
    SortedMap<String, ZenType<?>> result = new TreeMap<>();
    for (Field<?> field : fields) {
      Contract.assertTrue(result.put(field.name(), field.type()) == null, "Duplicate field %s on %s", field.name(),
        name);
    }
    return new RecordType(name, ImmutableSortedMap.copyOfSorted(result));
  }

  /** Returns the declared type of {@code fieldName}, or {@code null} if this record does not have that field. */
  public ZenType<?> fieldType(String fieldName) {
    return fields.get(fieldName);
  }

  /** Returns true if this record declares {@code field} with the same name and type. */
  public boolean hasField(Field<?> field) {
    return field.type().equals(fields.get(field.name()));
  }

  /**
   * Throws a {@link com.onthegomap.zen.util.ZenException} unless this record declares a field named {@code name} of
   * type {@code type}.
   */
  public void assertField(String fieldName, ZenType<?> type) {
    ZenType<?> declared = fields.get(fieldName);
    Contract.assertTrue(declared != null, "Field %s does not exist on type %s", fieldName, name);
    Contract.assertTrue(declared.equals(type), "Field %s on type %s has type %s, not %s", fieldName, name, declared,
      type);
  }

  @Override
  public Class<?> javaClass() {
    return ZenRecord.class;
  }

  @Override
  public ZenRecord defaultValue() {
    Map<String, Object> values = new TreeMap<>();
    fields.forEach((fieldName, type) -> values.put(fieldName, type.defaultValue()));
    return ZenRecord.of(this, values);
  }

  @Override
  public boolean isInstance(Object value) {
    return value instanceof ZenRecord r && r.type().equals(this);
  }

  @Override
  public String toString() {
    return name;
  }
}

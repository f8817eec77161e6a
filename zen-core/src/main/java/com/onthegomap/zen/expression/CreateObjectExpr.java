package com.onthegomap.zen.expression;

import com.google.common.collect.ImmutableSortedMap;
import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.RecordType;
import com.onthegomap.zen.datatype.ZenRecord;
import com.onthegomap.zen.util.Contract;
import java.util.Map;

/** A new record with a value for every field of its type, kept in field name order. */
public final class CreateObjectExpr extends Zen<ZenRecord> {

  private final ImmutableSortedMap<String, Zen<?>> fields;

  private CreateObjectExpr(RecordType type, ImmutableSortedMap<String, Zen<?>> fields) {
    super(type);
    this.fields = fields;
  }

  public static Zen<ZenRecord> create(RecordType type, Map<String, ? extends Zen<?>> fields) {
    Contract.assertNotNull(type);
    Contract.assertNotNull(fields);
    Contract.assertTrue(type.fields().keySet().equals(fields.keySet()), "Fields %s do not match the fields of %s: %s",
      fields.keySet(), type, type.fields().keySet());
    for (Zen<?> value : fields.values()) {
      Contract.assertNotNull(value);
    }
    ImmutableSortedMap<String, Zen<?>> sorted = ImmutableSortedMap.copyOf(fields);
    Object[] keyParts = new Object[1 + 2 * sorted.size()];
    keyParts[0] = type;
    int i = 1;
    for (var entry : sorted.entrySet()) {
      Zen<?> value = entry.getValue();
      type.assertField(entry.getKey(), value.type());
      keyParts[i++] = entry.getKey();
      keyParts[i++] = value.id();
    }
    Flyweight<Flyweight.ArrayKey, Zen<ZenRecord>> table = ZenContext.current().table(NodeKind.CREATE_OBJECT);
    return table.getOrAdd(Flyweight.arrayKey(keyParts), () -> new CreateObjectExpr(type, sorted));
  }

  public RecordType recordType() {
    return (RecordType) type();
  }

  /** Returns the value expression of each field, sorted by field name. */
  public ImmutableSortedMap<String, Zen<?>> fields() {
    return fields;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CREATE_OBJECT;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitCreateObject(this, parameter);
  }
}

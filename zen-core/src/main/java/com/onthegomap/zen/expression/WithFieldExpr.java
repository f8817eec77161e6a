package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Field;
import com.onthegomap.zen.datatype.ZenRecord;
import com.onthegomap.zen.util.Contract;
import java.util.HashMap;
import java.util.Map;

/** A copy of a record with one field replaced. */
public final class WithFieldExpr<F> extends Zen<ZenRecord> {

  private record Key(long expr, String fieldName, long value) {}

  private final Zen<ZenRecord> expr;
  private final Field<F> field;
  private final Zen<F> value;

  private WithFieldExpr(Zen<ZenRecord> expr, Field<F> field, Zen<F> value) {
    super(expr.type());
    this.expr = expr;
    this.field = field;
    this.value = value;
  }

  public static <F> Zen<ZenRecord> create(Zen<ZenRecord> expr, Field<F> field, Zen<F> value) {
    Contract.assertNotNull(expr);
    Contract.assertNotNull(field);
    Contract.assertNotNull(value);
    GetFieldExpr.recordType(expr).assertField(field.name(), field.type());
    Contract.assertTrue(value.type().equals(field.type()), "Value of type %s cannot be stored in field %s",
      value.type(), field);
    Flyweight<Key, Zen<ZenRecord>> table = ZenContext.current().table(NodeKind.WITH_FIELD);
    return table.getOrAdd(new Key(expr.id(), field.name(), value.id()), () -> simplify(expr, field, value));
  }

  private static <F> Zen<ZenRecord> simplify(Zen<ZenRecord> expr, Field<F> field, Zen<F> value) {
    if (expr instanceof CreateObjectExpr object) {
      Map<String, Zen<?>> fields = new HashMap<>(object.fields());
      fields.put(field.name(), value);
      return CreateObjectExpr.create(object.recordType(), fields);
    }
    if (expr instanceof WithFieldExpr<?> with && with.field.name().equals(field.name())) {
      return create(with.expr, field, value);
    }
    return new WithFieldExpr<>(expr, field, value);
  }

  public Zen<ZenRecord> expr() {
    return expr;
  }

  public Field<F> field() {
    return field;
  }

  public Zen<F> value() {
    return value;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.WITH_FIELD;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitWithField(this, parameter);
  }
}

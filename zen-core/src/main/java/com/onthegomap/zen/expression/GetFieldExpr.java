package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Field;
import com.onthegomap.zen.datatype.RecordType;
import com.onthegomap.zen.datatype.ZenRecord;
import com.onthegomap.zen.util.Contract;

/** Reads one field of a record. */
public final class GetFieldExpr<F> extends Zen<F> {

  private record Key(long expr, String fieldName) {}

  private final Zen<ZenRecord> expr;
  private final Field<F> field;

  private GetFieldExpr(Zen<ZenRecord> expr, Field<F> field) {
    super(field.type());
    this.expr = expr;
    this.field = field;
  }

  public static <F> Zen<F> create(Zen<ZenRecord> expr, Field<F> field) {
    Contract.assertNotNull(expr);
    Contract.assertNotNull(field);
    recordType(expr).assertField(field.name(), field.type());
    Flyweight<Key, Zen<F>> table = ZenContext.current().table(NodeKind.GET_FIELD);
    return table.getOrAdd(new Key(expr.id(), field.name()), () -> simplify(expr, field));
  }

  static RecordType recordType(Zen<ZenRecord> expr) {
    Contract.assertTrue(expr.type() instanceof RecordType, "Type %s is not a record", expr.type());
    return (RecordType) expr.type();
  }

  @SuppressWarnings("unchecked")
  private static <F> Zen<F> simplify(Zen<ZenRecord> expr, Field<F> field) {
    if (expr instanceof WithFieldExpr<?> with) {
      if (with.field().name().equals(field.name())) {
        return (Zen<F>) with.value();
      }
      return create(with.expr(), field);
    }
    if (expr instanceof CreateObjectExpr object) {
      return (Zen<F>) object.fields().get(field.name());
    }
    return new GetFieldExpr<>(expr, field);
  }

  public Zen<ZenRecord> expr() {
    return expr;
  }

  public Field<F> field() {
    return field;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.GET_FIELD;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitGetField(this, parameter);
  }
}

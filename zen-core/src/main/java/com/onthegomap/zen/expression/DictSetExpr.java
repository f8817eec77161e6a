package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Dict;
import com.onthegomap.zen.util.Contract;

/** A dictionary with one key bound to a value. */
public final class DictSetExpr<K, V> extends Zen<Dict<K, V>> {

  private record Key(long dict, long key, long value) {}

  private final Zen<Dict<K, V>> dict;
  private final Zen<K> key;
  private final Zen<V> value;

  private DictSetExpr(Zen<Dict<K, V>> dict, Zen<K> key, Zen<V> value) {
    super(dict.type());
    this.dict = dict;
    this.key = key;
    this.value = value;
  }

  public static <K, V> Zen<Dict<K, V>> create(Zen<Dict<K, V>> dict, Zen<K> key, Zen<V> value) {
    Contract.assertNotNull(dict);
    Contract.assertNotNull(key);
    Contract.assertNotNull(value);
    DictExprs.assertKey("Set", dict, key);
    Contract.assertTrue(Zen.dictType(dict).valueType().equals(value.type()), "Value of type %s cannot be stored in %s",
      value.type(), dict.type());
    Flyweight<Key, Zen<Dict<K, V>>> table = ZenContext.current().table(NodeKind.DICT_SET);
    return table.getOrAdd(new Key(dict.id(), key.id(), value.id()), () -> simplify(dict, key, value));
  }

  private static <K, V> Zen<Dict<K, V>> simplify(Zen<Dict<K, V>> dict, Zen<K> key, Zen<V> value) {
    if (dict instanceof DictSetExpr<K, V> set && set.key == key) {
      return create(set.dict, key, value);
    }
    if (dict instanceof DictDeleteExpr<K, V> delete && delete.key() == key) {
      return create(delete.dict(), key, value);
    }
    return new DictSetExpr<>(dict, key, value);
  }

  public Zen<Dict<K, V>> dict() {
    return dict;
  }

  public Zen<K> key() {
    return key;
  }

  public Zen<V> value() {
    return value;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.DICT_SET;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitDictSet(this, parameter);
  }
}

package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Dict;
import com.onthegomap.zen.datatype.Option;
import com.onthegomap.zen.datatype.ZenRecord;
import com.onthegomap.zen.util.Contract;

/** Looks up a key in a dictionary, producing an {@link Option} of the value. */
public final class DictGetExpr<K, V> extends Zen<ZenRecord> {

  private record Key(long dict, long key) {}

  private final Zen<Dict<K, V>> dict;
  private final Zen<K> key;

  private DictGetExpr(Zen<Dict<K, V>> dict, Zen<K> key) {
    super(Option.type(Zen.dictType(dict).valueType()));
    this.dict = dict;
    this.key = key;
  }

  public static <K, V> Zen<ZenRecord> create(Zen<Dict<K, V>> dict, Zen<K> key) {
    Contract.assertNotNull(dict);
    Contract.assertNotNull(key);
    DictExprs.assertKey("Get", dict, key);
    Flyweight<Key, Zen<ZenRecord>> table = ZenContext.current().table(NodeKind.DICT_GET);
    return table.getOrAdd(new Key(dict.id(), key.id()), () -> simplify(dict, key));
  }

  private static <K, V> Zen<ZenRecord> simplify(Zen<Dict<K, V>> dict, Zen<K> key) {
    if (dict instanceof ConstantExpr<Dict<K, V>> constant && constant.value().isEmpty()) {
      return Zen.none(Zen.dictType(dict).valueType());
    }
    if (dict instanceof DictDeleteExpr<K, V> delete && delete.key() == key) {
      return Zen.none(Zen.dictType(dict).valueType());
    }
    if (dict instanceof DictSetExpr<K, V> set && set.key() == key) {
      return Zen.some(set.value());
    }
    return new DictGetExpr<>(dict, key);
  }

  public Zen<Dict<K, V>> dict() {
    return dict;
  }

  public Zen<K> key() {
    return key;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.DICT_GET;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitDictGet(this, parameter);
  }
}

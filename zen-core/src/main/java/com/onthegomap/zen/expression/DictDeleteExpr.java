package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.Dict;
import com.onthegomap.zen.util.Contract;

/** A dictionary with one key removed. */
public final class DictDeleteExpr<K, V> extends Zen<Dict<K, V>> {

  private record Key(long dict, long key) {}

  private final Zen<Dict<K, V>> dict;
  private final Zen<K> key;

  private DictDeleteExpr(Zen<Dict<K, V>> dict, Zen<K> key) {
    super(dict.type());
    this.dict = dict;
    this.key = key;
  }

  public static <K, V> Zen<Dict<K, V>> create(Zen<Dict<K, V>> dict, Zen<K> key) {
    Contract.assertNotNull(dict);
    Contract.assertNotNull(key);
    DictExprs.assertKey("Delete", dict, key);
    Flyweight<Key, Zen<Dict<K, V>>> table = ZenContext.current().table(NodeKind.DICT_DELETE);
    return table.getOrAdd(new Key(dict.id(), key.id()), () -> new DictDeleteExpr<>(dict, key));
  }

  public Zen<Dict<K, V>> dict() {
    return dict;
  }

  public Zen<K> key() {
    return key;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.DICT_DELETE;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitDictDelete(this, parameter);
  }
}

package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.CMap;
import com.onthegomap.zen.util.Contract;

/** The value of one literal key in a constant-keyed map. */
public final class CMapGetExpr<K, V> extends Zen<V> {

  private record Key(long map, Object key) {}

  private final Zen<CMap<K, V>> map;
  private final K key;

  private CMapGetExpr(Zen<CMap<K, V>> map, K key) {
    super(Zen.cmapType(map).valueType());
    this.map = map;
    this.key = key;
  }

  public static <K, V> Zen<V> create(Zen<CMap<K, V>> map, K key) {
    Contract.assertNotNull(map);
    Contract.assertNotNull(key);
    CMapSetExpr.assertKey(map, key);
    Flyweight<Key, Zen<V>> table = ZenContext.current().table(NodeKind.CMAP_GET);
    return table.getOrAdd(new Key(map.id(), key), () -> simplify(map, key));
  }

  private static <K, V> Zen<V> simplify(Zen<CMap<K, V>> map, K key) {
    if (map instanceof CMapSetExpr<K, V> set) {
      return set.key().equals(key) ? set.value() : create(set.map(), key);
    }
    if (map instanceof ConstantExpr<CMap<K, V>> constant) {
      return ConstantExpr.create(Zen.cmapType(map).valueType(), constant.value().get(key));
    }
    return new CMapGetExpr<>(map, key);
  }

  public Zen<CMap<K, V>> map() {
    return map;
  }

  public K key() {
    return key;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CMAP_GET;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitCMapGet(this, parameter);
  }
}

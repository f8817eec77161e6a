package com.onthegomap.zen.expression;

import com.onthegomap.zen.collection.Flyweight;
import com.onthegomap.zen.datatype.CMap;
import com.onthegomap.zen.datatype.CMapType;
import com.onthegomap.zen.util.Contract;

/** A constant-keyed map with the value of one literal key replaced. */
public final class CMapSetExpr<K, V> extends Zen<CMap<K, V>> {

  private record Key(long map, Object key, long value) {}

  private final Zen<CMap<K, V>> map;
  private final K key;
  private final Zen<V> value;

  private CMapSetExpr(Zen<CMap<K, V>> map, K key, Zen<V> value) {
    super(map.type());
    this.map = map;
    this.key = key;
    this.value = value;
  }

  public static <K, V> Zen<CMap<K, V>> create(Zen<CMap<K, V>> map, K key, Zen<V> value) {
    Contract.assertNotNull(map);
    Contract.assertNotNull(key);
    Contract.assertNotNull(value);
    assertKey(map, key);
    Contract.assertTrue(Zen.cmapType(map).valueType().equals(value.type()), "Value of type %s cannot be stored in %s",
      value.type(), map.type());
    Flyweight<Key, Zen<CMap<K, V>>> table = ZenContext.current().table(NodeKind.CMAP_SET);
    return table.getOrAdd(new Key(map.id(), key, value.id()), () -> simplify(map, key, value));
  }

  static <K, V> void assertKey(Zen<CMap<K, V>> map, K key) {
    Contract.assertTrue(map.type() instanceof CMapType, "Type %s is not a constant map", map.type());
    Contract.assertTrue(Zen.cmapType(map).keyType().isInstance(key), "Key %s is not a %s", key,
      Zen.cmapType(map).keyType());
  }

  private static <K, V> Zen<CMap<K, V>> simplify(Zen<CMap<K, V>> map, K key, Zen<V> value) {
    if (map instanceof ConstantExpr<CMap<K, V>> constantMap && value instanceof ConstantExpr<V> constantValue) {
      return ConstantExpr.create(map.type(), constantMap.value().set(key, constantValue.value()));
    }
    if (map instanceof CMapSetExpr<K, V> set && set.key.equals(key)) {
      return create(set.map, key, value);
    }
    return new CMapSetExpr<>(map, key, value);
  }

  public Zen<CMap<K, V>> map() {
    return map;
  }

  public K key() {
    return key;
  }

  public Zen<V> value() {
    return value;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.CMAP_SET;
  }

  @Override
  public <P, R> R accept(ZenExprVisitor<P, R> visitor, P parameter) {
    return visitor.visitCMapSet(this, parameter);
  }
}

package com.onthegomap.zen.datatype;

/** Type of total maps from constant keys of {@code keyType} to {@code valueType}. */
public record CMapType<K, V>(ZenType<K> keyType, ZenType<V> valueType) implements ZenType<CMap<K, V>> {

  @Override
  public String name() {
    return "CMap<" + keyType.name() + ", " + valueType.name() + ">";
  }

  @Override
  public Class<?> javaClass() {
    return CMap.class;
  }

  @Override
  public CMap<K, V> defaultValue() {
    return CMap.empty(valueType.defaultValue());
  }

  @Override
  public String toString() {
    return name();
  }
}

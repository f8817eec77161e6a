package com.onthegomap.zen.datatype;

/** Type of finite dictionaries from {@code keyType} to {@code valueType}. */
public record DictType<K, V>(ZenType<K> keyType, ZenType<V> valueType) implements ZenType<Dict<K, V>> {

  @Override
  public String name() {
    return "Dict<" + keyType.name() + ", " + valueType.name() + ">";
  }

  @Override
  public Class<?> javaClass() {
    return Dict.class;
  }

  @Override
  public Dict<K, V> defaultValue() {
    return Dict.empty();
  }

  /** Returns true if this is a set, a dictionary whose values are all {@link SetUnit}. */
  public boolean isSet() {
    return valueType == UNIT;
  }

  @Override
  public String toString() {
    return name();
  }
}

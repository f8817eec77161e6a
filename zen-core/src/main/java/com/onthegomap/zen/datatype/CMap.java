package com.onthegomap.zen.datatype;

import com.google.common.collect.ImmutableMap;
import com.onthegomap.zen.util.Contract;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.annotation.concurrent.Immutable;

/**
 * An immutable total map where every key that was never set maps to a default value.
 * <p>
 * Entries equal to the default are not stored, so two maps that return the same value for every key are equal.
 */
@Immutable
public final class CMap<K, V> {

  private final ImmutableMap<K, V> values;
  private final V defaultValue;

  private CMap(ImmutableMap<K, V> values, V defaultValue) {
    this.values = values;
    this.defaultValue = defaultValue;
  }

  public static <K, V> CMap<K, V> empty(V defaultValue) {
    return new CMap<>(ImmutableMap.of(), Contract.assertNotNull(defaultValue));
  }

  public V get(K key) {
    return values.getOrDefault(key, defaultValue);
  }

  public CMap<K, V> set(K key, V value) {
    Contract.assertNotNull(key);
    Contract.assertNotNull(value);
    Map<K, V> updated = new LinkedHashMap<>(values);
    if (value.equals(defaultValue)) {
      updated.remove(key);
    } else {
      updated.put(key, value);
    }
    return new CMap<>(ImmutableMap.copyOf(updated), defaultValue);
  }

  /** Returns the entries whose value differs from the default. */
  public ImmutableMap<K, V> values() {
    return values;
  }

  public V defaultValue() {
    return defaultValue;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof CMap<?, ?> other && values.equals(other.values) &&
      defaultValue.equals(other.defaultValue));
  }

  @Override
  public int hashCode() {
    return Objects.hash(values, defaultValue);
  }

  @Override
  public String toString() {
    return values + " default " + defaultValue;
  }
}

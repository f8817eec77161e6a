package com.onthegomap.zen.datatype;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.onthegomap.zen.util.Contract;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import javax.annotation.concurrent.Immutable;

/**
 * An immutable finite dictionary. A {@code Dict<K, SetUnit>} represents a set of keys and supports the set
 * operations {@link #union(Dict)}, {@link #intersect(Dict)} and {@link #difference(Dict)}.
 */
@Immutable
public final class Dict<K, V> {

  private static final Dict<?, ?> EMPTY = new Dict<>(ImmutableMap.of());

  private final ImmutableMap<K, V> values;

  private Dict(ImmutableMap<K, V> values) {
    this.values = values;
  }

  @SuppressWarnings("unchecked")
  public static <K, V> Dict<K, V> empty() {
    return (Dict<K, V>) EMPTY;
  }

  public static <K, V> Dict<K, V> from(Map<K, V> values) {
    return new Dict<>(ImmutableMap.copyOf(values));
  }

  /** Returns a set containing {@code keys}. */
  @SafeVarargs
  public static <K> Dict<K, SetUnit> setOf(K... keys) {
    Map<K, SetUnit> values = new LinkedHashMap<>();
    for (K key : keys) {
      values.put(key, SetUnit.UNIT);
    }
    return from(values);
  }

  public ImmutableMap<K, V> values() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public Dict<K, V> set(K key, V value) {
    Contract.assertNotNull(key);
    Contract.assertNotNull(value);
    Map<K, V> updated = new LinkedHashMap<>(values);
    updated.put(key, value);
    return from(updated);
  }

  public Dict<K, V> delete(K key) {
    Contract.assertNotNull(key);
    if (!values.containsKey(key)) {
      return this;
    }
    Map<K, V> updated = new LinkedHashMap<>(values);
    updated.remove(key);
    return from(updated);
  }

  public Optional<V> get(K key) {
    return Optional.ofNullable(values.get(key));
  }

  public boolean containsKey(K key) {
    return values.containsKey(key);
  }

  /** Returns entries present in either dictionary, preferring values from {@code this}. */
  public Dict<K, V> union(Dict<K, V> other) {
    Map<K, V> updated = new LinkedHashMap<>(other.values);
    updated.putAll(values);
    return from(updated);
  }

  /** Returns entries of {@code this} whose keys are also in {@code other}. */
  public Dict<K, V> intersect(Dict<K, V> other) {
    return from(Maps.filterKeys(values, other.values::containsKey));
  }

  /** Returns entries of {@code this} whose keys are not in {@code other}. */
  public Dict<K, V> difference(Dict<K, V> other) {
    return from(Maps.filterKeys(values, key -> !other.values.containsKey(key)));
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Dict<?, ?> other && values.equals(other.values));
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}

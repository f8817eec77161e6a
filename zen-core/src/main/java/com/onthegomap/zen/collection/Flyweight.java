package com.onthegomap.zen.collection;

import com.onthegomap.zen.util.Contract;
import com.onthegomap.zen.util.ZenException;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;
import javax.annotation.concurrent.ThreadSafe;

/**
 * An append-only intern table that maps a structural key to one canonical value.
 * <p>
 * The builder runs at most once per key. The first caller to miss claims the key and builds the value, concurrent
 * callers for the same key wait for that build to finish and receive its result. No table-wide lock is held while
 * building, so builders may re-enter the table for other keys. A builder that requests its own key fails.
 *
 * @param <K> key type, must implement structural {@code equals} and {@code hashCode}
 * @param <V> canonical value type
 */
@ThreadSafe
public final class Flyweight<K, V> {

  private final ConcurrentHashMap<K, V> values = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<K, Build<V>> building = new ConcurrentHashMap<>();

  /** A value being built by {@code owner}. */
  private static final class Build<V> {
    final Thread owner = Thread.currentThread();
    final CompletableFuture<V> result = new CompletableFuture<>();
  }

  /**
   * Returns the value stored for {@code key}, or stores and returns {@code builder.apply(buildArgs)} if there is none.
   *
   * @param key       structural key for the requested value
   * @param buildArgs arguments passed to {@code builder} on a miss
   * @param builder   function that computes the canonical value for {@code key}
   * @return the value that every caller requesting {@code key} receives
   * @throws ZenException if the builder returns {@code null} or requests {@code key} itself
   */
  public <A> V getOrAdd(K key, A buildArgs, Function<? super A, ? extends V> builder) {
    V result = values.get(key);
    if (result != null) {
      return result;
    }
    Build<V> build = new Build<>();
    Build<V> other = building.putIfAbsent(key, build);
    if (other != null) {
      return await(key, other);
    }
    try {
      // a build that finished after the first lookup publishes its value before releasing the key
      result = values.get(key);
      if (result == null) {
        V built = Contract.assertNotNull(builder.apply(buildArgs));
        result = seed(key, built);
      }
      build.result.complete(result);
      return result;
    } catch (RuntimeException | Error e) {
      build.result.completeExceptionally(e);
      throw e;
    } finally {
      building.remove(key, build);
    }
  }

  private V await(K key, Build<V> build) {
    if (build.owner == Thread.currentThread()) {
      throw new ZenException("Builder for " + key + " requested its own key");
    }
    try {
      return build.result.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      } else if (e.getCause() instanceof Error error) {
        throw error;
      }
      throw e;
    }
  }

  /** Same as {@link #getOrAdd(Object, Object, Function)} for builders that capture their arguments. */
  public V getOrAdd(K key, Supplier<? extends V> builder) {
    return getOrAdd(key, builder, Supplier::get);
  }

  /** Stores {@code value} for {@code key} unless a value is already present, and returns the canonical value. */
  public V seed(K key, V value) {
    V existing = values.putIfAbsent(key, value);
    return existing == null ? value : existing;
  }

  public boolean contains(K key) {
    return values.containsKey(key);
  }

  public int size() {
    return values.size();
  }

  /** Returns a key that compares {@code parts} element-by-element, in order. */
  public static ArrayKey arrayKey(Object... parts) {
    return new ArrayKey(parts);
  }

  /**
   * Key wrapper for an array of components: equal when both arrays have equal elements in the same order.
   */
  public static final class ArrayKey {

    private final Object[] parts;
    private final int hash;

    private ArrayKey(Object[] parts) {
      this.parts = parts.clone();
      this.hash = Arrays.hashCode(this.parts);
    }

    @Override
    public boolean equals(Object o) {
      return this == o || (o instanceof ArrayKey other && hash == other.hash && Arrays.equals(parts, other.parts));
    }

    @Override
    public int hashCode() {
      return hash;
    }

    @Override
    public String toString() {
      return "ArrayKey" + Arrays.toString(parts);
    }
  }
}

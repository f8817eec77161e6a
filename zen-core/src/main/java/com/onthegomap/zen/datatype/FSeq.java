package com.onthegomap.zen.datatype;

import com.google.common.collect.ImmutableList;
import com.onthegomap.zen.util.Contract;
import java.util.List;
import java.util.stream.Collectors;
import javax.annotation.concurrent.Immutable;

/**
 * An immutable finite list that is built by adding elements to the front and consumed by splitting off its head.
 */
@Immutable
public final class FSeq<T> {

  private static final FSeq<?> EMPTY = new FSeq<>(ImmutableList.of());

  private final ImmutableList<T> values;

  private FSeq(ImmutableList<T> values) {
    this.values = values;
  }

  @SuppressWarnings("unchecked")
  public static <T> FSeq<T> empty() {
    return (FSeq<T>) EMPTY;
  }

  /** Returns a list of {@code values}, with the first value at the head. */
  @SafeVarargs
  public static <T> FSeq<T> of(T... values) {
    return new FSeq<>(ImmutableList.copyOf(values));
  }

  public static <T> FSeq<T> from(List<T> values) {
    return new FSeq<>(ImmutableList.copyOf(values));
  }

  public FSeq<T> addFront(T element) {
    Contract.assertNotNull(element);
    return new FSeq<>(ImmutableList.<T>builderWithExpectedSize(values.size() + 1).add(element).addAll(values).build());
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public int length() {
    return values.size();
  }

  /** Returns the first element. */
  public T head() {
    Contract.assertTrue(!isEmpty(), "head of empty list");
    return values.get(0);
  }

  /** Returns every element after the first. */
  public FSeq<T> tail() {
    Contract.assertTrue(!isEmpty(), "tail of empty list");
    return new FSeq<>(values.subList(1, values.size()));
  }

  public ImmutableList<T> values() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof FSeq<?> other && values.equals(other.values));
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
  }
}

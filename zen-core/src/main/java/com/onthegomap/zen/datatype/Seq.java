package com.onthegomap.zen.datatype;

import com.google.common.collect.ImmutableList;
import com.onthegomap.zen.util.Contract;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.annotation.concurrent.Immutable;

/**
 * An immutable finite sequence of values.
 * <p>
 * Operations that index outside of the sequence never throw: {@link #at(int)} and {@link #slice(int, int)} return an
 * empty sequence and {@link #indexOf(Seq, int)} returns {@code -1}.
 */
@Immutable
public final class Seq<T> {

  private static final Seq<?> EMPTY = new Seq<>(ImmutableList.of());

  private final ImmutableList<T> values;

  private Seq(ImmutableList<T> values) {
    this.values = values;
  }

  @SuppressWarnings("unchecked")
  public static <T> Seq<T> empty() {
    return (Seq<T>) EMPTY;
  }

  @SafeVarargs
  public static <T> Seq<T> of(T... values) {
    return new Seq<>(ImmutableList.copyOf(values));
  }

  public static <T> Seq<T> from(List<T> values) {
    return new Seq<>(ImmutableList.copyOf(values));
  }

  /** Returns the characters of {@code string} as a sequence. */
  public static Seq<Character> fromString(String string) {
    return new Seq<>(string.chars().mapToObj(c -> (char) c).collect(ImmutableList.toImmutableList()));
  }

  /** Returns the characters of {@code seq} as a string. */
  public static String asString(Seq<Character> seq) {
    StringBuilder builder = new StringBuilder(seq.length());
    for (Character c : seq.values) {
      builder.append(c.charValue());
    }
    return builder.toString();
  }

  public ImmutableList<T> values() {
    return values;
  }

  public int length() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  public Seq<T> concat(Seq<T> other) {
    Contract.assertNotNull(other);
    if (other.isEmpty()) {
      return this;
    }
    if (isEmpty()) {
      return other;
    }
    return new Seq<>(ImmutableList.<T>builder().addAll(values).addAll(other.values).build());
  }

  public Seq<T> add(T element) {
    return concat(of(element));
  }

  /** Returns a sequence of the element at {@code index}, or an empty sequence when out of range. */
  public Seq<T> at(int index) {
    if (index < 0 || index >= values.size()) {
      return empty();
    }
    return of(values.get(index));
  }

  /** Returns the element at {@code index}, or empty when out of range. */
  public Optional<T> nth(int index) {
    return index < 0 || index >= values.size() ? Optional.empty() : Optional.of(values.get(index));
  }

  /** Returns up to {@code length} elements starting at {@code offset}. */
  public Seq<T> slice(int offset, int length) {
    if (offset < 0 || offset >= values.size() || length < 0) {
      return empty();
    }
    int end = (int) Math.min(values.size(), (long) offset + length);
    return new Seq<>(values.subList(offset, end));
  }

  public int indexOf(Seq<T> other) {
    return indexOf(other, 0);
  }

  /** Returns the first index at or after {@code offset} where {@code other} occurs, or -1. */
  public int indexOf(Seq<T> other, int offset) {
    Contract.assertNotNull(other);
    if (offset < 0 || offset > length() || other.length() > length()) {
      return -1;
    }
    if (other.isEmpty()) {
      return offset;
    }
    for (int i = offset; i <= length() - other.length(); i++) {
      if (matchesAt(other, i)) {
        return i;
      }
    }
    return -1;
  }

  public boolean contains(Seq<T> other) {
    return indexOf(other, 0) >= 0;
  }

  public boolean hasPrefix(Seq<T> other) {
    Contract.assertNotNull(other);
    return other.length() <= length() && matchesAt(other, 0);
  }

  public boolean hasSuffix(Seq<T> other) {
    Contract.assertNotNull(other);
    return other.length() <= length() && matchesAt(other, length() - other.length());
  }

  /** Replaces the first occurrence of {@code match} with {@code replacement}, an empty match prepends it. */
  public Seq<T> replaceFirst(Seq<T> match, Seq<T> replacement) {
    Contract.assertNotNull(match);
    Contract.assertNotNull(replacement);
    if (match.isEmpty()) {
      return replacement.concat(this);
    }
    int index = indexOf(match);
    if (index < 0) {
      return this;
    }
    int afterMatch = index + match.length();
    return slice(0, index).concat(replacement).concat(slice(afterMatch, length() - afterMatch));
  }

  private boolean matchesAt(Seq<T> other, int index) {
    for (int i = 0; i < other.length(); i++) {
      if (!values.get(index + i).equals(other.values.get(i))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof Seq<?> other && values.equals(other.values));
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

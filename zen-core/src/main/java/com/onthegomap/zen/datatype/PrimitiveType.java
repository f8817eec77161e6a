package com.onthegomap.zen.datatype;

import javax.annotation.concurrent.Immutable;

/**
 * A scalar type with a fixed Java class, compared by identity since each one is a singleton on {@link ZenType}.
 */
@Immutable
public final class PrimitiveType<T> implements ZenType<T> {

  private final String name;
  private final Class<T> javaClass;
  private final T defaultValue;

  PrimitiveType(String name, Class<T> javaClass, T defaultValue) {
    this.name = name;
    this.javaClass = javaClass;
    this.defaultValue = defaultValue;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public Class<T> javaClass() {
    return javaClass;
  }

  @Override
  public T defaultValue() {
    return defaultValue;
  }

  @Override
  public String toString() {
    return name;
  }
}

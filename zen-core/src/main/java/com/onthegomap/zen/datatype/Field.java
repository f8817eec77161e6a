package com.onthegomap.zen.datatype;

import com.onthegomap.zen.util.Contract;

/**
 * A named, typed slot on a {@link RecordType}.
 *
 * @param <F> the Java class of the field's values
 */
public record Field<F>(String name, ZenType<F> type) {

  public Field {
    Contract.assertNotNull(name);
    Contract.assertNotNull(type);
  }

  public static <F> Field<F> of(String name, ZenType<F> type) {
    return new Field<>(name, type);
  }

  @Override
  public String toString() {
    return name + ": " + type;
  }
}

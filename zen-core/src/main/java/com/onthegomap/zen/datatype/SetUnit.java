package com.onthegomap.zen.datatype;

/** The single value stored for each member of a set, which is a {@link Dict} to this type. */
public enum SetUnit {
  UNIT;

  @Override
  public String toString() {
    return "()";
  }
}

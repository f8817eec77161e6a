package com.onthegomap.zen.datatype;

/** Type of finite lists of {@code elementType} that are built and matched from the front. */
public record FSeqType<E>(ZenType<E> elementType) implements ZenType<FSeq<E>> {

  @Override
  public String name() {
    return "FSeq<" + elementType.name() + ">";
  }

  @Override
  public Class<?> javaClass() {
    return FSeq.class;
  }

  @Override
  public FSeq<E> defaultValue() {
    return FSeq.empty();
  }

  @Override
  public String toString() {
    return name();
  }
}

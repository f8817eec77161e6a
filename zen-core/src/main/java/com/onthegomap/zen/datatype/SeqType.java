package com.onthegomap.zen.datatype;

/** Type of finite sequences of {@code elementType}. */
public record SeqType<E>(ZenType<E> elementType) implements ZenType<Seq<E>> {

  @Override
  public String name() {
    return "Seq<" + elementType.name() + ">";
  }

  @Override
  public Class<?> javaClass() {
    return Seq.class;
  }

  @Override
  public Seq<E> defaultValue() {
    return Seq.empty();
  }

  @Override
  public String toString() {
    return name();
  }
}

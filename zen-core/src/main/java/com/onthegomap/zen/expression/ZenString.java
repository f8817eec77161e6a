package com.onthegomap.zen.expression;

import com.onthegomap.zen.datatype.Seq;
import com.onthegomap.zen.datatype.ZenType;
import java.math.BigInteger;

/**
 * String operations, built from sequence nodes over the {@code Seq<char>} view of a string.
 */
public final class ZenString {
  private ZenString() {}

  /** Returns {@code string} as a sequence of characters. */
  public static Zen<Seq<Character>> chars(Zen<String> string) {
    return CastExpr.create(string, CastExpr.CHAR_SEQ);
  }

  /** Returns the string made of the characters in {@code chars}. */
  public static Zen<String> fromChars(Zen<Seq<Character>> chars) {
    return CastExpr.create(chars, ZenType.STRING);
  }

  public static Zen<BigInteger> length(Zen<String> string) {
    return Zen.length(chars(string));
  }

  public static Zen<String> concat(Zen<String> string1, Zen<String> string2) {
    return fromChars(Zen.concat(chars(string1), chars(string2)));
  }

  public static Zen<Boolean> contains(Zen<String> string, Zen<String> substring) {
    return Zen.contains(chars(string), chars(substring));
  }

  public static Zen<Boolean> startsWith(Zen<String> string, Zen<String> prefix) {
    return Zen.startsWith(chars(string), chars(prefix));
  }

  public static Zen<Boolean> endsWith(Zen<String> string, Zen<String> suffix) {
    return Zen.endsWith(chars(string), chars(suffix));
  }

  public static Zen<BigInteger> indexOf(Zen<String> string, Zen<String> substring) {
    return Zen.indexOf(chars(string), chars(substring));
  }

  public static Zen<BigInteger> indexOf(Zen<String> string, Zen<String> substring, Zen<BigInteger> offset) {
    return Zen.indexOf(chars(string), chars(substring), offset);
  }

  public static Zen<String> substring(Zen<String> string, Zen<BigInteger> offset, Zen<BigInteger> length) {
    return fromChars(Zen.slice(chars(string), offset, length));
  }

  /** Returns the one character string at {@code index}, or the empty string when out of range. */
  public static Zen<String> at(Zen<String> string, Zen<BigInteger> index) {
    return fromChars(Zen.at(chars(string), index));
  }

  public static Zen<String> replaceFirst(Zen<String> string, Zen<String> match, Zen<String> replacement) {
    return fromChars(Zen.replaceFirst(chars(string), chars(match), chars(replacement)));
  }
}

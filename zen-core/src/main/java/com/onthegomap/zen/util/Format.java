package com.onthegomap.zen.util;

import org.apache.commons.text.StringEscapeUtils;

/**
 * Utilities for formatting values as strings.
 */
public class Format {

  /** Width of one indentation level in formatted expressions. */
  public static final int INDENT_WIDTH = 2;

  private Format() {}

  public static String padRight(String str, int size) {
    StringBuilder strBuilder = new StringBuilder(str);
    while (strBuilder.length() < size) {
      strBuilder.append(" ");
    }
    return strBuilder.toString();
  }

  public static String padLeft(String str, int size) {
    StringBuilder strBuilder = new StringBuilder(str);
    while (strBuilder.length() < size) {
      strBuilder.insert(0, " ");
    }
    return strBuilder.toString();
  }

  /** Returns the whitespace that prefixes a line nested {@code level} levels deep. */
  public static String indent(int level) {
    return padRight("", level * INDENT_WIDTH);
  }

  /** Returns a Java-style literal for {@code string}: {@code null} if null, or {@code "contents"} if not. */
  public static String quote(Object string) {
    if (string == null) {
      return "null";
    }
    return '"' + StringEscapeUtils.escapeJava(string.toString()) + '"';
  }

  /** Returns a Java-style character literal for {@code c}. */
  public static String quote(char c) {
    return c == '\'' ? "'\\''" : "'" + StringEscapeUtils.escapeJava(String.valueOf(c)) + "'";
  }
}

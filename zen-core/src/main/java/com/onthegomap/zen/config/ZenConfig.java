package com.onthegomap.zen.config;

/**
 * Settings that control how expressions are simplified and formatted inside one
 * {@link com.onthegomap.zen.expression.ZenContext}.
 *
 * @param arguments          the source these settings were read from
 * @param preserveBranches   when true, {@code if} nodes keep their explicit branch structure instead of being rewritten
 *                           into boolean {@code and}/{@code or} or collapsed when both branches are the same node
 * @param formatInlineCutoff maximum width of a rendering that the formatter keeps on a single line
 * @param formatLetDepth     nesting level at which the formatter forces a {@code let} binding
 */
public record ZenConfig(
  Arguments arguments,
  boolean preserveBranches,
  int formatInlineCutoff,
  int formatLetDepth
) {

  public static final int DEFAULT_INLINE_CUTOFF = 80;
  public static final int DEFAULT_LET_DEPTH = 8;

  public ZenConfig {
    if (formatInlineCutoff <= 0) {
      throw new IllegalArgumentException("Inline cutoff must be > 0, was " + formatInlineCutoff);
    }
    if (formatLetDepth < 1) {
      throw new IllegalArgumentException("Let depth must be >= 1, was " + formatLetDepth);
    }
  }

  public static ZenConfig defaults() {
    return from(Arguments.of());
  }

  public static ZenConfig from(Arguments arguments) {
    return new ZenConfig(
      arguments,
      arguments.getBoolean("preserve_branches",
        "keep if-then-else structure instead of rewriting it into boolean operators", false),
      arguments.getInteger("format_inline_cutoff",
        "maximum width of a formatted expression that stays on one line", DEFAULT_INLINE_CUTOFF),
      arguments.getInteger("format_let_depth",
        "nesting depth where the formatter starts binding subexpressions to variables", DEFAULT_LET_DEPTH)
    );
  }

  /** Returns a copy of this config with {@code preserveBranches} replaced. */
  public ZenConfig withPreserveBranches(boolean preserveBranches) {
    return new ZenConfig(arguments, preserveBranches, formatInlineCutoff, formatLetDepth);
  }
}

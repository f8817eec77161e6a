package com.onthegomap.zen.config;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ZenConfigTest {

  @Test
  void testDefaults() {
    ZenConfig config = ZenConfig.defaults();
    assertFalse(config.preserveBranches());
    assertEquals(ZenConfig.DEFAULT_INLINE_CUTOFF, config.formatInlineCutoff());
    assertEquals(ZenConfig.DEFAULT_LET_DEPTH, config.formatLetDepth());
  }

  @Test
  void testFromArguments() {
    ZenConfig config = ZenConfig.from(Arguments.of(
      "preserve_branches", "true",
      "format_inline_cutoff", "40",
      "format_let_depth", "3"
    ));
    assertTrue(config.preserveBranches());
    assertEquals(40, config.formatInlineCutoff());
    assertEquals(3, config.formatLetDepth());
  }

  @Test
  void testWithPreserveBranches() {
    ZenConfig config = ZenConfig.defaults().withPreserveBranches(true);
    assertTrue(config.preserveBranches());
    assertEquals(ZenConfig.DEFAULT_INLINE_CUTOFF, config.formatInlineCutoff());
  }

  @Test
  void testRejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class,
      () -> ZenConfig.from(Arguments.of("format_inline_cutoff", "0")));
    assertThrows(IllegalArgumentException.class,
      () -> ZenConfig.from(Arguments.of("format_let_depth", "0")));
  }
}

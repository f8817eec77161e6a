package com.onthegomap.zen.datatype;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SeqTest {

  private static Seq<Character> seq(String value) {
    return Seq.fromString(value);
  }

  @Test
  void testStringConversion() {
    assertEquals("hello", Seq.asString(seq("hello")));
    assertEquals(Seq.of('a', 'b'), seq("ab"));
    assertTrue(seq("").isEmpty());
    assertSame(Seq.empty(), Seq.empty());
  }

  @Test
  void testConcat() {
    assertEquals(seq("abcd"), seq("ab").concat(seq("cd")));
    Seq<Character> ab = seq("ab");
    assertSame(ab, ab.concat(Seq.empty()));
    assertSame(ab, Seq.<Character>empty().concat(ab));
    assertEquals(seq("abc"), ab.add('c'));
  }

  @Test
  void testAtAndNth() {
    assertEquals(seq("b"), seq("abc").at(1));
    assertEquals(Seq.empty(), seq("abc").at(3));
    assertEquals(Seq.empty(), seq("abc").at(-1));
    assertEquals(Optional.of('c'), seq("abc").nth(2));
    assertEquals(Optional.empty(), seq("abc").nth(5));
  }

  @ParameterizedTest
  @CsvSource({
    "abcdef,1,3,bcd",
    "abcdef,4,10,ef",
    "abcdef,6,1,''",
    "abcdef,-1,2,''",
    "abcdef,2,-1,''",
    "abcdef,0,2147483647,abcdef",
  })
  void testSlice(String input, int offset, int length, String expected) {
    assertEquals(seq(expected), seq(input).slice(offset, length));
  }

  @ParameterizedTest
  @CsvSource({
    "abcabc,bc,0,1",
    "abcabc,bc,2,4",
    "abcabc,bc,5,-1",
    "abcabc,'',3,3",
    "abcabc,'',6,6",
    "abcabc,'',7,-1",
    "abc,abcd,0,-1",
    "abc,x,0,-1",
  })
  void testIndexOf(String input, String sub, int offset, int expected) {
    assertEquals(expected, seq(input).indexOf(seq(sub), offset));
  }

  @Test
  void testContainment() {
    assertTrue(seq("hello").contains(seq("ell")));
    assertFalse(seq("hello").contains(seq("elo")));
    assertTrue(seq("hello").hasPrefix(seq("he")));
    assertFalse(seq("hello").hasPrefix(seq("el")));
    assertTrue(seq("hello").hasSuffix(seq("llo")));
    assertTrue(seq("hello").hasSuffix(seq("")));
    assertFalse(seq("lo").hasSuffix(seq("hello")));
  }

  @ParameterizedTest
  @CsvSource({
    "hello,l,L,heLlo",
    "hello,x,L,hello",
    "hello,'',>,>hello",
    "hello,hello,'',''",
    "hello,o,'!!',hell!!",
  })
  void testReplaceFirst(String input, String match, String replacement, String expected) {
    assertEquals(seq(expected), seq(input).replaceFirst(seq(match), seq(replacement)));
  }

  @Test
  void testToString() {
    assertEquals("[1, 2]", Seq.of(1, 2).toString());
  }
}

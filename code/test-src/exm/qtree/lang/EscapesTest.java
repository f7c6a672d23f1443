package exm.qtree.lang;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class EscapesTest {

  @Test
  public void testQuotesAndBackslash() {
    assertEquals("a\\\"b", Escapes.escape("a\"b", '"'));
    assertEquals("a\"b", Escapes.escape("a\"b", '\''));
    assertEquals("c:\\\\dir", Escapes.escape("c:\\dir", '"'));
  }

  @Test
  public void testInterpolationStart() {
    assertEquals("\\#{x}", Escapes.escape("#{x}", '"'));
    assertEquals("#x", Escapes.escape("#x", '"'));
  }

  @Test
  public void testControlCharacters() {
    assertEquals("\\n\\t\\r", Escapes.escape("\n\t\r", '"'));
    assertEquals("\\0\\a\\e\\d", Escapes.escape("\0\u0007\u001b\u007f", '"'));
    assertEquals("\\x01", Escapes.escape("\u0001", '"'));
    assertEquals("\\x85", Escapes.escape("\u0085", '"'));
  }

  @Test
  public void testPrintableUnicodeKept() {
    assertEquals("h\u00e9llo \u4e16", Escapes.escape("h\u00e9llo \u4e16", '"'));
    assertEquals("\\uFFFF", Escapes.escape("\uffff", '"'));
  }
}

package exm.qtree.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.qtree.ast.Atom;
import exm.qtree.lang.AtomClassifier.Format;
import exm.qtree.lang.AtomClassifier.SourceForm;

public class AtomClassifierTest {

  private static AtomCategory classify(String name) {
    return AtomClassifier.classify(Atom.of(name));
  }

  private static String inspect(Format format, String name) {
    return AtomClassifier.inspect(format, Atom.of(name));
  }

  @Test
  public void testClassify() {
    assertEquals(AtomCategory.IDENTIFIER, classify("foo"));
    assertEquals(AtomCategory.IDENTIFIER, classify("valid?"));
    assertEquals(AtomCategory.UNQUOTED_OPERATOR, classify("+"));
    assertEquals(AtomCategory.UNQUOTED_OPERATOR, classify("|>"));
    assertEquals(AtomCategory.QUOTED_OPERATOR, classify("::"));
    assertEquals(AtomCategory.NOT_CALLABLE, classify("%{}"));
    assertEquals(AtomCategory.NOT_CALLABLE, classify("Foo"));
    assertEquals(AtomCategory.NOT_CALLABLE, classify("foo@bar"));
    assertEquals(AtomCategory.ALIAS, classify("Elixir.Foo.Bar"));
    assertEquals(AtomCategory.ALIAS, classify("Elixir"));
    assertEquals(AtomCategory.OTHER, classify("foo bar"));
    assertEquals(AtomCategory.OTHER, classify(""));
  }

  @Test
  public void testAliasShape() {
    assertTrue(AtomClassifier.isValidAlias("Elixir.Foo_1"));
    assertFalse(AtomClassifier.isValidAlias("Elixir.foo"));
    assertFalse(AtomClassifier.isValidAlias("Elixir."));
    assertFalse(AtomClassifier.isValidAlias("Elixir.Foo.-"));
  }

  @Test
  public void testSourceForm() {
    assertEquals(SourceForm.UNQUOTED,
                 AtomClassifier.sourceForm(Atom.of("foo@bar")));
    assertEquals(SourceForm.QUOTED,
                 AtomClassifier.sourceForm(Atom.of("::")));
  }

  @Test
  public void testInspectLiteral() {
    assertEquals(":foo", inspect(Format.LITERAL, "foo"));
    assertEquals(":+", inspect(Format.LITERAL, "+"));
    assertEquals(":\"::\"", inspect(Format.LITERAL, "::"));
    assertEquals("Foo.Bar", inspect(Format.LITERAL, "Elixir.Foo.Bar"));
    assertEquals("Elixir", inspect(Format.LITERAL, "Elixir"));
    assertEquals("nil", inspect(Format.LITERAL, "nil"));
    assertEquals("true", inspect(Format.LITERAL, "true"));
    assertEquals(":\"foo bar\"", inspect(Format.LITERAL, "foo bar"));
  }

  @Test
  public void testInspectKey() {
    assertEquals("foo:", inspect(Format.KEY, "foo"));
    assertEquals("+:", inspect(Format.KEY, "+"));
    assertEquals("\"Elixir.Foo\":", inspect(Format.KEY, "Elixir.Foo"));
    assertEquals("\"a\\\"b\":", inspect(Format.KEY, "a\"b"));
  }

  @Test
  public void testInspectRemoteCall() {
    assertEquals("foo", inspect(Format.REMOTE_CALL, "foo"));
    assertEquals("::", inspect(Format.REMOTE_CALL, "::"));
    assertEquals("\"%{}\"", inspect(Format.REMOTE_CALL, "%{}"));
    assertEquals("\"foo bar\"", inspect(Format.REMOTE_CALL, "foo bar"));
  }
}

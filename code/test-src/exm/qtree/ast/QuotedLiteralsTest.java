package exm.qtree.ast;

import static exm.qtree.ast.QuotedLiterals.isQuotedLiteral;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class QuotedLiteralsTest {

  @Test
  public void testLeaves() {
    assertTrue(isQuotedLiteral(Atom.of("foo")));
    assertTrue(isQuotedLiteral(Literal.integer(1)));
    assertTrue(isQuotedLiteral(Literal.floating(2.0)));
    assertTrue(isQuotedLiteral(Literal.string("abc")));
  }

  @Test
  public void testContainers() {
    assertTrue(isQuotedLiteral(Nodes.list(Atom.of("a"), Literal.integer(1))));
    assertTrue(isQuotedLiteral(new Tuple2(Atom.of("a"), Literal.integer(1))));
    assertTrue(isQuotedLiteral(Nodes.tuple(Atom.of("a"), Atom.of("b"),
                                           Atom.of("c"))));
    assertTrue(isQuotedLiteral(Nodes.map(Arrays.asList(
        new Tuple2(Atom.of("k"), Literal.string("v"))))));
    assertTrue(isQuotedLiteral(Nodes.aliases("Foo", "Bar")));
    assertTrue(isQuotedLiteral(Nodes.call(Nodes.STRUCT,
        Nodes.aliases("URI"), Nodes.map(Arrays.<Node>asList()))));
    assertTrue(isQuotedLiteral(Nodes.var(Nodes.MODULE, Atom.NIL)));
  }

  @Test
  public void testBitstrings() {
    Node seg = Nodes.op("::", Literal.integer(1),
        Nodes.op("-", Nodes.var("integer", Atom.NIL),
                 Nodes.call("size", Literal.integer(8))));
    assertTrue(isQuotedLiteral(Nodes.call(Nodes.BITSTRING,
                                Literal.string("a"), seg)));
    Node badSize = Nodes.op("::", Literal.integer(1),
        Nodes.call("size", Nodes.var("n", Atom.NIL)));
    assertFalse(isQuotedLiteral(Nodes.call(Nodes.BITSTRING, badSize)));
  }

  @Test
  public void testCode() {
    assertFalse(isQuotedLiteral(Nodes.var("x", Atom.NIL)));
    assertFalse(isQuotedLiteral(Nodes.call("foo")));
    assertFalse(isQuotedLiteral(Nodes.list(Atom.of("a"),
                                           Nodes.var("x", Atom.NIL))));
    assertFalse(isQuotedLiteral(Literal.foreign(new Object())));
  }
}

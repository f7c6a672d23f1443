package exm.qtree.term;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Literal;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.Nodes;
import exm.qtree.ast.Tuple2;

public class TermWriterTest {

  @Test
  public void testForms() {
    assertEquals("{:x, [line: 2], nil}",
        TermWriter.write(Nodes.var("x", Meta.line(2), Atom.NIL)));
    assertEquals("{:foo, [], [1, :a]}",
        TermWriter.write(Nodes.call("foo", Literal.integer(1), Atom.of("a"))));
    assertEquals("{{:., [], [Enum, :sum]}, [], []}",
        TermWriter.write(Nodes.remote(Atom.alias("Enum"), "sum")));
  }

  @Test
  public void testMetaValues() {
    Meta m = Meta.of(Meta.GENERATED, true, "file", "a.ex",
                     "ratio", 0.5, Meta.COUNTER, 7);
    assertEquals("{:x, [generated: true, file: \"a.ex\", ratio: 0.5, " +
                 "counter: 7], Foo}",
        TermWriter.write(Nodes.var("x", m, Atom.alias("Foo"))));
  }

  @Test
  public void testLists() {
    assertEquals("[a: 1, b: \"s\"]", TermWriter.write(
        Nodes.keyword("a", Literal.integer(1), "b", Literal.string("s"))));
    assertEquals("[{Foo, 1}]", TermWriter.write(Nodes.list(
        new Tuple2(Atom.alias("Foo"), Literal.integer(1)))));
    assertEquals("[]", TermWriter.write(Nodes.list()));
  }

  @Test
  public void testLeaves() {
    assertEquals("{1, 2.5}", TermWriter.write(
        new Tuple2(Literal.integer(1), Literal.floating(2.5))));
    assertEquals("1.0e10", TermWriter.formatFloat(1.0e10));
    assertEquals("\"a\\\"b\"", TermWriter.write(Literal.string("a\"b")));
    assertEquals(":\"::\"", TermWriter.write(Atom.of("::")));
  }

  @Test
  public void testForeign() {
    Node raw = Literal.foreign(new RawTuple(Arrays.asList(
        Atom.of("a"), Literal.integer(1), Atom.of("b"))));
    assertEquals("{:a, 1, :b}", TermWriter.write(raw));
    assertEquals("#Java<StringBuilder sb>",
        TermWriter.write(Literal.foreign(new StringBuilder("sb"))));
  }

  @Test
  public void testReadsBack() throws Exception {
    Node tree = TermReader.read(TermReaderTest.fixture("pipeline.term"));
    assertEquals(tree, TermReader.read(TermWriter.write(tree)));
  }
}

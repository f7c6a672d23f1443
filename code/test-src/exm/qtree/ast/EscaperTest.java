package exm.qtree.ast;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

import exm.qtree.common.exceptions.QTreeRuntimeError;
import exm.qtree.common.util.Pair;

public class EscaperTest {

  @Test
  public void testPlainValues() {
    assertEquals(Atom.NIL, Escaper.escape(null));
    assertEquals(Atom.TRUE, Escaper.escape(true));
    assertEquals(Literal.integer(3), Escaper.escape(3));
    assertEquals(Literal.floating(2.5), Escaper.escape(2.5f));
    assertEquals(Literal.string("hi"), Escaper.escape("hi"));
    assertEquals(Nodes.list(Literal.integer(1), Atom.of("a")),
                 Escaper.escape(Arrays.asList(1, Atom.of("a"))));
  }

  @Test
  public void testTuples() {
    assertEquals(new Tuple2(Atom.of("ok"), Literal.integer(1)),
                 Escaper.escape(Pair.create(Atom.of("ok"), 1)));
    assertEquals(Nodes.tuple(Literal.integer(1), Literal.integer(2),
                             Literal.integer(3)),
                 Escaper.escape(new Object[] {1, 2, 3}));
  }

  @Test
  public void testMap() {
    Map<String, Integer> m = new LinkedHashMap<String, Integer>();
    m.put("a", 1);
    Node expected = Nodes.map(Arrays.asList(
        new Tuple2(Literal.string("a"), Literal.integer(1))));
    assertEquals(expected, Escaper.escape(m));
  }

  @Test
  public void testFormBecomesTupleConstructor() {
    Form var = Nodes.var("x", Meta.line(2), Atom.NIL);
    Node expected = Nodes.tuple(Atom.of("x"),
        Nodes.keyword(Meta.LINE, Literal.integer(2)), Atom.NIL);
    assertEquals(expected, Escaper.escape(var));
  }

  @Test
  public void testPruneMetadata() {
    Form call = Nodes.call("foo",
        Meta.of(Meta.LINE, 1, Meta.COLUMN, 4, Meta.NO_PARENS, true),
        Arrays.<Node>asList());
    Node expected = Nodes.tuple(Atom.of("foo"),
        Nodes.keyword(Meta.LINE, Literal.integer(1),
                      Meta.NO_PARENS, Atom.TRUE),
        NodeList.EMPTY);
    assertEquals(expected,
        Escaper.escape(call, new Escaper.Options(false, true)));
  }

  @Test
  public void testUnquote() {
    Form x = Nodes.var("x", Atom.NIL);
    Node unquoted = Nodes.call("unquote", x);
    Escaper.Options opts = new Escaper.Options(true, false);
    assertEquals(x, Escaper.escape(unquoted, opts));
  }

  @Test
  public void testUnquoteSplicing() {
    Form xs = Nodes.var("xs", Atom.NIL);
    NodeList l = Nodes.list(Literal.integer(1),
                            Nodes.call("unquote_splicing", xs));
    Node expected = new Form(Nodes.dot(Atom.of("erlang"), Atom.of("++")),
        Meta.EMPTY, NodeList.of(Nodes.list(Literal.integer(1)), xs));
    assertEquals(expected,
                 Escaper.escape(l, new Escaper.Options(true, false)));
  }

  @Test(expected=QTreeRuntimeError.class)
  public void testUnknownValue() {
    Escaper.escape(new Object());
  }
}

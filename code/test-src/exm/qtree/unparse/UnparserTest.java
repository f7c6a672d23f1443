package exm.qtree.unparse;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Form;
import exm.qtree.ast.Literal;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.ast.Nodes;
import exm.qtree.ast.Tuple2;

public class UnparserTest {

  private static final Node X = Nodes.var("x", Atom.NIL);

  private static Node i(long v) {
    return Literal.integer(v);
  }

  @Test
  public void testPrecedence() {
    assertEquals("5 + 3 * 7",
        Unparser.toString(Nodes.op("+", i(5), Nodes.op("*", i(3), i(7)))));
    assertEquals("(5 + 3) * 7",
        Unparser.toString(Nodes.op("*", Nodes.op("+", i(5), i(3)), i(7))));
  }

  @Test
  public void testAssociativity() {
    assertEquals("1 - 2 - 3",
        Unparser.toString(Nodes.op("-", Nodes.op("-", i(1), i(2)), i(3))));
    assertEquals("1 - (2 - 3)",
        Unparser.toString(Nodes.op("-", i(1), Nodes.op("-", i(2), i(3)))));
    assertEquals("a ++ b ++ c",
        Unparser.toString(Nodes.op("++", Nodes.var("a", Atom.NIL),
            Nodes.op("++", Nodes.var("b", Atom.NIL),
                     Nodes.var("c", Atom.NIL)))));
  }

  @Test
  public void testRanges() {
    assertEquals("1..10", Unparser.toString(Nodes.op("..", i(1), i(10))));
    assertEquals("1..10//2",
        Unparser.toString(Nodes.call("..//", i(1), i(10), i(2))));
  }

  @Test
  public void testUnary() {
    assertEquals("-x", Unparser.toString(Nodes.call("-", X)));
    assertEquals("not(x)", Unparser.toString(Nodes.call("not", X)));
    assertEquals("!(x and y)", Unparser.toString(Nodes.call("!",
        Nodes.op("and", X, Nodes.var("y", Atom.NIL)))));
  }

  @Test
  public void testCalls() {
    assertEquals("foo(1, x)", Unparser.toString(Nodes.call("foo", i(1), X)));
    assertEquals("foo(1, a: 2)", Unparser.toString(Nodes.call("foo", i(1),
        Nodes.keyword("a", i(2)))));
    assertEquals("Enum.map(x, f)", Unparser.toString(Nodes.remote(
        Nodes.aliases("Enum"), "map", X, Nodes.var("f", Atom.NIL))));
    assertEquals(":lists.reverse(x)",
        Unparser.toString(Nodes.remote(Atom.of("lists"), "reverse", X)));
    assertEquals("Foo.bar()",
        Unparser.toString(Nodes.remote(Atom.alias("Foo"), "bar")));
  }

  @Test
  public void testNoParensRemote() {
    Form call = new Form(Nodes.dot(X, Atom.of("field")),
                         Meta.of(Meta.NO_PARENS, true), NodeList.EMPTY);
    assertEquals("x.field", Unparser.toString(call));
    assertEquals("x.field()", Unparser.toString(call.withMeta(Meta.EMPTY)));
  }

  @Test
  public void testContainers() {
    assertEquals("[1, x]", Unparser.toString(Nodes.list(i(1), X)));
    assertEquals("[]", Unparser.toString(NodeList.EMPTY));
    assertEquals("[a: 1, b: 2]",
        Unparser.toString(Nodes.keyword("a", i(1), "b", i(2))));
    assertEquals("{1, 2}", Unparser.toString(new Tuple2(i(1), i(2))));
    assertEquals("{1, 2, 3}", Unparser.toString(Nodes.tuple(i(1), i(2), i(3))));
    assertEquals("%{a: 1}", Unparser.toString(Nodes.map(Arrays.asList(
        new Tuple2(Atom.of("a"), i(1))))));
    assertEquals("%{\"a\" => 1}", Unparser.toString(Nodes.map(Arrays.asList(
        new Tuple2(Literal.string("a"), i(1))))));
    assertEquals("%URI{host: x}", Unparser.toString(Nodes.call(Nodes.STRUCT,
        Nodes.aliases("URI"),
        Nodes.map(Arrays.asList(new Tuple2(Atom.of("host"), X))))));
  }

  @Test
  public void testCharlist() {
    assertEquals("~c\"hi\"", Unparser.toString(Nodes.list(i('h'), i('i'))));
    assertEquals("[1, 2]", Unparser.toString(Nodes.list(i(1), i(2))));
  }

  @Test
  public void testLeaves() {
    assertEquals(":foo", Unparser.toString(Atom.of("foo")));
    assertEquals("Foo.Bar", Unparser.toString(Atom.alias("Foo.Bar")));
    assertEquals("nil", Unparser.toString(Atom.NIL));
    assertEquals("\"a\\nb\"", Unparser.toString(Literal.string("a\nb")));
    assertEquals("1.5", Unparser.toString(Literal.floating(1.5)));
  }

  @Test
  public void testInterpolation() {
    Node seg = Nodes.op("::",
        Nodes.remote(Atom.alias("Kernel"), "to_string", X),
        Nodes.var("binary", Atom.NIL));
    Node str = Nodes.call(Nodes.BITSTRING, Literal.string("a "), seg);
    assertEquals("\"a #{x}\"", Unparser.toString(str));
  }

  @Test
  public void testInterpolationEscapesText() {
    Node seg = Nodes.op("::",
        Nodes.remote(Atom.alias("Kernel"), "to_string", X),
        Nodes.var("binary", Atom.NIL));
    Node str = Nodes.call(Nodes.BITSTRING,
                          Literal.string("a\\b\"#{c}"), seg);
    assertEquals("\"a\\\\b\\\"\\#{c}#{x}\"", Unparser.toString(str));
  }

  @Test
  public void testBitstring() {
    Node seg = Nodes.op("::", X, Nodes.op("-",
        Nodes.var("integer", Atom.NIL), Nodes.call("size", i(8))));
    assertEquals("<<1, x::integer-size(8)>>",
        Unparser.toString(Nodes.call(Nodes.BITSTRING, i(1), seg)));
  }

  @Test
  public void testFn() {
    Node fn = Nodes.call("fn", Nodes.op("->", Nodes.list(X),
        Nodes.op("+", X, i(1))));
    assertEquals("fn x -> x + 1 end", Unparser.toString(fn));
  }

  @Test
  public void testCapture() {
    Node local = Nodes.call("&", Nodes.op("/",
        Nodes.var("foo", Atom.NIL), i(1)));
    assertEquals("&foo/1", Unparser.toString(local));
    Node remote = Nodes.call("&", Nodes.op("/",
        Nodes.remote(Nodes.aliases("Enum"), "map"), i(2)));
    assertEquals("&Enum.map/2", Unparser.toString(remote));
    Node expr = Nodes.call("&", Nodes.op("*",
        Nodes.call("&", i(1)), i(2)));
    assertEquals("&(&1 * 2)", Unparser.toString(expr));
  }

  @Test
  public void testDoBlock() {
    Node block = Nodes.call("if", X, Nodes.keyword(
        "do", i(1), "else", i(2)));
    assertEquals("if(x) do\n  1\nelse\n  2\nend", Unparser.toString(block));
  }

  @Test
  public void testBlock() {
    assertEquals("(\n  x\n  1\n)", Unparser.toString(Nodes.block(X, i(1))));
    assertEquals("x", Unparser.toString(Nodes.block(X)));
  }

  @Test
  public void testAccess() {
    Node get = Nodes.remote(Atom.alias("Access"), "get", X, Atom.of("k"));
    assertEquals("x[:k]", Unparser.toString(get));
  }

  @Test
  public void testWhenAndNotIn() {
    assertEquals("x when x > 1", Unparser.toString(Nodes.op("when", X,
        Nodes.op(">", X, i(1)))));
    assertEquals("x not in y", Unparser.toString(Nodes.call("not",
        Nodes.op("in", X, Nodes.var("y", Atom.NIL)))));
  }

  @Test
  public void testSubstitution() {
    Substitution hideNumbers = new Substitution() {
      @Override
      public String apply(Node node, String rendering) {
        return node.isInteger() ? "N" : rendering;
      }
    };
    assertEquals("foo(N, x + N)", Unparser.toString(
        Nodes.call("foo", i(1), Nodes.op("+", X, i(2))), hideNumbers));
  }

  @Test
  public void testNonCallFormInTermNotation() {
    Node odd = new Form(Atom.of("foo"), Meta.EMPTY, i(1));
    assertEquals("{:foo, [], 1}", Unparser.toString(odd));
  }
}

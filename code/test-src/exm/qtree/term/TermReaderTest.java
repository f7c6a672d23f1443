package exm.qtree.term;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.IOUtils;
import org.junit.Test;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Form;
import exm.qtree.ast.FunctionRef;
import exm.qtree.ast.Literal;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.ast.Nodes;
import exm.qtree.ast.ProcessRef;
import exm.qtree.ast.Tuple2;
import exm.qtree.ast.Validation;
import exm.qtree.ast.Validator;
import exm.qtree.common.exceptions.TermSyntaxException;
import exm.qtree.pipe.Pipeline;
import exm.qtree.unparse.Unparser;

public class TermReaderTest {

  static String fixture(String name) throws IOException {
    InputStream in = TermReaderTest.class.getResourceAsStream("/terms/" + name);
    try {
      return IOUtils.toString(in, StandardCharsets.UTF_8);
    } finally {
      in.close();
    }
  }

  @Test
  public void testPipelineFixture() throws Exception {
    Node tree = TermReader.read("pipeline.term", fixture("pipeline.term"));
    assertTrue(Validator.validate(tree).isOk());
    assertEquals(3, Pipeline.unpipe(tree).size());
    assertEquals("[1, 2, 3] |> Enum.map(&(&1 * 2)) |> Enum.sum()",
                 Unparser.toString(tree));
    assertEquals(1, ((Form)tree).meta().line());
  }

  @Test
  public void testInvalidFixture() throws Exception {
    Node tree = TermReader.read(fixture("invalid.term"));
    Validation v = Validator.validate(tree);
    assertFalse(v.isOk());
    Node bad = v.offending();
    assertEquals(Literal.Kind.FOREIGN, ((Literal)bad).kind());
    assertEquals("{:a, :b, :c, :d}", TermWriter.write(bad));
  }

  @Test
  public void testFormMeta() throws TermSyntaxException {
    Node n = TermReader.read("{:x, [line: 3, generated: true], nil}");
    assertEquals(Nodes.var("x",
        Meta.of(Meta.LINE, 3, Meta.GENERATED, true), Atom.NIL), n);
  }

  @Test
  public void testAtoms() throws TermSyntaxException {
    assertEquals(Atom.of("foo"), TermReader.read(":foo"));
    assertEquals(Atom.of("foo bar"), TermReader.read(":\"foo bar\""));
    assertEquals(Atom.of("%{}"), TermReader.read(":%{}"));
    assertEquals(Atom.of("|>"), TermReader.read(":|>"));
    assertEquals(Atom.alias("Foo.Bar"), TermReader.read("Foo.Bar"));
    assertEquals(Atom.TRUE, TermReader.read("true"));
    assertEquals(Atom.NIL, TermReader.read("nil"));
  }

  @Test
  public void testNumbers() throws TermSyntaxException {
    assertEquals(Literal.integer(1000), TermReader.read("1_000"));
    assertEquals(Literal.integer(-5), TermReader.read("-5"));
    assertEquals(Literal.floating(1500.0), TermReader.read("1.5e3"));
    assertEquals(Literal.integer(new BigInteger("123456789012345678901234567890")),
                 TermReader.read("123456789012345678901234567890"));
    assertEquals(Literal.integer(97), TermReader.read("?a"));
    assertEquals(Literal.integer(10), TermReader.read("?\\n"));
  }

  @Test
  public void testStrings() throws TermSyntaxException {
    assertEquals(Literal.string("a\nbA\"#{"),
                 TermReader.read("\"a\\nb\\x41\\\"\\#{\""));
    assertEquals(Literal.string(new String(Character.toChars(0x1F600))),
                 TermReader.read("\"\\u{1F600}\""));
  }

  @Test
  public void testRefs() throws TermSyntaxException {
    assertEquals(Literal.process(new ProcessRef(0, 110, 0)),
                 TermReader.read("#PID<0.110.0>"));
    assertEquals(Literal.function(new FunctionRef(Atom.alias("Enum"),
                                                  Atom.of("map"), 2)),
                 TermReader.read("&Enum.map/2"));
    assertEquals(Literal.function(new FunctionRef(Atom.of("lists"),
                                                  Atom.of("reverse"), 1)),
                 TermReader.read("&:lists.reverse/1"));
  }

  @Test
  public void testContainers() throws TermSyntaxException {
    assertEquals(new Tuple2(Literal.integer(1), Literal.integer(2)),
                 TermReader.read("{1, 2}"));
    assertEquals(Nodes.keyword("a", Literal.integer(1), "foo bar", Atom.NIL),
                 TermReader.read("[a: 1, \"foo bar\": nil]"));
    assertEquals(NodeList.of(Atom.of("a"), Literal.string("b")),
                 TermReader.read("[:a, \"b\"]"));
    assertEquals(NodeList.EMPTY, TermReader.read("[ ]"));
    Node foreign = TermReader.read("{1, 2, 3}");
    assertEquals(Literal.Kind.FOREIGN, ((Literal)foreign).kind());
  }

  @Test
  public void testComments() throws TermSyntaxException {
    assertEquals(Atom.of("a"), TermReader.read("# leading\n:a # trailing"));
  }

  @Test
  public void testReadAll() throws TermSyntaxException {
    List<Node> terms = new TermReader("<test>", ":a 1\n[2]").readAll();
    assertEquals(Arrays.asList(Atom.of("a"), Literal.integer(1),
                               NodeList.of(Literal.integer(2))), terms);
  }

  @Test
  public void testErrors() {
    assertSyntaxError("{:a, ", "<string>:1:");
    assertSyntaxError(":a :b", "unexpected input after term");
    assertSyntaxError("foo", "unexpected identifier foo");
    assertSyntaxError("\"abc", "unterminated string");
    assertSyntaxError("[1,\n 2", "<string>:2:");
  }

  private static void assertSyntaxError(String text, String expected) {
    try {
      TermReader.read(text);
      fail("expected syntax error for " + text);
    } catch (TermSyntaxException e) {
      assertTrue(e.getMessage(), e.getMessage().contains(expected));
    }
  }
}

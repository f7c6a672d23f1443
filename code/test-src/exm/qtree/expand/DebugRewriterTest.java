package exm.qtree.expand;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.After;
import org.junit.Test;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Escaper;
import exm.qtree.ast.Form;
import exm.qtree.ast.Literal;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.ast.Nodes;
import exm.qtree.ast.Tuple2;
import exm.qtree.common.Settings;
import exm.qtree.common.exceptions.InvalidDebugTargetException;

public class DebugRewriterTest {

  private static final Atom HELPER = Atom.alias("Macro");

  @After
  public void resetSettings() {
    Settings.reset(Settings.DBG_HELPER_MODULE);
  }

  private static BasicEnv.Builder env() {
    return BasicEnv.builder().module(Atom.alias("Foo")).file("lib/foo.ex")
                   .line(12).function("bar", 2);
  }

  /** The expression assigned to to_debug */
  private static Node debuggable(Node rewritten) {
    Form block = (Form)rewritten;
    Form assign = (Form)block.args().get(0);
    return assign.args().get(1);
  }

  @Test
  public void testShape() throws Exception {
    Node code = Nodes.call("foo", Literal.integer(1));
    NodeList opts = Nodes.keyword("label", Literal.string("x"));
    Form block = (Form)DebugRewriter.dbg(code, opts, env().build());
    assertTrue(block.isCall(Nodes.BLOCK, 2));

    Form toDebug = Nodes.var("to_debug", HELPER);
    assertEquals(Nodes.op("=", toDebug, Nodes.call(Nodes.TUPLE,
        Atom.of("value"), Escaper.escape(code), code)), block.args().get(0));

    Node call = new Form(Nodes.dot(HELPER, Atom.of("__dbg__")), Meta.EMPTY,
        NodeList.of(Literal.string("[lib/foo.ex:12: Foo.bar/2]"), toDebug,
                    opts));
    assertEquals(call, block.args().get(1));
  }

  @Test
  public void testHeader() {
    assertEquals("[lib/foo.ex:12: Foo.bar/2]",
                 DebugRewriter.header(env().build()));
    assertEquals("[lib/foo.ex: Foo.bar/2]",
                 DebugRewriter.header(env().line(0).build()));
    assertEquals("[foo.ex: Foo (module)]", DebugRewriter.header(
        BasicEnv.builder().module(Atom.alias("Foo")).file("foo.ex").build()));
    assertEquals("[(file)]", DebugRewriter.header(BasicEnv.builder().build()));
    assertEquals("[a.exs:3: (file)]", DebugRewriter.header(
        BasicEnv.builder().file("a.exs").line(3).build()));
  }

  @Test
  public void testHeaderRelativeToWorkingDirectory() {
    String file = System.getProperty("user.dir") + "/lib/x.ex";
    assertEquals("[lib/x.ex: (file)]", DebugRewriter.header(
        BasicEnv.builder().file(file).build()));
  }

  @Test
  public void testPipeline() throws Exception {
    BasicEnv e = env().build();
    Node pipe = Nodes.op("|>", Literal.integer(1), Nodes.call("foo"));
    Form outer = (Form)debuggable(DebugRewriter.dbg(pipe, NodeList.EMPTY, e));
    assertTrue(outer.isCall(Nodes.BLOCK, 2));

    Form value = Nodes.var("value", Meta.of(Meta.COUNTER, 1), HELPER);
    Form values = Nodes.var("values", Meta.of(Meta.COUNTER, 2), HELPER);
    Node expected = Nodes.call(Nodes.TUPLE, Atom.of("pipe"),
        Escaper.escape(Arrays.asList(Literal.integer(1), Nodes.call("foo"))),
        Nodes.remote(Nodes.aliases("Enum"), "reverse", values));
    assertEquals(expected, outer.args().get(1));

    // first step binds value, later steps pipe the previous value
    Form steps = (Form)outer.args().get(0);
    Form first = (Form)steps.args().get(0);
    assertEquals(Nodes.op("=", value, Literal.integer(1)),
                 first.args().get(0));
    assertEquals(Nodes.op("=", value, Nodes.call("foo", value)),
                 steps.args().get(1));
    assertEquals(2, e.counters().current(HELPER));
  }

  @Test
  public void testBooleanOps() throws Exception {
    Node code = Nodes.op("&&", Nodes.var("a", Atom.NIL),
                         Nodes.var("b", Atom.NIL));
    Form block = (Form)debuggable(
        DebugRewriter.dbg(code, NodeList.EMPTY, env().build()));
    assertTrue(block.isCall(Nodes.BLOCK, 3));
    Node last = block.args().get(2);
    assertTrue(last.isPair());
    assertEquals(Atom.of("logic_op"), ((Tuple2)last).left());
  }

  @Test
  public void testCase() throws Exception {
    Node clause = Nodes.op("->", NodeList.of(Literal.integer(1)),
                           Atom.of("one"));
    Node code = Nodes.call("case", Nodes.var("x", Atom.NIL),
                           Nodes.keyword("do", NodeList.of(clause)));
    Form block = (Form)debuggable(
        DebugRewriter.dbg(code, NodeList.EMPTY, env().build()));
    Form result = (Form)block.args().get(2);
    assertTrue(result.isCall(Nodes.TUPLE, 5));
    assertEquals(Atom.of("case"), result.args().get(0));
  }

  @Test
  public void testMalformedCaseIsPlainValue() throws Exception {
    Node code = Nodes.call("case", Nodes.var("x", Atom.NIL),
                           Nodes.var("clauses", Atom.NIL));
    Node expected = Nodes.call(Nodes.TUPLE, Atom.of("value"),
                               Escaper.escape(code), code);
    assertEquals(expected, debuggable(
        DebugRewriter.dbg(code, NodeList.EMPTY, env().build())));
  }

  @Test
  public void testCond() throws Exception {
    Node clause = Nodes.op("->", NodeList.of(Atom.TRUE), Atom.of("yes"));
    Node code = Nodes.call("cond", Nodes.keyword("do", NodeList.of(clause)));
    Form block = (Form)debuggable(
        DebugRewriter.dbg(code, NodeList.EMPTY, env().build()));
    Form result = (Form)block.args().get(1);
    assertTrue(result.isCall(Nodes.TUPLE, 6));
    assertEquals(Atom.of("cond"), result.args().get(0));
  }

  @Test
  public void testCustomHelper() throws Exception {
    Settings.set(Settings.DBG_HELPER_MODULE, "My.Dbg");
    Form block = (Form)DebugRewriter.dbg(Literal.integer(1), NodeList.EMPTY,
                                         env().build());
    Form call = (Form)block.args().get(1);
    assertEquals(Atom.alias("My.Dbg"), call.receiver());
  }

  @Test(expected=InvalidDebugTargetException.class)
  public void testInMatch() throws Exception {
    DebugRewriter.dbg(Literal.integer(1), NodeList.EMPTY,
                      env().context(EnvContext.MATCH).build());
  }

  @Test
  public void testInGuard() throws Exception {
    try {
      DebugRewriter.dbg(Literal.integer(1), NodeList.EMPTY,
                        env().context(EnvContext.GUARD).build());
    } catch (InvalidDebugTargetException e) {
      assertTrue(e.getMessage().startsWith("invalid expression in guard"));
      return;
    }
    throw new AssertionError("expected InvalidDebugTargetException");
  }
}

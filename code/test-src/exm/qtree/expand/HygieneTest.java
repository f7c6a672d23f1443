package exm.qtree.expand;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Form;
import exm.qtree.ast.Literal;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.ast.Nodes;
import exm.qtree.ast.Tuple2;

public class HygieneTest {

  private static final Atom MOD = Atom.alias("Mod");

  private static Node linify(Node quoted) {
    return Hygiene.linify(Meta.EMPTY, MOD, 7, quoted);
  }

  @Test
  public void testMacroVariables() {
    Form v = (Form)linify(Nodes.var("x", MOD));
    assertEquals(Long.valueOf(7), v.meta().counter());
  }

  @Test
  public void testOtherVariablesUntouched() {
    Node user = Nodes.var("x", Atom.NIL);
    Node other = Nodes.var("x", Atom.alias("Other"));
    Node underscore = Nodes.var("_", MOD);
    assertEquals(user, linify(user));
    assertEquals(other, linify(other));
    assertEquals(underscore, linify(underscore));
  }

  @Test
  public void testExistingCounterKept() {
    Node v = Nodes.var("x", Meta.of(Meta.COUNTER, 2), MOD);
    assertEquals(Long.valueOf(2), ((Form)linify(v)).meta().counter());
  }

  @Test
  public void testLexicalForms() {
    Form alias = (Form)linify(Nodes.call("alias", Nodes.aliases("Foo")));
    assertEquals(Long.valueOf(7), alias.meta().counter());
    Form ref = (Form)alias.args().get(0);
    assertEquals(Long.valueOf(7), ref.meta().counter());
    Form req = (Form)linify(Nodes.call("require", Nodes.aliases("Logger")));
    assertEquals(Long.valueOf(7), req.meta().counter());
    assertNull(((Form)linify(Nodes.call("foo", Literal.integer(1))))
                  .meta().counter());
    // no arguments, not a directive
    assertNull(((Form)linify(Nodes.call("import"))).meta().counter());
  }

  @Test
  public void testNested() {
    Node quoted = NodeList.of(new Tuple2(Atom.of("k"), Nodes.var("y", MOD)),
        Nodes.op("+", Nodes.var("y", MOD), Literal.integer(1)));
    NodeList res = (NodeList)linify(quoted);
    Form inPair = (Form)((Tuple2)res.get(0)).right();
    assertEquals(Long.valueOf(7), inPair.meta().counter());
    Form sum = (Form)res.get(1);
    assertNull(sum.meta().counter());
    assertEquals(Long.valueOf(7),
                 ((Form)sum.args().get(0)).meta().counter());
  }

  @Test
  public void testGenerated() {
    Node quoted = Nodes.op("+", Nodes.var("y", Atom.NIL), Literal.integer(1));
    Form plain = (Form)Hygiene.linify(Meta.EMPTY, MOD, 1, quoted);
    assertFalse(plain.meta().has(Meta.GENERATED));
    Form gen = (Form)Hygiene.linify(Meta.of(Meta.GENERATED, true), MOD, 1,
                                    quoted);
    assertTrue(gen.meta().isTrue(Meta.GENERATED));
    assertTrue(((Form)gen.args().get(0)).meta().isTrue(Meta.GENERATED));
    assertEquals(Literal.integer(1), gen.args().get(1));
  }
}

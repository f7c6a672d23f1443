package exm.qtree.expand;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import org.junit.Test;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Literal;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;

public class MacroTableTest {

  private static final Atom A = Atom.alias("A");
  private static final Atom B = Atom.alias("B");

  private static MacroTable.MacroBody constant(final Node result) {
    return new MacroTable.MacroBody() {
      @Override
      public Node expand(NodeList args, Env env) {
        return result;
      }
    };
  }

  @Test
  public void testImportPriority() {
    MacroTable t = new MacroTable()
        .defmacro(A, "m", 0, constant(Literal.integer(1)))
        .defmacro(B, "m", 0, constant(Literal.integer(2)))
        .importModule(B)
        .importModule(A)
        .importModule(B);
    BasicEnv env = BasicEnv.builder().resolver(t).build();
    Expansion e = env.resolve(Meta.EMPTY, Atom.of("m"), 0, NodeList.EMPTY);
    assertEquals(Expansion.Kind.MACRO, e.kind);
    assertEquals(B, e.receiver);
    assertEquals(Literal.integer(2), e.quoted);
  }

  @Test
  public void testArityAndImports() {
    MacroTable t = new MacroTable()
        .defmacro(A, "m", 1, constant(Literal.integer(1)));
    BasicEnv env = BasicEnv.builder().resolver(t).build();
    // not imported
    assertSame(Expansion.notFound(),
        env.resolve(Meta.EMPTY, Atom.of("m"), 1, NodeList.EMPTY));
    t.importModule(A);
    assertSame(Expansion.notFound(),
        env.resolve(Meta.EMPTY, Atom.of("m"), 2, NodeList.EMPTY));
    assertEquals(Expansion.Kind.MACRO,
        env.resolve(Meta.EMPTY, Atom.of("m"), 1, NodeList.EMPTY).kind);
  }

  @Test
  public void testQualified() {
    MacroTable t = new MacroTable()
        .defmacro(A, "m", 0, constant(Literal.integer(1)))
        .defun(A, "f", 1);
    BasicEnv env = BasicEnv.builder().resolver(t).build();
    assertEquals(Expansion.Kind.MACRO, env.resolveQualified(Meta.EMPTY,
        A, Atom.of("m"), 0, NodeList.EMPTY).kind);
    NodeList args = NodeList.of(Literal.integer(3));
    Expansion f = env.resolveQualified(Meta.EMPTY, A, Atom.of("f"), 1, args);
    assertEquals(Expansion.Kind.FUNCTION, f.kind);
    assertEquals(Atom.of("f"), f.name);
    assertEquals(args, f.args);
    assertEquals("function Elixir.A.f/1", f.toString());
    assertSame(Expansion.notFound(), env.resolveQualified(Meta.EMPTY,
        B, Atom.of("m"), 0, NodeList.EMPTY));
  }

  @Test
  public void testBodySeesArguments() {
    MacroTable t = new MacroTable().defmacro(A, "first", 2,
        new MacroTable.MacroBody() {
          @Override
          public Node expand(NodeList args, Env env) {
            return args.get(0);
          }
        });
    BasicEnv env = BasicEnv.builder().resolver(t).build();
    Expansion e = env.resolveQualified(Meta.EMPTY, A, Atom.of("first"), 2,
        NodeList.of(Literal.integer(5), Literal.integer(6)));
    assertEquals(Literal.integer(5), e.quoted);
  }

  @Test
  public void testNoResolver() {
    BasicEnv env = BasicEnv.builder().build();
    assertSame(Expansion.notFound(),
        env.resolve(Meta.EMPTY, Atom.of("m"), 0, NodeList.EMPTY));
  }
}

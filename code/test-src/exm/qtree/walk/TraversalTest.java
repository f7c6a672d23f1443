package exm.qtree.walk;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Test;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Form;
import exm.qtree.ast.Literal;
import exm.qtree.ast.Node;
import exm.qtree.ast.Nodes;
import exm.qtree.ast.Tuple2;
import exm.qtree.common.util.Pair;
import exm.qtree.unparse.Unparser;

public class TraversalTest {

  /** 1 + foo(2, x) */
  private static final Node TREE = Nodes.op("+", Literal.integer(1),
      Nodes.call("foo", Literal.integer(2), Nodes.var("x", Atom.NIL)));

  private static NodeFn<List<Node>> recorder() {
    return new NodeFn<List<Node>>() {
      @Override
      public Pair<Node, List<Node>> apply(Node node, List<Node> acc) {
        acc.add(node);
        return Pair.create(node, acc);
      }
    };
  }

  private static final NodeMapper INCREMENT = new NodeMapper() {
    @Override
    public Node apply(Node node) {
      if (node.isInteger()) {
        return Literal.integer(((Literal)node).longValue() + 1);
      }
      return node;
    }
  };

  @Test
  public void testPrewalkOrder() {
    List<Node> seen = Traversal.prewalk(TREE, new ArrayList<Node>(),
                                        recorder()).val2;
    assertEquals(5, seen.size());
    assertSame(TREE, seen.get(0));
    assertEquals(Literal.integer(1), seen.get(1));
    assertEquals(Nodes.var("x", Atom.NIL), seen.get(4));
  }

  @Test
  public void testPostwalkOrder() {
    List<Node> seen = Traversal.postwalk(TREE, new ArrayList<Node>(),
                                         recorder()).val2;
    assertEquals(5, seen.size());
    assertEquals(Literal.integer(1), seen.get(0));
    assertEquals(Literal.integer(2), seen.get(1));
    assertEquals(TREE, seen.get(4));
  }

  @Test
  public void testMapping() {
    Node expected = Nodes.op("+", Literal.integer(2),
        Nodes.call("foo", Literal.integer(3), Nodes.var("x", Atom.NIL)));
    assertEquals(expected, Traversal.prewalk(TREE, INCREMENT));
    assertEquals(expected, Traversal.postwalk(TREE, INCREMENT));
  }

  @Test
  public void testIdentityKeepsInstance() {
    assertSame(TREE, Traversal.prewalk(TREE, new NodeMapper() {
      @Override
      public Node apply(Node node) {
        return node;
      }
    }));
  }

  @Test
  public void testPreDecidesDescent() {
    // Replace the call before descending: its new contents are walked
    NodeMapper replace = new NodeMapper() {
      @Override
      public Node apply(Node node) {
        if (node.isForm() && ((Form)node).hasTag("foo")) {
          return Nodes.call("bar", Literal.integer(10));
        }
        return INCREMENT.apply(node);
      }
    };
    Node expected = Nodes.op("+", Literal.integer(2),
                             Nodes.call("bar", Literal.integer(11)));
    assertEquals(expected, Traversal.prewalk(TREE, replace));
  }

  @Test
  public void testCompoundTagVisited() {
    Node remote = Nodes.remote(Atom.alias("Enum"), "sum", Literal.integer(1));
    List<Node> seen = Traversal.postwalk(remote, new ArrayList<Node>(),
                                         recorder()).val2;
    // receiver, name, dot form, argument, call
    assertEquals(5, seen.size());
    assertEquals(((Form)remote).tag(), seen.get(2));
  }

  @Test
  public void testPairChildren() {
    Node pair = new Tuple2(Literal.integer(1), Literal.integer(2));
    assertEquals(new Tuple2(Literal.integer(2), Literal.integer(3)),
                 Traversal.postwalk(pair, INCREMENT));
  }

  @Test
  public void testPath() {
    List<Node> path = Traversal.path(TREE, new NodePredicate() {
      @Override
      public boolean matches(Node node) {
        return node.isForm() && ((Form)node).isVariable();
      }
    });
    Form foo = (Form)((Form)TREE).args().get(1);
    assertEquals(Arrays.asList(foo.args().get(1), foo, TREE), path);
  }

  @Test
  public void testPathNotFound() {
    assertNull(Traversal.path(TREE, new NodePredicate() {
      @Override
      public boolean matches(Node node) {
        return node.isString();
      }
    }));
  }

  @Test
  public void testDeepPipelineOnLargeStack() throws Exception {
    final int depth = 20000;
    Node tree = Nodes.var("x", Atom.NIL);
    StringBuilder expected = new StringBuilder("x");
    for (int i = 0; i < depth; i++) {
      tree = Nodes.op("|>", tree, Nodes.call("f"));
      expected.append(" |> f()");
    }
    final Node deep = tree;
    final AtomicReference<Object> walked = new AtomicReference<Object>();
    final AtomicReference<Object> rendered = new AtomicReference<Object>();
    Thread t = new Thread(null, new Runnable() {
      @Override
      public void run() {
        try {
          walked.set(Traversal.prewalk(deep, INCREMENT));
          rendered.set(Unparser.toString(deep));
        } catch (Throwable e) {
          walked.set(e);
        }
      }
    }, "deep-walk", 512L * 1024 * 1024);
    t.start();
    t.join();
    assertEquals(deep, walked.get());
    assertEquals(expected.toString(), rendered.get());
  }
}

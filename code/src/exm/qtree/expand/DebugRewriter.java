/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.qtree.expand;

import java.util.ArrayList;
import java.util.List;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Escaper;
import exm.qtree.ast.Form;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.ast.Nodes;
import exm.qtree.ast.Tuple2;
import exm.qtree.common.Settings;
import exm.qtree.common.exceptions.InvalidDebugTargetException;
import exm.qtree.common.exceptions.InvalidPipeException;
import exm.qtree.common.util.Pair;
import exm.qtree.lang.AtomClassifier;
import exm.qtree.lang.AtomClassifier.Format;
import exm.qtree.pipe.PipeStep;
import exm.qtree.pipe.Pipeline;

/**
 * Rewrites an expression so that, when run, it hands each
 * intermediate value to the helper module's __dbg__/3 along with the
 * code that produced it.
 *
 * Pipelines record the value after every step, boolean operator
 * chains record each operand, case and cond record the clause taken.
 */
public class DebugRewriter {

  private static final String[] BOOLEAN_OPS = {"&&", "||", "and", "or"};

  private final Env env;

  /** Module that provides __dbg__/3, also the context of its variables */
  private final Atom helper;

  private DebugRewriter(Env env) {
    this.env = env;
    this.helper = Atom.alias(Settings.get(Settings.DBG_HELPER_MODULE));
  }

  /**
   * @param code expression to instrument
   * @param options keyword list passed through to __dbg__/3
   * @throws InvalidDebugTargetException in a pattern or guard
   */
  public static Node dbg(Node code, Node options, Env env)
      throws InvalidDebugTargetException, InvalidPipeException {
    switch (env.context()) {
      case MATCH:
        throw new InvalidDebugTargetException(
            "invalid expression in match, dbg is not allowed in patterns " +
            "such as function clauses, case clauses or on the left side " +
            "of the = operator");
      case GUARD:
        throw new InvalidDebugTargetException(
            "invalid expression in guard, dbg is not allowed in guards. " +
            "To learn more about guards, visit: " +
            "https://hexdocs.pm/elixir/patterns-and-guards.html");
      default:
        break;
    }
    return new DebugRewriter(env).rewrite(code, options);
  }

  private Node rewrite(Node code, Node options)
      throws InvalidPipeException {
    String header = header(env);
    Form toDebug = var("to_debug");
    Form call = new Form(Nodes.dot(helper, Atom.of("__dbg__")), Meta.EMPTY,
                 NodeList.of(Nodes.string(header), toDebug, options));
    return Nodes.block(assign(toDebug, debuggable(code)), call);
  }

  private Node debuggable(Node code) throws InvalidPipeException {
    if (code.isForm()) {
      Form f = code.asForm();
      if (f.isCall("|>", 2)) {
        return pipeline(f);
      }
      if (f.arity() == 2 && isBooleanOp(f.tagName())) {
        return booleanOps(f);
      }
      Node res = null;
      if (f.isCall("case", 2)) {
        res = caseExpr(f);
      } else if (f.isCall("cond", 1)) {
        res = condExpr(f);
      }
      if (res != null) {
        return res;
      }
    }
    return Nodes.tuple(Atom.of("value"), Escaper.escape(code), code);
  }

  private Node pipeline(Form pipe) throws InvalidPipeException {
    Form value = uniqueVar("value");
    Form values = uniqueVar("values");

    List<Node> asts = new ArrayList<Node>();
    for (PipeStep step: Pipeline.unpipe(pipe)) {
      if (step.position == 0) {
        asts.add(step.node);
      }
    }
    Node acc = Nodes.block(assign(value, asts.get(0)),
                           assign(values, NodeList.of(value)));
    for (Node step: asts.subList(1, asts.size())) {
      Node piped = Pipeline.pipe(value, step, 0);
      acc = Nodes.block(acc, assign(value, piped),
                        assign(values, cons(value, values)));
    }
    Node result = Nodes.call(Nodes.TUPLE, Atom.of("pipe"),
                             Escaper.escape(asts), enumReverse(values));
    return Nodes.block(acc, result);
  }

  private static boolean isBooleanOp(String name) {
    if (name == null) {
      return false;
    }
    for (String op: BOOLEAN_OPS) {
      if (op.equals(name)) {
        return true;
      }
    }
    return false;
  }

  private Node booleanOps(Form f) {
    Form acc = uniqueVar("acc");
    Form result = uniqueVar("result");
    return Nodes.block(assign(acc, NodeList.EMPTY),
                       booleanTree(f, acc, result),
                       Nodes.tuple(Atom.of("logic_op"), enumReverse(acc)));
  }

  /**
   * Operands are evaluated left to right; each intermediate result is
   * recorded in acc alongside the code that produced it.
   */
  private Node booleanTree(Node ast, Form acc, Form result) {
    Node value;
    if (ast.isForm() && ast.asForm().arity() == 2 &&
        isBooleanOp(ast.asForm().tagName())) {
      Form op = ast.asForm();
      Node left = booleanTree(op.args().get(0), acc, result);
      value = Nodes.call(op.tagName(), left, op.args().get(1));
    } else {
      value = ast;
    }
    Node entry = Nodes.tuple(Escaper.escape(ast), result);
    return Nodes.block(assign(result, value),
                       assign(acc, cons(entry, acc)),
                       result);
  }

  /**
   * Each clause also returns its index so the clause taken is known
   * @return null if the case is not in the expected shape
   */
  private Node caseExpr(Form f) {
    Node subject = f.args().get(0);
    NodeList clauses = doClauses(f.args().get(1));
    if (clauses == null) {
      return null;
    }
    List<Node> indexed = new ArrayList<Node>(clauses.size());
    int index = 0;
    for (Node clause: clauses) {
      Form arrow = clause.asForm();
      Node left = arrow.args().get(0);
      Node right = arrow.args().get(1);
      indexed.add(arrow.withChildren(NodeList.of(left,
                        new Tuple2(right, Nodes.integer(index)))));
      index++;
    }
    Form expr = var("expr");
    Form result = var("result");
    Form clauseIndex = var("clause_index");
    Node caseCall = Nodes.call("case", expr,
                       Nodes.keyword("do", NodeList.of(indexed)));
    return Nodes.block(
        assign(expr, subject),
        assign(new Tuple2(result, clauseIndex), caseCall),
        Nodes.call(Nodes.TUPLE, Atom.of("case"), Escaper.escape(f), expr,
                   clauseIndex, result));
  }

  /**
   * Each clause binds its condition and returns it with its index
   * @return null if the cond is not in the expected shape
   */
  private Node condExpr(Form f) {
    NodeList clauses = doClauses(f.args().get(0));
    if (clauses == null) {
      return null;
    }
    Form clauseValue = var("clause_value");
    List<Node> modified = new ArrayList<Node>(clauses.size());
    int index = 0;
    for (Node clause: clauses) {
      Form arrow = clause.asForm();
      Node lhs = arrow.args().get(0);
      if (!lhs.isList() || lhs.asList().size() != 1) {
        return null;
      }
      Node left = lhs.asList().get(0);
      Node right = arrow.args().get(1);
      Node cond = assign(clauseValue, left);
      Node body = Nodes.call(Nodes.TUPLE, Escaper.escape(left), clauseValue,
                             Nodes.integer(index), right);
      modified.add(Nodes.call("->", NodeList.of(cond), body));
      index++;
    }
    Form clauseAst = var("clause_ast");
    Form clauseIndex = var("clause_index");
    Form value = var("value");
    Node condCall = Nodes.call("cond",
                       Nodes.keyword("do", NodeList.of(modified)));
    Node bound = Nodes.call(Nodes.TUPLE, clauseAst, clauseValue,
                            clauseIndex, value);
    return Nodes.block(
        assign(bound, condCall),
        Nodes.call(Nodes.TUPLE, Atom.of("cond"), Escaper.escape(f),
                   clauseAst, clauseValue, clauseIndex, value));
  }

  /**
   * @return the clauses of [do: clauses], or null if not that shape
   *        or any clause is not a -> form
   */
  private static NodeList doClauses(Node kw) {
    if (!kw.isList() || kw.asList().size() != 1) {
      return null;
    }
    Node entry = kw.asList().get(0);
    if (!entry.isPair() || !entry.asPair().left().isAtom("do") ||
        !entry.asPair().right().isList()) {
      return null;
    }
    NodeList clauses = entry.asPair().right().asList();
    for (Node c: clauses) {
      if (!c.isForm() || !c.asForm().isCall("->", 2)) {
        return null;
      }
    }
    return clauses;
  }

  private Form var(String name) {
    return Nodes.var(name, helper);
  }

  private Form uniqueVar(String name) {
    return Nodes.var(name, Meta.of(Meta.COUNTER, env.nextCounter(helper)),
                     helper);
  }

  private static Form assign(Node left, Node right) {
    return Nodes.call("=", left, right);
  }

  private static NodeList cons(Node head, Node tail) {
    return NodeList.of(Nodes.call("|", head, tail));
  }

  private static Form enumReverse(Node list) {
    return Nodes.remote(Nodes.aliases("Enum"), "reverse", list);
  }

  /**
   * Location of the call in stacktrace format, e.g.
   * [lib/foo.ex:12: Foo.bar/2]
   */
  static String header(Env env) {
    String file = relativeToCwd(env.file());
    StringBuilder sb = new StringBuilder("[");
    if (!file.isEmpty()) {
      sb.append(file).append(':');
      if (env.line() > 0) {
        sb.append(env.line()).append(':');
      }
      sb.append(' ');
    }
    Atom module = env.module();
    Pair<Atom, Integer> fun = env.function();
    if (module.isNil()) {
      sb.append("(file)");
    } else if (fun == null) {
      sb.append(AtomClassifier.inspect(Format.LITERAL, module));
      sb.append(" (module)");
    } else {
      sb.append(AtomClassifier.inspect(Format.LITERAL, module)).append('.');
      sb.append(AtomClassifier.inspect(Format.REMOTE_CALL, fun.val1));
      sb.append('/').append(fun.val2);
    }
    sb.append(']');
    return sb.toString();
  }

  private static String relativeToCwd(String file) {
    String cwd = System.getProperty("user.dir");
    if (cwd != null && file.startsWith(cwd + "/")) {
      return file.substring(cwd.length() + 1);
    }
    return file;
  }
}

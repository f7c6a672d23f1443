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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.io.FilenameUtils;
import org.apache.log4j.Logger;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Form;
import exm.qtree.ast.Literal;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.ast.Nodes;
import exm.qtree.ast.Tuple2;
import exm.qtree.common.LogHelper;
import exm.qtree.common.Logging;
import exm.qtree.common.Settings;
import exm.qtree.common.exceptions.ExpansionLimitException;
import exm.qtree.common.exceptions.InvalidOptionException;
import exm.qtree.common.exceptions.QTreeRuntimeError;
import exm.qtree.common.util.Pair;
import exm.qtree.lang.ModuleNames;
import exm.qtree.lang.SpecialForms;
import exm.qtree.term.TermWriter;
import exm.qtree.walk.NodeFn;

/**
 * Expansion of aliases, macros and environment references.
 *
 * Only the node passed in is expanded; its children are left alone.
 * Callers walk the tree themselves if they want a full expansion.
 */
public class Expander {

  private static final Logger logger = Logging.getQTreeLogger();

  private static final Atom KERNEL = Atom.alias("Kernel");
  private static final Atom APPLICATION = Atom.of("Application");

  /**
   * Expand node by one step
   * @return the new node and whether anything changed
   */
  public static ExpandResult expandOnce(Node node, Env env) {
    ExpandResult res = doExpandOnce(node, env);
    if (res.changed && LogHelper.isTraceEnabled()) {
      LogHelper.traceNode(0, "expand: ", node);
      LogHelper.traceNode(2, "=> ", res.node);
    }
    return res;
  }

  private static ExpandResult doExpandOnce(Node node, Env env) {
    if (!node.isForm()) {
      return ExpandResult.unchanged(node);
    }
    Form f = (Form)node;
    String name = f.tagName();

    if (name != null) {
      if (name.equals(Nodes.ALIASES) && f.isCall() && !f.args().isEmpty()) {
        return expandAliases(f, env);
      }
      if (f.isVariable()) {
        return expandEnvVariable(f, name, env);
      }
      if (f.isCall()) {
        return expandLocalCall(f, name, env);
      }
      return ExpandResult.unchanged(f);
    }

    if (f.isQualifiedCall()) {
      Node left = f.receiver();
      Node right = f.qualifiedName();
      if (f.args().isEmpty() && left.isForm() &&
          left.asForm().isVariable() && left.asForm().hasTag("__ENV__") &&
          right.isAtom()) {
        return expandEnvField(f, right.asAtom(), env);
      }
      if (right.isAtom()) {
        return expandRemoteCall(f, left, right.asAtom(), env);
      }
    }
    return ExpandResult.unchanged(f);
  }

  private static ExpandResult expandAliases(Form f, Env env) {
    NodeList segs = f.args();
    Node head = segs.get(0);
    if (head.isAtom() && !allAtoms(segs.butFirst())) {
      // Foo.bar or Elixir.bar: not an alias chain
      return ExpandResult.unchanged(f);
    }
    Atom receiver;
    if (head.isAtom(Atom.ALIAS_ROOT)) {
      receiver = concat(segs);
    } else if (head.isAtom()) {
      Atom lookup = Atom.alias(head.asAtom().name());
      Atom found = env.lookupAlias(lookup, f.meta().counter());
      if (found != null && !found.equals(lookup)) {
        TraceEvent ev = TraceEvent.aliasExpansion(f.meta(), lookup, found);
        logger.debug(ev);
        env.trace(ev);
        List<Atom> parts = new ArrayList<Atom>(segs.size());
        parts.add(found);
        for (Node seg: segs.butFirst()) {
          parts.add(seg.asAtom());
        }
        receiver = segs.size() == 1 ? found : ModuleNames.concat(parts);
      } else {
        receiver = concat(segs);
      }
    } else {
      List<Node> expanded = new ArrayList<Node>(segs.size());
      for (Node seg: segs) {
        expanded.add(doExpandOnce(seg, env).node);
      }
      NodeList expandedList = NodeList.of(expanded);
      if (!allAtoms(expandedList)) {
        return ExpandResult.unchanged(f);
      }
      receiver = concat(expandedList);
    }
    TraceEvent ref = TraceEvent.aliasReference(f.meta(), receiver);
    logger.debug(ref);
    env.trace(ref);
    return ExpandResult.changed(receiver);
  }

  private static boolean allAtoms(NodeList l) {
    for (Node n: l) {
      if (!n.isAtom()) {
        return false;
      }
    }
    return true;
  }

  private static Atom concat(NodeList segs) {
    if (!allAtoms(segs)) {
      throw new QTreeRuntimeError("alias segments must be atoms: " + segs);
    }
    List<Atom> atoms = new ArrayList<Atom>(segs.size());
    for (Node n: segs) {
      atoms.add(n.asAtom());
    }
    return ModuleNames.concat(atoms);
  }

  private static ExpandResult expandEnvVariable(Form f, String name,
                                                Env env) {
    if (name.equals(Nodes.MODULE)) {
      return ExpandResult.changed(env.module());
    } else if (name.equals("__DIR__")) {
      return ExpandResult.changed(Nodes.string(dirname(env.file())));
    } else if (name.equals("__ENV__")) {
      return ExpandResult.changed(envMap(env));
    }
    return ExpandResult.unchanged(f);
  }

  /**
   * Directory part of a path: "." when there is none
   */
  static String dirname(String file) {
    String dir = FilenameUtils.getFullPathNoEndSeparator(file);
    if (dir == null || dir.isEmpty()) {
      return ".";
    }
    return dir;
  }

  /**
   * __ENV__ as a map literal, keys sorted
   */
  private static Node envMap(Env env) {
    Map<String, Node> sorted = new TreeMap<String, Node>(env.fields());
    sorted.put("versioned_vars", versionedVarsMap(env));
    List<Node> pairs = new ArrayList<Node>(sorted.size());
    for (Map.Entry<String, Node> e: sorted.entrySet()) {
      pairs.add(new Tuple2(Atom.of(e.getKey()), e.getValue()));
    }
    return Nodes.map(pairs);
  }

  private static Node versionedVarsMap(Env env) {
    List<Node> pairs = new ArrayList<Node>();
    for (Map.Entry<Node, Node> e: env.versionedVars().entrySet()) {
      pairs.add(new Tuple2(e.getKey(), e.getValue()));
    }
    return Nodes.map(pairs);
  }

  private static ExpandResult expandEnvField(Form f, Atom field, Env env) {
    if (field.name().equals("versioned_vars")) {
      return ExpandResult.changed(versionedVarsMap(env));
    }
    Node value = env.fields().get(field.name());
    if (value == null) {
      return ExpandResult.unchanged(f);
    }
    return ExpandResult.changed(value);
  }

  private static ExpandResult expandLocalCall(Form f, String name,
                                              Env env) {
    NodeList args = f.args();
    int arity = args.size();
    if (SpecialForms.isSpecialForm(name, arity)) {
      return ExpandResult.unchanged(f);
    }
    Expansion exp = env.resolve(f.meta(), f.tag().asAtom(), arity, args);
    switch (exp.kind) {
      case MACRO:
        return expandMacro(f, exp, env);
      case FUNCTION:
        if (exp.receiver.equals(KERNEL) && exp.args.size() == 1 &&
            (exp.name.isAtom("+") || exp.name.isAtom("-"))) {
          return foldSign(f, exp.name.name(), exp.args.get(0), env);
        }
        return ExpandResult.unchanged(f);
      default:
        return ExpandResult.unchanged(f);
    }
  }

  /**
   * +1 and -1 written as unary calls become integer literals
   */
  private static ExpandResult foldSign(Form f, String op, Node arg,
                                       Env env) {
    Node value = expandOnce(arg, env).node;
    if (!value.isInteger()) {
      return ExpandResult.unchanged(f);
    }
    if (op.equals("+")) {
      return ExpandResult.changed(value);
    }
    BigInteger negated = ((Literal)value).bigValue().negate();
    return ExpandResult.changed(Literal.integer(negated));
  }

  private static ExpandResult expandMacro(Form f, Expansion exp, Env env) {
    long next = env.nextCounter(env.module());
    Meta meta = f.meta().take(Meta.GENERATED);
    return ExpandResult.changed(
                Hygiene.linify(meta, exp.receiver, next, exp.quoted));
  }

  private static ExpandResult expandRemoteCall(Form f, Node left,
                                               Atom right, Env env) {
    Node receiver = doExpandOnce(left, env).node;
    if (!receiver.isAtom()) {
      return ExpandResult.unchanged(f);
    }
    NodeList args = f.args();
    Expansion exp = env.resolveQualified(f.meta(), receiver.asAtom(), right,
                                         args.size(), args);
    if (exp.kind == Expansion.Kind.MACRO) {
      long next = env.nextCounter(env.module());
      Meta meta = f.meta().take(Meta.GENERATED);
      return ExpandResult.changed(
                  Hygiene.linify(meta, exp.receiver, next, exp.quoted));
    }
    return ExpandResult.unchanged(f);
  }

  /**
   * Expand the root node repeatedly until it stops changing
   * @throws ExpansionLimitException if it is still changing after the
   *        configured number of rounds
   */
  public static Node expand(Node node, Env env) {
    long max;
    try {
      max = Settings.getLong(Settings.EXPAND_MAX_ITERATIONS);
    } catch (InvalidOptionException e) {
      throw new QTreeRuntimeError(e.toString(), e);
    }
    Node current = node;
    long rounds = 0;
    while (true) {
      ExpandResult res = expandOnce(current, env);
      if (!res.changed) {
        return res.node;
      }
      current = res.node;
      rounds++;
      if (rounds >= max) {
        throw new ExpansionLimitException(rounds,
                                          TermWriter.write(current));
      }
    }
  }

  /**
   * Expand the literal parts of a tree: aliases, __MODULE__, and the
   * contents of structs, maps, tuples, pairs and lists.  Calls are not
   * entered, except for the default of Application.compile_env/3.
   * @param fn called with each expandable node
   */
  public static <A> Pair<Node, A> expandLiterals(Node node, A acc,
                                                 NodeFn<A> fn) {
    switch (node.type()) {
      case PAIR: {
        Tuple2 p = (Tuple2)node;
        Pair<Node, A> l = expandLiterals(p.left(), acc, fn);
        Pair<Node, A> r = expandLiterals(p.right(), l.val2, fn);
        return Pair.create((Node)p.with(l.val1, r.val1), r.val2);
      }
      case LIST: {
        Pair<NodeList, A> l = expandLiteralList((NodeList)node, acc, fn);
        return Pair.create((Node)l.val1, l.val2);
      }
      case FORM:
        return expandLiteralForm((Form)node, acc, fn);
      default:
        return Pair.create(node, acc);
    }
  }

  private static <A> Pair<NodeList, A> expandLiteralList(NodeList list,
                                                 A acc, NodeFn<A> fn) {
    List<Node> out = new ArrayList<Node>(list.size());
    A current = acc;
    for (Node e: list) {
      Pair<Node, A> r = expandLiterals(e, current, fn);
      out.add(r.val1);
      current = r.val2;
    }
    return Pair.create(NodeList.of(out), current);
  }

  private static <A> Pair<Node, A> expandLiteralForm(Form f, A acc,
                                                     NodeFn<A> fn) {
    String name = f.tagName();
    if (name != null && f.isVariable()) {
      if (name.equals(Nodes.MODULE)) {
        return fn.apply(f, acc);
      }
      return Pair.create((Node)f, acc);
    }
    if (name != null && f.isCall()) {
      if (name.equals(Nodes.ALIASES)) {
        Pair<NodeList, A> segs = expandLiteralList(f.args(), acc, fn);
        Form rebuilt = f.withChildren(segs.val1);
        if (allAtoms(segs.val1)) {
          return fn.apply(rebuilt, segs.val2);
        }
        return Pair.create((Node)rebuilt, segs.val2);
      }
      if ((name.equals(Nodes.STRUCT) && f.arity() == 2) ||
          name.equals(Nodes.MAP) || name.equals(Nodes.TUPLE)) {
        Pair<NodeList, A> args = expandLiteralList(f.args(), acc, fn);
        return Pair.create((Node)f.withChildren(args.val1), args.val2);
      }
      return Pair.create((Node)f, acc);
    }
    if (isCompileEnv(f)) {
      NodeList args = f.args();
      Pair<Node, A> def = expandLiterals(args.get(2), acc, fn);
      NodeList newArgs = NodeList.of(args.get(0), args.get(1), def.val1);
      return Pair.create((Node)f.withChildren(newArgs), def.val2);
    }
    return Pair.create((Node)f, acc);
  }

  /**
   * Application.compile_env(app, key, default) with an unexpanded
   * alias receiver
   */
  private static boolean isCompileEnv(Form f) {
    if (!f.isQualifiedCall() || f.arity() != 3 ||
        !f.qualifiedName().isAtom("compile_env")) {
      return false;
    }
    Node recv = f.receiver();
    return recv.isForm() && recv.asForm().isCall(Nodes.ALIASES, 1) &&
           recv.asForm().args().get(0).equals(APPLICATION);
  }

  /**
   * Expand literals fully against an environment
   */
  public static Node expandLiterals(Node node, final Env env) {
    Pair<Node, Object> res = expandLiterals(node, null,
        new NodeFn<Object>() {
          @Override
          public Pair<Node, Object> apply(Node n, Object acc) {
            return Pair.create(expand(n, env), acc);
          }
        });
    return res.val1;
  }
}

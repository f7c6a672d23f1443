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
package exm.qtree.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.qtree.common.exceptions.QTreeRuntimeError;
import exm.qtree.expand.HygieneCounters;

/**
 * Builders and small structural queries for trees.
 */
public class Nodes {

  public static final String ALIASES = "__aliases__";
  public static final String BLOCK = "__block__";
  public static final String TUPLE = "{}";
  public static final String MAP = "%{}";
  public static final String STRUCT = "%";
  public static final String BITSTRING = "<<>>";
  public static final String MODULE = "__MODULE__";

  /** Rewrites form metadata */
  public static interface MetaUpdater {
    public Meta update(Meta meta);
  }

  public static Atom atom(String name) {
    return Atom.of(name);
  }

  public static Literal integer(long v) {
    return Literal.integer(v);
  }

  public static Literal floating(double v) {
    return Literal.floating(v);
  }

  public static Literal string(String s) {
    return Literal.string(s);
  }

  public static NodeList list(Node... elems) {
    return NodeList.of(elems);
  }

  /**
   * Variable reference {name, [], context}.  Use Atom.NIL as the
   * context to refer to a variable written by the user.
   */
  public static Form var(String name, Atom context) {
    return new Form(Atom.of(name), Meta.EMPTY, context);
  }

  public static Form var(String name, Meta meta, Atom context) {
    return new Form(Atom.of(name), meta, context);
  }

  /**
   * A variable no other call can produce: it carries a fresh counter
   * for its context.
   */
  public static Form uniqueVar(String name, Atom context,
                               HygieneCounters counters) {
    long counter = counters.next(context);
    return new Form(Atom.of(name), Meta.of(Meta.COUNTER, counter), context);
  }

  public static Form call(String name, Node... args) {
    return call(name, Meta.EMPTY, Arrays.asList(args));
  }

  public static Form call(String name, Meta meta, List<? extends Node> args) {
    return new Form(Atom.of(name), meta, NodeList.of(args));
  }

  /**
   * The dot form receiver.name used as tag of qualified calls
   */
  public static Form dot(Node receiver, Node name) {
    return new Form(Atom.of(Form.DOT), Meta.EMPTY, NodeList.of(receiver, name));
  }

  public static Form remote(Node receiver, String name, Node... args) {
    return new Form(dot(receiver, Atom.of(name)), Meta.EMPTY,
                    NodeList.of(args));
  }

  /**
   * Unexpanded alias chain, e.g. aliases("Foo", "Bar") for Foo.Bar
   */
  public static Form aliases(String... segments) {
    List<Node> atoms = new ArrayList<Node>(segments.length);
    for (String s: segments) {
      atoms.add(Atom.of(s));
    }
    return call(ALIASES, Meta.EMPTY, atoms);
  }

  /**
   * @param keysAndValues alternating String keys and Node values
   */
  public static NodeList keyword(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new QTreeRuntimeError("Odd number of keyword arguments");
    }
    List<Node> pairs = new ArrayList<Node>(keysAndValues.length / 2);
    for (int i = 0; i < keysAndValues.length; i += 2) {
      pairs.add(new Tuple2(Atom.of((String)keysAndValues[i]),
                           (Node)keysAndValues[i + 1]));
    }
    return NodeList.of(pairs);
  }

  public static Form block(Node... exprs) {
    return block(Arrays.asList(exprs));
  }

  public static Form block(List<? extends Node> exprs) {
    return call(BLOCK, Meta.EMPTY, exprs);
  }

  /**
   * Tuple literal: a pair for two elements, otherwise a {} form
   */
  public static Node tuple(Node... elems) {
    return tuple(Arrays.asList(elems));
  }

  public static Node tuple(List<? extends Node> elems) {
    if (elems.size() == 2) {
      return new Tuple2(elems.get(0), elems.get(1));
    }
    return call(TUPLE, Meta.EMPTY, elems);
  }

  /**
   * Map literal from a list of pairs
   */
  public static Form map(List<? extends Node> pairs) {
    return call(MAP, Meta.EMPTY, pairs);
  }

  /**
   * Binary operator application
   */
  public static Form op(String op, Node left, Node right) {
    return call(op, left, right);
  }

  /**
   * Apply fn to the metadata of a form.  Other nodes are returned
   * unchanged.
   */
  public static Node updateMeta(Node node, MetaUpdater fn) {
    if (!node.isForm()) {
      return node;
    }
    Form f = (Form)node;
    return f.withMeta(fn.update(f.meta()));
  }

  /**
   * Split a call into receiver, name and arguments.
   * Variables decompose as zero-argument local calls.
   * @return null for non-calls and tuple literals
   */
  public static DecomposedCall decomposeCall(Node node) {
    if (!node.isForm()) {
      return null;
    }
    Form f = (Form)node;
    if (f.hasTag(TUPLE) && f.isCall()) {
      return null;
    }
    if (f.isQualifiedCall()) {
      Node remote = f.receiver();
      if (remote.isForm() || remote.isAtom() || remote.isPair()) {
        return new DecomposedCall(remote, f.qualifiedName(),
                                  f.args().elements());
      }
      return null;
    }
    if (f.tag().isAtom()) {
      if (f.isVariable()) {
        return new DecomposedCall(null, f.tag(),
                                  Collections.<Node>emptyList());
      } else if (f.isCall()) {
        return new DecomposedCall(null, f.tag(), f.args().elements());
      }
    }
    return null;
  }

  /**
   * Variables arg1..argN in the given context.  Calling again with the
   * same inputs gives the same variables.
   */
  public static List<Node> generateArguments(int amount, Atom context) {
    checkAmount(amount);
    List<Node> res = new ArrayList<Node>(amount);
    for (int i = 1; i <= amount; i++) {
      res.add(var("arg" + i, context));
    }
    return res;
  }

  /**
   * As generateArguments, but each variable is unique
   */
  public static List<Node> generateUniqueArguments(int amount, Atom context,
                                          HygieneCounters counters) {
    checkAmount(amount);
    List<Node> res = new ArrayList<Node>(amount);
    for (int i = 1; i <= amount; i++) {
      res.add(uniqueVar("arg" + i, context, counters));
    }
    return res;
  }

  private static void checkAmount(int amount) {
    if (amount < 0) {
      throw new QTreeRuntimeError("Negative argument count: " + amount);
    }
  }

  /**
   * Keyword list entry value, or null
   */
  public static Node keywordGet(Node list, String key) {
    if (!list.isList()) {
      return null;
    }
    return ((NodeList)list).keywordGet(key);
  }
}

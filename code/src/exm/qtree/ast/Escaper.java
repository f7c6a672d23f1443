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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import exm.qtree.common.exceptions.QTreeRuntimeError;
import exm.qtree.common.util.Pair;
import exm.qtree.term.RawTuple;

/**
 * Turns runtime values into trees that evaluate to them.
 *
 * A Node given to escape is itself treated as a value: the result is
 * the tree that constructs that node, so forms become {} tuples of
 * tag, metadata keyword list and children.
 */
public class Escaper {

  public static final class Options {
    public static final Options DEFAULT = new Options(false, false);

    /** Leave unquote/1 contents as they are and splice unquote_splicing/1 */
    public final boolean unquote;
    /** Keep only line and no_parens metadata in escaped forms */
    public final boolean pruneMetadata;

    public Options(boolean unquote, boolean pruneMetadata) {
      this.unquote = unquote;
      this.pruneMetadata = pruneMetadata;
    }
  }

  public static Node escape(Object value) {
    return escape(value, Options.DEFAULT);
  }

  /**
   * @throws QTreeRuntimeError if the value has no tree representation
   */
  public static Node escape(Object value, Options opts) {
    if (value instanceof Node) {
      return escapeNode((Node)value, opts);
    }
    return escapeValue(value, opts);
  }

  private static Node escapeValue(Object value, Options opts) {
    if (value == null) {
      return Atom.NIL;
    } else if (value instanceof Boolean) {
      return Atom.bool((Boolean)value);
    } else if (value instanceof Integer || value instanceof Long ||
               value instanceof Short || value instanceof Byte) {
      return Literal.integer(((Number)value).longValue());
    } else if (value instanceof BigInteger) {
      return Literal.integer((BigInteger)value);
    } else if (value instanceof Double || value instanceof Float) {
      return Literal.floating(((Number)value).doubleValue());
    } else if (value instanceof Character) {
      return Literal.integer((Character)value);
    } else if (value instanceof String) {
      return Literal.string((String)value);
    } else if (value instanceof ProcessRef) {
      return Literal.process((ProcessRef)value);
    } else if (value instanceof FunctionRef) {
      return Literal.function((FunctionRef)value);
    } else if (value instanceof Pair) {
      Pair<?, ?> p = (Pair<?, ?>)value;
      return new Tuple2(escape(p.val1, opts), escape(p.val2, opts));
    } else if (value instanceof Object[]) {
      return escapeTuple(Arrays.asList((Object[])value), opts);
    } else if (value instanceof RawTuple) {
      return escapeTuple(((RawTuple)value).elements(), opts);
    } else if (value instanceof List) {
      List<Node> elems = new ArrayList<Node>();
      for (Object o: (List<?>)value) {
        elems.add(escape(o, opts));
      }
      return NodeList.of(elems);
    } else if (value instanceof Map) {
      List<Node> pairs = new ArrayList<Node>();
      for (Entry<?, ?> e: ((Map<?, ?>)value).entrySet()) {
        pairs.add(new Tuple2(escape(e.getKey(), opts),
                             escape(e.getValue(), opts)));
      }
      return Nodes.map(pairs);
    }
    throw new QTreeRuntimeError("Cannot escape value of " +
                    value.getClass().getName() + ": " + value);
  }

  private static Node escapeTuple(List<?> elems, Options opts) {
    List<Node> escaped = new ArrayList<Node>(elems.size());
    for (Object o: elems) {
      escaped.add(escape(o, opts));
    }
    return Nodes.tuple(escaped);
  }

  private static Node escapeNode(Node node, Options opts) {
    switch (node.type()) {
      case ATOM:
        return node;
      case LITERAL: {
        Literal l = (Literal)node;
        if (l.kind() == Literal.Kind.FOREIGN) {
          return escapeValue(l.value(), opts);
        }
        return l;
      }
      case PAIR: {
        Tuple2 p = (Tuple2)node;
        return new Tuple2(escapeNode(p.left(), opts),
                          escapeNode(p.right(), opts));
      }
      case LIST:
        return escapeList((NodeList)node, opts);
      case FORM: {
        Form f = (Form)node;
        if (opts.unquote && f.isCall("unquote", 1)) {
          return f.args().get(0);
        }
        return Nodes.call(Nodes.TUPLE, Meta.EMPTY, Arrays.asList(
            escapeNode(f.tag(), opts),
            escapeMeta(f.meta(), opts),
            escapeNode(f.children(), opts)));
      }
      default:
        throw new QTreeRuntimeError("Unknown node type " + node.type());
    }
  }

  /**
   * With unquote enabled, unquote_splicing(x) elements are joined
   * into the list with :erlang.++
   */
  private static Node escapeList(NodeList list, Options opts) {
    if (!opts.unquote || !hasSplice(list)) {
      List<Node> elems = new ArrayList<Node>(list.size());
      for (Node n: list) {
        elems.add(escapeNode(n, opts));
      }
      return NodeList.of(elems);
    }

    // Segments of plain elements and spliced expressions
    List<Node> segments = new ArrayList<Node>();
    List<Node> pending = new ArrayList<Node>();
    for (Node n: list) {
      if (isSplice(n)) {
        if (!pending.isEmpty()) {
          segments.add(NodeList.of(pending));
          pending = new ArrayList<Node>();
        }
        segments.add(((Form)n).args().get(0));
      } else {
        pending.add(escapeNode(n, opts));
      }
    }
    if (!pending.isEmpty()) {
      segments.add(NodeList.of(pending));
    }

    Node result = segments.get(segments.size() - 1);
    for (int i = segments.size() - 2; i >= 0; i--) {
      result = new Form(Nodes.dot(Atom.of("erlang"), Atom.of("++")),
                        Meta.EMPTY, NodeList.of(segments.get(i), result));
    }
    return result;
  }

  private static boolean hasSplice(NodeList list) {
    for (Node n: list) {
      if (isSplice(n)) {
        return true;
      }
    }
    return false;
  }

  private static boolean isSplice(Node n) {
    return n.isForm() && ((Form)n).isCall("unquote_splicing", 1);
  }

  private static Node escapeMeta(Meta meta, Options opts) {
    if (opts.pruneMetadata) {
      meta = meta.take(Meta.LINE, Meta.NO_PARENS);
    }
    List<Node> pairs = new ArrayList<Node>(meta.size());
    for (Entry<String, Object> e: meta.entries()) {
      pairs.add(new Tuple2(Atom.of(e.getKey()), escape(e.getValue(), opts)));
    }
    return NodeList.of(pairs);
  }
}

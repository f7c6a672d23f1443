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
package exm.qtree.term;

import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;

import org.apache.commons.lang3.StringUtils;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Form;
import exm.qtree.ast.Literal;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.ast.Tuple2;
import exm.qtree.lang.AtomClassifier;
import exm.qtree.lang.AtomClassifier.Format;
import exm.qtree.lang.Escapes;

/**
 * Write trees in term notation, the inverse of {@link TermReader}.
 * Forms are written as {tag, [meta...], children}.
 */
public class TermWriter {

  public static String write(Node node) {
    StringBuilder sb = new StringBuilder();
    write(sb, node);
    return sb.toString();
  }

  public static void write(StringBuilder sb, Node node) {
    switch (node.type()) {
      case ATOM:
        sb.append(AtomClassifier.inspect(Format.LITERAL, (Atom)node));
        break;
      case LITERAL:
        writeLiteral(sb, (Literal)node);
        break;
      case PAIR: {
        Tuple2 p = (Tuple2)node;
        sb.append('{');
        write(sb, p.left());
        sb.append(", ");
        write(sb, p.right());
        sb.append('}');
        break;
      }
      case FORM: {
        Form f = (Form)node;
        sb.append('{');
        write(sb, f.tag());
        sb.append(", ");
        writeMeta(sb, f.meta());
        sb.append(", ");
        write(sb, f.children());
        sb.append('}');
        break;
      }
      case LIST:
        writeList(sb, (NodeList)node);
        break;
      default:
        throw new IllegalArgumentException("node type " + node.type());
    }
  }

  private static void writeList(StringBuilder sb, NodeList list) {
    sb.append('[');
    boolean keyword = list.isKeyword();
    boolean first = true;
    for (Node elem: list) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      if (keyword) {
        Tuple2 kv = (Tuple2)elem;
        sb.append(AtomClassifier.inspect(Format.KEY, (Atom)kv.left()));
        sb.append(' ');
        write(sb, kv.right());
      } else {
        write(sb, elem);
      }
    }
    sb.append(']');
  }

  private static void writeLiteral(StringBuilder sb, Literal lit) {
    switch (lit.kind()) {
      case INTEGER:
        sb.append(lit.value().toString());
        break;
      case FLOAT:
        sb.append(formatFloat(lit.doubleValue()));
        break;
      case STRING:
        writeString(sb, lit.stringValue());
        break;
      case FOREIGN:
        if (lit.value() instanceof RawTuple) {
          sb.append(writeTuple(((RawTuple)lit.value()).elements()));
        } else {
          sb.append("#Java<").append(lit.value().getClass().getSimpleName());
          sb.append(' ').append(lit.value()).append('>');
        }
        break;
      default:
        // process and function references
        sb.append(lit.value().toString());
        break;
    }
  }

  private static void writeString(StringBuilder sb, String s) {
    sb.append('"').append(Escapes.escape(s, '"')).append('"');
  }

  static String writeTuple(List<Node> elements) {
    List<String> parts = new ArrayList<String>(elements.size());
    for (Node e: elements) {
      parts.add(write(e));
    }
    return "{" + StringUtils.join(parts, ", ") + "}";
  }

  private static void writeMeta(StringBuilder sb, Meta meta) {
    sb.append('[');
    boolean first = true;
    for (Entry<String, Object> e: meta.entries()) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(AtomClassifier.inspect(Format.KEY, Atom.of(e.getKey())));
      sb.append(' ');
      Object v = e.getValue();
      if (v instanceof Node) {
        write(sb, (Node)v);
      } else if (v instanceof Double) {
        sb.append(formatFloat((Double)v));
      } else if (v instanceof Number || v instanceof Boolean) {
        sb.append(v.toString());
      } else {
        writeString(sb, v.toString());
      }
    }
    sb.append(']');
  }

  /**
   * Shortest digits that read back as the same double, with at least
   * one digit after the point
   */
  public static String formatFloat(double d) {
    String s = Double.toString(d);
    return s.replace('E', 'e');
  }
}

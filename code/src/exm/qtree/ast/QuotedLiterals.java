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

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Recognises trees that denote plain data.
 */
public class QuotedLiterals {

  /** Bit-string segment types and flags that need no argument */
  private static final Set<String> BITSTRING_MODIFIERS =
      new HashSet<String>(Arrays.asList(
          "integer", "float", "bits", "bitstring", "binary", "bytes",
          "utf8", "utf16", "utf32", "signed", "unsigned",
          "little", "big", "native"));

  /**
   * True for atoms, numbers, strings, and for aliases, tuples, maps,
   * structs, lists and pairs made only of quoted literals.  A
   * __MODULE__ reference and bit-strings of literal segments also count.
   */
  public static boolean isQuotedLiteral(Node node) {
    switch (node.type()) {
      case ATOM:
        return true;
      case LITERAL: {
        Literal l = (Literal)node;
        return l.isNumber() || l.kind() == Literal.Kind.STRING;
      }
      case PAIR:
        return isQuotedLiteral(((Tuple2)node).left()) &&
               isQuotedLiteral(((Tuple2)node).right());
      case LIST:
        return allQuotedLiterals((NodeList)node);
      case FORM:
        return isQuotedLiteralForm((Form)node);
      default:
        return false;
    }
  }

  private static boolean isQuotedLiteralForm(Form f) {
    if (f.hasTag(Nodes.MODULE) && f.isVariable()) {
      return true;
    }
    if (!f.isCall()) {
      return false;
    }
    NodeList args = f.args();
    String tag = f.tagName();
    if (tag == null) {
      return false;
    } else if (tag.equals(Nodes.ALIASES) || tag.equals(Nodes.MAP) ||
               tag.equals(Nodes.TUPLE)) {
      return allQuotedLiterals(args);
    } else if (tag.equals(Nodes.STRUCT) && args.size() == 2) {
      return isQuotedLiteral(args.get(0)) && isQuotedLiteral(args.get(1));
    } else if (tag.equals(Nodes.BITSTRING)) {
      for (Node seg: args) {
        if (!isQuotedSegment(seg)) {
          return false;
        }
      }
      return true;
    }
    return false;
  }

  private static boolean allQuotedLiterals(NodeList l) {
    for (Node n: l) {
      if (!isQuotedLiteral(n)) {
        return false;
      }
    }
    return true;
  }

  private static boolean isQuotedSegment(Node seg) {
    if (seg.isInteger() || seg.isString()) {
      return true;
    }
    if (seg.isForm() && ((Form)seg).isCall("::", 2)) {
      NodeList args = ((Form)seg).args();
      Node value = args.get(0);
      return (value.isInteger() || value.isString()) &&
              isQuotedModifier(args.get(1));
    }
    return false;
  }

  private static boolean isQuotedModifier(Node mod) {
    if (!mod.isForm()) {
      return false;
    }
    Form f = (Form)mod;
    if (f.isCall("-", 2)) {
      return isQuotedModifier(f.args().get(0)) &&
             isQuotedModifier(f.args().get(1));
    } else if ((f.isCall("size", 1) || f.isCall("unit", 1))) {
      return f.args().get(0).isInteger();
    } else if (f.isCall("*", 2)) {
      return f.args().get(0).isInteger() && f.args().get(1).isInteger();
    } else if (f.tagName() != null &&
              (f.isVariable() || f.arity() == 0)) {
      return BITSTRING_MODIFIERS.contains(f.tagName());
    }
    return false;
  }
}

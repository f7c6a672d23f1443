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
package exm.qtree.unparse;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Form;
import exm.qtree.ast.Literal;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.ast.Nodes;
import exm.qtree.ast.Tuple2;
import exm.qtree.common.Settings;
import exm.qtree.common.exceptions.InvalidOptionException;
import exm.qtree.common.exceptions.QTreeRuntimeError;
import exm.qtree.common.util.Pair;
import exm.qtree.common.util.StringUtil;
import exm.qtree.lang.Associativity;
import exm.qtree.lang.AtomClassifier;
import exm.qtree.lang.AtomClassifier.Format;
import exm.qtree.lang.Escapes;
import exm.qtree.lang.Operators;
import exm.qtree.term.TermWriter;

/**
 * Render quoted trees back to source text.
 *
 * Every node rendered is passed through a {@link Substitution} together
 * with its text, so callers can rewrite the output of any subtree.
 * Parentheses are inserted from operator precedence, not from the
 * text the tree was parsed from, so comments and layout are lost.
 *
 * Rendering recurses on the Java stack, so nesting depth is bounded as
 * for {@link exm.qtree.walk.Traversal}.
 */
public class Unparser {

  private static final String[] KW_BLOCK_KEYS =
      {"do", "rescue", "catch", "else", "after"};

  private static final Atom ACCESS = Atom.alias("Access");
  private static final Atom KERNEL = Atom.alias("Kernel");

  private final Substitution fun;

  /** Indentation used for nested blocks */
  private final String indent;

  private Unparser(Substitution fun) {
    this.fun = fun;
    int width;
    try {
      width = Settings.getInt(Settings.UNPARSE_INDENT);
    } catch (InvalidOptionException e) {
      throw new QTreeRuntimeError(e.toString(), e);
    }
    this.indent = StringUtils.repeat(' ', width);
  }

  public static String toString(Node node) {
    return toString(node, Substitution.IDENTITY);
  }

  public static String toString(Node node, Substitution fun) {
    return new Unparser(fun).render(node);
  }

  private String render(Node node) {
    switch (node.type()) {
      case FORM:
        return renderForm((Form)node);
      case PAIR: {
        Tuple2 p = (Tuple2)node;
        return render(Nodes.call(Nodes.TUPLE, p.left(), p.right()));
      }
      case LIST:
        return renderList((NodeList)node);
      default:
        return fun.apply(node, inspect(node));
    }
  }

  private String renderForm(Form f) {
    String name = f.tagName();
    if (name != null && f.isVariable()) {
      return fun.apply(f, name);
    }

    if (!f.isCall()) {
      return fun.apply(f, inspect(f));
    }
    NodeList args = f.args();

    if (name != null) {
      String s = renderSpecial(f, name, args);
      if (s != null) {
        return s;
      }
    } else {
      String s = renderCompoundTag(f, args);
      if (s != null) {
        return s;
      }
    }

    String s = unaryCall(f);
    if (s != null) {
      return s;
    }
    s = opCall(f);
    if (s != null) {
      return fun.apply(f, s);
    }
    s = sigilCall(f);
    if (s != null) {
      return fun.apply(f, s);
    }

    Node last = args.isEmpty() ? NodeList.EMPTY : args.last();
    if (isKwBlocks(last)) {
      NodeList front = args.butLast();
      if (front.isEmpty()) {
        s = callToString(f.tag()) + kwBlocksToString((NodeList)last);
      } else {
        s = callToStringWithArgs(f.tag(), front) +
            kwBlocksToString((NodeList)last);
      }
    } else {
      s = callToStringWithArgs(f.tag(), args);
    }
    return fun.apply(f, s);
  }

  /**
   * Calls with an atom tag that have their own syntax
   * @return null if the form is an ordinary call
   */
  private String renderSpecial(Form f, String name, NodeList args) {
    if (name.equals(Nodes.ALIASES)) {
      List<String> segments = new ArrayList<String>(args.size());
      for (Node ref: args) {
        segments.add(callToString(ref));
      }
      return fun.apply(f, StringUtils.join(segments, "."));
    } else if (name.equals(Nodes.BLOCK)) {
      if (args.size() == 1) {
        return fun.apply(f, render(args.get(0)));
      }
      String block = adjustNewLines(blockToString(f));
      return fun.apply(f, "(\n" + indent + block + "\n)");
    } else if (name.equals(Nodes.BITSTRING)) {
      return fun.apply(f, bitstringToString(f, args));
    } else if (name.equals(Nodes.TUPLE)) {
      return fun.apply(f, "{" + argsToString(args) + "}");
    } else if (name.equals(Nodes.MAP)) {
      return fun.apply(f, "%{" + mapToString(args) + "}");
    } else if (name.equals(Nodes.STRUCT) && args.size() == 2 &&
               args.get(1).isForm() &&
               args.get(1).asForm().isCall() &&
               args.get(1).asForm().hasTag(Nodes.MAP)) {
      NodeList mapArgs = args.get(1).asForm().args();
      return fun.apply(f, "%" + render(args.get(0)) + "{" +
                          mapToString(mapArgs) + "}");
    } else if (name.equals("fn")) {
      return fun.apply(f, fnToString(args));
    } else if (name.equals("when")) {
      return whenToString(f, args);
    } else if (name.equals("&") && args.size() == 1) {
      return captureToString(f, args.get(0));
    } else if (name.equals("not") && args.size() == 1 &&
               args.get(0).isForm() &&
               args.get(0).asForm().isCall("in", 2)) {
      NodeList in = args.get(0).asForm().args();
      return fun.apply(f, render(in.get(0)) + " not in " +
                          render(in.get(1)));
    }
    return null;
  }

  /**
   * Calls whose tag is a dot form
   */
  private String renderCompoundTag(Form f, NodeList args) {
    if (!f.tag().isForm()) {
      return null;
    }
    Form dot = f.tag().asForm();
    if (!dot.isCall(Form.DOT, 2)) {
      return null;
    }
    Node left = dot.args().get(0);
    Node right = dot.args().get(1);

    if (left.equals(ACCESS) && right.isAtom("get") && args.size() == 2) {
      Node base = args.get(0);
      String idx = render(NodeList.of(args.get(1)));
      if (isOpExpr(base)) {
        return fun.apply(f, "(" + render(base) + ")" + idx);
      }
      return fun.apply(f, render(base) + idx);
    }

    if (right.isAtom(Nodes.TUPLE)) {
      return fun.apply(f, render(left) + ".{" + argsToString(args) + "}");
    }

    if (args.isEmpty()) {
      String call = callToString(dot);
      boolean tupleLeft = left.isForm() || left.isPair();
      if (tupleLeft && f.meta().isTrue(Meta.NO_PARENS)) {
        return fun.apply(f, call);
      }
      return fun.apply(f, call + "()");
    }
    return null;
  }

  private String fnToString(NodeList args) {
    if (args.size() == 1 && isArrow(args.get(0))) {
      Node body = args.get(0).asForm().args().get(1);
      if (!isBlockTuple(body)) {
        return "fn " + arrowToString(args, false) + " end";
      }
      return "fn " + blockToString(args) + "\nend";
    }
    return "fn\n" + indent + adjustNewLines(blockToString(args)) + "\nend";
  }

  /**
   * Any tuple whose first element is the block atom
   */
  private static boolean isBlockTuple(Node n) {
    if (n.isForm()) {
      return n.asForm().hasTag(Nodes.BLOCK);
    } else if (n.isPair()) {
      return n.asPair().left().isAtom(Nodes.BLOCK);
    }
    return false;
  }

  private String whenToString(Form f, NodeList args) {
    if (args.size() == 2) {
      Node left = args.get(0);
      Node right = args.get(1);
      String r;
      if (right.isList() && !right.asList().isEmpty() &&
          right.asList().isKeyword()) {
        r = kwListToString(right.asList());
      } else {
        r = fun.apply(f, opToString(right, "when", Associativity.RIGHT));
      }
      return fun.apply(f, opToString(left, "when", Associativity.LEFT) +
                          " when " + r);
    }
    NodeList front = args.isEmpty() ? NodeList.EMPTY : args.butLast();
    Node last = args.isEmpty() ? NodeList.EMPTY : args.last();
    return fun.apply(f, "(" + joinArgs(front) + ") when " + render(last));
  }

  private String captureToString(Form f, Node arg) {
    if (arg.isForm() && arg.asForm().isCall("/", 2) &&
        arg.asForm().args().get(1).isInteger()) {
      Node target = arg.asForm().args().get(0);
      Node arity = arg.asForm().args().get(1);
      if (target.isForm() && target.asForm().isVariable() &&
          target.asForm().tagName() != null) {
        return fun.apply(f, "&" + target.asForm().tagName() + "/" +
                            render(arity));
      }
      if (target.isForm() && target.asForm().isCall() &&
          target.asForm().args().isEmpty() &&
          target.asForm().tag().isForm() &&
          target.asForm().tag().asForm().isCall(Form.DOT, 2) &&
          target.asForm().tag().asForm().args().get(1).isAtom()) {
        NodeList dotArgs = target.asForm().tag().asForm().args();
        return fun.apply(f, "&" + render(dotArgs.get(0)) + "." +
                            dotArgs.get(1).asAtom().name() + "/" +
                            render(arity));
      }
    }
    if (!arg.isInteger()) {
      return fun.apply(f, "&(" + render(arg) + ")");
    }
    return null;
  }

  private String bitstringToString(Form f, NodeList parts) {
    if (isInterpolated(f)) {
      return interpolate(parts, "\"", "\"");
    }
    List<String> rendered = new ArrayList<String>(parts.size());
    for (Node part: parts) {
      String str = bitpartToString(part);
      if (!str.isEmpty() &&
          (str.charAt(0) == '<' || str.charAt(str.length() - 1) == '>')) {
        rendered.add("(" + str + ")");
      } else {
        rendered.add(str);
      }
    }
    return "<<" + StringUtils.join(rendered, ", ") + ">>";
  }

  private String bitpartToString(Node part) {
    if (part.isForm() && part.asForm().isCall("::", 2)) {
      Form f = part.asForm();
      Node left = f.args().get(0);
      Node right = f.args().get(1);
      if (f.meta().has(Meta.INFERRED_BITSTRING_SPEC)) {
        return fun.apply(f, render(left));
      }
      return fun.apply(f, opToString(left, "::", Associativity.LEFT) +
          "::" + bitmodsToString(right, "::", Associativity.RIGHT));
    }
    return render(part);
  }

  private String bitmodsToString(Node node, String parentOp,
                                 Associativity side) {
    if (node.isForm()) {
      Form f = node.asForm();
      String op = f.tagName();
      if (op != null && f.arity() == 2 &&
          (op.equals("*") || op.equals("-"))) {
        return fun.apply(f,
            bitmodsToString(f.args().get(0), op, Associativity.LEFT) + op +
            bitmodsToString(f.args().get(1), op, Associativity.RIGHT));
      }
    }
    return opToString(node, parentOp, side);
  }

  /**
   * True for a bitstring whose parts are all literal text or
   * to_string interpolation segments
   */
  private static boolean isInterpolated(Form f) {
    if (!f.isCall() || f.args().isEmpty()) {
      return false;
    }
    for (Node part: f.args()) {
      if (!part.isString() && !isInterpolationSegment(part)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Matches Kernel.to_string(arg)::binary
   */
  private static boolean isInterpolationSegment(Node part) {
    if (!part.isForm() || !part.asForm().isCall("::", 2)) {
      return false;
    }
    Node conv = part.asForm().args().get(0);
    Node type = part.asForm().args().get(1);
    if (!type.isForm() || !type.asForm().hasTag("binary")) {
      return false;
    }
    if (!conv.isForm() || !conv.asForm().isQualifiedCall() ||
        conv.asForm().arity() != 1) {
      return false;
    }
    return conv.asForm().receiver().equals(KERNEL) &&
           conv.asForm().qualifiedName().isAtom("to_string");
  }

  private String interpolate(NodeList parts, String left, String right) {
    if ((left.equals("\"\"\"\n") || left.equals("'''\n")) &&
        parts.size() == 1 && parts.get(0).isString()) {
      return left + parts.get(0).asLiteral().stringValue() + right;
    }
    StringBuilder sb = new StringBuilder(left);
    for (Node part: parts) {
      if (part.isString()) {
        sb.append(escapeText(part.asLiteral().stringValue(), left, right));
      } else if (isInterpolationSegment(part)) {
        Form conv = part.asForm().args().get(0).asForm();
        sb.append("#{").append(render(conv.args().get(0))).append("}");
      } else {
        sb.append("#{").append(render(part)).append("}");
      }
    }
    sb.append(right);
    return sb.toString();
  }

  /**
   * Escape literal text between interpolations so that it reads back
   * as the same text: backslashes, the start of an interpolation and
   * the closing delimiter.
   */
  private static String escapeText(String s, String left, String right) {
    if (left.equals("\"")) {
      return Escapes.escape(s, '"');
    }
    String escaped = s.replace("\\", "\\\\").replace("#{", "\\#{");
    if (right.length() == 1) {
      escaped = escaped.replace(right, "\\" + right);
    }
    return escaped;
  }

  private static final String[][] DELIMITER_PAIRS = {
    {"(", ")"}, {"[", "]"}, {"{", "}"}, {"<", ">"},
    {"\"\"\"", "\"\"\""}, {"'''", "'''"}
  };

  private static Pair<String, String> delimiterPair(String delimiter) {
    for (String[] p: DELIMITER_PAIRS) {
      if (p[0].equals(delimiter)) {
        if (delimiter.length() == 3) {
          // Heredocs open with a newline and close on their own line
          return Pair.create(delimiter + "\n", p[1]);
        }
        return Pair.create(p[0], p[1]);
      }
    }
    return Pair.create(delimiter, delimiter);
  }

  /**
   * @return rendering of a sigil call, or null if not one
   */
  private String sigilCall(Form f) {
    String letters = Sigils.letters(f.tagName());
    if (letters == null || f.arity() != 2) {
      return null;
    }
    Node parts = f.args().get(0);
    Node mods = f.args().get(1);
    if (!parts.isForm() || !parts.asForm().isCall() ||
        !parts.asForm().hasTag(Nodes.BITSTRING) || !mods.isList()) {
      return null;
    }
    String modifiers = sigilArgs(mods.asList());
    if (modifiers == null) {
      return null;
    }
    Object delim = f.meta().get(Meta.DELIMITER);
    String delimiter = delim instanceof String ? (String)delim : "\"";
    Pair<String, String> lr = delimiterPair(delimiter);
    NodeList pieces = parts.asForm().args();

    if (Sigils.isRaw(letters)) {
      if (pieces.size() != 1 || !pieces.get(0).isString()) {
        return null;
      }
      return "~" + letters + lr.val1 +
             pieces.get(0).asLiteral().stringValue() + lr.val2 + modifiers;
    }
    return "~" + letters + interpolate(pieces, lr.val1, lr.val2) +
           modifiers;
  }

  private String sigilArgs(NodeList mods) {
    if (mods.isEmpty()) {
      return "";
    }
    StringBuilder sb = new StringBuilder();
    for (Node m: mods) {
      if (!m.isInteger() || !m.asLiteral().fitsLong()) {
        return null;
      }
      long c = m.asLiteral().longValue();
      if (c < 0 || c > Integer.MAX_VALUE ||
          !Character.isValidCodePoint((int)c)) {
        return null;
      }
      sb.appendCodePoint((int)c);
    }
    return fun.apply(mods, sb.toString());
  }

  private String unaryCall(Form f) {
    String op = f.tagName();
    if (op == null || f.arity() != 1 || !Operators.isOperator(op, 1)) {
      return null;
    }
    Node arg = f.args().get(0);
    if (op.equals("not") || isOpExpr(arg)) {
      return fun.apply(f, op + "(" + render(arg) + ")");
    }
    return fun.apply(f, op + render(arg));
  }

  private String opCall(Form f) {
    String op = f.tagName();
    if (op == null) {
      return null;
    }
    if (op.equals(Operators.RANGE_STEP) && f.arity() == 3) {
      NodeList a = f.args();
      return opToString(a.get(0), Operators.RANGE, Associativity.LEFT) +
          ".." +
          opToString(a.get(1), Operators.RANGE, Associativity.RIGHT) +
          "//" +
          opToString(a.get(2), Operators.STEP, Associativity.RIGHT);
    }
    if (f.arity() == 2 && Operators.isOperator(op, 2)) {
      String l = opToString(f.args().get(0), op, Associativity.LEFT);
      String r = opToString(f.args().get(1), op, Associativity.RIGHT);
      if (op.equals(Operators.RANGE)) {
        return l + ".." + r;
      }
      return l + " " + op + " " + r;
    }
    return null;
  }

  private String callToString(Node target) {
    if (target.isAtom()) {
      return target.asAtom().name();
    }
    if (target.isForm() && target.asForm().hasTag(Form.DOT) &&
        target.asForm().isCall()) {
      NodeList dotArgs = target.asForm().args();
      if (dotArgs.size() == 1) {
        return moduleToString(dotArgs.get(0)) + ".";
      } else if (dotArgs.size() == 2) {
        Node right = dotArgs.get(1);
        if (right.isAtom()) {
          return moduleToString(dotArgs.get(0)) + "." +
              AtomClassifier.inspect(Format.REMOTE_CALL, right.asAtom());
        }
        return moduleToString(dotArgs.get(0)) + "." + callToString(right);
      }
    }
    return render(target);
  }

  private String callToStringWithArgs(Node target, NodeList args) {
    return callToString(target) + "(" + argsToString(args) + ")";
  }

  private String moduleToString(Node n) {
    if (n.isAtom()) {
      return inspect(n);
    }
    if (n.isForm()) {
      Form f = n.asForm();
      boolean paren = false;
      if (f.hasTag("&") && f.arity() == 1 && !f.args().get(0).isInteger()) {
        paren = true;
      } else if (f.hasTag("fn")) {
        paren = true;
      } else if (f.isCall() && !f.args().isEmpty() &&
                 isKwBlocks(f.args().last())) {
        paren = true;
      }
      if (paren) {
        return "(" + render(n) + ")";
      }
    }
    return render(n);
  }

  private boolean isKwBlocks(Node n) {
    if (!n.isList() || n.asList().isEmpty()) {
      return false;
    }
    NodeList l = n.asList();
    Node first = l.first();
    if (!first.isPair() || !first.asPair().left().isAtom("do")) {
      return false;
    }
    for (Node e: l) {
      if (!e.isPair() || !isKwBlockKey(e.asPair().left())) {
        return false;
      }
    }
    return true;
  }

  private static boolean isKwBlockKey(Node key) {
    for (String k: KW_BLOCK_KEYS) {
      if (key.isAtom(k)) {
        return true;
      }
    }
    return false;
  }

  private String kwBlocksToString(NodeList blocks) {
    StringBuilder sb = new StringBuilder(" ");
    for (String key: KW_BLOCK_KEYS) {
      Node value = blocks.keywordGet(key);
      if (value != null) {
        sb.append(key).append("\n").append(indent);
        sb.append(adjustNewLines(blockToString(value))).append("\n");
      }
    }
    sb.append("end");
    return sb.toString();
  }

  private String blockToString(Node n) {
    if (n.isList() && !n.asList().isEmpty() && isArrow(n.asList().first())) {
      List<String> clauses = new ArrayList<String>(n.asList().size());
      for (Node clause: n.asList()) {
        if (!isArrow(clause)) {
          clauses.add(render(clause));
          continue;
        }
        NodeList ab = clause.asForm().args();
        String left = commaJoinOrEmptyParen(asArgList(ab.get(0)), false);
        clauses.add(left + "->\n" + indent +
                    adjustNewLines(blockToString(ab.get(1))));
      }
      return StringUtils.join(clauses, "\n");
    }
    if (n.isForm() && n.asForm().hasTag(Nodes.BLOCK) && n.asForm().isCall()) {
      List<String> exprs = new ArrayList<String>();
      for (Node e: n.asForm().args()) {
        exprs.add(render(e));
      }
      return StringUtils.join(exprs, "\n");
    }
    return render(n);
  }

  private static boolean isArrow(Node n) {
    return n.isForm() && n.asForm().isCall("->", 2);
  }

  private static NodeList asArgList(Node n) {
    return n.isList() ? n.asList() : NodeList.of(n);
  }

  private String mapToString(NodeList args) {
    if (args.size() == 1 && args.get(0).isForm() &&
        args.get(0).asForm().isCall("|", 2)) {
      NodeList upd = args.get(0).asForm().args();
      String rest = upd.get(1).isList() ? mapToString(upd.get(1).asList())
                                        : render(upd.get(1));
      return render(upd.get(0)) + " | " + rest;
    }
    if (args.isKeyword()) {
      return kwListToString(args);
    }
    List<String> elems = new ArrayList<String>(args.size());
    for (Node e: args) {
      if (e.isPair()) {
        elems.add(render(e.asPair().left()) + " => " +
                  render(e.asPair().right()));
      } else {
        elems.add(render(e));
      }
    }
    return StringUtils.join(elems, ", ");
  }

  private String kwListToString(NodeList list) {
    List<String> elems = new ArrayList<String>(list.size());
    for (Node e: list) {
      Tuple2 kv = e.asPair();
      elems.add(AtomClassifier.inspect(Format.KEY, kv.left().asAtom()) +
                " " + render(kv.right()));
    }
    return StringUtils.join(elems, ", ");
  }

  private String argsToString(NodeList args) {
    if (!args.isEmpty()) {
      Node last = args.last();
      if (last.isList() && !last.asList().isEmpty() &&
          last.asList().isKeyword()) {
        NodeList front = args.butLast();
        String prefix = front.isEmpty() ? "" : joinArgs(front) + ", ";
        return prefix + kwListToString(last.asList());
      }
    }
    return joinArgs(args);
  }

  private String joinArgs(NodeList args) {
    List<String> elems = new ArrayList<String>(args.size());
    for (Node a: args) {
      elems.add(render(a));
    }
    return StringUtils.join(elems, ", ");
  }

  private String arrowToString(NodeList clauses, boolean paren) {
    List<String> elems = new ArrayList<String>(clauses.size());
    for (Node c: clauses) {
      if (!isArrow(c)) {
        elems.add(render(c));
        continue;
      }
      NodeList ab = c.asForm().args();
      elems.add(commaJoinOrEmptyParen(asArgList(ab.get(0)), paren) +
                "-> " + render(ab.get(1)));
    }
    return StringUtils.join(elems, "; ");
  }

  private String commaJoinOrEmptyParen(NodeList args, boolean paren) {
    if (args.isEmpty()) {
      return paren ? "() " : "";
    }
    return joinArgs(args) + " ";
  }

  private String renderList(NodeList l) {
    String s;
    if (!l.isEmpty() && isArrow(l.first())) {
      s = "(" + arrowToString(l, true) + ")";
    } else if (l.isEmpty()) {
      s = "[]";
    } else if (isPrintableCharlist(l)) {
      StringBuilder chars = new StringBuilder(l.size());
      for (Node c: l) {
        chars.appendCodePoint((int)c.asLiteral().longValue());
      }
      s = "~c\"" + Escapes.escape(chars.toString(), '"') + "\"";
    } else if (l.isKeyword()) {
      s = "[" + kwListToString(l) + "]";
    } else {
      s = "[" + joinArgs(l) + "]";
    }
    return fun.apply(l, s);
  }

  private static boolean isPrintableCharlist(NodeList l) {
    for (Node c: l) {
      if (!c.isInteger() || !c.asLiteral().fitsLong()) {
        return false;
      }
      long v = c.asLiteral().longValue();
      if (v < 0 || v > 0xFF || !StringUtil.isPrintableLatin1((int)v)) {
        return false;
      }
    }
    return true;
  }

  private String opToString(Node expr, String parentOp, Associativity side) {
    if (expr.isForm()) {
      Form f = expr.asForm();
      String op = f.tagName();
      if (op != null && f.arity() == 2) {
        Pair<Associativity, Integer> mine = Operators.binaryOp(op);
        Pair<Associativity, Integer> parent = Operators.binaryOp(parentOp);
        if (mine != null && parent != null) {
          int cmp = mine.val2.compareTo(parent.val2);
          boolean paren;
          if (cmp < 0) {
            paren = true;
          } else if (cmp == 0) {
            paren = parent.val1 != side;
          } else {
            paren = false;
          }
          String s = render(expr);
          return paren ? "(" + s + ")" : s;
        }
      }
    }
    return render(expr);
  }

  /**
   * True for a call of a unary or binary operator with matching arity
   */
  private static boolean isOpExpr(Node n) {
    if (!n.isForm()) {
      return false;
    }
    Form f = n.asForm();
    String op = f.tagName();
    if (op == null) {
      return false;
    }
    int arity = f.arity();
    if (arity == 1 || arity == 2) {
      return Operators.isOperator(op, arity);
    }
    return false;
  }

  private String adjustNewLines(String block) {
    return block.replace("\n", "\n" + indent);
  }

  /**
   * Leaves, and forms with no source syntax, render in term notation
   */
  private static String inspect(Node node) {
    if (node.isLiteral()) {
      Literal l = node.asLiteral();
      if (l.kind() == Literal.Kind.STRING) {
        return "\"" + Escapes.escape(l.stringValue(), '"') + "\"";
      }
    }
    return TermWriter.write(node);
  }
}

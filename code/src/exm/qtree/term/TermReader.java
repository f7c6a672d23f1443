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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Form;
import exm.qtree.ast.FunctionRef;
import exm.qtree.ast.Literal;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.ast.ProcessRef;
import exm.qtree.ast.Tuple2;
import exm.qtree.common.exceptions.TermSyntaxException;

/**
 * Read trees written in term notation:
 * <pre>
 *   {:foo, [line: 3], [1, "two", :three, Four.Five, {:a, :b}]}
 * </pre>
 * A three-element tuple whose middle element is a keyword list is a
 * form.  Two-element tuples are pairs.  Other tuples are kept as
 * foreign literals holding a {@link RawTuple}.
 * Lines starting with # outside of a term are comments.
 */
public class TermReader {

  private static final String DEFAULT_FILE = "<string>";

  private final String file;
  private final char[] src;
  private int p = 0;
  private int line = 1;
  private int lineStart = 0;

  public TermReader(String file, String text) {
    this.file = file;
    this.src = text.toCharArray();
  }

  public static Node read(String text) throws TermSyntaxException {
    return read(DEFAULT_FILE, text);
  }

  public static Node read(String file, String text)
      throws TermSyntaxException {
    return new TermReader(file, text).readOne();
  }

  /**
   * Read exactly one term; trailing input is an error
   */
  public Node readOne() throws TermSyntaxException {
    Node n = readTerm();
    skipSpace();
    if (p < src.length) {
      throw error("unexpected input after term: " + src[p]);
    }
    return n;
  }

  /**
   * Read whitespace-separated terms until end of input
   */
  public List<Node> readAll() throws TermSyntaxException {
    List<Node> terms = new ArrayList<Node>();
    skipSpace();
    while (p < src.length) {
      terms.add(readTerm());
      skipSpace();
    }
    return terms;
  }

  private TermSyntaxException error(String msg) {
    return new TermSyntaxException(file, line, p - lineStart + 1, msg);
  }

  private void skipSpace() {
    while (p < src.length) {
      char c = src[p];
      if (c == '\n') {
        p++;
        line++;
        lineStart = p;
      } else if (Character.isWhitespace(c)) {
        p++;
      } else if (c == '#' && !lookingAt("#PID<")) {
        while (p < src.length && src[p] != '\n') {
          p++;
        }
      } else {
        return;
      }
    }
  }

  private boolean lookingAt(String s) {
    if (p + s.length() > src.length) {
      return false;
    }
    for (int i = 0; i < s.length(); i++) {
      if (src[p + i] != s.charAt(i)) {
        return false;
      }
    }
    return true;
  }

  private void expect(char c) throws TermSyntaxException {
    skipSpace();
    if (p >= src.length) {
      throw error("expected '" + c + "' but input ended");
    }
    if (src[p] != c) {
      throw error("expected '" + c + "' but found '" + src[p] + "'");
    }
    p++;
  }

  private Node readTerm() throws TermSyntaxException {
    skipSpace();
    if (p >= src.length) {
      throw error("unexpected end of input");
    }
    char c = src[p];
    switch (c) {
      case '[':
        return readList();
      case '{':
        return readTuple();
      case '"':
        return Literal.string(readString());
      case ':':
        p++;
        return readAtomAfterColon();
      case '#':
        return readPid();
      case '&':
        p++;
        return readFunctionRef();
      case '?':
        p++;
        return readCharLiteral();
      default:
        break;
    }
    if (c == '-' || (c >= '0' && c <= '9')) {
      return readNumber();
    }
    if (c >= 'A' && c <= 'Z') {
      return Atom.alias(readRun());
    }
    if ((c >= 'a' && c <= 'z') || c == '_') {
      int start = p;
      String word = readRun();
      if (word.equals("true") || word.equals("false") || word.equals("nil")) {
        return Atom.of(word);
      }
      p = start;
      throw error("unexpected identifier " + word);
    }
    throw error("unexpected character '" + c + "'");
  }

  private static boolean isDelimiter(char c) {
    switch (c) {
      case ',': case '[': case ']': case '{': case '}':
      case '(': case ')': case '"':
        return true;
      default:
        return Character.isWhitespace(c);
    }
  }

  /**
   * Characters up to whitespace or a delimiter
   */
  private String readRun() {
    int start = p;
    while (p < src.length && !isDelimiter(src[p])) {
      p++;
    }
    return new String(src, start, p - start);
  }

  private static final String[] BRACKET_ATOMS = {"%{}", "{}", "[]"};

  private Atom readAtomAfterColon() throws TermSyntaxException {
    if (p < src.length && src[p] == '"') {
      return Atom.of(readString());
    }
    for (String name: BRACKET_ATOMS) {
      if (lookingAt(name)) {
        p += name.length();
        return Atom.of(name);
      }
    }
    String name = readRun();
    if (name.isEmpty()) {
      throw error("empty atom");
    }
    return Atom.of(name);
  }

  private String readString() throws TermSyntaxException {
    int startLine = line;
    p++;
    StringBuilder sb = new StringBuilder();
    while (true) {
      if (p >= src.length) {
        throw new TermSyntaxException(file, startLine, 0,
                                      "unterminated string");
      }
      char c = src[p++];
      if (c == '"') {
        return sb.toString();
      } else if (c == '\\') {
        readEscape(sb);
      } else {
        if (c == '\n') {
          line++;
          lineStart = p;
        }
        sb.append(c);
      }
    }
  }

  private void readEscape(StringBuilder sb) throws TermSyntaxException {
    if (p >= src.length) {
      throw error("unterminated escape");
    }
    char c = src[p++];
    switch (c) {
      case '0': sb.append('\0'); break;
      case 'a': sb.append((char)7); break;
      case 'b': sb.append('\b'); break;
      case 't': sb.append('\t'); break;
      case 'n': sb.append('\n'); break;
      case 'v': sb.append((char)11); break;
      case 'f': sb.append('\f'); break;
      case 'r': sb.append('\r'); break;
      case 'e': sb.append((char)27); break;
      case 'd': sb.append((char)127); break;
      case 's': sb.append(' '); break;
      case 'x':
        sb.appendCodePoint(readHex(2));
        break;
      case 'u':
        if (p < src.length && src[p] == '{') {
          p++;
          int start = p;
          while (p < src.length && src[p] != '}') {
            p++;
          }
          if (p >= src.length) {
            throw error("unterminated \\u{ escape");
          }
          String digits = new String(src, start, p - start);
          p++;
          sb.appendCodePoint(parseHex(digits));
        } else {
          sb.appendCodePoint(readHex(4));
        }
        break;
      default:
        // \\ \" \# and any other character stand for themselves
        sb.append(c);
        break;
    }
  }

  /**
   * ?c is the integer code point of c
   */
  private Literal readCharLiteral() throws TermSyntaxException {
    if (p >= src.length) {
      throw error("expected character after ?");
    }
    if (src[p] == '\\') {
      p++;
      StringBuilder sb = new StringBuilder(2);
      readEscape(sb);
      return Literal.integer(sb.codePointAt(0));
    }
    int c = Character.codePointAt(src, p);
    p += Character.charCount(c);
    return Literal.integer(c);
  }

  private int readHex(int width) throws TermSyntaxException {
    if (p + width > src.length) {
      throw error("truncated hex escape");
    }
    String digits = new String(src, p, width);
    p += width;
    return parseHex(digits);
  }

  private int parseHex(String digits) throws TermSyntaxException {
    try {
      return Integer.parseInt(digits, 16);
    } catch (NumberFormatException e) {
      throw error("bad hex escape: " + digits);
    }
  }

  private Literal readNumber() throws TermSyntaxException {
    int start = p;
    if (src[p] == '-') {
      p++;
    }
    boolean isFloat = false;
    while (p < src.length) {
      char c = src[p];
      if ((c >= '0' && c <= '9') || c == '_') {
        p++;
      } else if (c == '.' && p + 1 < src.length &&
                 Character.isDigit(src[p + 1])) {
        isFloat = true;
        p++;
      } else if ((c == 'e' || c == 'E') && isFloat) {
        p++;
        if (p < src.length && (src[p] == '-' || src[p] == '+')) {
          p++;
        }
      } else {
        break;
      }
    }
    String text = new String(src, start, p - start).replace("_", "");
    try {
      if (isFloat) {
        return Literal.floating(Double.parseDouble(text));
      }
      return Literal.integer(new BigInteger(text));
    } catch (NumberFormatException e) {
      p = start;
      throw error("bad number: " + text);
    }
  }

  private Literal readPid() throws TermSyntaxException {
    if (!lookingAt("#PID<")) {
      throw error("unexpected character '#'");
    }
    p += "#PID<".length();
    int node = readSmallInt();
    expect('.');
    int id = readSmallInt();
    expect('.');
    int serial = readSmallInt();
    expect('>');
    return Literal.process(new ProcessRef(node, id, serial));
  }

  private int readSmallInt() throws TermSyntaxException {
    int start = p;
    while (p < src.length && Character.isDigit(src[p])) {
      p++;
    }
    if (start == p) {
      throw error("expected digits");
    }
    return Integer.parseInt(new String(src, start, p - start));
  }

  /**
   * &amp;Mod.fun/arity or &amp;:mod.fun/arity
   */
  private Literal readFunctionRef() throws TermSyntaxException {
    String text = readRun();
    int slash = text.lastIndexOf('/');
    if (slash <= 0 || slash == text.length() - 1) {
      throw error("bad function reference &" + text);
    }
    int arity;
    try {
      arity = Integer.parseInt(text.substring(slash + 1));
    } catch (NumberFormatException e) {
      throw error("bad function arity &" + text);
    }
    String head = text.substring(0, slash);
    int dot;
    Atom module;
    if (head.startsWith(":")) {
      dot = head.indexOf('.', 1);
      if (dot < 0) {
        throw error("bad function reference &" + text);
      }
      module = Atom.of(head.substring(1, dot));
    } else {
      // Module segments are capitalized; the function name follows
      dot = -1;
      int next = head.indexOf('.');
      while (next > 0 && next + 1 < head.length() &&
             Character.isUpperCase(head.charAt(dot + 1))) {
        dot = next;
        next = head.indexOf('.', dot + 1);
      }
      if (dot <= 0) {
        throw error("bad function reference &" + text);
      }
      module = Atom.alias(head.substring(0, dot));
    }
    Atom name = Atom.of(head.substring(dot + 1));
    return Literal.function(new FunctionRef(module, name, arity));
  }

  private NodeList readList() throws TermSyntaxException {
    p++;
    skipSpace();
    List<Node> elems = new ArrayList<Node>();
    if (p < src.length && src[p] == ']') {
      p++;
      return NodeList.EMPTY;
    }
    while (true) {
      elems.add(readListElement());
      skipSpace();
      if (p >= src.length) {
        throw error("unterminated list");
      }
      if (src[p] == ']') {
        p++;
        return NodeList.of(elems);
      }
      expect(',');
    }
  }

  /**
   * A term, or a keyword entry written as key: value
   */
  private Node readListElement() throws TermSyntaxException {
    skipSpace();
    int start = p;
    int startLine = line;
    int startLineStart = lineStart;
    String key = null;
    if (p < src.length && src[p] == '"') {
      String s = readString();
      if (atKeyColon()) {
        key = s;
      }
    } else if (p < src.length && src[p] != ':' && !isDelimiter(src[p])) {
      String run = readRun();
      if (run.length() > 1 && run.endsWith(":") &&
          (p >= src.length || Character.isWhitespace(src[p]))) {
        key = run.substring(0, run.length() - 1);
        p--;
        atKeyColon();
      }
    }
    if (key == null) {
      p = start;
      line = startLine;
      lineStart = startLineStart;
      return readTerm();
    }
    Node value = readTerm();
    return new Tuple2(Atom.of(key), value);
  }

  /**
   * Consume a colon that ends a keyword key
   */
  private boolean atKeyColon() {
    if (p < src.length && src[p] == ':' &&
        (p + 1 >= src.length || Character.isWhitespace(src[p + 1]))) {
      p++;
      return true;
    }
    return false;
  }

  private Node readTuple() throws TermSyntaxException {
    p++;
    skipSpace();
    List<Node> elems = new ArrayList<Node>();
    if (p < src.length && src[p] == '}') {
      p++;
    } else {
      while (true) {
        elems.add(readTerm());
        skipSpace();
        if (p >= src.length) {
          throw error("unterminated tuple");
        }
        if (src[p] == '}') {
          p++;
          break;
        }
        expect(',');
      }
    }
    if (elems.size() == 2) {
      return new Tuple2(elems.get(0), elems.get(1));
    }
    if (elems.size() == 3 && isMeta(elems.get(1))) {
      return new Form(elems.get(0), toMeta((NodeList)elems.get(1)),
                      elems.get(2));
    }
    return Literal.foreign(new RawTuple(elems));
  }

  private static boolean isMeta(Node n) {
    if (!n.isList()) {
      return false;
    }
    for (Node e: (NodeList)n) {
      if (!e.isPair() || !e.asPair().left().isAtom()) {
        return false;
      }
    }
    return true;
  }

  private static Meta toMeta(NodeList kw) {
    Map<String, Object> m = new LinkedHashMap<String, Object>();
    for (Node e: kw) {
      Tuple2 kv = e.asPair();
      m.put(kv.left().asAtom().name(), metaValue(kv.right()));
    }
    return Meta.fromMap(m);
  }

  private static Object metaValue(Node v) {
    if (v.isAtom()) {
      Atom a = (Atom)v;
      if (a.isBoolean()) {
        return a.equals(Atom.TRUE);
      }
      return a;
    }
    if (v.isLiteral()) {
      Literal l = (Literal)v;
      switch (l.kind()) {
        case INTEGER:
          if (l.fitsLong()) {
            return l.longValue();
          }
          return v;
        case FLOAT:
          return l.doubleValue();
        case STRING:
          return l.stringValue();
        default:
          return v;
      }
    }
    return v;
  }
}

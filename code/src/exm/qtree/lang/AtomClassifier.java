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
package exm.qtree.lang;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import exm.qtree.ast.Atom;
import exm.qtree.lang.IdentifierTokenizer.Kind;
import exm.qtree.lang.IdentifierTokenizer.Special;
import exm.qtree.lang.IdentifierTokenizer.Token;

/**
 * Classifies atoms by how they may be written in source, and renders
 * them accordingly.
 */
public class AtomClassifier {

  /** Coarse classification */
  public static enum SourceForm {
    ALIAS,
    IDENTIFIER,
    /** Operators, and atoms such as :foo@bar or :Foo */
    UNQUOTED,
    QUOTED,
  }

  /** Position the atom is rendered in */
  public static enum Format {
    /** :foo */
    LITERAL,
    /** foo: in a keyword list or map */
    KEY,
    /** Function name after a dot */
    REMOTE_CALL,
  }

  private static final Set<String> NOT_CALLABLE = new HashSet<String>(
      Arrays.asList("%", "%{}", "{}", "<<>>", "...", "..", ".", "..//", "->"));

  /** Deprecated or ambiguous as bare atoms */
  private static final Set<String> QUOTED_OPERATORS = new HashSet<String>(
      Arrays.asList("::", "^^^", "~~~", "<|>"));

  public static AtomCategory classify(Atom atom) {
    String name = atom.name();
    if (NOT_CALLABLE.contains(name)) {
      return AtomCategory.NOT_CALLABLE;
    } else if (QUOTED_OPERATORS.contains(name)) {
      return AtomCategory.QUOTED_OPERATOR;
    } else if (Operators.isUnaryOrBinary(name)) {
      return AtomCategory.UNQUOTED_OPERATOR;
    } else if (isValidAlias(name)) {
      return AtomCategory.ALIAS;
    }

    Token tok = IdentifierTokenizer.tokenize(name);
    if (tok == null || !tok.consumedAll()) {
      return AtomCategory.OTHER;
    } else if (tok.kind != Kind.IDENTIFIER ||
               tok.special.contains(Special.AT)) {
      return AtomCategory.NOT_CALLABLE;
    } else if (tok.special.contains(Special.NFKC)) {
      return AtomCategory.OTHER;
    } else {
      return AtomCategory.IDENTIFIER;
    }
  }

  public static SourceForm sourceForm(Atom atom) {
    switch (classify(atom)) {
      case ALIAS:
        return SourceForm.ALIAS;
      case IDENTIFIER:
        return SourceForm.IDENTIFIER;
      case UNQUOTED_OPERATOR:
      case NOT_CALLABLE:
        return SourceForm.UNQUOTED;
      default:
        return SourceForm.QUOTED;
    }
  }

  /**
   * "Elixir" followed by any number of .Segment, each segment an
   * uppercase ASCII letter then ASCII letters, digits or underscores.
   */
  static boolean isValidAlias(String name) {
    if (!name.startsWith(Atom.ALIAS_ROOT)) {
      return false;
    }
    int pos = Atom.ALIAS_ROOT.length();
    while (pos < name.length()) {
      if (name.charAt(pos) != '.' || pos + 1 >= name.length()) {
        return false;
      }
      char first = name.charAt(pos + 1);
      if (first < 'A' || first > 'Z') {
        return false;
      }
      pos += 2;
      while (pos < name.length() && isAliasChar(name.charAt(pos))) {
        pos++;
      }
    }
    return true;
  }

  private static boolean isAliasChar(char c) {
    return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') ||
           (c >= '0' && c <= '9') || c == '_';
  }

  public static String inspect(Format format, Atom atom) {
    String name = atom.name();
    switch (format) {
      case LITERAL:
        return inspectLiteral(atom, name);
      case KEY:
        switch (sourceForm(atom)) {
          case ALIAS:
            return "\"" + name + "\":";
          case QUOTED:
            return "\"" + Escapes.escape(name, '"') + "\":";
          default:
            return name + ":";
        }
      case REMOTE_CALL:
        AtomCategory cat = classify(atom);
        switch (cat) {
          case IDENTIFIER:
          case UNQUOTED_OPERATOR:
          case QUOTED_OPERATOR:
            return name;
          case NOT_CALLABLE:
          case ALIAS:
            return "\"" + name + "\"";
          default:
            return "\"" + Escapes.escape(name, '"') + "\"";
        }
      default:
        throw new IllegalArgumentException("format " + format);
    }
  }

  private static String inspectLiteral(Atom atom, String name) {
    if (atom.isNil() || atom.isBoolean()) {
      return name;
    }
    switch (sourceForm(atom)) {
      case ALIAS:
        if (name.equals(Atom.ALIAS_ROOT) ||
            name.startsWith(Atom.ALIAS_PREFIX + Atom.ALIAS_ROOT)) {
          return name;
        }
        return name.substring(Atom.ALIAS_PREFIX.length());
      case QUOTED:
        return ":\"" + Escapes.escape(name, '"') + "\"";
      default:
        return ":" + name;
    }
  }
}

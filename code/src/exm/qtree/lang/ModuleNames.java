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
import java.util.List;

import exm.qtree.ast.Atom;
import exm.qtree.common.exceptions.QTreeRuntimeError;

/**
 * Module name arithmetic and case conversion of identifiers.
 * ASCII only.
 */
public class ModuleNames {

  public static Atom concat(Atom... segments) {
    return concat(Arrays.asList(segments));
  }

  /**
   * Join alias segments into one module atom.  A leading Elixir or
   * Elixir.X segment is kept as the root; nil segments are skipped;
   * the Elixir. prefix of later segments is dropped.
   */
  public static Atom concat(List<Atom> segments) {
    StringBuilder sb = new StringBuilder();
    int start = 0;
    if (!segments.isEmpty() && !segments.get(0).isNil() &&
        (segments.get(0).name().equals(Atom.ALIAS_ROOT) ||
         segments.get(0).hasAliasPrefix())) {
      sb.append(segments.get(0).name());
      start = 1;
    } else {
      sb.append(Atom.ALIAS_ROOT);
    }
    for (int i = start; i < segments.size(); i++) {
      Atom seg = segments.get(i);
      if (seg.isNil()) {
        continue;
      }
      sb.append('.').append(toPartial(seg.name()));
    }
    return Atom.of(sb.toString());
  }

  private static String toPartial(String s) {
    if (s.startsWith(Atom.ALIAS_PREFIX)) {
      return s.substring(Atom.ALIAS_PREFIX.length());
    } else if (s.startsWith(".")) {
      return s.substring(1);
    }
    return s;
  }

  /**
   * Module name without the Elixir. prefix
   */
  public static String stripNamespace(Atom module) {
    String name = module.name();
    if (name.startsWith(Atom.ALIAS_PREFIX)) {
      return name.substring(Atom.ALIAS_PREFIX.length());
    }
    return name;
  }

  /**
   * Underscore a module atom, e.g. Elixir.Foo.Bar to foo/bar
   */
  public static String underscore(Atom module) {
    if (!module.hasAliasPrefix()) {
      throw new QTreeRuntimeError("Not a module name: " + module.name());
    }
    return underscore(stripNamespace(module));
  }

  /**
   * FooBar to foo_bar, Foo.Bar to foo/bar.  Runs of capitals stay
   * together: SAPExample to sap_example.
   */
  public static String underscore(String s) {
    if (s.isEmpty()) {
      return s;
    }
    StringBuilder sb = new StringBuilder(s.length() + 4);
    sb.append(toLower(s.charAt(0)));
    underscoreRest(s, 1, s.charAt(0), sb);
    return sb.toString();
  }

  private static void underscoreRest(String s, int i, char prev,
                                     StringBuilder sb) {
    while (i < s.length()) {
      char h = s.charAt(i);
      if (i + 1 < s.length() && isUpper(h)) {
        char t = s.charAt(i + 1);
        if (!isUpper(t) && !isDigit(t) && t != '.' && t != '_') {
          sb.append('_').append(toLower(h)).append(t);
          prev = t;
          i += 2;
          continue;
        }
      }
      if (isUpper(h) && !isUpper(prev) && prev != '_') {
        sb.append('_').append(toLower(h));
      } else if (h == '.') {
        sb.append('/');
        String rest = s.substring(i + 1);
        if (!rest.isEmpty()) {
          sb.append(toLower(rest.charAt(0)));
          underscoreRest(s, i + 2, rest.charAt(0), sb);
        }
        return;
      } else {
        sb.append(toLower(h));
      }
      prev = h;
      i++;
    }
  }

  /**
   * foo_bar to FooBar, foo/bar to Foo.Bar.  Existing capitals are
   * kept: API_SPEC stays API_SPEC.
   */
  public static String camelize(String s) {
    int i = 0;
    while (i < s.length() && s.charAt(i) == '_') {
      i++;
    }
    if (i == s.length()) {
      return "";
    }
    StringBuilder sb = new StringBuilder(s.length());
    sb.append(toUpper(s.charAt(i)));
    i++;
    while (i < s.length()) {
      char c = s.charAt(i);
      if (c == '_') {
        while (i + 1 < s.length() && s.charAt(i + 1) == '_') {
          i++;
        }
        if (i + 1 >= s.length()) {
          // trailing underscore dropped
          i++;
        } else {
          char h = s.charAt(i + 1);
          if (h >= 'a' && h <= 'z') {
            sb.append(toUpper(h));
            i += 2;
          } else if (isDigit(h)) {
            sb.append(h);
            i += 2;
          } else {
            sb.append(c);
            i++;
          }
        }
      } else if (c == '/') {
        sb.append('.').append(camelize(s.substring(i + 1)));
        return sb.toString();
      } else {
        sb.append(c);
        i++;
      }
    }
    return sb.toString();
  }

  private static boolean isUpper(char c) {
    return c >= 'A' && c <= 'Z';
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static char toLower(char c) {
    return isUpper(c) ? (char)(c + 32) : c;
  }

  private static char toUpper(char c) {
    return (c >= 'a' && c <= 'z') ? (char)(c - 32) : c;
  }
}

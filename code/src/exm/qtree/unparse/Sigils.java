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

import exm.qtree.ast.Form;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.ast.Nodes;
import exm.qtree.common.exceptions.InvalidSigilException;

/**
 * Sigil call forms: {:sigil_x, meta, [{:<<>>, [], parts}, modifiers]}
 */
public class Sigils {

  public static final String PREFIX = "sigil_";

  /**
   * Check the part of a sigil name after the prefix.
   * Either one lowercase letter, or an uppercase letter followed by
   * uppercase letters and digits.
   */
  public static boolean isValidLetters(String letters) {
    if (letters.isEmpty()) {
      return false;
    }
    char first = letters.charAt(0);
    if (first >= 'a' && first <= 'z') {
      return letters.length() == 1;
    }
    if (first < 'A' || first > 'Z') {
      return false;
    }
    for (int i = 1; i < letters.length(); i++) {
      char c = letters.charAt(i);
      if (!(c >= 'A' && c <= 'Z') && !(c >= '0' && c <= '9')) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return the sigil letters of a call name like sigil_r, or null
   */
  public static String letters(String callName) {
    if (callName == null || !callName.startsWith(PREFIX)) {
      return null;
    }
    String letters = callName.substring(PREFIX.length());
    return isValidLetters(letters) ? letters : null;
  }

  public static boolean isRaw(String letters) {
    return Character.isUpperCase(letters.charAt(0));
  }

  /**
   * Build a sigil call with a literal body
   * @param letters e.g. "r" or "SQL"
   * @param modifiers modifier characters, may be empty
   * @param delimiter opening delimiter, null for the default
   */
  public static Form sigil(String letters, String body, String modifiers,
                           String delimiter) throws InvalidSigilException {
    if (!isValidLetters(letters)) {
      throw InvalidSigilException.badName(letters);
    }
    List<Node> mods = new ArrayList<Node>(modifiers.length());
    for (int i = 0; i < modifiers.length(); i++) {
      char c = modifiers.charAt(i);
      if (!Character.isLetterOrDigit(c)) {
        throw new InvalidSigilException("invalid sigil modifier: " + c);
      }
      mods.add(Nodes.integer(c));
    }
    Meta meta = delimiter == null ? Meta.EMPTY :
                          Meta.of(Meta.DELIMITER, delimiter);
    Form parts = Nodes.call(Nodes.BITSTRING, Nodes.string(body));
    List<Node> args = new ArrayList<Node>(2);
    args.add(parts);
    args.add(NodeList.of(mods));
    return Nodes.call(PREFIX + letters, meta, args);
  }
}

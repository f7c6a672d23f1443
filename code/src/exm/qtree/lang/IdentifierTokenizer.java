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

import java.text.Normalizer;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Splits the longest identifier or alias off the front of a string.
 */
public class IdentifierTokenizer {

  public static enum Kind {
    /** Starts lowercase or with underscore */
    IDENTIFIER,
    /** Starts uppercase */
    ALIAS,
  }

  public static enum Special {
    /** Contains '@' */
    AT,
    /** Text is not in canonical normal form */
    NFKC,
  }

  public static class Token {
    public final Kind kind;
    public final String text;
    /** Unconsumed input, empty if the whole input was an identifier */
    public final String rest;
    public final Set<Special> special;

    public Token(Kind kind, String text, String rest, Set<Special> special) {
      this.kind = kind;
      this.text = text;
      this.rest = rest;
      this.special = Collections.unmodifiableSet(special);
    }

    public boolean consumedAll() {
      return rest.isEmpty();
    }

    @Override
    public String toString() {
      return kind + "(" + text + ", rest=" + rest + ", " + special + ")";
    }
  }

  /**
   * @return the token, or null if input does not start with an
   *        identifier character
   */
  public static Token tokenize(String input) {
    if (input.isEmpty()) {
      return null;
    }
    int first = input.codePointAt(0);
    if (!isStart(first)) {
      return null;
    }
    Kind kind = Character.isUpperCase(first) ? Kind.ALIAS : Kind.IDENTIFIER;
    EnumSet<Special> special = EnumSet.noneOf(Special.class);

    int pos = Character.charCount(first);
    while (pos < input.length()) {
      int c = input.codePointAt(pos);
      if (c == '@') {
        special.add(Special.AT);
      } else if (!isContinue(c)) {
        break;
      }
      pos += Character.charCount(c);
    }
    // One trailing ? or ! ends the identifier
    if (pos < input.length()) {
      char c = input.charAt(pos);
      if (c == '?' || c == '!') {
        pos++;
      }
    }

    String text = input.substring(0, pos);
    if (!Normalizer.isNormalized(text, Normalizer.Form.NFC)) {
      special.add(Special.NFKC);
    }
    return new Token(kind, text, input.substring(pos), special);
  }

  private static boolean isStart(int c) {
    return c == '_' || Character.isLetter(c);
  }

  private static boolean isContinue(int c) {
    if (c == '_' || Character.isLetterOrDigit(c)) {
      return true;
    }
    int type = Character.getType(c);
    return type == Character.NON_SPACING_MARK ||
           type == Character.COMBINING_SPACING_MARK ||
           type == Character.CONNECTOR_PUNCTUATION;
  }
}

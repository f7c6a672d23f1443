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

import org.apache.commons.lang3.StringUtils;

/**
 * Escaping of text for display inside a quoted literal.
 */
public class Escapes {

  /**
   * Escape text for display between the given quote characters.
   * Backslashes, the quote character and the start of an interpolation
   * are escaped; control characters use their mnemonic escapes; other
   * unprintable characters are written in hexadecimal.
   */
  public static String escape(String text, char quote) {
    StringBuilder sb = new StringBuilder(text.length() + 8);
    int i = 0;
    while (i < text.length()) {
      int c = text.codePointAt(i);
      i += Character.charCount(c);
      if (c == '\\') {
        sb.append("\\\\");
      } else if (c == quote) {
        sb.append('\\').append(quote);
      } else if (c == '#' && i < text.length() && text.charAt(i) == '{') {
        sb.append("\\#{");
        i++;
      } else {
        appendChar(sb, c);
      }
    }
    return sb.toString();
  }

  private static void appendChar(StringBuilder sb, int c) {
    switch (c) {
      case 0: sb.append("\\0"); return;
      case 7: sb.append("\\a"); return;
      case '\b': sb.append("\\b"); return;
      case '\t': sb.append("\\t"); return;
      case '\n': sb.append("\\n"); return;
      case 11: sb.append("\\v"); return;
      case '\f': sb.append("\\f"); return;
      case '\r': sb.append("\\r"); return;
      case 27: sb.append("\\e"); return;
      case 127: sb.append("\\d"); return;
      default:
        break;
    }
    if (isPrintable(c)) {
      sb.appendCodePoint(c);
    } else if (c < 0x100) {
      sb.append("\\x").append(hex(c, 2));
    } else if (c < 0x10000) {
      sb.append("\\u").append(hex(c, 4));
    } else {
      sb.append("\\u{").append(Integer.toHexString(c).toUpperCase())
        .append('}');
    }
  }

  static boolean isPrintable(int c) {
    if (c >= 0x20 && c <= 0x7E) {
      return true;
    }
    if (c < 0xA0) {
      return false;
    }
    if (c >= 0xD800 && c <= 0xDFFF) {
      return false;
    }
    return c != 0xFFFE && c != 0xFFFF && c <= 0x10FFFF;
  }

  private static String hex(int c, int width) {
    return StringUtils.leftPad(Integer.toHexString(c).toUpperCase(), width, '0');
  }
}

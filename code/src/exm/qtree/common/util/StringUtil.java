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
package exm.qtree.common.util;

public class StringUtil {

  /**
   * True if c is a Latin-1 printable character:
   * 0x20-0x7E, 0xA0-0xFF, or one of \n \r \t \v \b \f \e
   */
  public static boolean isPrintableLatin1(int c) {
    if (c >= 0x20 && c <= 0x7E)
      return true;
    if (c >= 0xA0 && c <= 0xFF)
      return true;
    switch (c) {
      case '\n': case '\r': case '\t': case 0x0B: case '\b':
      case '\f': case 0x1B:
        return true;
      default:
        return false;
    }
  }
}

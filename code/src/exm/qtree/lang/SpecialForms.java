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

import java.util.HashMap;
import java.util.Map;

/**
 * Built-in forms whose meaning is fixed.  The expander never offers
 * them to macro resolution.
 */
public class SpecialForms {

  private static final int ANY_ARITY = -1;

  /** name to arities; ANY_ARITY matches everything */
  private static final Map<String, int[]> forms = new HashMap<String, int[]>();

  static {
    add("&", 1);
    add("^", 1);
    add("=", 2);
    add("%", 2);
    add(".", 2);
    add("->", 2);
    add("::", 2);
    add("|", 2);
    add("{}", ANY_ARITY);
    add("%{}", ANY_ARITY);
    add("<<>>", ANY_ARITY);
    add("alias", 1, 2);
    add("require", 1, 2);
    add("import", 1, 2);
    add("quote", 1, 2);
    add("unquote", 1);
    add("unquote_splicing", 1);
    add("fn", ANY_ARITY);
    add("case", 2);
    add("cond", 1);
    add("try", 1);
    add("receive", 1);
    add("for", ANY_ARITY);
    add("with", ANY_ARITY);
    add("__block__", ANY_ARITY);
    add("__cover__", 2);
    add("__aliases__", ANY_ARITY);
    add("__CALLER__", 0);
    add("__DIR__", 0);
    add("__ENV__", 0);
    add("__MODULE__", 0);
    add("__STACKTRACE__", 0);
    add("super", ANY_ARITY);
  }

  private static void add(String name, int... arities) {
    forms.put(name, arities);
  }

  public static boolean isSpecialForm(String name, int arity) {
    int[] arities = forms.get(name);
    if (arities == null) {
      return false;
    }
    for (int a: arities) {
      if (a == ANY_ARITY || a == arity) {
        return true;
      }
    }
    return false;
  }
}

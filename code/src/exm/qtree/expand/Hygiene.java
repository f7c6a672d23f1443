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
package exm.qtree.expand;

import java.util.ArrayList;
import java.util.List;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Form;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.ast.Tuple2;

/**
 * Marks the output of a macro so that the variables and aliases it
 * introduces do not clash with those at the call site.
 */
public class Hygiene {

  private static final String[] LEXICAL = {"alias", "import", "require"};

  /**
   * Attach counter to variables whose context is the macro's module
   * and to alias, import, require and __aliases__ forms.  If the
   * call's meta is marked generated, every form is marked too.
   * @param callMeta meta of the macro call
   * @param receiver module that defined the macro
   */
  public static Node linify(Meta callMeta, Atom receiver, long counter,
                            Node quoted) {
    boolean generated = callMeta.isTrue(Meta.GENERATED);
    return linify(quoted, receiver, counter, generated);
  }

  private static Node linify(Node node, Atom receiver, long counter,
                             boolean generated) {
    switch (node.type()) {
      case FORM:
        return linifyForm((Form)node, receiver, counter, generated);
      case PAIR: {
        Tuple2 p = (Tuple2)node;
        return p.with(linify(p.left(), receiver, counter, generated),
                      linify(p.right(), receiver, counter, generated));
      }
      case LIST: {
        NodeList l = (NodeList)node;
        List<Node> out = new ArrayList<Node>(l.size());
        for (Node e: l) {
          out.add(linify(e, receiver, counter, generated));
        }
        return NodeList.of(out);
      }
      default:
        return node;
    }
  }

  private static Node linifyForm(Form f, Atom receiver, long counter,
                                 boolean generated) {
    Meta meta = f.meta();
    String name = f.tagName();
    if (name != null && f.isVariable() && f.children().equals(receiver) &&
        !name.equals("_")) {
      meta = meta.withNew(Meta.COUNTER, counter);
    } else if (name != null && f.isCall() && !f.args().isEmpty() &&
               isLexical(name)) {
      meta = meta.withNew(Meta.COUNTER, counter);
    }
    if (generated) {
      meta = meta.with(Meta.GENERATED, true);
    }
    return new Form(linify(f.tag(), receiver, counter, generated), meta,
                    linify(f.children(), receiver, counter, generated));
  }

  private static boolean isLexical(String name) {
    if (name.equals("__aliases__")) {
      return true;
    }
    for (String l: LEXICAL) {
      if (l.equals(name)) {
        return true;
      }
    }
    return false;
  }
}

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
package exm.qtree.ast;

/**
 * Checks a tree is well formed.  Never throws.
 */
public class Validator {

  /**
   * Search outside-in, left to right: pair left then right, form tag
   * then children, list elements in order.
   * @return ok, or the first invalid subnode
   */
  public static Validation validate(Node node) {
    Node bad = findInvalid(node);
    return bad == null ? Validation.ok() : Validation.error(bad);
  }

  private static Node findInvalid(Node node) {
    switch (node.type()) {
      case ATOM:
        return null;
      case LITERAL:
        return ((Literal)node).kind() == Literal.Kind.FOREIGN ? node : null;
      case PAIR: {
        Tuple2 p = (Tuple2)node;
        Node bad = findInvalid(p.left());
        return bad != null ? bad : findInvalid(p.right());
      }
      case FORM: {
        Form f = (Form)node;
        if (!f.children().isAtom() && !f.children().isList()) {
          return f;
        }
        Node bad = findInvalid(f.tag());
        return bad != null ? bad : findInvalid(f.children());
      }
      case LIST:
        for (Node elem: (NodeList)node) {
          Node bad = findInvalid(elem);
          if (bad != null) {
            return bad;
          }
        }
        return null;
      default:
        return node;
    }
  }
}

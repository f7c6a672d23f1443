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
package exm.qtree.walk;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.AbstractIterator;

import exm.qtree.ast.Form;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.ast.Tuple2;
import exm.qtree.common.util.StackLite;

/**
 * Lazy depth-first walks.  Each call returns a fresh, single-use
 * iterator driven by an explicit work stack: nothing beyond the
 * yielded nodes is computed until next() is called again.
 *
 * Every occurrence of a node is yielded, so equal subtrees at different
 * positions each appear.
 */
public class Walkers {

  /**
   * Nodes in pre-order: a node, then its tag (if compound), then its
   * children.
   */
  public static Iterator<Node> prewalker(final Node root) {
    return new AbstractIterator<Node>() {
      private final StackLite<Node> stack = initialStack(root);

      @Override
      protected Node computeNext() {
        if (stack.isEmpty()) {
          return endOfData();
        }
        Node node = stack.pop();
        stack.pushReversed(children(node));
        return node;
      }
    };
  }

  /**
   * Nodes in post-order: every node after all of its descendants.
   */
  public static Iterator<Node> postwalker(final Node root) {
    return new AbstractIterator<Node>() {
      private final StackLite<Object> stack = new StackLite<Object>();
      {
        stack.push(root);
      }

      @Override
      protected Node computeNext() {
        while (!stack.isEmpty()) {
          Object top = stack.pop();
          if (top instanceof Revisit) {
            return ((Revisit)top).node;
          }
          Node node = (Node)top;
          List<Node> children = children(node);
          if (children.isEmpty()) {
            return node;
          }
          stack.push(new Revisit(node));
          stack.pushReversed(children);
        }
        return endOfData();
      }
    };
  }

  /**
   * Drain a walker into a list.  Forces the whole walk.
   */
  public static List<Node> collect(Iterator<Node> it) {
    List<Node> res = new ArrayList<Node>();
    while (it.hasNext()) {
      res.add(it.next());
    }
    return res;
  }

  private static StackLite<Node> initialStack(Node root) {
    StackLite<Node> s = new StackLite<Node>();
    s.push(root);
    return s;
  }

  /**
   * Immediate substructure visited by the walkers, in visit order
   */
  static List<Node> children(Node node) {
    List<Node> res = new ArrayList<Node>();
    switch (node.type()) {
      case PAIR:
        res.add(((Tuple2)node).left());
        res.add(((Tuple2)node).right());
        break;
      case FORM: {
        Form f = (Form)node;
        if (!f.tag().isAtom()) {
          res.add(f.tag());
        }
        if (f.isCall()) {
          res.addAll(f.args().elements());
        }
        break;
      }
      case LIST:
        res.addAll(((NodeList)node).elements());
        break;
      default:
        break;
    }
    return res;
  }

  /**
   * Marks a node whose children are already on the stack
   */
  private static final class Revisit {
    final Node node;

    Revisit(Node node) {
      this.node = node;
    }
  }
}

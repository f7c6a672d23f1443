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
import java.util.Collections;
import java.util.List;

import exm.qtree.ast.Form;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.ast.Tuple2;
import exm.qtree.common.util.Pair;

/**
 * Depth-first rewriting walks over a tree.
 *
 * Descent order:
 * <ul>
 * <li>pair: left, then right</li>
 * <li>form with an atom tag: the arguments only, none for a variable</li>
 * <li>form with a compound tag: the tag, then the arguments</li>
 * <li>list: each element in order</li>
 * <li>atoms and literals: nothing</li>
 * </ul>
 * The pre callback runs on entry to a node and decides what is
 * descended into; post runs on exit, after all descendants have been
 * rewritten.
 *
 * Walks recurse on the Java stack, so nesting depth is bounded by the
 * thread's stack size: a few thousand levels with the default stack.
 * Deeper trees need a thread with a larger stack, or the lazy
 * iterators in {@link Walkers}, which keep their work list on the heap.
 */
public class Traversal {

  /**
   * Combined walk: pre on entry, post on exit, one pass.
   */
  public static <A> Pair<Node, A> traverse(Node node, A acc,
                                     NodeFn<A> pre, NodeFn<A> post) {
    Pair<Node, A> entered = pre.apply(node, acc);
    return descend(entered.val1, entered.val2, pre, post);
  }

  private static <A> Pair<Node, A> descend(Node node, A acc,
                                     NodeFn<A> pre, NodeFn<A> post) {
    switch (node.type()) {
      case FORM: {
        Form f = (Form)node;
        Node tag = f.tag();
        if (!tag.isAtom()) {
          Pair<Node, A> t = traverse(tag, acc, pre, post);
          tag = t.val1;
          acc = t.val2;
        }
        Pair<Node, A> c = descendArgs(f.children(), acc, pre, post);
        Form rebuilt = f.withTag(tag).withChildren(c.val1);
        return post.apply(rebuilt, c.val2);
      }
      case PAIR: {
        Tuple2 p = (Tuple2)node;
        Pair<Node, A> l = traverse(p.left(), acc, pre, post);
        Pair<Node, A> r = traverse(p.right(), l.val2, pre, post);
        return post.apply(p.with(l.val1, r.val1), r.val2);
      }
      case LIST: {
        Pair<Node, A> l = descendList((NodeList)node, acc, pre, post);
        return post.apply(l.val1, l.val2);
      }
      default:
        return post.apply(node, acc);
    }
  }

  /**
   * Variables have an atom here, which is left alone
   */
  private static <A> Pair<Node, A> descendArgs(Node children, A acc,
                                     NodeFn<A> pre, NodeFn<A> post) {
    if (children.isList()) {
      return descendList((NodeList)children, acc, pre, post);
    }
    return Pair.create(children, acc);
  }

  private static <A> Pair<Node, A> descendList(NodeList list, A acc,
                                     NodeFn<A> pre, NodeFn<A> post) {
    List<Node> out = new ArrayList<Node>(list.size());
    boolean changed = false;
    for (Node elem: list) {
      Pair<Node, A> r = traverse(elem, acc, pre, post);
      out.add(r.val1);
      changed = changed || r.val1 != elem;
      acc = r.val2;
    }
    Node result = changed ? NodeList.of(out) : list;
    return Pair.create(result, acc);
  }

  public static <A> Pair<Node, A> prewalk(Node node, A acc, NodeFn<A> fn) {
    return traverse(node, acc, fn, Traversal.<A>identity());
  }

  public static <A> Pair<Node, A> postwalk(Node node, A acc, NodeFn<A> fn) {
    return traverse(node, acc, Traversal.<A>identity(), fn);
  }

  public static Node prewalk(Node node, NodeMapper fn) {
    return prewalk(node, null, Traversal.<Object>lift(fn)).val1;
  }

  public static Node postwalk(Node node, NodeMapper fn) {
    return postwalk(node, null, Traversal.<Object>lift(fn)).val1;
  }

  public static <A> NodeFn<A> identity() {
    return new NodeFn<A>() {
      @Override
      public Pair<Node, A> apply(Node node, A acc) {
        return Pair.create(node, acc);
      }
    };
  }

  private static <A> NodeFn<A> lift(final NodeMapper fn) {
    return new NodeFn<A>() {
      @Override
      public Pair<Node, A> apply(Node node, A acc) {
        return Pair.create(fn.apply(node), acc);
      }
    };
  }

  /**
   * Find the first node in pre-order that matches.
   * @return that node followed by its ancestors, innermost first, or
   *        null if nothing matches
   */
  public static List<Node> path(Node node, NodePredicate pred) {
    List<Node> ancestors = new ArrayList<Node>();
    if (!findPath(node, ancestors, pred)) {
      return null;
    }
    Collections.reverse(ancestors);
    return ancestors;
  }

  /**
   * @param stack root first; on success holds the path
   */
  private static boolean findPath(Node node, List<Node> stack,
                                  NodePredicate pred) {
    stack.add(node);
    if (pred.matches(node)) {
      return true;
    }
    boolean found = false;
    switch (node.type()) {
      case FORM: {
        Form f = (Form)node;
        if (!f.tag().isAtom()) {
          found = findPath(f.tag(), stack, pred);
        }
        if (!found && f.children().isList()) {
          found = findInList((NodeList)f.children(), stack, pred);
        }
        break;
      }
      case PAIR: {
        Tuple2 p = (Tuple2)node;
        found = findPath(p.left(), stack, pred) ||
                findPath(p.right(), stack, pred);
        break;
      }
      case LIST:
        found = findInList((NodeList)node, stack, pred);
        break;
      default:
        break;
    }
    if (!found) {
      stack.remove(stack.size() - 1);
    }
    return found;
  }

  private static boolean findInList(NodeList list, List<Node> stack,
                                    NodePredicate pred) {
    for (Node elem: list) {
      if (findPath(elem, stack, pred)) {
        return true;
      }
    }
    return false;
  }
}

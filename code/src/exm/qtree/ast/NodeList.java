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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Ordered, immutable sequence of nodes: call arguments, block bodies,
 * container literals.
 */
public final class NodeList extends Node implements Iterable<Node> {

  public static final NodeList EMPTY =
                          new NodeList(ImmutableList.<Node>of());

  private final ImmutableList<Node> elems;

  private NodeList(ImmutableList<Node> elems) {
    this.elems = elems;
  }

  public static NodeList of(Node... elems) {
    return of(Arrays.asList(elems));
  }

  public static NodeList of(List<? extends Node> elems) {
    if (elems.isEmpty()) {
      return EMPTY;
    }
    return new NodeList(ImmutableList.<Node>copyOf(elems));
  }

  @Override
  public NodeType type() {
    return NodeType.LIST;
  }

  public ImmutableList<Node> elements() {
    return elems;
  }

  public int size() {
    return elems.size();
  }

  public boolean isEmpty() {
    return elems.isEmpty();
  }

  public Node get(int i) {
    return elems.get(i);
  }

  public Node first() {
    return elems.get(0);
  }

  public Node last() {
    return elems.get(elems.size() - 1);
  }

  /**
   * All but the last element
   */
  public NodeList butLast() {
    return of(elems.subList(0, elems.size() - 1));
  }

  public NodeList butFirst() {
    return of(elems.subList(1, elems.size()));
  }

  public NodeList append(Node n) {
    ArrayList<Node> l = new ArrayList<Node>(elems);
    l.add(n);
    return of(l);
  }

  /**
   * Insert an element.  A negative index counts from the end, so -1
   * appends.  An index past either end clamps to that end.
   */
  public NodeList insertAt(int index, Node n) {
    int size = elems.size();
    int pos;
    if (index < 0) {
      pos = size + index + 1;
      if (pos < 0) {
        pos = 0;
      }
    } else {
      pos = Math.min(index, size);
    }
    ArrayList<Node> l = new ArrayList<Node>(size + 1);
    l.addAll(elems.subList(0, pos));
    l.add(n);
    l.addAll(elems.subList(pos, size));
    return of(l);
  }

  /**
   * True for a proper keyword list: every element a pair whose left
   * is an atom that is not a module name.  The empty list qualifies.
   */
  public boolean isKeyword() {
    for (Node n: elems) {
      if (!n.isPair()) {
        return false;
      }
      Node key = ((Tuple2)n).left();
      if (!key.isAtom() || ((Atom)key).hasAliasPrefix()) {
        return false;
      }
    }
    return true;
  }

  /**
   * Keyword lookup: first pair keyed by the given atom name
   * @return the value, or null if absent
   */
  public Node keywordGet(String key) {
    for (Node n: elems) {
      if (n.isPair() && ((Tuple2)n).left().isAtom(key)) {
        return ((Tuple2)n).right();
      }
    }
    return null;
  }

  @Override
  public Iterator<Node> iterator() {
    return elems.iterator();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof NodeList))
      return false;
    return elems.equals(((NodeList)obj).elems);
  }

  @Override
  public int hashCode() {
    return elems.hashCode();
  }
}

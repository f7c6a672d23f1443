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
 * Two-element tuple.  Keyword list entries are pairs with an atom
 * on the left.
 */
public final class Tuple2 extends Node {
  private final Node left;
  private final Node right;

  public Tuple2(Node left, Node right) {
    if (left == null || right == null) {
      throw new NullPointerException("pair element");
    }
    this.left = left;
    this.right = right;
  }

  public static Tuple2 of(Node left, Node right) {
    return new Tuple2(left, right);
  }

  @Override
  public NodeType type() {
    return NodeType.PAIR;
  }

  public Node left() {
    return left;
  }

  public Node right() {
    return right;
  }

  public Tuple2 with(Node newLeft, Node newRight) {
    if (newLeft == left && newRight == right) {
      return this;
    }
    return new Tuple2(newLeft, newRight);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Tuple2))
      return false;
    Tuple2 o = (Tuple2)obj;
    return left.equals(o.left) && right.equals(o.right);
  }

  @Override
  public int hashCode() {
    return left.hashCode() * 31 + right.hashCode();
  }
}

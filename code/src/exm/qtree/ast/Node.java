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

import exm.qtree.common.exceptions.QTreeRuntimeError;
import exm.qtree.term.TermWriter;

/**
 * An element of a quoted tree.
 *
 * Nodes are immutable values: every transformation builds new nodes.
 * Equality is structural over the whole subtree, metadata included.
 * The only subclasses are {@link Atom}, {@link Literal}, {@link Tuple2},
 * {@link Form} and {@link NodeList}.
 */
public abstract class Node {

  Node() {
    // Closed hierarchy
  }

  public abstract NodeType type();

  public boolean isAtom() {
    return type() == NodeType.ATOM;
  }

  /**
   * @return true if this is the atom with the given name
   */
  public boolean isAtom(String name) {
    return isAtom() && ((Atom)this).name().equals(name);
  }

  public boolean isLiteral() {
    return type() == NodeType.LITERAL;
  }

  public boolean isPair() {
    return type() == NodeType.PAIR;
  }

  public boolean isForm() {
    return type() == NodeType.FORM;
  }

  public boolean isList() {
    return type() == NodeType.LIST;
  }

  public boolean isInteger() {
    return isLiteral() && ((Literal)this).kind() == Literal.Kind.INTEGER;
  }

  public boolean isString() {
    return isLiteral() && ((Literal)this).kind() == Literal.Kind.STRING;
  }

  public Atom asAtom() {
    checkType(NodeType.ATOM);
    return (Atom)this;
  }

  public Literal asLiteral() {
    checkType(NodeType.LITERAL);
    return (Literal)this;
  }

  public Tuple2 asPair() {
    checkType(NodeType.PAIR);
    return (Tuple2)this;
  }

  public Form asForm() {
    checkType(NodeType.FORM);
    return (Form)this;
  }

  public NodeList asList() {
    checkType(NodeType.LIST);
    return (NodeList)this;
  }

  private void checkType(NodeType expected) {
    if (type() != expected) {
      throw new QTreeRuntimeError("Expected " + expected + " node but got "
                                  + type() + ": " + this);
    }
  }

  /**
   * @return the node in term notation
   */
  @Override
  public String toString() {
    return TermWriter.write(this);
  }
}

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
 * A (tag, meta, children) triple.
 *
 * If children is an {@link Atom} the form is a variable reference and
 * the atom is its context.  If children is a {@link NodeList} the form
 * is a call with those arguments.  Any other children value can be
 * represented, but fails validation.
 *
 * A qualified call has a nested form as tag:
 * <pre>{{:., [], [receiver, :name]}, [], args}</pre>
 */
public final class Form extends Node {
  public static final String DOT = ".";

  private final Node tag;
  private final Meta meta;
  private final Node children;

  public Form(Node tag, Meta meta, Node children) {
    if (tag == null || meta == null || children == null) {
      throw new NullPointerException("form component");
    }
    this.tag = tag;
    this.meta = meta;
    this.children = children;
  }

  @Override
  public NodeType type() {
    return NodeType.FORM;
  }

  public Node tag() {
    return tag;
  }

  public Meta meta() {
    return meta;
  }

  public Node children() {
    return children;
  }

  public boolean isVariable() {
    return children.isAtom();
  }

  public boolean isCall() {
    return children.isList();
  }

  /**
   * @return arguments, or null if not a call
   */
  public NodeList args() {
    return children.isList() ? (NodeList)children : null;
  }

  public int arity() {
    return children.isList() ? ((NodeList)children).size() : -1;
  }

  /**
   * @return tag name if tag is an atom, else null
   */
  public String tagName() {
    return tag.isAtom() ? ((Atom)tag).name() : null;
  }

  public boolean hasTag(String name) {
    return tag.isAtom(name);
  }

  /**
   * @return true if this is a call of the named atom with exact arity
   */
  public boolean isCall(String name, int arity) {
    return hasTag(name) && arity() == arity;
  }

  /**
   * @return true if the tag is a two-argument dot form, i.e. this
   *        is a qualified call receiver.name(args)
   */
  public boolean isQualifiedCall() {
    if (!tag.isForm() || !isCall()) {
      return false;
    }
    Form dot = (Form)tag;
    return dot.isCall(DOT, 2);
  }

  /**
   * For a qualified call, the receiver
   */
  public Node receiver() {
    return ((Form)tag).args().get(0);
  }

  /**
   * For a qualified call, the function position (usually an atom)
   */
  public Node qualifiedName() {
    return ((Form)tag).args().get(1);
  }

  public Form withTag(Node newTag) {
    return newTag == tag ? this : new Form(newTag, meta, children);
  }

  public Form withMeta(Meta newMeta) {
    return newMeta == meta ? this : new Form(tag, newMeta, children);
  }

  public Form withChildren(Node newChildren) {
    return newChildren == children ? this : new Form(tag, meta, newChildren);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Form))
      return false;
    Form o = (Form)obj;
    return tag.equals(o.tag) && meta.equals(o.meta) &&
           children.equals(o.children);
  }

  @Override
  public int hashCode() {
    return (tag.hashCode() * 31 + meta.hashCode()) * 31 + children.hashCode();
  }
}

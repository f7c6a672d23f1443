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

import exm.qtree.ast.Atom;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;

/**
 * Outcome of resolving a call against the environment
 */
public class Expansion {

  public static enum Kind {
    NOT_FOUND,
    /** A macro; quoted holds its expansion */
    MACRO,
    /** An ordinary function; nothing to expand */
    FUNCTION,
  }

  private static final Expansion NOT_FOUND =
                  new Expansion(Kind.NOT_FOUND, null, null, null, null);

  public final Kind kind;
  public final Atom receiver;
  public final Node quoted;
  public final Atom name;
  public final NodeList args;

  private Expansion(Kind kind, Atom receiver, Node quoted, Atom name,
                    NodeList args) {
    this.kind = kind;
    this.receiver = receiver;
    this.quoted = quoted;
    this.name = name;
    this.args = args;
  }

  public static Expansion notFound() {
    return NOT_FOUND;
  }

  public static Expansion macro(Atom receiver, Node quoted) {
    return new Expansion(Kind.MACRO, receiver, quoted, null, null);
  }

  public static Expansion function(Atom receiver, Atom name, NodeList args) {
    return new Expansion(Kind.FUNCTION, receiver, null, name, args);
  }

  @Override
  public String toString() {
    switch (kind) {
      case MACRO:
        return "macro from " + receiver.name();
      case FUNCTION:
        return "function " + receiver.name() + "." + name.name() + "/" +
               args.size();
      default:
        return "not found";
    }
  }
}

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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Interned symbolic constant.  Module names are atoms whose name
 * begins with {@link #ALIAS_PREFIX}.
 */
public final class Atom extends Node implements Comparable<Atom> {

  private static final ConcurrentMap<String, Atom> table =
                            new ConcurrentHashMap<String, Atom>();

  public static final String ALIAS_PREFIX = "Elixir.";
  public static final String ALIAS_ROOT = "Elixir";

  public static final Atom TRUE = of("true");
  public static final Atom FALSE = of("false");
  public static final Atom NIL = of("nil");

  private final String name;

  private Atom(String name) {
    this.name = name;
  }

  public static Atom of(String name) {
    if (name == null) {
      throw new NullPointerException("atom name");
    }
    Atom atom = table.get(name);
    if (atom == null) {
      Atom fresh = new Atom(name);
      atom = table.putIfAbsent(name, fresh);
      if (atom == null) {
        atom = fresh;
      }
    }
    return atom;
  }

  public static Atom bool(boolean b) {
    return b ? TRUE : FALSE;
  }

  /**
   * Module atom for a dotted name, e.g. "Foo.Bar" becomes Elixir.Foo.Bar.
   * Names that already carry the prefix are returned as is.
   */
  public static Atom alias(String dotted) {
    if (dotted.equals(ALIAS_ROOT) || dotted.startsWith(ALIAS_PREFIX)) {
      return of(dotted);
    }
    return of(ALIAS_PREFIX + dotted);
  }

  @Override
  public NodeType type() {
    return NodeType.ATOM;
  }

  public String name() {
    return name;
  }

  public boolean isBoolean() {
    return this == TRUE || this == FALSE;
  }

  public boolean isNil() {
    return this == NIL;
  }

  /**
   * True if the name carries the module prefix.  Says nothing about
   * whether the rest is a well-formed alias.
   */
  public boolean hasAliasPrefix() {
    return name.startsWith(ALIAS_PREFIX);
  }

  @Override
  public int compareTo(Atom o) {
    return name.compareTo(o.name);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Atom))
      return false;
    return name.equals(((Atom)obj).name);
  }

  @Override
  public int hashCode() {
    return name.hashCode();
  }
}

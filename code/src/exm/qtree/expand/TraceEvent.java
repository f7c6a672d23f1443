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
import exm.qtree.ast.Meta;

/**
 * Notification sent to the environment during alias expansion
 */
public class TraceEvent {

  public static enum Kind {
    /** An alias was replaced by its target */
    ALIAS_EXPANSION,
    /** An alias chain resolved to a module */
    ALIAS_REFERENCE,
  }

  public final Kind kind;
  public final Meta meta;

  /** For expansions, the alias that was looked up.  Null otherwise */
  public final Atom alias;

  /** The module the alias resolved to */
  public final Atom module;

  private TraceEvent(Kind kind, Meta meta, Atom alias, Atom module) {
    this.kind = kind;
    this.meta = meta;
    this.alias = alias;
    this.module = module;
  }

  public static TraceEvent aliasExpansion(Meta meta, Atom alias,
                                          Atom module) {
    return new TraceEvent(Kind.ALIAS_EXPANSION, meta, alias, module);
  }

  public static TraceEvent aliasReference(Meta meta, Atom module) {
    return new TraceEvent(Kind.ALIAS_REFERENCE, meta, null, module);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof TraceEvent))
      return false;
    TraceEvent o = (TraceEvent)obj;
    return kind == o.kind && meta.equals(o.meta) &&
        (alias == null ? o.alias == null : alias.equals(o.alias)) &&
        module.equals(o.module);
  }

  @Override
  public int hashCode() {
    int h = kind.hashCode() * 31 + meta.hashCode();
    h = h * 31 + (alias == null ? 0 : alias.hashCode());
    return h * 31 + module.hashCode();
  }

  @Override
  public String toString() {
    if (kind == Kind.ALIAS_EXPANSION) {
      return "alias_expansion " + alias.name() + " -> " + module.name();
    }
    return "alias_reference " + module.name();
  }
}

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

import exm.qtree.lang.AtomClassifier;

/**
 * Captured remote function, &amp;Mod.fun/arity.  These carry no
 * environment, so they are valid inside a tree.
 */
public final class FunctionRef {
  public final Atom module;
  public final Atom name;
  public final int arity;

  public FunctionRef(Atom module, Atom name, int arity) {
    assert(arity >= 0);
    this.module = module;
    this.name = name;
    this.arity = arity;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof FunctionRef))
      return false;
    FunctionRef o = (FunctionRef)obj;
    return module.equals(o.module) && name.equals(o.name) && arity == o.arity;
  }

  @Override
  public int hashCode() {
    return (module.hashCode() * 31 + name.hashCode()) * 31 + arity;
  }

  @Override
  public String toString() {
    return "&" + AtomClassifier.inspect(AtomClassifier.Format.LITERAL, module)
        + "." + AtomClassifier.inspect(AtomClassifier.Format.REMOTE_CALL, name)
        + "/" + arity;
  }
}

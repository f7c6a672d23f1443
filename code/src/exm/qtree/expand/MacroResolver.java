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
import exm.qtree.ast.NodeList;

/**
 * Looks up macros and functions on behalf of an environment
 */
public interface MacroResolver {

  public Expansion resolve(Env env, Meta meta, Atom name, int arity,
                           NodeList args);

  public Expansion resolveQualified(Env env, Meta meta, Atom receiver,
                                    Atom name, int arity, NodeList args);

  /** Resolves nothing */
  public static final MacroResolver NONE = new MacroResolver() {
    @Override
    public Expansion resolve(Env env, Meta meta, Atom name, int arity,
                             NodeList args) {
      return Expansion.notFound();
    }

    @Override
    public Expansion resolveQualified(Env env, Meta meta, Atom receiver,
                                      Atom name, int arity, NodeList args) {
      return Expansion.notFound();
    }
  };
}

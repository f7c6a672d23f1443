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

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;

/**
 * In-memory table of macro and function definitions by module, with
 * an ordered list of imported modules for local calls.
 */
public class MacroTable implements MacroResolver {

  /**
   * Produces the expansion of a macro call
   */
  public static interface MacroBody {
    public Node expand(NodeList args, Env env);
  }

  private static class Definition {
    final String name;
    final int arity;
    /** Null for functions */
    final MacroBody body;

    Definition(String name, int arity, MacroBody body) {
      this.name = name;
      this.arity = arity;
      this.body = body;
    }
  }

  private final ListMultimap<Atom, Definition> defs =
                                      ArrayListMultimap.create();

  private final List<Atom> imports = new ArrayList<Atom>();

  public MacroTable defmacro(Atom module, String name, int arity,
                             MacroBody body) {
    defs.put(module, new Definition(name, arity, body));
    return this;
  }

  public MacroTable defun(Atom module, String name, int arity) {
    defs.put(module, new Definition(name, arity, null));
    return this;
  }

  /**
   * Make a module's definitions callable without qualification.
   * Earlier imports take priority.
   */
  public MacroTable importModule(Atom module) {
    if (!imports.contains(module)) {
      imports.add(module);
    }
    return this;
  }

  private Definition find(Atom module, String name, int arity) {
    for (Definition d: defs.get(module)) {
      if (d.name.equals(name) && d.arity == arity) {
        return d;
      }
    }
    return null;
  }

  private static Expansion expansion(Env env, Atom module, Definition d,
                                     NodeList args) {
    if (d.body == null) {
      return Expansion.function(module, Atom.of(d.name), args);
    }
    return Expansion.macro(module, d.body.expand(args, env));
  }

  @Override
  public Expansion resolve(Env env, Meta meta, Atom name, int arity,
                           NodeList args) {
    for (Atom module: imports) {
      Definition d = find(module, name.name(), arity);
      if (d != null) {
        return expansion(env, module, d, args);
      }
    }
    return Expansion.notFound();
  }

  @Override
  public Expansion resolveQualified(Env env, Meta meta, Atom receiver,
                                    Atom name, int arity, NodeList args) {
    Definition d = find(receiver, name.name(), arity);
    if (d == null) {
      return Expansion.notFound();
    }
    return expansion(env, receiver, d, args);
  }
}

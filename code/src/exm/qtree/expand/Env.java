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

import java.util.Map;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.common.util.Pair;

/**
 * The compilation environment seen by the expander.  The expander
 * never looks up modules itself: alias, macro and function
 * resolution all go through this interface.
 */
public interface Env {

  /**
   * @return current module, or nil outside of a module
   */
  public Atom module();

  /**
   * @return current file, empty if unknown
   */
  public String file();

  public int line();

  /**
   * @return current function name and arity, or null outside of a
   *        function
   */
  public Pair<Atom, Integer> function();

  public EnvContext context();

  /**
   * Variables visible at this point, keyed by {name, context}
   */
  public Map<Node, Node> versionedVars();

  /**
   * Fields exposed through __ENV__, in order, not including
   * versioned_vars
   */
  public Map<String, Node> fields();

  /**
   * @param counter the hygiene counter of the alias reference, or null
   * @return the module an alias refers to, or null if not aliased
   */
  public Atom lookupAlias(Atom alias, Long counter);

  /**
   * Resolve a local call name(args) against imports
   */
  public Expansion resolve(Meta meta, Atom name, int arity, NodeList args);

  /**
   * Resolve a call receiver.name(args)
   */
  public Expansion resolveQualified(Meta meta, Atom receiver, Atom name,
                                    int arity, NodeList args);

  public void trace(TraceEvent event);

  /**
   * @return a fresh hygiene counter value for a macro defined in module
   */
  public long nextCounter(Atom module);
}

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
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;

import exm.qtree.ast.Atom;
import exm.qtree.ast.Meta;
import exm.qtree.ast.Node;
import exm.qtree.ast.NodeList;
import exm.qtree.ast.Nodes;
import exm.qtree.ast.Tuple2;
import exm.qtree.common.util.Pair;

/**
 * Environment built from plain values.  Resolution is delegated to
 * a {@link MacroResolver}; trace events are recorded and can be
 * inspected afterwards.
 */
public class BasicEnv implements Env {

  private static final Atom ENV_STRUCT = Atom.alias("Macro.Env");

  private final Atom module;
  private final String file;
  private final int line;
  private final Pair<Atom, Integer> function;
  private final EnvContext context;
  private final Map<Atom, Atom> aliases;
  private final Map<Pair<Long, Atom>, Atom> macroAliases;
  private final Map<Node, Node> versionedVars;
  private final Map<String, Node> extraFields;
  private final MacroResolver resolver;
  private final HygieneCounters counters;

  /** Recorded trace events, in order */
  private final ListMultimap<TraceEvent.Kind, TraceEvent> traces =
                                          LinkedListMultimap.create();

  private BasicEnv(Builder b) {
    this.module = b.module;
    this.file = b.file;
    this.line = b.line;
    this.function = b.function;
    this.context = b.context;
    this.aliases = new LinkedHashMap<Atom, Atom>(b.aliases);
    this.macroAliases = new HashMap<Pair<Long, Atom>, Atom>(b.macroAliases);
    this.versionedVars = Collections.unmodifiableMap(
                  new LinkedHashMap<Node, Node>(b.versionedVars));
    this.extraFields = new LinkedHashMap<String, Node>(b.extraFields);
    this.resolver = b.resolver;
    this.counters = b.counters;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public Atom module() {
    return module;
  }

  @Override
  public String file() {
    return file;
  }

  @Override
  public int line() {
    return line;
  }

  @Override
  public Pair<Atom, Integer> function() {
    return function;
  }

  @Override
  public EnvContext context() {
    return context;
  }

  @Override
  public Map<Node, Node> versionedVars() {
    return versionedVars;
  }

  @Override
  public Map<String, Node> fields() {
    Map<String, Node> res = new LinkedHashMap<String, Node>();
    res.put("__struct__", ENV_STRUCT);
    res.put("aliases", aliasList());
    res.put("context", Atom.of(context.atomName()));
    res.put("file", Nodes.string(file));
    if (function == null) {
      res.put("function", Atom.NIL);
    } else {
      res.put("function", new Tuple2(function.val1,
                                     Nodes.integer(function.val2)));
    }
    res.put("line", Nodes.integer(line));
    res.put("module", module);
    res.putAll(extraFields);
    return res;
  }

  private NodeList aliasList() {
    List<Node> pairs = new ArrayList<Node>(aliases.size());
    for (Map.Entry<Atom, Atom> e: aliases.entrySet()) {
      pairs.add(new Tuple2(e.getKey(), e.getValue()));
    }
    return NodeList.of(pairs);
  }

  @Override
  public Atom lookupAlias(Atom alias, Long counter) {
    Atom target = aliases.get(alias);
    if (target != null) {
      return target;
    }
    if (counter != null) {
      return macroAliases.get(Pair.create(counter, alias));
    }
    return null;
  }

  @Override
  public Expansion resolve(Meta meta, Atom name, int arity, NodeList args) {
    return resolver.resolve(this, meta, name, arity, args);
  }

  @Override
  public Expansion resolveQualified(Meta meta, Atom receiver, Atom name,
                                    int arity, NodeList args) {
    return resolver.resolveQualified(this, meta, receiver, name, arity,
                                     args);
  }

  @Override
  public synchronized void trace(TraceEvent event) {
    traces.put(event.kind, event);
  }

  /**
   * @return all recorded trace events in the order they happened
   */
  public synchronized List<TraceEvent> traces() {
    return new ArrayList<TraceEvent>(traces.values());
  }

  public synchronized List<TraceEvent> traces(TraceEvent.Kind kind) {
    return new ArrayList<TraceEvent>(traces.get(kind));
  }

  @Override
  public long nextCounter(Atom mod) {
    return counters.next(mod);
  }

  public HygieneCounters counters() {
    return counters;
  }

  public static class Builder {
    private Atom module = Atom.NIL;
    private String file = "";
    private int line = 0;
    private Pair<Atom, Integer> function = null;
    private EnvContext context = EnvContext.NONE;
    private final Map<Atom, Atom> aliases = new LinkedHashMap<Atom, Atom>();
    private final Map<Pair<Long, Atom>, Atom> macroAliases =
                                  new HashMap<Pair<Long, Atom>, Atom>();
    private final Map<Node, Node> versionedVars =
                                  new LinkedHashMap<Node, Node>();
    private final Map<String, Node> extraFields =
                                  new LinkedHashMap<String, Node>();
    private MacroResolver resolver = MacroResolver.NONE;
    private HygieneCounters counters = null;

    private Builder() {
    }

    public Builder module(Atom module) {
      this.module = module;
      return this;
    }

    public Builder file(String file) {
      this.file = file;
      return this;
    }

    public Builder line(int line) {
      this.line = line;
      return this;
    }

    public Builder function(String name, int arity) {
      this.function = Pair.create(Atom.of(name), arity);
      return this;
    }

    public Builder context(EnvContext context) {
      this.context = context;
      return this;
    }

    /**
     * alias Target, as: Alias
     */
    public Builder alias(Atom alias, Atom target) {
      aliases.put(alias, target);
      return this;
    }

    /**
     * An alias defined inside the expansion of a macro, only visible to
     * references carrying the same counter
     */
    public Builder macroAlias(long counter, Atom alias, Atom target) {
      macroAliases.put(Pair.create(counter, alias), target);
      return this;
    }

    public Builder versionedVar(String name, Atom varContext, long version) {
      versionedVars.put(new Tuple2(Atom.of(name), varContext),
                        Nodes.integer(version));
      return this;
    }

    /**
     * Additional field shown through __ENV__
     */
    public Builder field(String name, Node value) {
      extraFields.put(name, value);
      return this;
    }

    public Builder resolver(MacroResolver resolver) {
      this.resolver = resolver;
      return this;
    }

    public Builder counters(HygieneCounters counters) {
      this.counters = counters;
      return this;
    }

    public BasicEnv build() {
      if (counters == null) {
        counters = new HygieneCounters();
      }
      return new BasicEnv(this);
    }
  }
}

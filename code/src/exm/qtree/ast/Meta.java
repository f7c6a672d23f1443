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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import com.google.common.collect.ImmutableMap;

import exm.qtree.common.exceptions.QTreeRuntimeError;

/**
 * Metadata of a form: an insertion-ordered, immutable mapping from
 * symbolic keys to values.
 *
 * Values are Java objects: Number, String, Boolean, Atom or Node.
 * Order has no meaning but is preserved on every copy.
 */
public final class Meta {

  public static final String LINE = "line";
  public static final String COLUMN = "column";
  public static final String COUNTER = "counter";
  public static final String GENERATED = "generated";
  public static final String NO_PARENS = "no_parens";
  public static final String DELIMITER = "delimiter";
  public static final String FROM_BRACKETS = "from_brackets";
  public static final String INFERRED_BITSTRING_SPEC =
                                          "inferred_bitstring_spec";

  public static final Meta EMPTY =
      new Meta(ImmutableMap.<String, Object>of());

  private final ImmutableMap<String, Object> entries;

  private Meta(ImmutableMap<String, Object> entries) {
    this.entries = entries;
  }

  /**
   * @param keysAndValues alternating String keys and values
   */
  public static Meta of(Object... keysAndValues) {
    if (keysAndValues.length % 2 != 0) {
      throw new QTreeRuntimeError("Odd number of meta arguments: " +
                                  Arrays.toString(keysAndValues));
    }
    LinkedHashMap<String, Object> m = new LinkedHashMap<String, Object>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      m.put((String)keysAndValues[i], keysAndValues[i + 1]);
    }
    return fromMap(m);
  }

  public static Meta fromMap(Map<String, ?> map) {
    if (map.isEmpty()) {
      return EMPTY;
    }
    ImmutableMap.Builder<String, Object> b = ImmutableMap.builder();
    for (Entry<String, ?> e: map.entrySet()) {
      b.put(e.getKey(), normalize(e.getKey(), e.getValue()));
    }
    return new Meta(b.build());
  }

  /**
   * Integral values are stored as Long and floating ones as Double,
   * so equality does not depend on the boxed type a caller used.
   */
  private static Object normalize(String key, Object value) {
    if (value == null) {
      throw new NullPointerException("meta value for " + key);
    } else if (value instanceof Integer || value instanceof Short ||
               value instanceof Byte) {
      return ((Number)value).longValue();
    } else if (value instanceof Float) {
      return ((Float)value).doubleValue();
    }
    return value;
  }

  public static Meta line(int line) {
    return of(LINE, line);
  }

  public Object get(String key) {
    return entries.get(key);
  }

  public boolean has(String key) {
    return entries.containsKey(key);
  }

  /**
   * @return true if key is present and bound to Boolean.TRUE
   */
  public boolean isTrue(String key) {
    return Boolean.TRUE.equals(entries.get(key));
  }

  /**
   * @return line number, or 0 if none recorded
   */
  public int line() {
    Object l = entries.get(LINE);
    if (l instanceof Number) {
      return ((Number)l).intValue();
    }
    return 0;
  }

  /**
   * @return counter, or null if none recorded
   */
  public Long counter() {
    Object c = entries.get(COUNTER);
    if (c instanceof Number) {
      return ((Number)c).longValue();
    }
    return null;
  }

  /**
   * Store key, replacing an existing binding in place
   */
  public Meta with(String key, Object value) {
    LinkedHashMap<String, Object> m = new LinkedHashMap<String, Object>(entries);
    m.put(key, normalize(key, value));
    return new Meta(ImmutableMap.<String, Object>copyOf(m));
  }

  /**
   * Store key only if it is absent
   */
  public Meta withNew(String key, Object value) {
    if (entries.containsKey(key)) {
      return this;
    }
    return with(key, value);
  }

  public Meta without(String key) {
    if (!entries.containsKey(key)) {
      return this;
    }
    LinkedHashMap<String, Object> m = new LinkedHashMap<String, Object>(entries);
    m.remove(key);
    return fromMap(m);
  }

  /**
   * Keep only the given keys, in their current order
   */
  public Meta take(String... keys) {
    LinkedHashMap<String, Object> m = new LinkedHashMap<String, Object>();
    for (Entry<String, Object> e: entries.entrySet()) {
      for (String k: keys) {
        if (k.equals(e.getKey())) {
          m.put(e.getKey(), e.getValue());
          break;
        }
      }
    }
    return fromMap(m);
  }

  public Set<Entry<String, Object>> entries() {
    return entries.entrySet();
  }

  public Set<String> keys() {
    return entries.keySet();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public int size() {
    return entries.size();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Meta))
      return false;
    return entries.equals(((Meta)obj).entries);
  }

  @Override
  public int hashCode() {
    return entries.hashCode();
  }

  @Override
  public String toString() {
    return entries.toString();
  }
}

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
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import exm.qtree.ast.Atom;

/**
 * Per-module counters used to tell apart variables introduced by
 * different macro expansions.  Values only go up and are never reused.
 * Safe to share between threads.
 */
public class HygieneCounters {

  private final ConcurrentMap<Atom, AtomicLong> counters =
                      new ConcurrentHashMap<Atom, AtomicLong>();

  /**
   * @return the next value for the key, starting at 1
   */
  public long next(Atom key) {
    AtomicLong c = counters.get(key);
    if (c == null) {
      AtomicLong fresh = new AtomicLong();
      c = counters.putIfAbsent(key, fresh);
      if (c == null) {
        c = fresh;
      }
    }
    return c.incrementAndGet();
  }

  /**
   * @return last value handed out for key, 0 if none
   */
  public long current(Atom key) {
    AtomicLong c = counters.get(key);
    return c == null ? 0 : c.get();
  }

  /**
   * Snapshot, sorted by key
   */
  public Map<Atom, Long> snapshot() {
    Map<Atom, Long> res = new TreeMap<Atom, Long>();
    for (Map.Entry<Atom, AtomicLong> e: counters.entrySet()) {
      res.put(e.getKey(), e.getValue().get());
    }
    return res;
  }

  @Override
  public String toString() {
    return snapshot().toString();
  }
}

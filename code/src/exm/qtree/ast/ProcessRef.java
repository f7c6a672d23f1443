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

/**
 * Opaque process identifier, printed as #PID&lt;a.b.c&gt;.
 * Never produced by parsing; only by escaping runtime values.
 */
public final class ProcessRef {
  public final int node;
  public final int id;
  public final int serial;

  public ProcessRef(int node, int id, int serial) {
    this.node = node;
    this.id = id;
    this.serial = serial;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ProcessRef))
      return false;
    ProcessRef o = (ProcessRef)obj;
    return node == o.node && id == o.id && serial == o.serial;
  }

  @Override
  public int hashCode() {
    return (node * 31 + id) * 31 + serial;
  }

  @Override
  public String toString() {
    return "#PID<" + node + "." + id + "." + serial + ">";
  }
}

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

import exm.qtree.ast.Node;

/**
 * A node after one expansion step and whether the step changed it
 */
public class ExpandResult {
  public final Node node;
  public final boolean changed;

  public ExpandResult(Node node, boolean changed) {
    this.node = node;
    this.changed = changed;
  }

  public static ExpandResult unchanged(Node node) {
    return new ExpandResult(node, false);
  }

  public static ExpandResult changed(Node node) {
    return new ExpandResult(node, true);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof ExpandResult))
      return false;
    ExpandResult o = (ExpandResult)obj;
    return changed == o.changed && node.equals(o.node);
  }

  @Override
  public int hashCode() {
    return node.hashCode() * 2 + (changed ? 1 : 0);
  }

  @Override
  public String toString() {
    return "{" + node + ", " + changed + "}";
  }
}

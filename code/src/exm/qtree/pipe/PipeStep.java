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
package exm.qtree.pipe;

import exm.qtree.ast.Node;

/**
 * One link of a pipeline: the expression, and the argument position
 * the upstream value goes into.
 */
public final class PipeStep {
  public final Node node;
  public final int position;

  public PipeStep(Node node, int position) {
    this.node = node;
    this.position = position;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof PipeStep))
      return false;
    PipeStep o = (PipeStep)obj;
    return node.equals(o.node) && position == o.position;
  }

  @Override
  public int hashCode() {
    return node.hashCode() * 31 + position;
  }

  @Override
  public String toString() {
    return "{" + node + ", " + position + "}";
  }
}

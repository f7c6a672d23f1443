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

import java.util.List;

/**
 * A call split into optional receiver, function name and arguments.
 */
public class DecomposedCall {
  /** null for local calls */
  public final Node receiver;
  /** Usually an atom; qualified calls may have a computed name */
  public final Node name;
  public final List<Node> args;

  public DecomposedCall(Node receiver, Node name, List<Node> args) {
    this.receiver = receiver;
    this.name = name;
    this.args = args;
  }

  public boolean isRemote() {
    return receiver != null;
  }

  @Override
  public String toString() {
    return (receiver == null ? "" : receiver + ", ") + name + ", " + args;
  }
}

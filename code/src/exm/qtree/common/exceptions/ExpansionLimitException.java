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
package exm.qtree.common.exceptions;

/**
 * Fixpoint expansion kept changing the root node past the configured
 * number of rounds.  Usually a macro that expands to itself.
 */
public class ExpansionLimitException extends QTreeRuntimeError {

  public ExpansionLimitException(long rounds, String lastNode) {
    super("Expansion did not reach a fixpoint after " + rounds +
          " rounds, last node: " + lastNode);
  }

  private static final long serialVersionUID = 1L;
}

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
package exm.qtree.unparse;

import exm.qtree.ast.Node;

/**
 * Hook called by the unparser with every node and the text it produced
 * for that node.  The returned text is used in place of the rendering.
 */
public interface Substitution {
  public String apply(Node node, String rendering);

  public static final Substitution IDENTITY = new Substitution() {
    @Override
    public String apply(Node node, String rendering) {
      return rendering;
    }
  };
}

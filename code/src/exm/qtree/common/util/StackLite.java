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
package exm.qtree.common.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Unsynchronized stack on top of an ArrayList.
 * Work list for the lazy walkers.
 */
public class StackLite<T> extends ArrayList<T> {

  private static final long serialVersionUID = 1L;

  public StackLite() {
    super();
  }

  public void push(T x) {
    this.add(x);
  }

  /**
   * Push elements so that the first of them is popped first
   */
  public void pushReversed(List<? extends T> l) {
    for (int i = l.size() - 1; i >= 0; i--) {
      this.add(l.get(i));
    }
  }

  public T pop() {
    return this.remove(this.size() - 1);
  }

  public T peek() {
    return this.get(this.size() - 1);
  }
}

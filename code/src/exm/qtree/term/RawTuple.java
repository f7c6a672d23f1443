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
package exm.qtree.term;

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.qtree.ast.Node;

/**
 * A tuple that is not a valid tree node: any arity other than two,
 * or a three-tuple whose middle element is not metadata.
 * Carried inside foreign literals so the validator can report it.
 */
public final class RawTuple {
  private final ImmutableList<Node> elements;

  public RawTuple(List<? extends Node> elements) {
    this.elements = ImmutableList.copyOf(elements);
  }

  public List<Node> elements() {
    return elements;
  }

  public int size() {
    return elements.size();
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof RawTuple))
      return false;
    return elements.equals(((RawTuple)obj).elements);
  }

  @Override
  public int hashCode() {
    return elements.hashCode();
  }

  @Override
  public String toString() {
    return TermWriter.writeTuple(elements);
  }
}

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
 * Result of {@link Validator#validate(Node)}: ok, or the first
 * offending subnode.
 */
public final class Validation {
  private static final Validation OK = new Validation(null);

  private final Node offending;

  private Validation(Node offending) {
    this.offending = offending;
  }

  public static Validation ok() {
    return OK;
  }

  public static Validation error(Node offending) {
    return new Validation(offending);
  }

  public boolean isOk() {
    return offending == null;
  }

  /**
   * @return offending subnode, or null if valid
   */
  public Node offending() {
    return offending;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Validation))
      return false;
    Validation o = (Validation)obj;
    return offending == null ? o.offending == null
                             : offending.equals(o.offending);
  }

  @Override
  public int hashCode() {
    return offending == null ? 0 : offending.hashCode();
  }

  @Override
  public String toString() {
    return isOk() ? "ok" : "{:error, " + offending + "}";
  }
}

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
package exm.qtree.lang;

/**
 * Where an atom may appear in source without quoting.
 */
public enum AtomCategory {
  /** Module name such as Elixir.Foo.Bar */
  ALIAS,
  /** Usable as a variable or local call */
  IDENTIFIER,
  /** Callable operator, e.g. :+ */
  UNQUOTED_OPERATOR,
  /** Callable operator that needs quotes as an atom, e.g. :"::" */
  QUOTED_OPERATOR,
  /** Structural markers and other atoms that cannot follow a dot */
  NOT_CALLABLE,
  /** Needs quotes everywhere */
  OTHER,
  ;
}

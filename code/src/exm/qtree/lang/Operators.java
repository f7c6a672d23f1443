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

import java.util.HashMap;
import java.util.Map;

import exm.qtree.common.util.Pair;

/**
 * The operator table: associativity and precedence of every binary
 * operator, precedence of every unary operator.
 * Higher precedence binds tighter.
 */
public class Operators {

  public static final String PIPE = "|>";
  public static final String RANGE = "..";
  public static final String RANGE_STEP = "..//";
  public static final String STEP = "//";

  private static final Map<String, Pair<Associativity, Integer>> binary =
                new HashMap<String, Pair<Associativity, Integer>>();
  private static final Map<String, Integer> unary =
                new HashMap<String, Integer>();

  static {
    addBinary(Associativity.LEFT, 40, "<-", "\\\\");
    addBinary(Associativity.RIGHT, 50, "when");
    addBinary(Associativity.RIGHT, 60, "::");
    addBinary(Associativity.RIGHT, 70, "|");
    addBinary(Associativity.RIGHT, 100, "=");
    addBinary(Associativity.LEFT, 130, "||", "|||", "or");
    addBinary(Associativity.LEFT, 140, "&&", "&&&", "and");
    addBinary(Associativity.LEFT, 150, "==", "!=", "=~", "===", "!==");
    addBinary(Associativity.LEFT, 160, "<", "<=", ">=", ">");
    addBinary(Associativity.LEFT, 170, "|>", "<<<", ">>>", "<<~", "~>>",
                                       "<~", "~>", "<~>", "<|>");
    addBinary(Associativity.LEFT, 180, "in");
    addBinary(Associativity.LEFT, 190, "^^^");
    addBinary(Associativity.RIGHT, 200, STEP);
    addBinary(Associativity.RIGHT, 210, "++", "--", RANGE, "<>", "+++", "---");
    addBinary(Associativity.LEFT, 220, "+", "-");
    addBinary(Associativity.LEFT, 230, "*", "/");
    addBinary(Associativity.LEFT, 235, "**");
    addBinary(Associativity.LEFT, 310, ".");

    addUnary(90, "&");
    addUnary(300, "!", "^", "not", "+", "-", "~~~");
    addUnary(320, "@");
  }

  private static void addBinary(Associativity assoc, int prec,
                                String... ops) {
    for (String op: ops) {
      binary.put(op, Pair.create(assoc, prec));
    }
  }

  private static void addUnary(int prec, String... ops) {
    for (String op: ops) {
      unary.put(op, prec);
    }
  }

  /**
   * Lookup in the binary table.  Includes "//", which has a precedence
   * but is not an operator by itself.
   * @return (associativity, precedence), or null if not present
   */
  public static Pair<Associativity, Integer> binaryOp(String name) {
    return binary.get(name);
  }

  /**
   * @return precedence, or null if not a unary operator
   */
  public static Integer unaryOp(String name) {
    return unary.get(name);
  }

  public static boolean isOperator(String name, int arity) {
    switch (arity) {
      case 0:
        return name.equals(RANGE);
      case 1:
        return unary.containsKey(name);
      case 2:
        return binary.containsKey(name) && !name.equals(STEP);
      case 3:
        return name.equals(RANGE_STEP);
      default:
        return false;
    }
  }

  /**
   * True if the name is a unary or binary operator at either arity
   */
  public static boolean isUnaryOrBinary(String name) {
    return isOperator(name, 1) || isOperator(name, 2);
  }
}

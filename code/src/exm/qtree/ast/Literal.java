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

import java.math.BigInteger;

import exm.qtree.common.exceptions.QTreeRuntimeError;

/**
 * A leaf that is not an atom: number, string, or opaque runtime value.
 */
public final class Literal extends Node {

  public static enum Kind {
    /** Long, or BigInteger when it does not fit */
    INTEGER,
    FLOAT,
    /** Binary string */
    STRING,
    PROCESS,
    /** &Mod.fun/arity */
    FUNCTION,
    /** Any other Java value.  Never valid in a tree. */
    FOREIGN,
  }

  private static final BigInteger LONG_MIN =
                              BigInteger.valueOf(Long.MIN_VALUE);
  private static final BigInteger LONG_MAX =
                              BigInteger.valueOf(Long.MAX_VALUE);

  private final Kind kind;
  private final Object value;

  private Literal(Kind kind, Object value) {
    if (value == null) {
      throw new NullPointerException("literal value");
    }
    this.kind = kind;
    this.value = value;
  }

  public static Literal integer(long value) {
    return new Literal(Kind.INTEGER, Long.valueOf(value));
  }

  public static Literal integer(BigInteger value) {
    if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
      return integer(value.longValue());
    }
    return new Literal(Kind.INTEGER, value);
  }

  public static Literal floating(double value) {
    return new Literal(Kind.FLOAT, Double.valueOf(value));
  }

  public static Literal string(String value) {
    return new Literal(Kind.STRING, value);
  }

  public static Literal process(ProcessRef pid) {
    return new Literal(Kind.PROCESS, pid);
  }

  public static Literal function(FunctionRef fun) {
    return new Literal(Kind.FUNCTION, fun);
  }

  public static Literal foreign(Object value) {
    return new Literal(Kind.FOREIGN, value);
  }

  @Override
  public NodeType type() {
    return NodeType.LITERAL;
  }

  public Kind kind() {
    return kind;
  }

  public Object value() {
    return value;
  }

  public boolean isNumber() {
    return kind == Kind.INTEGER || kind == Kind.FLOAT;
  }

  public boolean fitsLong() {
    return kind == Kind.INTEGER && value instanceof Long;
  }

  public long longValue() {
    if (!fitsLong()) {
      throw new QTreeRuntimeError("Not a small integer: " + this);
    }
    return (Long)value;
  }

  public BigInteger bigValue() {
    if (kind != Kind.INTEGER) {
      throw new QTreeRuntimeError("Not an integer: " + this);
    }
    if (value instanceof Long) {
      return BigInteger.valueOf((Long)value);
    }
    return (BigInteger)value;
  }

  public double doubleValue() {
    if (kind != Kind.FLOAT) {
      throw new QTreeRuntimeError("Not a float: " + this);
    }
    return (Double)value;
  }

  public String stringValue() {
    if (kind != Kind.STRING) {
      throw new QTreeRuntimeError("Not a string: " + this);
    }
    return (String)value;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof Literal))
      return false;
    Literal o = (Literal)obj;
    return kind == o.kind && value.equals(o.value);
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + value.hashCode();
  }
}

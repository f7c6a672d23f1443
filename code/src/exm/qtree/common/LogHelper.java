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
package exm.qtree.common;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import exm.qtree.ast.Node;
import exm.qtree.term.TermWriter;

/**
 * Indented logging of tree transformations.
 * Indentation follows the nesting depth of the walk, so the log
 * reads like the tree.
 */
public class LogHelper {

  static final Logger logger = Logging.getQTreeLogger();

  /**
     DEBUG-level with indentation for nice output
   */
  public static void debug(int indent, String msg) {
    log(indent, Level.DEBUG, msg);
  }

  /**
     TRACE-level with indentation for nice output
   */
  public static void trace(int indent, String msg) {
    log(indent, Level.TRACE, msg);
  }

  /**
   * Log a node in term notation.  The node is only printed if the
   * level is enabled.
   */
  public static void traceNode(int indent, String prefix, Node node) {
    if (logger.isTraceEnabled()) {
      log(indent, Level.TRACE, prefix + TermWriter.write(node));
    }
  }

  public static void log(int indent, Level level, String msg) {
    StringBuilder sb = new StringBuilder(256);
    for (int i = 0; i < indent; i++)
      sb.append(' ');
    sb.append(msg);
    logger.log(level, sb);
  }

  public static boolean isDebugEnabled() {
    return logger.isDebugEnabled();
  }

  public static boolean isTraceEnabled() {
    return logger.isTraceEnabled();
  }
}

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

import java.io.IOException;
import java.util.HashSet;

import org.apache.log4j.FileAppender;
import org.apache.log4j.Layout;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import exm.qtree.common.exceptions.QTreeRuntimeError;
import exm.qtree.common.util.Pair;

public class Logging {
  private static final String QTREE_LOGGER_NAME = "exm.qtree";

  private static final String FILE_PATTERN = "%-5p %c{1} %m%n";

  /**
   * Messages already emitted.
   */
  private static final HashSet<Pair<Level, String>> emitted =
          new HashSet<Pair<Level, String>>();

  public static Logger getQTreeLogger() {
    return Logger.getLogger(QTREE_LOGGER_NAME);
  }

  /**
   * Attach a file appender to the qtree logger.
   * @param logfile file to log into, or null or empty for none
   * @param trace if true, log everything down to TRACE level
   * @return the qtree logger
   */
  public static Logger setupLogging(String logfile, boolean trace) {
    Logger logger = getQTreeLogger();
    if (logfile != null && logfile.length() > 0) {
      Layout layout = new PatternLayout(FILE_PATTERN);
      try {
        FileAppender appender = new FileAppender(layout, logfile, false);
        logger.addAppender(appender);
      } catch (IOException e) {
        throw new QTreeRuntimeError("Could not open log file: " + logfile, e);
      }
      logger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    } else if (trace) {
      logger.setLevel(Level.TRACE);
    }
    return logger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg) {
    return emitted.add(Pair.create(level, msg));
  }

  public static void uniqueWarn(String msg) {
    if (Logging.addEmitted(Level.WARN, msg)) {
      Logging.getQTreeLogger().warn(msg);
    } else {
      Logging.getQTreeLogger().debug("Duplicate Warning: " + msg);
    }
  }
}

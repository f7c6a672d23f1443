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
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.commons.io.IOUtils;

import exm.qtree.common.exceptions.InvalidOptionException;
import exm.qtree.common.exceptions.QTreeRuntimeError;

/**
 * General qtree settings.
 *
 * Values come from, in increasing priority: the defaults below,
 * qtree.properties on the classpath, and Java system properties.
 * */
public class Settings
{
  public static final String LOG_FILE = "qtree.log.file";
  public static final String LOG_TRACE = "qtree.log.trace";

  /** Rounds of root expansion before giving up */
  public static final String EXPAND_MAX_ITERATIONS =
                                          "qtree.expand.max-iterations";

  /** Spaces per nesting level in rendered blocks */
  public static final String UNPARSE_INDENT = "qtree.unparse.indent";

  /** Module that receives the instrumented __dbg__ call */
  public static final String DBG_HELPER_MODULE = "qtree.dbg.helper-module";

  static final String PROPERTIES_RESOURCE = "qtree.properties";

  private static final Properties defaults;
  private static final Properties properties;

  static {
    defaults = new Properties();
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(EXPAND_MAX_ITERATIONS, "10000");
    defaults.setProperty(UNPARSE_INDENT, "2");
    defaults.setProperty(DBG_HELPER_MODULE, "Macro");
    properties = new Properties(defaults);
    loadClasspathProperties();
    loadSystemProperties();
  }

  /**
   * Re-read system properties and check all values are well formed
   */
  public static void initQTreeProperties() throws InvalidOptionException {
    loadSystemProperties();
    validateProperties();
  }

  private static void loadClasspathProperties() {
    InputStream in = Settings.class.getClassLoader()
                            .getResourceAsStream(PROPERTIES_RESOURCE);
    if (in == null) {
      return;
    }
    try {
      Properties fromFile = new Properties();
      fromFile.load(in);
      for (String key: fromFile.stringPropertyNames()) {
        properties.setProperty(key, fromFile.getProperty(key));
      }
    } catch (IOException e) {
      throw new QTreeRuntimeError("IOException while reading " +
                                  PROPERTIES_RESOURCE, e);
    } finally {
      IOUtils.closeQuietly(in);
    }
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  private static void loadSystemProperties() {
    for (String key: defaults.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
  }

  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    long maxIter = getLong(EXPAND_MAX_ITERATIONS);
    if (maxIter <= 0) {
      throw new InvalidOptionException("Expected positive value for " +
                        EXPAND_MAX_ITERATIONS + " but was " + maxIter);
    }
    long indent = getLong(UNPARSE_INDENT);
    if (indent < 0) {
      throw new InvalidOptionException("Expected non-negative value for " +
                        UNPARSE_INDENT + " but was " + indent);
    }
    checkNonEmpty(DBG_HELPER_MODULE);
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any override of key, reverting to the default
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  private static void checkNonEmpty(String key) throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null || val.trim().length() == 0) {
      throw new InvalidOptionException("no value set for option " + key);
    }
  }

  public static long getLong(String key) throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }
    try {
      return Long.parseLong(strVal.trim());
    } catch (NumberFormatException e) {
      throw new InvalidOptionException("Invalid integral value for option " +
      key + ": " + strVal);
    }
  }

  public static int getInt(String key) throws InvalidOptionException {
    long val = getLong(key);
    if (val > Integer.MAX_VALUE || val < Integer.MIN_VALUE) {
      throw new InvalidOptionException("Value out of range for option " +
      key + ": " + val);
    }
    return (int)val;
  }

  public static boolean getBoolean(String key)
                  throws InvalidOptionException {
    String strVal = properties.getProperty(key);
    if (strVal == null) {
      throw new InvalidOptionException("no value set for option " + key);
    }

    String lStrVal = strVal.trim().toLowerCase();
    if (lStrVal.equals("true")) {
      return true;
    } else if (lStrVal.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException(
          "option string for " + key + " must be true or false, but was '" +
              strVal + "'");
    }
  }
}

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

package exm.quint.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

import org.apache.log4j.Logger;

import exm.quint.common.exceptions.InvalidOptionException;

/**
 * General front end settings.
 *
 * Every key has a default here; any of them can be overridden with a
 * Java system property of the same name.
 * */
public class Settings
{
  public static final String LOG_FILE = "quint.log.file";
  public static final String LOG_TRACE = "quint.log.trace";

  /** Source name recorded in the source map if the caller gives none */
  public static final String DEFAULT_SOURCE_NAME = "quint.source.default-name";

  /** Warn about components left on the stacks when a module completes */
  public static final String CHECK_STACK_LEAKS = "quint.lowering.check-leaks";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    defaults.setProperty(DEFAULT_SOURCE_NAME, "<input>");
    defaults.setProperty(CHECK_STACK_LEAKS, "true");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static synchronized void initQuintProperties()
                                    throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  /**
   * Configure logging from the current settings.
   */
  public static Logger initLogging() throws InvalidOptionException {
    return Logging.setupLogging(get(LOG_FILE), getBoolean(LOG_TRACE));
  }

  public static synchronized void set(String key, String value) {
    properties.setProperty(key, value);
  }

  public static List<String> getKeys() {
    ArrayList<String> keys;
    keys = new ArrayList<String>(properties.stringPropertyNames());
    Collections.sort(keys);
    return keys;
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(LOG_TRACE);
    getBoolean(CHECK_STACK_LEAKS);
  }

  public static synchronized String get(String key) {
    return properties.getProperty(key);
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String val = get(key);
    if (val == null) {
      throw new InvalidOptionException("Unknown property " + key);
    }
    val = val.trim();
    if (val.equalsIgnoreCase("true")) {
      return true;
    } else if (val.equalsIgnoreCase("false")) {
      return false;
    } else {
      throw new InvalidOptionException(key, val, "true or false");
    }
  }
}

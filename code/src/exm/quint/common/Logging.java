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

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

public class Logging
{
  private static final String QUINT_LOGGER_NAME = "exm.quint";

  private static final String LOG_PATTERN = "%-5p %c{1} - %m%n";

  /** Name of the file appender added by {@link #setupLogging} */
  public static final String FILE_APPENDER_NAME = "quint-file";

  /**
   * Messages already emitted.
   */
  private static final Set<String> emitted = new HashSet<String>();

  public static Logger getQuintLogger()
  {
    return Logger.getLogger(QUINT_LOGGER_NAME);
  }

  /**
   * Configure the project logger.  Can be called more than once: a file
   * appender from an earlier call is replaced, not duplicated.
   * @param logfile if non-empty, also log to this file
   * @param trace if true, log at TRACE level, otherwise DEBUG
   * @return the project logger
   */
  public static synchronized Logger setupLogging(String logfile,
                                                 boolean trace)
  {
    Logger quintLogger = getQuintLogger();
    if (StringUtils.isNotBlank(logfile)) {
      Appender previous = quintLogger.getAppender(FILE_APPENDER_NAME);
      if (previous != null) {
        quintLogger.removeAppender(previous);
        previous.close();
      }
      try {
        FileAppender appender = new FileAppender(
                new PatternLayout(LOG_PATTERN), logfile, false);
        appender.setName(FILE_APPENDER_NAME);
        quintLogger.addAppender(appender);
      } catch (IOException e) {
        quintLogger.warn("Could not open log file " + logfile + ": " +
                         e.getMessage());
      }
    }
    quintLogger.setLevel(trace ? Level.TRACE : Level.DEBUG);
    return quintLogger;
  }

  /**
   * @param level
   * @param msg
   * @return true if not already emitted
   */
  public static synchronized boolean addEmitted(Level level, String msg)
  {
    return emitted.add(level.toString() + ":" + msg);
  }

  public static void uniqueWarn(String msg)
  {
    if (addEmitted(Level.WARN, msg))
      getQuintLogger().warn(msg);
    else
      getQuintLogger().debug("Duplicate Warning: " + msg);
  }
}

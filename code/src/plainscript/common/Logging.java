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

package plainscript.common;

import java.io.IOException;

import org.apache.log4j.Appender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.PatternLayout;

import plainscript.common.exceptions.InvalidOptionException;

public class Logging
{
  private static final String PSC_LOGGER_NAME = "plainscript";

  private static final String LOG_PATTERN = "%-5p %c{1} %m%n";

  /** Name of the file appender, so setting up again replaces it */
  public static final String FILE_APPENDER_NAME = "psc-file";

  public static Logger getPSCLogger()
  {
    return Logger.getLogger(PSC_LOGGER_NAME);
  }

  /**
   * Configure the compiler logger.
   * @param logfile if non-empty, also log to this file, replacing any
   *        file set up by an earlier call
   * @param trace if true, log everything down to TRACE level
   * @return the compiler logger
   * @throws InvalidOptionException if the log file can't be opened
   */
  public static Logger setupLogging(String logfile, boolean trace)
      throws InvalidOptionException
  {
    Logger pscLogger = getPSCLogger();
    if (logfile != null && logfile.length() > 0) {
      try {
        FileAppender appender = new FileAppender(
                  new PatternLayout(LOG_PATTERN), logfile, false);
        appender.setName(FILE_APPENDER_NAME);
        Appender old = pscLogger.getAppender(FILE_APPENDER_NAME);
        if (old != null) {
          pscLogger.removeAppender(old);
          old.close();
        }
        pscLogger.addAppender(appender);
      } catch (IOException e) {
        throw new InvalidOptionException("Could not open log file " +
                                  logfile + ": " + e.getMessage());
      }
    }
    if (trace) {
      pscLogger.setLevel(Level.TRACE);
    }
    // Even if logging is disabled, this must be valid:
    return pscLogger;
  }
}

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
package plainscript.frontend;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import plainscript.common.Logging;

/**
 * Helper functions to augment log messages with contextual information
 * about the current scope.
 */
public class LogHelper {
  static final Logger logger = Logging.getPSCLogger();

  public static void debug(Context context, String msg) {
    log(context.getLevel(), Level.DEBUG, context.getLocation(), msg);
  }

  public static void trace(Context context, String msg) {
    log(context.getLevel(), Level.TRACE, context.getLocation(), msg);
  }

  public static void log(int indent, Level level, String location, String msg) {
    if (logger.isEnabledFor(level)) {
      logger.log(level, logMsg(indent, location, msg));
    }
  }

  private static String logMsg(int indent, String location, String msg) {
    StringBuilder sb = new StringBuilder(256);
    for (int i = 0; i < indent; i++)
      sb.append("  ");
    sb.append(location);
    sb.append(msg);
    return sb.toString();
  }

  public static boolean isTraceEnabled() {
    return logger.isTraceEnabled();
  }
}

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

import java.util.Properties;

import plainscript.common.exceptions.InvalidOptionException;
import plainscript.common.exceptions.PSCRuntimeError;

/**
 * General compiler settings.
 *
 * Settings are Java properties with defaults set here.  Any of them
 * can be overridden with a system property of the same name.
 * */
public class Settings
{
  /** Whether the compiler runs the optimizer when not told otherwise */
  public static final String OPTIMIZE = "psc.optimize";

  public static final String OPT_CONSTANT_FOLD = "psc.opt.constant-fold";
  public static final String OPT_DEAD_CODE_ELIM = "psc.opt.dead-code-elim";
  public static final String OPT_NOOP_ASSIGN = "psc.opt.noop-assign";

  public static final String CODEGEN_INDENT_WIDTH = "psc.codegen.indent-width";

  public static final String LOG_FILE = "psc.log.file";
  public static final String LOG_TRACE = "psc.log.trace";

  private static final Properties properties;

  static {
    Properties defaults = new Properties();
    defaults.setProperty(OPTIMIZE, "false");
    defaults.setProperty(OPT_CONSTANT_FOLD, "true");
    defaults.setProperty(OPT_DEAD_CODE_ELIM, "true");
    defaults.setProperty(OPT_NOOP_ASSIGN, "true");
    defaults.setProperty(CODEGEN_INDENT_WIDTH, "2");
    defaults.setProperty(LOG_FILE, "");
    defaults.setProperty(LOG_TRACE, "false");
    properties = new Properties(defaults);
  }

  /**
     Try to overwrite each default property in properties
     with value from System
   */
  public static void initPSCProperties() throws InvalidOptionException {
    for (String key: properties.stringPropertyNames()) {
      String sysVal = System.getProperty(key);
      if (sysVal != null) {
        properties.setProperty(key, sysVal);
      }
    }
    validateProperties();
  }

  public static void set(String key, String value) {
    properties.setProperty(key, value);
  }

  /**
   * Drop any value set since startup, going back to the default
   * @param key
   */
  public static void reset(String key) {
    properties.remove(key);
  }

  /**
   * Do any checks for correctness of properties
   * @throws InvalidOptionException
   */
  private static void validateProperties() throws InvalidOptionException {
    getBoolean(OPTIMIZE);
    getBoolean(OPT_CONSTANT_FOLD);
    getBoolean(OPT_DEAD_CODE_ELIM);
    getBoolean(OPT_NOOP_ASSIGN);
    getBoolean(LOG_TRACE);

    long indent = getLong(CODEGEN_INDENT_WIDTH);
    if (indent < 0) {
      throw new InvalidOptionException(CODEGEN_INDENT_WIDTH +
                              " must not be negative, but was " + indent);
    }
  }

  public static String get(String key)
  {
    return properties.getProperty(key);
  }

  public static boolean getBoolean(String key) throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    val = val.trim().toLowerCase();
    if (val.equals("true")) {
      return true;
    } else if (val.equals("false")) {
      return false;
    } else {
      throw new InvalidOptionException("Invalid boolean value for " + key +
                                      ": \"" + val + "\"");
    }
  }

  public static long getLong(String key) throws InvalidOptionException {
    String val = properties.getProperty(key);
    if (val == null) {
      throw new InvalidOptionException("Could not find property " + key);
    }
    try {
      return Long.parseLong(val.trim());
    } catch (NumberFormatException ex) {
      throw new InvalidOptionException("Invalid integer value for " + key +
                                      ": \"" + val + "\"");
    }
  }

  /**
   * For settings that have already been validated, so a bad value
   * means a compiler bug
   */
  public static boolean getBooleanUnchecked(String key) {
    try {
      return getBoolean(key);
    } catch (InvalidOptionException e) {
      throw new PSCRuntimeError(e.getMessage());
    }
  }

  public static long getLongUnchecked(String key) {
    try {
      return getLong(key);
    } catch (InvalidOptionException e) {
      throw new PSCRuntimeError(e.getMessage());
    }
  }
}

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

package plainscript.ui;

import org.apache.log4j.Logger;

import plainscript.ast.Program;
import plainscript.common.Logging;
import plainscript.common.Settings;
import plainscript.common.exceptions.InvalidOptionException;
import plainscript.common.exceptions.UserException;
import plainscript.frontend.GlobalContext;
import plainscript.jsbackend.JSGenerator;
import plainscript.opt.Optimizer;

/**
 * This is the main entry point to the compiler.  Each call compiles one
 * program with its own global context, so separate programs share no
 * state.
 */
public class PSCompiler {

  private final Logger logger;

  public PSCompiler(Logger logger) {
    super();
    this.logger = logger;
  }

  /**
   * Load settings from system properties and set up logging as they
   * ask.  Call once before compiling.
   * @return the compiler logger
   * @throws InvalidOptionException
   */
  public static Logger init() throws InvalidOptionException {
    Settings.initPSCProperties();
    return Logging.setupLogging(Settings.get(Settings.LOG_FILE),
                                Settings.getBoolean(Settings.LOG_TRACE));
  }

  /**
   * Check the program, without optimizing or generating code.
   * @param program
   * @return global context holding the analysis results
   * @throws UserException the first error found in the program
   */
  public GlobalContext analyze(Program program) throws UserException {
    logger.debug("Analyzing program");
    GlobalContext globals = new GlobalContext(logger);
    program.analyze(globals);
    return globals;
  }

  /**
   * Compile, optimizing if the psc.optimize setting says so
   * @param program
   * @return JavaScript source
   * @throws UserException
   */
  public String compile(Program program) throws UserException {
    return compile(program, Settings.getBooleanUnchecked(Settings.OPTIMIZE));
  }

  /**
   * Analyze, optionally optimize, then generate JavaScript.  The program
   * tree is modified in place when optimizing.
   * @param program
   * @param optimize
   * @return JavaScript source
   * @throws UserException if analysis fails.  Nothing is generated then.
   */
  public String compile(Program program, boolean optimize)
      throws UserException {
    logger.info("PSC starting");
    GlobalContext globals = analyze(program);

    if (optimize) {
      new Optimizer(logger).optimize(program);
    }

    JSGenerator codeGen = new JSGenerator(logger, globals);
    String output = codeGen.generate(program);
    logger.debug("PSC done");
    return output;
  }
}

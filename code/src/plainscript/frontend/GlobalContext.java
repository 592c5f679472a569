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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import plainscript.ast.FunctionDeclaration;
import plainscript.common.exceptions.PSCRuntimeError;
import plainscript.common.exceptions.UserException;

/**
 * Root of the context chain for one compilation.  Holds the built-in
 * library functions and the side table that analysis fills in.
 * Each compiled program needs its own GlobalContext.
 */
public class GlobalContext extends Context {

  private final Bindings bindings = new Bindings();

  /** Built-in functions, in declaration order */
  private final List<FunctionDeclaration> builtins =
                              new ArrayList<FunctionDeclaration>();

  public GlobalContext(Logger logger) {
    super(logger, ROOT_LEVEL);
    declareBuiltins();
  }

  private void declareBuiltins() {
    for (FunctionDeclaration builtin: Builtins.createDeclarations()) {
      try {
        builtin.analyze(this);
      } catch (UserException e) {
        throw new PSCRuntimeError("Invalid builtin " + builtin.getName() +
                                  ": " + e.getMessage());
      }
      builtins.add(builtin);
    }
  }

  @Override
  public GlobalContext getGlobals() {
    return this;
  }

  @Override
  public Bindings getBindings() {
    return bindings;
  }

  @Override
  public boolean isInLoop() {
    return false;
  }

  @Override
  public FunctionDeclaration getFunction() {
    return null;
  }

  @Override
  public Declaration lookupUnsafe(String name) {
    return declarations.get(name);
  }

  public List<FunctionDeclaration> getBuiltins() {
    return Collections.unmodifiableList(builtins);
  }

  public boolean isBuiltin(Declaration decl) {
    for (FunctionDeclaration builtin: builtins) {
      if (builtin == decl) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "GlobalContext: " + declarations.keySet();
  }
}

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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.log4j.Logger;

import plainscript.ast.FunctionDeclaration;
import plainscript.ast.Node;
import plainscript.common.exceptions.DoubleDefineException;
import plainscript.common.exceptions.UndefinedVarError;

/**
 * One lexical scope of the program being analyzed.  Scopes are chained
 * to their enclosing scope, and lookups move outward from the innermost
 * scope until a declaration is found.
 */
public abstract class Context {

  public static final int ROOT_LEVEL = 0;

  /**
   * How many levels from root: 0 if this is the root
   */
  protected final int level;

  /**
   * A logger for use by child classes
   */
  protected final Logger logger;

  /**
     Map from name to declaration, for this scope only
   */
  protected final Map<String, Declaration> declarations =
                            new LinkedHashMap<String, Declaration>();

  public Context(Logger logger, int level) {
    super();
    this.level = level;
    this.logger = logger;
  }

  /**
     Return global context.
     If this is a GlobalContext, return this,
     else return the GlobalContext this is using.
   */
  public abstract GlobalContext getGlobals();

  /**
   * @return true if a break statement is legal here
   */
  public abstract boolean isInLoop();

  /**
   * @return the function whose body we're in, or null if not in a function
   */
  public abstract FunctionDeclaration getFunction();

  /**
   * Lookup declaration based on name.  This version will
   * return null if undeclared, leaving handling to caller.
   * @param name
   * @return nearest declaration, searching outward from this scope
   */
  public abstract Declaration lookupUnsafe(String name);

  /**
   * Lookup declaration referred to in user code
   * @param name
   * @param node the referring node, for error reporting
   * @return the nearest declaration
   * @throws UndefinedVarError if no enclosing scope declares name
   */
  public Declaration lookup(String name, Node node) throws UndefinedVarError {
    Declaration result = lookupUnsafe(name);
    if (result == null) {
      throw UndefinedVarError.fromName(this, node, name);
    }
    return result;
  }

  public Declaration lookup(String name) throws UndefinedVarError {
    return lookup(name, null);
  }

  /**
   * Add a declaration to this scope.  It will be visible in this
   * scope and all descendant scopes, hiding any declaration with the
   * same name in enclosing scopes.
   * @param decl
   * @throws DoubleDefineException if this scope already declares the name
   */
  public void addVariable(Declaration decl) throws DoubleDefineException {
    String name = decl.getName();
    Declaration existing = declarations.get(name);
    if (existing != null) {
      throw new DoubleDefineException(this, decl.getNode(), name, existing);
    }
    if (logger.isTraceEnabled()) {
      LogHelper.trace(this, "declare " + decl.getKind().humanReadable() +
                            " " + name);
    }
    declarations.put(name, decl);
  }

  /**
   * @return the side table holding analysis results
   */
  public Bindings getBindings() {
    return getGlobals().getBindings();
  }

  /**
   * New scope for a block nested in this one
   */
  public LocalContext createChildContext() {
    return LocalContext.blockContext(this);
  }

  /**
   * New scope for a loop body nested in this one
   */
  public LocalContext createLoopContext() {
    return LocalContext.loopContext(this);
  }

  /**
   * New scope for the parameters and body of a function
   * @param function
   */
  public LocalContext createFunctionContext(FunctionDeclaration function) {
    return LocalContext.fnContext(this, function);
  }

  /**
   * @return E.g. "in function f: "
   */
  public String getLocation() {
    FunctionDeclaration function = getFunction();
    if (function == null) {
      return "";
    }
    return "in function " + function.getName() + ": ";
  }

  public final int getLevel() {
    return level;
  }

  public final Logger getLogger() {
    return logger;
  }

  /**
   * @return the declarations made in this scope, in declaration order
   */
  public Collection<Declaration> getScopeDeclarations() {
    return Collections.unmodifiableCollection(declarations.values());
  }

  /**
   * Different types of definition name can be associated with.
   */
  public static enum DefKind {
    FUNCTION, PARAMETER, VARIABLE;

    public String humanReadable() {
      return this.toString().toLowerCase();
    }
  }
}

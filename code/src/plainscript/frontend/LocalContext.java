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

import plainscript.ast.FunctionDeclaration;

/**
 * Context for any scope nested inside the global scope.  New child
 * contexts are created for every new variable scope.
 */
public class LocalContext extends Context {
  private final Context parent;
  private final GlobalContext globals;
  private final FunctionDeclaration function;
  private final boolean inLoop;

  private LocalContext(Context parent, FunctionDeclaration function,
                       boolean inLoop) {
    super(parent.getLogger(), parent.getLevel() + 1);
    this.parent = parent;
    this.globals = parent.getGlobals();
    this.function = function;
    this.inLoop = inLoop;
  }

  /**
   * Subcontext for a block, e.g. an if branch.  Keeps the enclosing
   * function and loop.
   * @param parent
   * @return
   */
  public static LocalContext blockContext(Context parent) {
    return new LocalContext(parent, parent.getFunction(), parent.isInLoop());
  }

  /**
   * Subcontext for a loop body
   * @param parent
   * @return
   */
  public static LocalContext loopContext(Context parent) {
    return new LocalContext(parent, parent.getFunction(), true);
  }

  /**
   * Context for parameters and top level of function body.  A loop
   * around the function declaration doesn't make break legal inside it.
   * @param parent
   * @param function
   * @return
   */
  public static LocalContext fnContext(Context parent,
                                       FunctionDeclaration function) {
    return new LocalContext(parent, function, false);
  }

  @Override
  public GlobalContext getGlobals() {
    return globals;
  }

  @Override
  public boolean isInLoop() {
    return inLoop;
  }

  @Override
  public FunctionDeclaration getFunction() {
    return function;
  }

  @Override
  public Declaration lookupUnsafe(String name) {
    Declaration result = declarations.get(name);
    if (result != null) {
      return result;
    }
    return parent.lookupUnsafe(name);
  }

  @Override
  public String toString() {
    return "LocalContext(level " + level + "): " + declarations.keySet();
  }
}

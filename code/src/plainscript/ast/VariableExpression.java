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

package plainscript.ast;

import plainscript.common.exceptions.InvalidWriteException;
import plainscript.common.exceptions.UserException;
import plainscript.frontend.Bindings;
import plainscript.frontend.Context;
import plainscript.frontend.Context.DefKind;
import plainscript.frontend.Declaration;
import plainscript.frontend.LogHelper;
import plainscript.frontend.Variable;
import plainscript.jsbackend.JSGenerator;
import plainscript.jsbackend.tree.JSExpr;
import plainscript.jsbackend.tree.Token;
import plainscript.opt.Optimizer;

/**
 * Use of a name: read in an expression, written as an assignment
 * target, or called as a callee.
 */
public final class VariableExpression extends Expression {
  private final String name;

  public VariableExpression(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Override
  public void analyze(Context context) throws UserException {
    Declaration decl = context.lookup(name, this);
    if (LogHelper.isTraceEnabled()) {
      LogHelper.trace(context, name + " resolves to " +
                      decl.getKind().humanReadable() + " " + decl.getName());
    }
    context.getBindings().bind(this, decl);
  }

  /**
   * Resolve an assignment target.  Assigning to a name not visible in
   * any enclosing scope declares it as a new variable in the current
   * scope.  Otherwise the target writes the visible declaration, which
   * must not be a function.
   * @param context
   * @throws UserException
   */
  void analyzeAsTarget(Context context) throws UserException {
    Bindings bindings = context.getBindings();
    Declaration decl = context.lookupUnsafe(name);
    if (decl == null) {
      Variable var = new Variable(name, this);
      context.addVariable(var);
      bindings.introduce(this, var);
      decl = var;
    } else if (decl.getKind() == DefKind.FUNCTION) {
      throw new InvalidWriteException(context, this,
                              "Cannot assign to function " + name);
    }
    bindings.bind(this, decl);
  }

  @Override
  public Expression optimize(Optimizer opt) {
    return this;
  }

  @Override
  public JSExpr generate(JSGenerator gen) {
    return new Token(gen.name(gen.getBindings().getReferent(this)));
  }

  @Override
  public String toString() {
    return "(Var " + name + ")";
  }
}

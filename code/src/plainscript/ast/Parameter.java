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

import plainscript.common.exceptions.UserException;
import plainscript.frontend.Context;
import plainscript.frontend.Context.DefKind;
import plainscript.frontend.Declaration;
import plainscript.jsbackend.JSGenerator;
import plainscript.jsbackend.tree.BinaryOp;
import plainscript.jsbackend.tree.JSExpr;
import plainscript.jsbackend.tree.Token;
import plainscript.opt.Optimizer;

/**
 * Function parameter, optionally with a default value
 */
public final class Parameter extends Node implements Declaration {
  private final String name;

  /** null if the parameter is required */
  private Expression defaultValue;

  public Parameter(String name, Expression defaultValue) {
    this.name = name;
    this.defaultValue = defaultValue;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public DefKind getKind() {
    return DefKind.PARAMETER;
  }

  @Override
  public Parameter getNode() {
    return this;
  }

  public Expression getDefaultValue() {
    return defaultValue;
  }

  public boolean isRequired() {
    return defaultValue == null;
  }

  /**
   * The default sees earlier parameters but not this one
   */
  @Override
  public void analyze(Context context) throws UserException {
    if (defaultValue != null) {
      defaultValue.analyze(context);
    }
    context.addVariable(this);
  }

  public void optimize(Optimizer opt) {
    if (defaultValue != null) {
      defaultValue = defaultValue.optimize(opt);
    }
  }

  public JSExpr generate(JSGenerator gen) {
    Token id = new Token(gen.name(this));
    if (defaultValue == null) {
      return id;
    }
    return new BinaryOp(id, "=", JSExpr.ASSIGN_PRECEDENCE,
                        defaultValue.generate(gen));
  }

  @Override
  public String toString() {
    if (defaultValue == null) {
      return "(Param " + name + ")";
    }
    return "(Param " + name + " " + defaultValue + ")";
  }
}

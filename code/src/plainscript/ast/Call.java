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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import plainscript.common.exceptions.UndefinedFunctionException;
import plainscript.common.exceptions.UserException;
import plainscript.frontend.Bindings;
import plainscript.frontend.Context;
import plainscript.frontend.Context.DefKind;
import plainscript.frontend.Declaration;
import plainscript.frontend.FunctionSignature;
import plainscript.jsbackend.JSGenerator;
import plainscript.jsbackend.tree.CallExpr;
import plainscript.jsbackend.tree.JSExpr;
import plainscript.jsbackend.tree.Token;
import plainscript.opt.Optimizer;

public final class Call extends Expression {
  private final VariableExpression callee;
  private final List<Argument> args;

  public Call(VariableExpression callee, List<Argument> args) {
    this.callee = callee;
    this.args = new ArrayList<Argument>(args);
  }

  public Call(String callee, List<Argument> args) {
    this(new VariableExpression(callee), args);
  }

  public VariableExpression getCallee() {
    return callee;
  }

  public List<Argument> getArgs() {
    return Collections.unmodifiableList(args);
  }

  @Override
  public void analyze(Context context) throws UserException {
    callee.analyze(context);
    Bindings bindings = context.getBindings();
    Declaration decl = bindings.getReferent(callee);
    if (decl.getKind() != DefKind.FUNCTION) {
      throw UndefinedFunctionException.notAFunction(context, this, decl);
    }
    FunctionSignature sig = bindings.getSignature((FunctionDeclaration)decl);
    bindings.setArgumentPositions(this, sig.bindArguments(context, this));
    for (Argument arg: args) {
      arg.analyze(context);
    }
  }

  @Override
  public Call optimize(Optimizer opt) {
    for (Argument arg: args) {
      arg.optimize(opt);
    }
    return this;
  }

  /**
   * Arguments go in parameter order.  Skipped parameters before the
   * last one given are passed undefined so that their defaults apply.
   * Keyword arguments are therefore evaluated in parameter order, not
   * in the order they were written at the call site.
   */
  @Override
  public JSExpr generate(JSGenerator gen) {
    List<Integer> positions = gen.getBindings().getArgumentPositions(this);
    int count = 0;
    for (int pos: positions) {
      count = Math.max(count, pos + 1);
    }
    JSExpr[] ordered = new JSExpr[count];
    for (int i = 0; i < args.size(); i++) {
      ordered[positions.get(i)] = args.get(i).generate(gen);
    }
    List<JSExpr> jsArgs = new ArrayList<JSExpr>(count);
    for (JSExpr arg: ordered) {
      jsArgs.add(arg == null ? new Token("undefined") : arg);
    }
    return new CallExpr(callee.generate(gen), jsArgs);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(Call ");
    sb.append(callee.getName());
    for (Argument arg: args) {
      sb.append(' ').append(arg.toString());
    }
    sb.append(')');
    return sb.toString();
  }
}

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

import plainscript.common.exceptions.PSCRuntimeError;
import plainscript.common.exceptions.UserException;
import plainscript.frontend.Context;
import plainscript.frontend.Context.DefKind;
import plainscript.frontend.Declaration;
import plainscript.frontend.FunctionSignature;
import plainscript.frontend.LogHelper;
import plainscript.jsbackend.JSGenerator;
import plainscript.jsbackend.tree.FunctionDef;
import plainscript.jsbackend.tree.JSExpr;
import plainscript.jsbackend.tree.JSTree;
import plainscript.opt.Optimizer;

public final class FunctionDeclaration extends Statement
                                       implements Declaration {
  private final String name;
  private final List<Parameter> params;

  /** null for built-in functions */
  private List<Statement> body;

  public FunctionDeclaration(String name, List<Parameter> params,
                             List<Statement> body) {
    this.name = name;
    this.params = new ArrayList<Parameter>(params);
    this.body = body == null ? null : new ArrayList<Statement>(body);
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public DefKind getKind() {
    return DefKind.FUNCTION;
  }

  @Override
  public FunctionDeclaration getNode() {
    return this;
  }

  public List<Parameter> getParams() {
    return Collections.unmodifiableList(params);
  }

  /**
   * @return the body, or null for a built-in
   */
  public List<Statement> getBody() {
    return body == null ? null : Collections.unmodifiableList(body);
  }

  public boolean isBuiltin() {
    return body == null;
  }

  /**
   * Parameters share the scope of the function body.  The function is
   * declared in the enclosing scope before the body is checked, so the
   * body may call it recursively.
   */
  @Override
  public void analyze(Context context) throws UserException {
    Context fnContext = context.createFunctionContext(this);
    for (Parameter p: params) {
      p.analyze(fnContext);
    }
    FunctionSignature sig = FunctionSignature.fromParameters(fnContext,
                                                             name, params);
    context.getBindings().setSignature(this, sig);
    context.addVariable(this);

    if (body != null) {
      LogHelper.debug(fnContext, "analyzing body of " + name);
      for (Statement stmt: body) {
        stmt.analyze(fnContext);
      }
    }
  }

  @Override
  public List<Statement> optimize(Optimizer opt) {
    for (Parameter p: params) {
      p.optimize(opt);
    }
    if (body != null) {
      body = opt.optimizeBlock(body);
    }
    return Collections.<Statement>singletonList(this);
  }

  @Override
  public JSTree generate(JSGenerator gen) {
    if (body == null) {
      throw new PSCRuntimeError("Built-in " + name +
                                " has no body to generate");
    }
    String jsName = gen.name(this);
    List<JSExpr> jsParams = new ArrayList<JSExpr>(params.size());
    for (Parameter p: params) {
      jsParams.add(p.generate(gen));
    }
    return new FunctionDef(jsName, jsParams, gen.generateBlock(body));
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("(Function ").append(name).append(' ');
    appendList(sb, "Params", params);
    sb.append(' ');
    if (body == null) {
      sb.append("builtin");
    } else {
      appendList(sb, "Body", body);
    }
    sb.append(')');
    return sb.toString();
  }
}

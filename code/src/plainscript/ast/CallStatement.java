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

import java.util.Collections;
import java.util.List;

import plainscript.common.exceptions.UserException;
import plainscript.frontend.Context;
import plainscript.jsbackend.JSGenerator;
import plainscript.jsbackend.tree.ExprStatement;
import plainscript.jsbackend.tree.JSTree;
import plainscript.opt.Optimizer;

/**
 * Call evaluated for its effect, discarding the result
 */
public final class CallStatement extends Statement {
  private Call call;

  public CallStatement(Call call) {
    this.call = call;
  }

  public Call getCall() {
    return call;
  }

  @Override
  public void analyze(Context context) throws UserException {
    call.analyze(context);
  }

  @Override
  public List<Statement> optimize(Optimizer opt) {
    call = call.optimize(opt);
    return Collections.<Statement>singletonList(this);
  }

  @Override
  public JSTree generate(JSGenerator gen) {
    return new ExprStatement(call.generate(gen));
  }

  @Override
  public String toString() {
    return "(CallStmt " + call + ")";
  }
}

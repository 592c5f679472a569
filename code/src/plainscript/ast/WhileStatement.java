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

import plainscript.common.exceptions.UserException;
import plainscript.frontend.Context;
import plainscript.jsbackend.JSGenerator;
import plainscript.jsbackend.tree.JSTree;
import plainscript.jsbackend.tree.WhileLoop;
import plainscript.opt.Optimizer;
import plainscript.opt.Optimizer.RewriteKind;

public final class WhileStatement extends Statement {
  private Expression test;
  private List<Statement> body;

  public WhileStatement(Expression test, List<Statement> body) {
    this.test = test;
    this.body = new ArrayList<Statement>(body);
  }

  public Expression getTest() {
    return test;
  }

  public List<Statement> getBody() {
    return Collections.unmodifiableList(body);
  }

  @Override
  public void analyze(Context context) throws UserException {
    test.analyze(context);
    Context loopContext = context.createLoopContext();
    for (Statement stmt: body) {
      stmt.analyze(loopContext);
    }
  }

  @Override
  public List<Statement> optimize(Optimizer opt) {
    test = test.optimize(opt);
    body = opt.optimizeBlock(body);
    if (opt.isDeadCodeElimEnabled() && test instanceof BooleanLiteral &&
        !((BooleanLiteral)test).getValue()) {
      opt.recordRewrite(RewriteKind.PRUNE_WHILE, this, null);
      return Collections.emptyList();
    }
    return Collections.<Statement>singletonList(this);
  }

  @Override
  public JSTree generate(JSGenerator gen) {
    return new WhileLoop(test.generate(gen), gen.generateBlock(body));
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(While ");
    sb.append(test.toString()).append(' ');
    appendList(sb, "Body", body);
    sb.append(')');
    return sb.toString();
  }
}

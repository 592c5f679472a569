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
import plainscript.jsbackend.tree.If;
import plainscript.jsbackend.tree.JSTree;
import plainscript.opt.Optimizer;
import plainscript.opt.Optimizer.RewriteKind;

/**
 * if/elif/else chain.  Cases are tested in order; the first case whose
 * test is true runs, or the else body if none is.
 */
public final class IfStatement extends Statement {
  private List<Case> cases;

  /** else body, or null */
  private List<Statement> alternate;

  public IfStatement(List<Case> cases, List<Statement> alternate) {
    assert(!cases.isEmpty()) : "if statement with no cases";
    this.cases = new ArrayList<Case>(cases);
    this.alternate = alternate == null ? null :
                                      new ArrayList<Statement>(alternate);
  }

  public List<Case> getCases() {
    return Collections.unmodifiableList(cases);
  }

  public List<Statement> getAlternate() {
    return alternate == null ? null : Collections.unmodifiableList(alternate);
  }

  @Override
  public void analyze(Context context) throws UserException {
    for (Case c: cases) {
      c.test.analyze(context);
      Context caseContext = context.createChildContext();
      for (Statement stmt: c.body) {
        stmt.analyze(caseContext);
      }
    }
    if (alternate != null) {
      Context elseContext = context.createChildContext();
      for (Statement stmt: alternate) {
        stmt.analyze(elseContext);
      }
    }
  }

  @Override
  public List<Statement> optimize(Optimizer opt) {
    for (Case c: cases) {
      c.test = c.test.optimize(opt);
      c.body = opt.optimizeBlock(c.body);
    }
    if (alternate != null) {
      alternate = opt.optimizeBlock(alternate);
    }
    if (!opt.isDeadCodeElimEnabled()) {
      return Collections.<Statement>singletonList(this);
    }

    List<Case> remaining = new ArrayList<Case>();
    List<Statement> newAlternate = alternate;
    for (Case c: cases) {
      if (!(c.test instanceof BooleanLiteral)) {
        remaining.add(c);
        continue;
      }
      if (((BooleanLiteral)c.test).getValue()) {
        if (remaining.isEmpty()) {
          // Always taken
          opt.recordRewrite(RewriteKind.PRUNE_IF, this, null);
          return c.body;
        }
        // Later cases can't be reached
        newAlternate = c.body;
        break;
      }
      opt.recordRewrite(RewriteKind.PRUNE_IF, c.test, null);
    }

    if (remaining.isEmpty()) {
      opt.recordRewrite(RewriteKind.PRUNE_IF, this, null);
      if (newAlternate == null) {
        return Collections.emptyList();
      }
      return newAlternate;
    }
    if (remaining.size() != cases.size()) {
      cases = remaining;
      alternate = newAlternate;
    }
    return Collections.<Statement>singletonList(this);
  }

  @Override
  public JSTree generate(JSGenerator gen) {
    If result = new If();
    for (Case c: cases) {
      result.addCase(c.test.generate(gen), gen.generateBlock(c.body));
    }
    if (alternate != null) {
      result.setElse(gen.generateBlock(alternate));
    }
    return result;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(If");
    for (Case c: cases) {
      sb.append(' ').append(c.toString());
    }
    if (alternate != null) {
      sb.append(' ');
      appendList(sb, "Else", alternate);
    }
    sb.append(')');
    return sb.toString();
  }

  /**
   * One test and the body run when it holds
   */
  public static final class Case {
    private Expression test;
    private List<Statement> body;

    public Case(Expression test, List<Statement> body) {
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
    public String toString() {
      StringBuilder sb = new StringBuilder("(Case ");
      sb.append(test.toString()).append(' ');
      appendList(sb, "Body", body);
      sb.append(')');
      return sb.toString();
    }
  }
}

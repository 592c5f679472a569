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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import plainscript.common.exceptions.ArityMismatchException;
import plainscript.common.exceptions.InvalidWriteException;
import plainscript.common.exceptions.UserException;
import plainscript.frontend.Bindings;
import plainscript.frontend.Context;
import plainscript.frontend.Variable;
import plainscript.jsbackend.JSGenerator;
import plainscript.jsbackend.tree.JSExpr;
import plainscript.jsbackend.tree.JSTree;
import plainscript.jsbackend.tree.LetDeclaration;
import plainscript.jsbackend.tree.Sequence;
import plainscript.jsbackend.tree.SetVariable;
import plainscript.opt.Optimizer;
import plainscript.opt.Optimizer.RewriteKind;

/**
 * Parallel assignment: all sources are evaluated before any target
 * is written.
 */
public final class AssignmentStatement extends Statement {
  private final List<VariableExpression> targets;
  private final List<Expression> sources;

  public AssignmentStatement(List<VariableExpression> targets,
                             List<Expression> sources) {
    this.targets = new ArrayList<VariableExpression>(targets);
    this.sources = new ArrayList<Expression>(sources);
  }

  public AssignmentStatement(VariableExpression target, Expression source) {
    this(Collections.singletonList(target),
         Collections.singletonList(source));
  }

  public List<VariableExpression> getTargets() {
    return Collections.unmodifiableList(targets);
  }

  public List<Expression> getSources() {
    return Collections.unmodifiableList(sources);
  }

  @Override
  public void analyze(Context context) throws UserException {
    if (targets.size() != sources.size()) {
      throw new ArityMismatchException(context, this, targets.size(),
                                       sources.size());
    }
    for (Expression source: sources) {
      source.analyze(context);
    }
    Set<String> written = new HashSet<String>();
    for (VariableExpression target: targets) {
      if (!written.add(target.getName())) {
        throw new InvalidWriteException(context, target, "Variable " +
              target.getName() + " is assigned twice in one statement");
      }
      target.analyzeAsTarget(context);
    }
  }

  /**
   * Drops pairs that copy a variable to itself
   */
  @Override
  public List<Statement> optimize(Optimizer opt) {
    for (int i = 0; i < sources.size(); i++) {
      sources.set(i, sources.get(i).optimize(opt));
    }
    if (opt.isNoopAssignEnabled()) {
      for (int i = targets.size() - 1; i >= 0; i--) {
        Expression source = sources.get(i);
        if (source instanceof VariableExpression &&
            ((VariableExpression)source).getName().equals(
                                        targets.get(i).getName())) {
          opt.recordRewrite(RewriteKind.NOOP_ASSIGN, this, null);
          targets.remove(i);
          sources.remove(i);
        }
      }
      if (targets.isEmpty()) {
        return Collections.emptyList();
      }
    }
    return Collections.<Statement>singletonList(this);
  }

  /**
   * New variables are declared with let: in the same statement if
   * every target is new, otherwise on separate lines before it.
   */
  @Override
  public JSTree generate(JSGenerator gen) {
    Bindings bindings = gen.getBindings();
    List<JSExpr> jsTargets = new ArrayList<JSExpr>(targets.size());
    List<JSExpr> jsSources = new ArrayList<JSExpr>(sources.size());
    List<Variable> introduced = new ArrayList<Variable>();
    for (VariableExpression target: targets) {
      Variable v = bindings.getIntroduced(target);
      if (v != null) {
        introduced.add(v);
      }
      jsTargets.add(target.generate(gen));
    }
    for (Expression source: sources) {
      jsSources.add(source.generate(gen));
    }

    if (introduced.isEmpty() || introduced.size() == targets.size()) {
      return new SetVariable(!introduced.isEmpty(), jsTargets, jsSources);
    }
    Sequence seq = new Sequence();
    for (Variable v: introduced) {
      seq.add(new LetDeclaration(gen.name(v)));
    }
    seq.add(new SetVariable(false, jsTargets, jsSources));
    return seq;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(Assign ");
    appendList(sb, "Targets", targets);
    sb.append(' ');
    appendList(sb, "Sources", sources);
    sb.append(')');
    return sb.toString();
  }
}

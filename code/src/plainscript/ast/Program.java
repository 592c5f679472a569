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
import plainscript.jsbackend.tree.Sequence;
import plainscript.opt.Optimizer;

/**
 * Root of the tree for one source unit
 */
public final class Program extends Node {
  private List<Statement> statements;

  public Program(List<Statement> statements) {
    this.statements = new ArrayList<Statement>(statements);
  }

  public List<Statement> getStatements() {
    return Collections.unmodifiableList(statements);
  }

  /**
   * Top-level code gets its own scope below the one holding built-ins,
   * so programs can shadow them.
   */
  @Override
  public void analyze(Context context) throws UserException {
    Context topLevel = context.createChildContext();
    for (Statement stmt: statements) {
      stmt.analyze(topLevel);
    }
  }

  public Program optimize(Optimizer opt) {
    statements = opt.optimizeBlock(statements);
    return this;
  }

  public Sequence generate(JSGenerator gen) {
    return gen.generateBlock(statements);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    appendList(sb, "Program", statements);
    return sb.toString();
  }
}

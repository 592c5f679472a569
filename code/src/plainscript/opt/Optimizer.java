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

package plainscript.opt;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;

import plainscript.ast.Node;
import plainscript.ast.Program;
import plainscript.ast.Statement;
import plainscript.common.Settings;

/**
 * Local rewriting of an analyzed tree.  Nodes optimize their own
 * children and call back here for block handling and the switches
 * for each kind of rewrite.  Running the optimizer on its own output
 * changes nothing.
 */
public class Optimizer {

  public static enum RewriteKind {
    CONSTANT_FOLD, SHORT_CIRCUIT, PRUNE_IF, PRUNE_WHILE, NOOP_ASSIGN,
    UNREACHABLE,
  }

  private final Logger logger;

  private final boolean constantFold;
  private final boolean deadCodeElim;
  private final boolean noopAssign;

  private final Multiset<RewriteKind> rewrites = HashMultiset.create();

  /**
   * Use settings to decide which rewrites are enabled
   * @param logger
   */
  public Optimizer(Logger logger) {
    this(logger, Settings.getBooleanUnchecked(Settings.OPT_CONSTANT_FOLD),
                 Settings.getBooleanUnchecked(Settings.OPT_DEAD_CODE_ELIM),
                 Settings.getBooleanUnchecked(Settings.OPT_NOOP_ASSIGN));
  }

  public Optimizer(Logger logger, boolean constantFold,
                   boolean deadCodeElim, boolean noopAssign) {
    this.logger = logger;
    this.constantFold = constantFold;
    this.deadCodeElim = deadCodeElim;
    this.noopAssign = noopAssign;
  }

  public Program optimize(Program program) {
    logger.debug("Optimizing program");
    program.optimize(this);
    if (logger.isDebugEnabled()) {
      logger.debug("Optimizer rewrites: " + rewrites);
    }
    return program;
  }

  /**
   * Optimize each statement of a block, splicing in replacements and
   * dropping removed statements.
   * @param block
   * @return new statement list for the block
   */
  public List<Statement> optimizeBlock(List<Statement> block) {
    List<Statement> result = new ArrayList<Statement>(block.size());
    for (int i = 0; i < block.size(); i++) {
      List<Statement> replacement = block.get(i).optimize(this);
      for (int j = 0; j < replacement.size(); j++) {
        Statement stmt = replacement.get(j);
        result.add(stmt);
        if (deadCodeElim && stmt.isTerminal()) {
          boolean dropped = j < replacement.size() - 1 ||
                            i < block.size() - 1;
          if (dropped) {
            recordRewrite(RewriteKind.UNREACHABLE, stmt, null);
          }
          return result;
        }
      }
    }
    return result;
  }

  /**
   * Note that a rewrite happened
   * @param kind
   * @param before
   * @param after replacement node, or null if removed
   */
  public void recordRewrite(RewriteKind kind, Node before, Node after) {
    rewrites.add(kind);
    if (logger.isDebugEnabled()) {
      if (after == null) {
        logger.debug(kind + ": removed " + before);
      } else {
        logger.debug(kind + ": " + before + " => " + after);
      }
    }
  }

  public boolean isConstantFoldEnabled() {
    return constantFold;
  }

  public boolean isDeadCodeElimEnabled() {
    return deadCodeElim;
  }

  public boolean isNoopAssignEnabled() {
    return noopAssign;
  }

  /**
   * @return how many of each kind of rewrite were made so far
   */
  public Multiset<RewriteKind> getRewriteCounts() {
    return ImmutableMultiset.copyOf(rewrites);
  }
}

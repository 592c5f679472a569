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

import java.util.List;

import plainscript.jsbackend.JSGenerator;
import plainscript.jsbackend.tree.JSTree;
import plainscript.opt.Optimizer;

public abstract class Statement extends Node {

  Statement() {
  }

  /**
   * Optimize children, then this statement.
   * @param opt
   * @return statements to put in place of this one: empty to remove it,
   *        or this statement itself, or any replacements
   */
  public abstract List<Statement> optimize(Optimizer opt);

  /**
   * Only call after successful analysis
   * @param gen
   * @return
   */
  public abstract JSTree generate(JSGenerator gen);

  /**
   * @return true if control never reaches the statement after this
   */
  public boolean isTerminal() {
    return false;
  }
}

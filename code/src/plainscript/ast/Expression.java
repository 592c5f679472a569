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

import plainscript.jsbackend.JSGenerator;
import plainscript.jsbackend.tree.JSExpr;
import plainscript.opt.Optimizer;

public abstract class Expression extends Node {

  Expression() {
  }

  /**
   * @param opt
   * @return this expression with optimized children, or a simpler
   *          expression with the same value
   */
  public abstract Expression optimize(Optimizer opt);

  public abstract JSExpr generate(JSGenerator gen);
}

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

import plainscript.frontend.Context;
import plainscript.jsbackend.JSGenerator;
import plainscript.jsbackend.tree.JSExpr;
import plainscript.jsbackend.tree.Token;
import plainscript.opt.Optimizer;

public final class BooleanLiteral extends Expression {
  private final boolean value;

  public BooleanLiteral(boolean value) {
    this.value = value;
  }

  /**
   * @param text "true" or "false"
   */
  public BooleanLiteral(String text) {
    this(Boolean.parseBoolean(text.trim()));
  }

  public boolean getValue() {
    return value;
  }

  @Override
  public void analyze(Context context) {
    // Nothing to check
  }

  @Override
  public Expression optimize(Optimizer opt) {
    return this;
  }

  @Override
  public JSExpr generate(JSGenerator gen) {
    return new Token(Boolean.toString(value));
  }

  @Override
  public String toString() {
    return "(Bool " + value + ")";
  }
}

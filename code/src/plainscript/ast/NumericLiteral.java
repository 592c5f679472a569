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

public final class NumericLiteral extends Expression {
  /** Values past this can't be printed exactly as a long */
  private static final double MAX_INTEGRAL_PRINT = 1e15;

  private final double value;

  public NumericLiteral(double value) {
    this.value = value;
  }

  public NumericLiteral(String text) {
    this(Double.parseDouble(text.trim()));
  }

  public double getValue() {
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
    return Token.number(formatNumber(value));
  }

  /**
   * Format as a JavaScript numeric literal: whole numbers without
   * a fractional part.
   * @param value a finite number
   * @return
   */
  public static String formatNumber(double value) {
    if (value == 0.0 && 1.0 / value < 0) {
      return "-0";
    }
    if (value == Math.rint(value) && Math.abs(value) < MAX_INTEGRAL_PRINT) {
      return Long.toString((long)value);
    }
    return Double.toString(value);
  }

  @Override
  public String toString() {
    return "(Num " + formatNumber(value) + ")";
  }
}

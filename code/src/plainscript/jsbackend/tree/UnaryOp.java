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

package plainscript.jsbackend.tree;

/**
 * Prefix operator
 */
public class UnaryOp extends JSExpr
{
  private final String op;
  private final JSExpr operand;

  public UnaryOp(String op, JSExpr operand)
  {
    this.op = op;
    this.operand = operand;
  }

  @Override
  public int precedence()
  {
    return UNARY_PRECEDENCE;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    sb.append(op);
    boolean parens = operand.precedence() < UNARY_PRECEDENCE;
    if (!parens && op.equals("-")) {
      // Avoid rendering - -x as the decrement operator
      String text = operand.toString();
      parens = text.startsWith("-");
    }
    appendOperand(sb, operand, parens);
  }
}

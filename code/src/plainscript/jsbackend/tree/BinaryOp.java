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
 * Infix operator.  All operators rendered through this class are
 * left-associative except assignment.
 */
public class BinaryOp extends JSExpr
{
  private final JSExpr left;
  private final String op;
  private final int precedence;
  private final JSExpr right;

  public BinaryOp(JSExpr left, String op, int precedence, JSExpr right)
  {
    this.left = left;
    this.op = op;
    this.precedence = precedence;
    this.right = right;
  }

  @Override
  public int precedence()
  {
    return precedence;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    boolean rightAssoc = precedence == ASSIGN_PRECEDENCE;
    appendOperand(sb, left, rightAssoc ? left.precedence() <= precedence
                                       : left.precedence() < precedence);
    sb.append(' ').append(op).append(' ');
    appendOperand(sb, right, rightAssoc ? right.precedence() < precedence
                                        : right.precedence() <= precedence);
  }
}

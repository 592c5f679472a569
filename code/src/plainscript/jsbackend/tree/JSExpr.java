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
 * JavaScript expression.  Rendered without indentation or terminator.
 * Precedence values follow the JavaScript operator precedence table:
 * higher binds tighter.
 */
public abstract class JSExpr extends JSTree
{
  public static final int ASSIGN_PRECEDENCE = 2;
  public static final int UNARY_PRECEDENCE = 14;
  public static final int CALL_PRECEDENCE = 17;
  public static final int PRIMARY_PRECEDENCE = 20;

  public abstract int precedence();

  /**
   * Append, in parentheses if needed
   * @param sb
   * @param parens
   */
  static void appendOperand(StringBuilder sb, JSExpr operand, boolean parens)
  {
    if (parens) {
      sb.append('(');
      operand.appendTo(sb);
      sb.append(')');
    } else {
      operand.appendTo(sb);
    }
  }
}

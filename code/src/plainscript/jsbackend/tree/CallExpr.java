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

import java.util.ArrayList;
import java.util.List;

public class CallExpr extends JSExpr
{
  private final JSExpr callee;
  private final List<JSExpr> args;

  public CallExpr(JSExpr callee, List<JSExpr> args)
  {
    this.callee = callee;
    this.args = new ArrayList<JSExpr>(args);
  }

  @Override
  public int precedence()
  {
    return CALL_PRECEDENCE;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    appendOperand(sb, callee, callee.precedence() < CALL_PRECEDENCE);
    sb.append('(');
    appendList(sb, args);
    sb.append(')');
  }

  /**
   * Comma separated list; elements never need parentheses
   */
  static void appendList(StringBuilder sb, List<? extends JSExpr> exprs)
  {
    boolean first = true;
    for (JSExpr e: exprs) {
      if (!first) {
        sb.append(", ");
      }
      first = false;
      e.appendTo(sb);
    }
  }
}

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

/**
 * Assignment to one or more variables.  Several targets are assigned
 * together by array destructuring.
 */
public class SetVariable extends JSTree
{
  private final boolean declare;
  private final List<JSExpr> targets;
  private final List<JSExpr> values;

  /**
   * @param declare if true, prefix with let
   * @param targets
   * @param values same length as targets
   */
  public SetVariable(boolean declare, List<JSExpr> targets,
                     List<JSExpr> values)
  {
    assert(targets.size() == values.size() && !targets.isEmpty());
    this.declare = declare;
    this.targets = new ArrayList<JSExpr>(targets);
    this.values = new ArrayList<JSExpr>(values);
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    if (declare) {
      sb.append("let ");
    }
    if (targets.size() == 1) {
      targets.get(0).appendTo(sb);
      sb.append(" = ");
      values.get(0).appendTo(sb);
    } else {
      new ArrayLiteral(targets).appendTo(sb);
      sb.append(" = ");
      new ArrayLiteral(values).appendTo(sb);
    }
    sb.append(";\n");
  }
}

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

import plainscript.common.exceptions.PSCRuntimeError;

/**
 * if / else if / else chain
 */
public class If extends JSTree
{
  private final List<JSExpr> conditions = new ArrayList<JSExpr>();
  private final List<Sequence> blocks = new ArrayList<Sequence>();
  private Sequence elseBlock = null;

  public If()
  {
  }

  public void addCase(JSExpr condition, Sequence block)
  {
    conditions.add(condition);
    blocks.add(block);
  }

  public void setElse(Sequence block)
  {
    this.elseBlock = block;
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    if (conditions.isEmpty()) {
      throw new PSCRuntimeError("if: no condition found");
    }
    indent(sb);
    for (int i = 0; i < conditions.size(); i++) {
      if (i > 0) {
        sb.append(" else ");
      }
      sb.append("if (");
      conditions.get(i).appendTo(sb);
      sb.append(") ");
      Sequence block = blocks.get(i);
      prepareChild(block, indentation);
      block.appendToAsBlock(sb);
    }
    if (elseBlock != null) {
      sb.append(" else ");
      prepareChild(elseBlock, indentation);
      elseBlock.appendToAsBlock(sb);
    }
    sb.append("\n");
  }
}

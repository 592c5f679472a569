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
 * Function declaration
 */
public class FunctionDef extends JSTree
{
  private final String name;
  private final List<JSExpr> params;
  private final Sequence body;

  /**
   * @param name
   * @param params parameter names, or name = default
   * @param body
   */
  public FunctionDef(String name, List<JSExpr> params, Sequence body)
  {
    checkFunctionName(name);
    this.name = name;
    this.params = new ArrayList<JSExpr>(params);
    this.body = body;
  }

  /**
   * Check that there are no invalid characters
   */
  private static void checkFunctionName(String name)
  {
    for (int i = 0; i < name.length(); i++) {
      char c = name.charAt(i);
      boolean ok = i == 0 ? Character.isJavaIdentifierStart(c)
                          : Character.isJavaIdentifierPart(c);
      if (!ok) {
        throw new PSCRuntimeError("Bad character '" + c +
                                  "' in JavaScript function name " + name);
      }
    }
  }

  @Override
  public void appendTo(StringBuilder sb)
  {
    indent(sb);
    sb.append("function ");
    sb.append(name);
    sb.append('(');
    CallExpr.appendList(sb, params);
    sb.append(") ");
    prepareChild(body, indentation);
    body.appendToAsBlock(sb);
    sb.append("\n");
  }
}

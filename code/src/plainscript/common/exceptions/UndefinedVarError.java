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

package plainscript.common.exceptions;

import plainscript.ast.Node;
import plainscript.frontend.Context;

public class UndefinedVarError
extends UserException
{
  private final String name;

  public UndefinedVarError(Context context, Node node, String name, String msg)
  {
    super(context, node, msg);
    this.name = name;
  }

  public static UndefinedVarError fromName(Context context, Node node,
                                           String varName) {
    return new UndefinedVarError(context, node, varName,
               "Identifier " + varName + " has not been declared");
  }

  public String getName() {
    return name;
  }

  private static final long serialVersionUID = 1L;
}

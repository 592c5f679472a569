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

package plainscript.frontend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import plainscript.ast.FunctionDeclaration;
import plainscript.ast.Parameter;

/**
 * Functions that every program can call without declaring them.
 * Their bodies are supplied by the code generator.
 */
public class Builtins {

  public static final String PRINT = "print";
  public static final String SQRT = "sqrt";

  /** Name of the single parameter of each library function */
  public static final String ARG_NAME = "_";

  private static final List<String> NAMES =
              Collections.unmodifiableList(Arrays.asList(PRINT, SQRT));

  public static List<String> names() {
    return NAMES;
  }

  /**
   * Create fresh, unanalyzed declarations of all built-ins.  Bodies
   * are null, which marks the functions as built-in.
   * @return
   */
  public static List<FunctionDeclaration> createDeclarations() {
    List<FunctionDeclaration> result = new ArrayList<FunctionDeclaration>();
    for (String name: NAMES) {
      List<Parameter> params = Collections.singletonList(
                                      new Parameter(ARG_NAME, null));
      result.add(new FunctionDeclaration(name, params, null));
    }
    return result;
  }
}

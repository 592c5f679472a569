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
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import plainscript.ast.Argument;
import plainscript.ast.Call;
import plainscript.ast.Parameter;
import plainscript.common.exceptions.CallBindingException;
import plainscript.common.exceptions.ParameterOrderException;

/**
 * Parameter names of a function, as needed to check calls.
 * All required parameters come before all optional ones.
 */
public class FunctionSignature {
  private final String function;

  /** All parameter names, in declaration order */
  private final List<String> allParameterNames;

  /** Names of parameters without a default, in declaration order */
  private final Set<String> requiredParameterNames;

  private FunctionSignature(String function, List<String> allParameterNames,
                            Set<String> requiredParameterNames) {
    this.function = function;
    this.allParameterNames = Collections.unmodifiableList(allParameterNames);
    this.requiredParameterNames =
                      Collections.unmodifiableSet(requiredParameterNames);
  }

  /**
   * Build the signature, checking that no required parameter follows an
   * optional one.
   * @param context context the parameters were declared in
   * @param function function name
   * @param params
   * @return
   * @throws ParameterOrderException
   */
  public static FunctionSignature fromParameters(Context context,
        String function, List<Parameter> params)
            throws ParameterOrderException {
    List<String> all = new ArrayList<String>();
    Set<String> required = new LinkedHashSet<String>();
    for (Parameter p: params) {
      all.add(p.getName());
      if (p.isRequired()) {
        required.add(p.getName());
        if (required.size() < all.size()) {
          throw new ParameterOrderException(context, function, p);
        }
      }
    }
    return new FunctionSignature(function, all, required);
  }

  /**
   * Match the arguments of a call to parameters.  Positional arguments
   * come first and bind in order; keyword arguments bind by name.
   * @param context context of the call
   * @param call
   * @return for each argument, the index of the parameter it binds to
   * @throws CallBindingException
   */
  public List<Integer> bindArguments(Context context, Call call)
      throws CallBindingException {
    List<Argument> args = call.getArgs();
    if (args.size() > allParameterNames.size()) {
      throw CallBindingException.tooManyArgs(context, call, function,
                                  allParameterNames.size(), args.size());
    }

    List<Integer> positions = new ArrayList<Integer>(args.size());
    Set<String> matched = new HashSet<String>();
    boolean keywordArgSeen = false;
    for (int i = 0; i < args.size(); i++) {
      Argument arg = args.get(i);
      String paramName;
      if (arg.isKeywordArgument()) {
        keywordArgSeen = true;
        paramName = arg.getName();
      } else if (keywordArgSeen) {
        throw CallBindingException.positionalAfterKeyword(context, arg,
                                                          function);
      } else {
        paramName = allParameterNames.get(i);
      }

      int pos = allParameterNames.indexOf(paramName);
      if (pos < 0) {
        throw CallBindingException.unknownParameter(context, arg, function,
                                                    paramName);
      }
      if (!matched.add(paramName)) {
        throw CallBindingException.multipleArgs(context, arg, function,
                                                paramName);
      }
      positions.add(pos);
    }

    for (String required: requiredParameterNames) {
      if (!matched.contains(required)) {
        throw CallBindingException.missingRequired(context, call, function,
                                                   required);
      }
    }
    return positions;
  }

  public String getFunction() {
    return function;
  }

  public List<String> getAllParameterNames() {
    return allParameterNames;
  }

  public Set<String> getRequiredParameterNames() {
    return requiredParameterNames;
  }

  @Override
  public String toString() {
    return "FunctionSignature: " + function + " " + allParameterNames +
           " required: " + requiredParameterNames;
  }
}

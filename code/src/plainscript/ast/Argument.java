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

package plainscript.ast;

import plainscript.common.exceptions.UserException;
import plainscript.frontend.Context;
import plainscript.jsbackend.JSGenerator;
import plainscript.jsbackend.tree.JSExpr;
import plainscript.opt.Optimizer;

/**
 * Argument of a call, either positional or keyword (name = value)
 */
public final class Argument extends Node {
  /** Parameter name for keyword arguments, otherwise null */
  private final String name;
  private Expression value;

  public Argument(String name, Expression value) {
    this.name = name;
    this.value = value;
  }

  public Argument(Expression value) {
    this(null, value);
  }

  public String getName() {
    return name;
  }

  public Expression getValue() {
    return value;
  }

  public boolean isKeywordArgument() {
    return name != null;
  }

  @Override
  public void analyze(Context context) throws UserException {
    value.analyze(context);
  }

  public void optimize(Optimizer opt) {
    value = value.optimize(opt);
  }

  public JSExpr generate(JSGenerator gen) {
    return value.generate(gen);
  }

  @Override
  public String toString() {
    if (name == null) {
      return "(Arg " + value + ")";
    }
    return "(Arg " + name + " " + value + ")";
  }
}

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

import java.util.List;

import plainscript.common.exceptions.UserException;
import plainscript.frontend.Context;

/**
 * Base of all PlainScript syntax tree nodes.
 *
 * The set of node classes is closed: constructors of the abstract
 * classes in this package are package-private, and the concrete
 * classes are final.
 */
public abstract class Node {

  Node() {
  }

  /**
   * Check this node and its children, recording resolved names in the
   * bindings of the context.  Stops at the first error.
   * @param context scope this node appears in
   * @throws UserException
   */
  public abstract void analyze(Context context) throws UserException;

  /**
   * @return a structural dump, e.g. (Binary + (Num 3) (Var x)).  Two
   *        trees with the same dump have the same structure.
   */
  @Override
  public abstract String toString();

  static void appendList(StringBuilder sb, String tag,
                         List<? extends Node> nodes) {
    sb.append('(').append(tag);
    for (Node n: nodes) {
      sb.append(' ').append(n.toString());
    }
    sb.append(')');
  }
}

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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

import plainscript.ast.Call;
import plainscript.ast.FunctionDeclaration;
import plainscript.ast.VariableExpression;
import plainscript.common.exceptions.PSCRuntimeError;

/**
 * Results of semantic analysis, kept in a side table keyed by node
 * identity rather than stored in the nodes.  Analysing the same tree
 * again with a fresh GlobalContext gives an independent table.
 */
public class Bindings {

  /** Declaration each variable expression resolved to */
  private final Map<VariableExpression, Declaration> referents =
                  new IdentityHashMap<VariableExpression, Declaration>();

  /** Reverse of referents: expressions resolved to each declaration */
  private final ListMultimap<Declaration, VariableExpression> references =
                  ArrayListMultimap.create();

  private final Map<FunctionDeclaration, FunctionSignature> signatures =
                  new IdentityHashMap<FunctionDeclaration, FunctionSignature>();

  /** For each call, index of parameter each argument binds to */
  private final Map<Call, List<Integer>> argPositions =
                  new IdentityHashMap<Call, List<Integer>>();

  /** Assignment targets that introduced a new variable */
  private final Map<VariableExpression, Variable> introduced =
                  new IdentityHashMap<VariableExpression, Variable>();

  public void bind(VariableExpression expr, Declaration decl) {
    Declaration prev = referents.put(expr, decl);
    assert(prev == null || prev == decl) : "Rebinding " + expr;
    if (prev == null) {
      references.put(decl, expr);
    }
  }

  /**
   * @param expr an analyzed expression
   * @return the declaration expr resolved to
   */
  public Declaration getReferent(VariableExpression expr) {
    Declaration decl = referents.get(expr);
    if (decl == null) {
      throw new PSCRuntimeError("Variable expression " + expr +
                                " was not analyzed");
    }
    return decl;
  }

  /**
   * @param decl
   * @return expressions that were resolved to decl, in analysis order
   */
  public List<VariableExpression> getReferences(Declaration decl) {
    return Collections.unmodifiableList(references.get(decl));
  }

  public void setSignature(FunctionDeclaration function,
                           FunctionSignature signature) {
    signatures.put(function, signature);
  }

  public FunctionSignature getSignature(FunctionDeclaration function) {
    FunctionSignature sig = signatures.get(function);
    if (sig == null) {
      throw new PSCRuntimeError("Function " + function.getName() +
                                " was not analyzed");
    }
    return sig;
  }

  public void setArgumentPositions(Call call, List<Integer> positions) {
    argPositions.put(call, Collections.unmodifiableList(positions));
  }

  public List<Integer> getArgumentPositions(Call call) {
    List<Integer> positions = argPositions.get(call);
    if (positions == null) {
      throw new PSCRuntimeError("Call " + call + " was not analyzed");
    }
    return positions;
  }

  public void introduce(VariableExpression target, Variable var) {
    introduced.put(target, var);
  }

  /**
   * @param target an assignment target
   * @return the variable the target introduced, or null if it assigns
   *          an existing declaration
   */
  public Variable getIntroduced(VariableExpression target) {
    return introduced.get(target);
  }
}

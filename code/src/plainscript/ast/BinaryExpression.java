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

import plainscript.common.exceptions.PSCRuntimeError;
import plainscript.common.exceptions.UserException;
import plainscript.frontend.Context;
import plainscript.jsbackend.BuiltinOps;
import plainscript.jsbackend.JSGenerator;
import plainscript.jsbackend.tree.BinaryOp;
import plainscript.jsbackend.tree.JSExpr;
import plainscript.opt.ConstantFolder;
import plainscript.opt.Optimizer;
import plainscript.opt.Optimizer.RewriteKind;

public final class BinaryExpression extends Expression {
  private final Operator op;
  private Expression left;
  private Expression right;

  public BinaryExpression(Operator op, Expression left, Expression right) {
    this.op = op;
    this.left = left;
    this.right = right;
  }

  /**
   * @param op operator as written in source, e.g. "<=" or "and"
   */
  public BinaryExpression(String op, Expression left, Expression right) {
    this(Operator.fromSymbol(op), left, right);
  }

  public Operator getOp() {
    return op;
  }

  public Expression getLeft() {
    return left;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  public void analyze(Context context) throws UserException {
    left.analyze(context);
    right.analyze(context);
  }

  @Override
  public Expression optimize(Optimizer opt) {
    left = left.optimize(opt);
    right = right.optimize(opt);
    if (!opt.isConstantFoldEnabled()) {
      return this;
    }
    Expression folded = ConstantFolder.fold(op, left, right);
    if (folded != null) {
      opt.recordRewrite(RewriteKind.CONSTANT_FOLD, this, folded);
      return folded;
    }
    folded = ConstantFolder.shortCircuit(op, left, right);
    if (folded != null) {
      opt.recordRewrite(RewriteKind.SHORT_CIRCUIT, this, folded);
      return folded;
    }
    return this;
  }

  @Override
  public JSExpr generate(JSGenerator gen) {
    return new BinaryOp(left.generate(gen), BuiltinOps.jsOperator(op),
                        BuiltinOps.precedence(op), right.generate(gen));
  }

  @Override
  public String toString() {
    return "(Binary " + op.symbol() + " " + left + " " + right + ")";
  }

  public static enum Operator {
    OR("or"), AND("and"),
    LT("<"), LTE("<="), EQ("=="), NEQ("!="), GTE(">="), GT(">"),
    PLUS("+"), MINUS("-"), TIMES("*"), DIVIDE("/");

    private final String symbol;

    private Operator(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }

    public boolean isLogical() {
      return this == OR || this == AND;
    }

    /**
     * Case-insensitive for the word operators
     */
    public static Operator fromSymbol(String symbol) {
      for (Operator op: values()) {
        if (op.symbol.equalsIgnoreCase(symbol)) {
          return op;
        }
      }
      throw new PSCRuntimeError("Unknown binary operator " + symbol);
    }
  }
}

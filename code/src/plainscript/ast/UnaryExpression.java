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
import plainscript.jsbackend.tree.JSExpr;
import plainscript.jsbackend.tree.UnaryOp;
import plainscript.opt.ConstantFolder;
import plainscript.opt.Optimizer;
import plainscript.opt.Optimizer.RewriteKind;

public final class UnaryExpression extends Expression {
  private final Operator op;
  private Expression operand;

  public UnaryExpression(Operator op, Expression operand) {
    this.op = op;
    this.operand = operand;
  }

  public UnaryExpression(String op, Expression operand) {
    this(Operator.fromSymbol(op), operand);
  }

  public Operator getOp() {
    return op;
  }

  public Expression getOperand() {
    return operand;
  }

  @Override
  public void analyze(Context context) throws UserException {
    operand.analyze(context);
  }

  @Override
  public Expression optimize(Optimizer opt) {
    operand = operand.optimize(opt);
    if (!opt.isConstantFoldEnabled()) {
      return this;
    }
    Expression folded = ConstantFolder.foldUnary(op, operand);
    if (folded == null) {
      return this;
    }
    opt.recordRewrite(RewriteKind.CONSTANT_FOLD, this, folded);
    return folded;
  }

  @Override
  public JSExpr generate(JSGenerator gen) {
    return new UnaryOp(BuiltinOps.jsOperator(op), operand.generate(gen));
  }

  @Override
  public String toString() {
    return "(Unary " + op.symbol() + " " + operand + ")";
  }

  public static enum Operator {
    NEGATE("-"), NOT("not");

    private final String symbol;

    private Operator(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }

    public static Operator fromSymbol(String symbol) {
      for (Operator op: values()) {
        if (op.symbol.equalsIgnoreCase(symbol)) {
          return op;
        }
      }
      throw new PSCRuntimeError("Unknown unary operator " + symbol);
    }
  }
}

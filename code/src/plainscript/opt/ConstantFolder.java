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

package plainscript.opt;

import plainscript.ast.BinaryExpression;
import plainscript.ast.BooleanLiteral;
import plainscript.ast.Expression;
import plainscript.ast.NumericLiteral;
import plainscript.ast.UnaryExpression;

/**
 * Compile time evaluation of operators with literal operands
 */
public class ConstantFolder {

  /**
   * Try to evaluate operator with both operands known
   *
   * @return a literal with the value of the expression, or null if it
   *        can't be evaluated at compile time
   */
  public static Expression fold(BinaryExpression.Operator op,
                                Expression left, Expression right) {
    if (left instanceof NumericLiteral && right instanceof NumericLiteral) {
      return evalNumOp(op, ((NumericLiteral)left).getValue(),
                           ((NumericLiteral)right).getValue());
    } else if (left instanceof BooleanLiteral &&
               right instanceof BooleanLiteral) {
      return evalBoolOp(op, ((BooleanLiteral)left).getValue(),
                            ((BooleanLiteral)right).getValue());
    }
    return null;
  }

  /**
   * Simplify and/or where only the left operand is known.  Skipping
   * the right operand matches the evaluation order at runtime.
   * @return the simplified expression, or null
   */
  public static Expression shortCircuit(BinaryExpression.Operator op,
                                        Expression left, Expression right) {
    if (!op.isLogical() || !(left instanceof BooleanLiteral)) {
      return null;
    }
    boolean arg1 = ((BooleanLiteral)left).getValue();
    if (op == BinaryExpression.Operator.AND) {
      return arg1 ? right : left;
    } else {
      return arg1 ? left : right;
    }
  }

  public static Expression foldUnary(UnaryExpression.Operator op,
                                     Expression operand) {
    switch (op) {
      case NEGATE:
        if (operand instanceof NumericLiteral) {
          return new NumericLiteral(-((NumericLiteral)operand).getValue());
        }
        break;
      case NOT:
        if (operand instanceof BooleanLiteral) {
          return new BooleanLiteral(!((BooleanLiteral)operand).getValue());
        }
        break;
      default:
        // fall through
    }
    return null;
  }

  private static Expression evalNumOp(BinaryExpression.Operator op,
                                      double arg1, double arg2) {
    double result;
    switch (op) {
      case PLUS:
        result = arg1 + arg2;
        break;
      case MINUS:
        result = arg1 - arg2;
        break;
      case TIMES:
        result = arg1 * arg2;
        break;
      case DIVIDE:
        if (arg2 == 0.0) {
          // Leave for runtime
          return null;
        }
        result = arg1 / arg2;
        break;
      case LT:
        return new BooleanLiteral(arg1 < arg2);
      case LTE:
        return new BooleanLiteral(arg1 <= arg2);
      case EQ:
        return new BooleanLiteral(arg1 == arg2);
      case NEQ:
        return new BooleanLiteral(arg1 != arg2);
      case GTE:
        return new BooleanLiteral(arg1 >= arg2);
      case GT:
        return new BooleanLiteral(arg1 > arg2);
      default:
        return null;
    }
    if (Double.isNaN(result) || Double.isInfinite(result)) {
      return null;
    }
    return new NumericLiteral(result);
  }

  private static Expression evalBoolOp(BinaryExpression.Operator op,
                                       boolean arg1, boolean arg2) {
    switch (op) {
      case AND:
        return new BooleanLiteral(arg1 && arg2);
      case OR:
        return new BooleanLiteral(arg1 || arg2);
      case EQ:
        return new BooleanLiteral(arg1 == arg2);
      case NEQ:
        return new BooleanLiteral(arg1 != arg2);
      default:
        return null;
    }
  }
}

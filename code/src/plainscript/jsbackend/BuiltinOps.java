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

package plainscript.jsbackend;

import java.util.Collections;

import plainscript.ast.BinaryExpression;
import plainscript.ast.UnaryExpression;
import plainscript.common.exceptions.PSCRuntimeError;
import plainscript.frontend.Builtins;
import plainscript.jsbackend.tree.CallExpr;
import plainscript.jsbackend.tree.ExprStatement;
import plainscript.jsbackend.tree.JSExpr;
import plainscript.jsbackend.tree.JSTree;
import plainscript.jsbackend.tree.Return;
import plainscript.jsbackend.tree.Sequence;
import plainscript.jsbackend.tree.Token;

/**
 * JavaScript for PlainScript operators and built-in functions
 */
public class BuiltinOps {

  public static String jsOperator(BinaryExpression.Operator op) {
    switch (op) {
      case OR:
        return "||";
      case AND:
        return "&&";
      case EQ:
        return "===";
      case NEQ:
        return "!==";
      case LT:
      case LTE:
      case GTE:
      case GT:
      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
        return op.symbol();
      default:
        throw new PSCRuntimeError("Unknown operator " + op);
    }
  }

  public static String jsOperator(UnaryExpression.Operator op) {
    switch (op) {
      case NEGATE:
        return "-";
      case NOT:
        return "!";
      default:
        throw new PSCRuntimeError("Unknown operator " + op);
    }
  }

  /**
   * @return JavaScript precedence of the operator op maps to
   */
  public static int precedence(BinaryExpression.Operator op) {
    switch (op) {
      case OR:
        return 3;
      case AND:
        return 4;
      case EQ:
      case NEQ:
        return 8;
      case LT:
      case LTE:
      case GTE:
      case GT:
        return 9;
      case PLUS:
      case MINUS:
        return 11;
      case TIMES:
      case DIVIDE:
        return 12;
      default:
        throw new PSCRuntimeError("Unknown operator " + op);
    }
  }

  /**
   * Body of a built-in function, using its single parameter
   * @param builtin name of built-in
   * @return
   */
  public static Sequence builtinBody(String builtin) {
    JSExpr arg = new Token(Builtins.ARG_NAME);
    JSTree stmt;
    if (builtin.equals(Builtins.PRINT)) {
      stmt = new ExprStatement(new CallExpr(new Token("console.log"),
                                         Collections.singletonList(arg)));
    } else if (builtin.equals(Builtins.SQRT)) {
      stmt = new Return(new CallExpr(new Token("Math.sqrt"),
                                     Collections.singletonList(arg)));
    } else {
      throw new PSCRuntimeError("No implementation for built-in " + builtin);
    }
    Sequence body = new Sequence();
    body.add(stmt);
    return body;
  }
}

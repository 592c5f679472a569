package plainscript.ast;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shorthand for building trees the way a parser would
 */
public class TestTrees {

  public static Program program(Statement... stmts) {
    return new Program(Arrays.asList(stmts));
  }

  public static List<Statement> block(Statement... stmts) {
    return new ArrayList<Statement>(Arrays.asList(stmts));
  }

  public static VariableExpression var(String name) {
    return new VariableExpression(name);
  }

  public static NumericLiteral num(double value) {
    return new NumericLiteral(value);
  }

  public static BooleanLiteral bool(boolean value) {
    return new BooleanLiteral(value);
  }

  public static BinaryExpression bin(String op, Expression left,
                                     Expression right) {
    return new BinaryExpression(op, left, right);
  }

  public static UnaryExpression unary(String op, Expression operand) {
    return new UnaryExpression(op, operand);
  }

  public static AssignmentStatement assign(String target, Expression source) {
    return new AssignmentStatement(var(target), source);
  }

  public static AssignmentStatement assignAll(List<String> targets,
                                              List<Expression> sources) {
    List<VariableExpression> vars = new ArrayList<VariableExpression>();
    for (String t: targets) {
      vars.add(var(t));
    }
    return new AssignmentStatement(vars, sources);
  }

  public static Argument arg(Expression value) {
    return new Argument(value);
  }

  public static Argument kwarg(String name, Expression value) {
    return new Argument(name, value);
  }

  public static Call call(String function, Argument... args) {
    return new Call(function, Arrays.asList(args));
  }

  public static CallStatement callStmt(String function, Argument... args) {
    return new CallStatement(call(function, args));
  }

  public static Parameter param(String name) {
    return new Parameter(name, null);
  }

  public static Parameter param(String name, Expression defaultValue) {
    return new Parameter(name, defaultValue);
  }

  public static List<Parameter> params(Parameter... params) {
    return Arrays.asList(params);
  }

  public static FunctionDeclaration function(String name,
                          List<Parameter> params, Statement... body) {
    return new FunctionDeclaration(name, params, Arrays.asList(body));
  }

  public static IfStatement ifElse(Expression test, List<Statement> then,
                                   List<Statement> otherwise) {
    List<IfStatement.Case> cases = new ArrayList<IfStatement.Case>();
    cases.add(new IfStatement.Case(test, then));
    return new IfStatement(cases, otherwise);
  }

  public static IfStatement.Case ifCase(Expression test, Statement... body) {
    return new IfStatement.Case(test, Arrays.asList(body));
  }

  public static IfStatement ifChain(List<Statement> otherwise,
                                    IfStatement.Case... cases) {
    return new IfStatement(Arrays.asList(cases), otherwise);
  }

  public static WhileStatement whileLoop(Expression test, Statement... body) {
    return new WhileStatement(test, Arrays.asList(body));
  }

  public static ReturnStatement ret(Expression value) {
    return new ReturnStatement(value);
  }
}

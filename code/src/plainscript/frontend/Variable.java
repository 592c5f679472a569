package plainscript.frontend;

import plainscript.ast.VariableExpression;
import plainscript.frontend.Context.DefKind;

/**
 * A local variable.  There is no declaration syntax: the first
 * assignment to a name that isn't visible introduces one in the
 * scope of the assignment.
 */
public class Variable implements Declaration {
  private final String name;
  private final VariableExpression declaringTarget;

  public Variable(String name, VariableExpression declaringTarget) {
    this.name = name;
    this.declaringTarget = declaringTarget;
  }

  @Override
  public String getName() {
    return name;
  }

  @Override
  public DefKind getKind() {
    return DefKind.VARIABLE;
  }

  /**
   * @return the assignment target that introduced the variable
   */
  @Override
  public VariableExpression getNode() {
    return declaringTarget;
  }

  @Override
  public String toString() {
    return "Variable: " + name;
  }
}

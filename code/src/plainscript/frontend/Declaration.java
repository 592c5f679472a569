package plainscript.frontend;

import plainscript.ast.Node;
import plainscript.frontend.Context.DefKind;

/**
 * Something that introduces a name that can be bound in a scope:
 * a function, a parameter or a variable.
 *
 * Declarations are compared by identity: two declarations with the same
 * name in different scopes are different entities.
 */
public interface Declaration {

  public String getName();

  public DefKind getKind();

  /**
   * @return the node that introduced the declaration
   */
  public Node getNode();
}

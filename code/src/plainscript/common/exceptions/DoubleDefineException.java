package plainscript.common.exceptions;

import plainscript.ast.Node;
import plainscript.frontend.Context;
import plainscript.frontend.Declaration;

/**
 * A name was declared twice in the same scope
 */
public class DoubleDefineException extends UserException {

  private final String name;

  public DoubleDefineException(Context context, Node node, String name,
                               Declaration existing) {
    super(context, node, "Identifier " + name + " already declared in this "
        + "scope as a " + existing.getKind().humanReadable());
    this.name = name;
  }

  public String getName() {
    return name;
  }

  private static final long serialVersionUID = 1L;
}

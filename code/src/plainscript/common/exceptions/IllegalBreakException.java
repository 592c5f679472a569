package plainscript.common.exceptions;

import plainscript.ast.Node;
import plainscript.frontend.Context;

public class IllegalBreakException extends UserException {

  public IllegalBreakException(Context context, Node node) {
    super(context, node, "Break statement outside loop");
  }

  private static final long serialVersionUID = 1L;
}

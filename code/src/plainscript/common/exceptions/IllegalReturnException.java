package plainscript.common.exceptions;

import plainscript.ast.Node;
import plainscript.frontend.Context;

public class IllegalReturnException extends UserException {

  public IllegalReturnException(Context context, Node node) {
    super(context, node, "Return statement outside function");
  }

  private static final long serialVersionUID = 1L;
}

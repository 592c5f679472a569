package plainscript.common.exceptions;

import plainscript.ast.Node;
import plainscript.frontend.Context;

/**
 * Used when an assignment targets something that can't be assigned,
 * e.g. a function
 */
public class InvalidWriteException extends UserException {

  private static final long serialVersionUID = 1L;

  public InvalidWriteException(Context context, Node node, String message) {
    super(context, node, message);
  }

}

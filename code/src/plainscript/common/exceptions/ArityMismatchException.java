package plainscript.common.exceptions;

import plainscript.ast.Node;
import plainscript.frontend.Context;

/**
 * Number of assignment targets doesn't match the number of sources
 */
public class ArityMismatchException extends UserException {

  private final int expected;
  private final int actual;

  public ArityMismatchException(Context context, Node node,
                                int expected, int actual) {
    super(context, node, "Number of variables (" + expected + ") does not " +
          "equal number of expressions (" + actual + ")");
    this.expected = expected;
    this.actual = actual;
  }

  /** @return number of targets */
  public int getExpected() {
    return expected;
  }

  /** @return number of sources */
  public int getActual() {
    return actual;
  }

  private static final long serialVersionUID = 1L;
}

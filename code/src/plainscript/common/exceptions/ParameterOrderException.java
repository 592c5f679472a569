package plainscript.common.exceptions;

import plainscript.ast.Parameter;
import plainscript.frontend.Context;

/**
 * A required parameter was declared after an optional one
 */
public class ParameterOrderException extends UserException {

  public ParameterOrderException(Context context, String function,
                                 Parameter param) {
    super(context, param, "Required parameter " + param.getName() +
          " of " + function + " cannot appear after an optional parameter");
  }

  @Override
  public Parameter getNode() {
    return (Parameter)super.getNode();
  }

  private static final long serialVersionUID = 1L;
}

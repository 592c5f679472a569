package plainscript.common.exceptions;

import plainscript.ast.Node;
import plainscript.frontend.Context;

/**
 * Arguments of a call could not be matched up with the parameters
 * of the function called
 */
public class CallBindingException extends UserException {

  private final String function;
  /** Parameter the problem concerns, null if none in particular */
  private final String parameter;

  private CallBindingException(Context context, Node node, String function,
                               String parameter, String message) {
    super(context, node, message);
    this.function = function;
    this.parameter = parameter;
  }

  public static CallBindingException tooManyArgs(Context context, Node node,
                                    String function, int expected, int actual) {
    return new CallBindingException(context, node, function, null,
        "Too many arguments in call to " + function + ": expected at most " +
        expected + " but got " + actual);
  }

  public static CallBindingException positionalAfterKeyword(Context context,
                                                Node node, String function) {
    return new CallBindingException(context, node, function, null,
        "Positional argument in call to " + function +
        " after keyword argument");
  }

  public static CallBindingException unknownParameter(Context context,
                            Node node, String function, String parameter) {
    return new CallBindingException(context, node, function, parameter,
        "Function " + function + " does not have a parameter called " +
        parameter);
  }

  public static CallBindingException multipleArgs(Context context,
                            Node node, String function, String parameter) {
    return new CallBindingException(context, node, function, parameter,
        "Multiple arguments for parameter " + parameter + " in call to " +
        function);
  }

  public static CallBindingException missingRequired(Context context,
                            Node node, String function, String parameter) {
    return new CallBindingException(context, node, function, parameter,
        "Required parameter " + parameter + " is not matched in call to " +
        function);
  }

  public String getFunction() {
    return function;
  }

  public String getParameter() {
    return parameter;
  }

  private static final long serialVersionUID = 1L;
}

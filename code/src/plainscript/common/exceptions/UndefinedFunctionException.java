package plainscript.common.exceptions;

import plainscript.ast.Node;
import plainscript.frontend.Context;
import plainscript.frontend.Declaration;

public class UndefinedFunctionException
extends UserException
{
  public UndefinedFunctionException(Context context, Node node, String msg)
  {
    super(context, node, msg);
  }

  public static UndefinedFunctionException notAFunction(Context context,
                                    Node node, Declaration decl) {
    return new UndefinedFunctionException(context, node, decl.getName() +
              " is a " + decl.getKind().humanReadable() + ", not a function");
  }

  private static final long serialVersionUID = 1L;
}

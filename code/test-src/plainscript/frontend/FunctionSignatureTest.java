package plainscript.frontend;

import static org.junit.Assert.assertEquals;
import static plainscript.ast.TestTrees.arg;
import static plainscript.ast.TestTrees.call;
import static plainscript.ast.TestTrees.kwarg;
import static plainscript.ast.TestTrees.num;
import static plainscript.ast.TestTrees.param;
import static plainscript.ast.TestTrees.params;

import java.util.Arrays;
import java.util.List;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import plainscript.ast.Argument;
import plainscript.common.Logging;
import plainscript.common.exceptions.CallBindingException;
import plainscript.common.exceptions.ParameterOrderException;

public class FunctionSignatureTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private Context context;

  /** f(a, b = 2, c = 3) */
  private FunctionSignature sig;

  @Before
  public void setup() throws ParameterOrderException {
    context = new GlobalContext(Logging.getPSCLogger()).createChildContext();
    sig = FunctionSignature.fromParameters(context, "f",
        params(param("a"), param("b", num(2)), param("c", num(3))));
  }

  private List<Integer> bind(Argument... args) throws CallBindingException {
    return sig.bindArguments(context, call("f", args));
  }

  @Test
  public void testNames() {
    assertEquals(Arrays.asList("a", "b", "c"), sig.getAllParameterNames());
    assertEquals(1, sig.getRequiredParameterNames().size());
    assertEquals("f", sig.getFunction());
  }

  @Test
  public void testOrderViolation() throws ParameterOrderException {
    exception.expect(ParameterOrderException.class);
    exception.expectMessage("Required parameter y");
    FunctionSignature.fromParameters(context, "g",
        params(param("x", num(1)), param("y")));
  }

  @Test
  public void testPositional() throws CallBindingException {
    assertEquals(Arrays.asList(0), bind(arg(num(1))));
    assertEquals(Arrays.asList(0, 1, 2),
                 bind(arg(num(1)), arg(num(2)), arg(num(3))));
  }

  @Test
  public void testKeyword() throws CallBindingException {
    assertEquals(Arrays.asList(2, 0),
                 bind(kwarg("c", num(1)), kwarg("a", num(2))));
  }

  @Test
  public void testTooMany() throws CallBindingException {
    exception.expect(CallBindingException.class);
    bind(arg(num(1)), arg(num(2)), arg(num(3)), arg(num(4)));
  }

  @Test
  public void testPositionalAfterKeyword() throws CallBindingException {
    exception.expect(CallBindingException.class);
    exception.expectMessage("after keyword argument");
    bind(kwarg("a", num(1)), arg(num(2)));
  }

  @Test
  public void testUnknownName() throws CallBindingException {
    try {
      bind(arg(num(1)), kwarg("z", num(2)));
      throw new AssertionError("Expected CallBindingException");
    } catch (CallBindingException e) {
      assertEquals("z", e.getParameter());
      assertEquals("f", e.getFunction());
    }
  }

  @Test
  public void testMultipleArgs() throws CallBindingException {
    exception.expect(CallBindingException.class);
    exception.expectMessage("Multiple arguments for parameter a");
    bind(arg(num(1)), kwarg("a", num(2)));
  }

  @Test
  public void testMissingRequired() throws CallBindingException {
    exception.expect(CallBindingException.class);
    exception.expectMessage("Required parameter a");
    bind(kwarg("b", num(1)));
  }
}

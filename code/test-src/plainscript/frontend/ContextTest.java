package plainscript.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import plainscript.ast.FunctionDeclaration;
import plainscript.ast.Parameter;
import plainscript.ast.Statement;
import plainscript.ast.VariableExpression;
import plainscript.common.Logging;
import plainscript.common.exceptions.DoubleDefineException;
import plainscript.common.exceptions.UndefinedVarError;

public class ContextTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private GlobalContext globals;

  @Before
  public void setup() {
    globals = new GlobalContext(Logging.getPSCLogger());
  }

  private static Variable variable(String name) {
    return new Variable(name, new VariableExpression(name));
  }

  @Test
  public void testBuiltinsDeclared() throws UndefinedVarError {
    assertEquals(Arrays.asList("print", "sqrt"), Builtins.names());
    assertEquals(2, globals.getBuiltins().size());
    Declaration print = globals.lookup("print");
    assertEquals(Context.DefKind.FUNCTION, print.getKind());
    assertTrue(globals.isBuiltin(print));
    assertEquals(0, globals.getLevel());
  }

  @Test
  public void testLookupOutward() throws Exception {
    Variable x = variable("x");
    Context top = globals.createChildContext();
    top.addVariable(x);
    Context inner = top.createChildContext().createLoopContext();
    assertSame(x, inner.lookup("x"));
    assertEquals(3, inner.getLevel());
    assertNull(globals.lookupUnsafe("x"));
  }

  @Test
  public void testShadowing() throws Exception {
    Variable outer = variable("x");
    Variable inner = variable("x");
    Context top = globals.createChildContext();
    top.addVariable(outer);
    Context block = top.createChildContext();
    block.addVariable(inner);
    assertSame(inner, block.lookup("x"));
    assertSame(outer, top.lookup("x"));
  }

  @Test
  public void testDoubleDefine() throws Exception {
    Context top = globals.createChildContext();
    top.addVariable(variable("x"));
    try {
      top.addVariable(variable("x"));
      throw new AssertionError("Expected DoubleDefineException");
    } catch (DoubleDefineException e) {
      assertEquals("x", e.getName());
    }
  }

  @Test
  public void testUndefined() throws UndefinedVarError {
    exception.expect(UndefinedVarError.class);
    exception.expectMessage("Identifier y has not been declared");
    globals.createChildContext().lookup("y");
  }

  @Test
  public void testLoopAndFunctionFlags() {
    FunctionDeclaration f = new FunctionDeclaration("f",
        Collections.<Parameter>emptyList(),
        Collections.<Statement>emptyList());
    Context top = globals.createChildContext();
    assertFalse(top.isInLoop());
    assertNull(top.getFunction());
    assertEquals("", top.getLocation());

    Context loop = top.createLoopContext();
    assertTrue(loop.isInLoop());
    assertTrue("Blocks inherit loop", loop.createChildContext().isInLoop());

    Context fn = loop.createFunctionContext(f);
    assertFalse("Function body is not in the loop", fn.isInLoop());
    assertSame(f, fn.getFunction());
    assertSame(f, fn.createChildContext().getFunction());
    assertEquals("in function f: ", fn.getLocation());
    assertTrue(fn.createLoopContext().isInLoop());
  }

  @Test
  public void testScopeDeclarationsInOrder() throws Exception {
    Context top = globals.createChildContext();
    Variable b = variable("b");
    Variable a = variable("a");
    top.addVariable(b);
    top.addVariable(a);
    assertEquals(Arrays.<Declaration>asList(b, a),
                 new ArrayList<Declaration>(top.getScopeDeclarations()));
    assertSame(globals.getBindings(), top.getBindings());
  }
}

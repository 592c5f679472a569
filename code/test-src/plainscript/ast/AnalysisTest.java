package plainscript.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static plainscript.ast.TestTrees.arg;
import static plainscript.ast.TestTrees.assign;
import static plainscript.ast.TestTrees.assignAll;
import static plainscript.ast.TestTrees.bin;
import static plainscript.ast.TestTrees.block;
import static plainscript.ast.TestTrees.call;
import static plainscript.ast.TestTrees.callStmt;
import static plainscript.ast.TestTrees.function;
import static plainscript.ast.TestTrees.ifElse;
import static plainscript.ast.TestTrees.kwarg;
import static plainscript.ast.TestTrees.num;
import static plainscript.ast.TestTrees.param;
import static plainscript.ast.TestTrees.params;
import static plainscript.ast.TestTrees.program;
import static plainscript.ast.TestTrees.ret;
import static plainscript.ast.TestTrees.var;
import static plainscript.ast.TestTrees.whileLoop;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import plainscript.common.Logging;
import plainscript.common.exceptions.ArityMismatchException;
import plainscript.common.exceptions.CallBindingException;
import plainscript.common.exceptions.DoubleDefineException;
import plainscript.common.exceptions.IllegalBreakException;
import plainscript.common.exceptions.IllegalReturnException;
import plainscript.common.exceptions.InvalidWriteException;
import plainscript.common.exceptions.ParameterOrderException;
import plainscript.common.exceptions.UndefinedFunctionException;
import plainscript.common.exceptions.UndefinedVarError;
import plainscript.common.exceptions.UserException;
import plainscript.frontend.Bindings;
import plainscript.frontend.Context.DefKind;
import plainscript.frontend.Declaration;
import plainscript.frontend.GlobalContext;
import plainscript.frontend.Variable;

public class AnalysisTest {

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static GlobalContext analyze(Program program) throws UserException {
    GlobalContext globals = new GlobalContext(Logging.getPSCLogger());
    program.analyze(globals);
    return globals;
  }

  @Test
  public void testResolvesToNearestDeclaration() throws UserException {
    VariableExpression outerUse = var("x");
    VariableExpression innerUse = var("x");
    Parameter p = param("x");
    Program prog = program(
        assign("x", num(1)),
        function("f", params(p), ret(innerUse)),
        callStmt("print", arg(outerUse)));
    Bindings b = analyze(prog).getBindings();

    assertSame("Parameter shadows outer variable", p,
               b.getReferent(innerUse));
    assertEquals(DefKind.VARIABLE, b.getReferent(outerUse).getKind());
    assertEquals(Arrays.asList(innerUse), b.getReferences(p));
  }

  @Test
  public void testUndeclared() throws UserException {
    exception.expect(UndefinedVarError.class);
    exception.expectMessage("y");
    analyze(program(assign("x", var("y"))));
  }

  @Test
  public void testAssignmentIntroducesVariable() throws UserException {
    AssignmentStatement first = assign("x", num(1));
    AssignmentStatement second = assign("x", num(2));
    Bindings b = analyze(program(first, second)).getBindings();

    VariableExpression t1 = first.getTargets().get(0);
    VariableExpression t2 = second.getTargets().get(0);
    Variable introduced = b.getIntroduced(t1);
    assertTrue("First assignment declares", introduced != null);
    assertNull("Second assignment reuses", b.getIntroduced(t2));
    assertSame(introduced, b.getReferent(t2));
  }

  @Test
  public void testSourcesBeforeTargets() throws UserException {
    exception.expect(UndefinedVarError.class);
    // x isn't visible until the assignment completes
    analyze(program(assign("x", bin("+", var("x"), num(1)))));
  }

  @Test
  public void testArityMismatch() throws UserException {
    try {
      analyze(program(assignAll(Arrays.asList("x", "y"),
                      Collections.<Expression>singletonList(num(1)))));
      throw new AssertionError("Expected arity mismatch");
    } catch (ArityMismatchException e) {
      assertEquals(2, e.getExpected());
      assertEquals(1, e.getActual());
    }
  }

  @Test
  public void testDuplicateTargets() throws UserException {
    exception.expect(InvalidWriteException.class);
    analyze(program(assignAll(Arrays.asList("x", "x"),
                    Arrays.<Expression>asList(num(1), num(2)))));
  }

  @Test
  public void testAssignToFunction() throws UserException {
    exception.expect(InvalidWriteException.class);
    analyze(program(function("f", params()), assign("f", num(1))));
  }

  @Test
  public void testDuplicateFunction() throws UserException {
    exception.expect(DoubleDefineException.class);
    analyze(program(function("f", params()), function("f", params())));
  }

  @Test
  public void testDuplicateParameter() throws UserException {
    exception.expect(DoubleDefineException.class);
    analyze(program(function("f", params(param("a"), param("a")))));
  }

  @Test
  public void testParameterOrder() throws UserException {
    try {
      analyze(program(function("f",
                      params(param("a", num(1)), param("b")))));
      throw new AssertionError("Expected parameter order error");
    } catch (ParameterOrderException e) {
      assertEquals("b", e.getNode().getName());
    }
  }

  @Test
  public void testDefaultSeesEarlierParameters() throws UserException {
    VariableExpression use = var("a");
    Parameter a = param("a");
    analyze(program(function("f", params(a, param("b", use)))));

    exception.expect(UndefinedVarError.class);
    analyze(program(function("g",
        params(param("a", var("b")), param("b", num(1))))));
  }

  @Test
  public void testRecursion() throws UserException {
    FunctionDeclaration f = function("f", params(param("n")),
                                     ret(call("f", arg(var("n")))));
    Program prog = program(f);
    Bindings b = analyze(prog).getBindings();
    Call inner = (Call)((ReturnStatement)f.getBody().get(0)).getReturnValue();
    assertSame(f, b.getReferent(inner.getCallee()));
  }

  @Test
  public void testParameterNamedLikeFunction() throws UserException {
    VariableExpression use = var("f");
    Parameter p = param("f");
    Bindings b = analyze(program(function("f", params(p), ret(use))))
                                                          .getBindings();
    assertSame(p, b.getReferent(use));
  }

  @Test
  public void testShadowBuiltin() throws UserException {
    FunctionDeclaration print = function("print", params(param("a")),
                                         ret(var("a")));
    Call c = call("print", arg(num(1)));
    GlobalContext globals = analyze(program(print, new CallStatement(c)));
    assertSame(print, globals.getBindings().getReferent(c.getCallee()));
    assertTrue(globals.isBuiltin(globals.lookup("print")));
  }

  @Test
  public void testBreakOutsideLoop() throws UserException {
    exception.expect(IllegalBreakException.class);
    analyze(program(new BreakStatement()));
  }

  @Test
  public void testBreakInIfInLoop() throws UserException {
    analyze(program(whileLoop(TestTrees.bool(true),
        ifElse(TestTrees.bool(true), block(new BreakStatement()), null))));
  }

  @Test
  public void testBreakInFunctionInLoop() throws UserException {
    exception.expect(IllegalBreakException.class);
    analyze(program(whileLoop(TestTrees.bool(true),
        function("f", params(), new BreakStatement()))));
  }

  @Test
  public void testReturnOutsideFunction() throws UserException {
    exception.expect(IllegalReturnException.class);
    analyze(program(ret(num(1))));
  }

  @Test
  public void testCallNonFunction() throws UserException {
    exception.expect(UndefinedFunctionException.class);
    exception.expectMessage("not a function");
    analyze(program(assign("x", num(1)), callStmt("x")));
  }

  @Test
  public void testCallTooManyArgs() throws UserException {
    exception.expect(CallBindingException.class);
    exception.expectMessage("Too many arguments");
    analyze(program(callStmt("sqrt", arg(num(1)), arg(num(2)))));
  }

  @Test
  public void testCallMissingRequired() throws UserException {
    exception.expect(CallBindingException.class);
    exception.expectMessage("Required parameter _");
    analyze(program(callStmt("print")));
  }

  @Test
  public void testKeywordArgumentPositions() throws UserException {
    Call c = call("f", arg(num(1)), kwarg("c", num(3)));
    Bindings b = analyze(program(
        function("f", params(param("a"), param("b", num(2)),
                             param("c", num(3)))),
        new CallStatement(c))).getBindings();
    assertEquals(Arrays.asList(0, 2), b.getArgumentPositions(c));
  }

  @Test
  public void testFirstErrorWins() throws UserException {
    // Both statements are invalid: only the first is reported
    exception.expect(IllegalBreakException.class);
    analyze(program(new BreakStatement(), ret(num(1))));
  }

  @Test
  public void testSequentialResolution() throws UserException {
    AssignmentStatement outer = assign("x", num(1));
    AssignmentStatement inner = assign("x", num(2));
    Bindings b = analyze(program(outer,
                          function("f", params(), inner))).getBindings();
    VariableExpression innerTarget = inner.getTargets().get(0);
    assertNull("Writes outer variable", b.getIntroduced(innerTarget));
    assertSame(b.getIntroduced(outer.getTargets().get(0)),
               b.getReferent(innerTarget));
  }

  @Test
  public void testBlockScopes() throws UserException {
    // y only exists inside the if body
    exception.expect(UndefinedVarError.class);
    analyze(program(
        ifElse(TestTrees.bool(true), block(assign("y", num(1))), null),
        callStmt("print", arg(var("y")))));
  }

  @Test
  public void testReanalysisIsIndependent() throws UserException {
    VariableExpression use = var("x");
    Program prog = program(assign("x", num(1)),
                           callStmt("print", arg(use)));
    Bindings first = analyze(prog).getBindings();
    Bindings second = analyze(prog).getBindings();
    assertNotSame(first, second);
    Declaration d1 = first.getReferent(use);
    Declaration d2 = second.getReferent(use);
    assertNotSame("Each analysis creates its own variables", d1, d2);
    assertTrue(first.getReferences(d1).contains(use));
  }

  @Test
  public void testDefaultCannotCallOwnFunction() throws UserException {
    // The function isn't declared until its parameters are analyzed
    exception.expect(UndefinedVarError.class);
    analyze(program(function("f",
        params(param("x", call("f", arg(num(1))))))));
  }
}

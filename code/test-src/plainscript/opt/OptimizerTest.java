package plainscript.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static plainscript.ast.TestTrees.arg;
import static plainscript.ast.TestTrees.assign;
import static plainscript.ast.TestTrees.assignAll;
import static plainscript.ast.TestTrees.bin;
import static plainscript.ast.TestTrees.block;
import static plainscript.ast.TestTrees.bool;
import static plainscript.ast.TestTrees.callStmt;
import static plainscript.ast.TestTrees.function;
import static plainscript.ast.TestTrees.ifCase;
import static plainscript.ast.TestTrees.ifChain;
import static plainscript.ast.TestTrees.ifElse;
import static plainscript.ast.TestTrees.num;
import static plainscript.ast.TestTrees.params;
import static plainscript.ast.TestTrees.program;
import static plainscript.ast.TestTrees.ret;
import static plainscript.ast.TestTrees.unary;
import static plainscript.ast.TestTrees.var;
import static plainscript.ast.TestTrees.whileLoop;

import java.util.Arrays;

import org.junit.After;
import org.junit.Test;

import plainscript.ast.BreakStatement;
import plainscript.ast.Expression;
import plainscript.ast.Program;
import plainscript.common.Logging;
import plainscript.common.Settings;
import plainscript.opt.Optimizer.RewriteKind;

public class OptimizerTest {

  private static Optimizer allEnabled() {
    return new Optimizer(Logging.getPSCLogger(), true, true, true);
  }

  private static String optimize(Program prog) {
    return allEnabled().optimize(prog).toString();
  }

  @After
  public void resetSettings() {
    Settings.reset(Settings.OPT_CONSTANT_FOLD);
    Settings.reset(Settings.OPT_DEAD_CODE_ELIM);
  }

  @Test
  public void testFoldNested() {
    Expression e = bin("+", num(3), bin("*", num(4), num(2)));
    Optimizer opt = allEnabled();
    assertEquals("(Num 11)", e.optimize(opt).toString());
    assertEquals(2, opt.getRewriteCounts().count(RewriteKind.CONSTANT_FOLD));
  }

  @Test
  public void testFoldUnderVariable() {
    Expression e = bin("*", var("x"), bin("-", num(1), unary("-", num(2))));
    assertEquals("(Binary * (Var x) (Num 3))",
                 e.optimize(allEnabled()).toString());
  }

  @Test
  public void testShortCircuit() {
    Expression e = bin("and", bool(true), bin("<", var("x"), num(1)));
    assertEquals("(Binary < (Var x) (Num 1))",
                 e.optimize(allEnabled()).toString());
  }

  @Test
  public void testIfFalseSplicesElse() {
    Program prog = program(ifElse(bool(false),
                                  block(assign("a", num(1))),
                                  block(assign("b", num(2)),
                                        assign("c", num(3)))));
    assertEquals("(Program (Assign (Targets (Var b)) (Sources (Num 2))) " +
                 "(Assign (Targets (Var c)) (Sources (Num 3))))",
                 optimize(prog));
  }

  @Test
  public void testIfFalseWithoutElseRemoved() {
    Program prog = program(ifElse(bin("<", num(2), num(1)),
                                  block(assign("a", num(1))), null));
    assertEquals("(Program)", optimize(prog));
  }

  @Test
  public void testIfTrueReplacesStatement() {
    Program prog = program(ifChain(block(assign("c", num(3))),
        ifCase(bool(true), assign("a", num(1))),
        ifCase(var("x"), assign("b", num(2)))));
    assertEquals("(Program (Assign (Targets (Var a)) (Sources (Num 1))))",
                 optimize(prog));
  }

  @Test
  public void testLaterTrueCaseBecomesElse() {
    Program prog = program(ifChain(block(assign("d", num(4))),
        ifCase(var("x"), assign("a", num(1))),
        ifCase(bool(false), assign("b", num(2))),
        ifCase(bin("or", bool(false), bool(true)), assign("c", num(3))),
        ifCase(var("y"), assign("e", num(5)))));
    assertEquals("(Program (If (Case (Var x) (Body (Assign (Targets (Var a)) " +
                 "(Sources (Num 1))))) (Else (Assign (Targets (Var c)) " +
                 "(Sources (Num 3))))))", optimize(prog));
  }

  @Test
  public void testWhileFalseRemoved() {
    Program prog = program(whileLoop(bool(false), new BreakStatement()),
                           whileLoop(bool(true), new BreakStatement()));
    assertEquals("(Program (While (Bool true) (Body (Break))))",
                 optimize(prog));
  }

  @Test
  public void testNoopAssign() {
    Program prog = program(assign("x", var("x")),
        assignAll(Arrays.asList("x", "y"),
                  Arrays.<Expression>asList(var("x"), num(1))),
        assignAll(Arrays.asList("a", "b"),
                  Arrays.<Expression>asList(var("b"), var("a"))));
    assertEquals("(Program (Assign (Targets (Var y)) (Sources (Num 1))) " +
        "(Assign (Targets (Var a) (Var b)) (Sources (Var b) (Var a))))",
        optimize(prog));
  }

  @Test
  public void testUnreachableAfterReturn() {
    Program prog = program(function("f", params(),
        ret(num(1)), callStmt("print", arg(num(2))), ret(num(3))));
    Optimizer opt = allEnabled();
    assertEquals("(Program (Function f (Params) (Body (Return (Num 1)))))",
                 opt.optimize(prog).toString());
    assertEquals(1, opt.getRewriteCounts().count(RewriteKind.UNREACHABLE));
  }

  @Test
  public void testUnreachableAfterSplicedBreak() {
    Program prog = program(whileLoop(var("x"),
        ifElse(bool(true), block(new BreakStatement()), null),
        assign("y", num(1))));
    assertEquals("(Program (While (Var x) (Body (Break))))", optimize(prog));
  }

  @Test
  public void testIdempotent() {
    Program prog = program(
        function("f", params(),
            ifChain(null,
                ifCase(var("a"), assign("b", bin("+", num(1), num(2)))),
                ifCase(bool(true), ret(num(1)), ret(num(2))),
                ifCase(var("c"), ret(num(3)))),
            whileLoop(bin("and", bool(false), var("d"))),
            assign("e", var("e"))),
        ifElse(unary("not", bool(true)), block(assign("x", num(1))),
               block(assign("y", bin("/", num(1), num(0))))));
    String once = optimize(prog);
    String twice = optimize(prog);
    assertEquals(once, twice);
    assertTrue(once.contains("(Binary / (Num 1) (Num 0))"));
  }

  @Test
  public void testSettingsDisableRewrites() {
    Settings.set(Settings.OPT_CONSTANT_FOLD, "false");
    Settings.set(Settings.OPT_DEAD_CODE_ELIM, "false");
    Optimizer opt = new Optimizer(Logging.getPSCLogger());
    Program prog = program(ifElse(bool(false),
                           block(assign("a", bin("+", num(1), num(2)))),
                           null));
    String before = prog.toString();
    assertEquals(before, opt.optimize(prog).toString());
    assertTrue(opt.getRewriteCounts().isEmpty());
  }
}

package plainscript.opt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static plainscript.ast.TestTrees.bool;
import static plainscript.ast.TestTrees.num;
import static plainscript.ast.TestTrees.var;

import org.junit.Test;

import plainscript.ast.BinaryExpression.Operator;
import plainscript.ast.Expression;
import plainscript.ast.UnaryExpression;
import plainscript.ast.VariableExpression;

public class ConstantFolderTest {

  @Test
  public void testArithmetic() {
    assertEquals("(Num 7)",
        ConstantFolder.fold(Operator.PLUS, num(3), num(4)).toString());
    assertEquals("(Num -1)",
        ConstantFolder.fold(Operator.MINUS, num(3), num(4)).toString());
    assertEquals("(Num 2.5)",
        ConstantFolder.fold(Operator.DIVIDE, num(5), num(2)).toString());
  }

  @Test
  public void testDivideByZeroNotFolded() {
    assertNull(ConstantFolder.fold(Operator.DIVIDE, num(1), num(0)));
  }

  @Test
  public void testOverflowNotFolded() {
    assertNull(ConstantFolder.fold(Operator.TIMES, num(1e308), num(10)));
  }

  @Test
  public void testComparisons() {
    assertEquals("(Bool true)",
        ConstantFolder.fold(Operator.LT, num(1), num(2)).toString());
    assertEquals("(Bool false)",
        ConstantFolder.fold(Operator.EQ, num(1), num(2)).toString());
    assertEquals("(Bool true)",
        ConstantFolder.fold(Operator.NEQ, bool(true), bool(false)).toString());
  }

  @Test
  public void testLogical() {
    assertEquals("(Bool false)",
        ConstantFolder.fold(Operator.AND, bool(true), bool(false)).toString());
    assertEquals("(Bool true)",
        ConstantFolder.fold(Operator.OR, bool(false), bool(true)).toString());
  }

  @Test
  public void testMixedTypesNotFolded() {
    assertNull(ConstantFolder.fold(Operator.EQ, num(1), bool(true)));
    assertNull(ConstantFolder.fold(Operator.PLUS, bool(true), bool(true)));
    assertNull(ConstantFolder.fold(Operator.PLUS, num(1), var("x")));
  }

  @Test
  public void testShortCircuit() {
    VariableExpression x = var("x");
    assertEquals("(Bool false)",
        ConstantFolder.shortCircuit(Operator.AND, bool(false), x).toString());
    assertEquals("(Bool true)",
        ConstantFolder.shortCircuit(Operator.OR, bool(true), x).toString());
    assertSame(x, ConstantFolder.shortCircuit(Operator.AND, bool(true), x));
    assertSame(x, ConstantFolder.shortCircuit(Operator.OR, bool(false), x));
  }

  @Test
  public void testShortCircuitNeedsLeftLiteral() {
    assertNull(ConstantFolder.shortCircuit(Operator.AND, var("x"),
                                           bool(false)));
    assertNull(ConstantFolder.shortCircuit(Operator.PLUS, bool(true),
                                           var("x")));
  }

  @Test
  public void testUnary() {
    Expression neg = ConstantFolder.foldUnary(UnaryExpression.Operator.NEGATE,
                                              num(5));
    assertEquals("(Num -5)", neg.toString());
    assertEquals("(Bool false)", ConstantFolder.foldUnary(
                   UnaryExpression.Operator.NOT, bool(true)).toString());
    assertNull(ConstantFolder.foldUnary(UnaryExpression.Operator.NOT, num(1)));
  }
}

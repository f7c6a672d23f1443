package exm.qtree.lang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.qtree.common.util.Pair;

public class OperatorsTest {

  @Test
  public void testBinaryTable() {
    assertEquals(Pair.create(Associativity.LEFT, 220), Operators.binaryOp("+"));
    assertEquals(Pair.create(Associativity.RIGHT, 100), Operators.binaryOp("="));
    assertEquals(Pair.create(Associativity.LEFT, 170),
                 Operators.binaryOp(Operators.PIPE));
    assertNull(Operators.binaryOp("foo"));
  }

  @Test
  public void testPrecedenceOrdering() {
    assertTrue(Operators.binaryOp("*").val2 > Operators.binaryOp("+").val2);
    assertTrue(Operators.binaryOp("+").val2 > Operators.binaryOp("|>").val2);
    assertTrue(Operators.unaryOp("@") > Operators.unaryOp("!"));
  }

  @Test
  public void testArities() {
    assertTrue(Operators.isOperator("..", 0));
    assertTrue(Operators.isOperator("-", 1));
    assertTrue(Operators.isOperator("-", 2));
    assertTrue(Operators.isOperator("..//", 3));
    assertFalse(Operators.isOperator("//", 2));
    assertFalse(Operators.isOperator("*", 1));
    assertFalse(Operators.isOperator("+", 4));
  }

  @Test
  public void testUnaryOrBinary() {
    assertTrue(Operators.isUnaryOrBinary("not"));
    assertTrue(Operators.isUnaryOrBinary("in"));
    assertFalse(Operators.isUnaryOrBinary("//"));
    assertFalse(Operators.isUnaryOrBinary("foo"));
  }
}

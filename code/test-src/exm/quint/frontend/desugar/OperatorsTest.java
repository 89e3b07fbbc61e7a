package exm.quint.frontend.desugar;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.quint.common.exceptions.QuintRuntimeError;
import exm.quint.ir.Builtins;

public class OperatorsTest {

  @Test
  public void testBinary() {
    assertEquals(Builtins.IADD, Operators.binaryOpcode("+"));
    assertEquals(Builtins.IPOW, Operators.binaryOpcode("^"));
    assertEquals(Builtins.ILTE, Operators.binaryOpcode("<="));
    assertEquals(Builtins.NEQ, Operators.binaryOpcode("!="));
    assertEquals(Builtins.IFF, Operators.binaryOpcode("iff"));
  }

  @Test
  public void testSingleEqualsIsEquality() {
    assertEquals(Builtins.EQ, Operators.binaryOpcode("="));
    assertEquals(Operators.binaryOpcode("=="), Operators.binaryOpcode("="));
  }

  @Test
  public void testBlocks() {
    assertEquals(Builtins.AND, Operators.blockOpcode("and"));
    assertEquals(Builtins.ACTION_ALL, Operators.blockOpcode("all"));
    assertEquals(Builtins.ACTION_ANY, Operators.blockOpcode("any"));
  }

  @Test
  public void testIsBinaryOperator() {
    assertTrue(Operators.isBinaryOperator("implies"));
    assertFalse(Operators.isBinaryOperator("all"));
    assertFalse(Operators.isBinaryOperator("&&"));
  }

  @Test(expected=QuintRuntimeError.class)
  public void testUnknownOperator() {
    Operators.binaryOpcode("&&");
  }

  @Test(expected=QuintRuntimeError.class)
  public void testUnknownBlock() {
    Operators.blockOpcode("seq");
  }
}

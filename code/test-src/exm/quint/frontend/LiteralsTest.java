package exm.quint.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.math.BigInteger;

import org.junit.Test;

import exm.quint.common.exceptions.QuintRuntimeError;

public class LiteralsTest {

  @Test
  public void testIntegers() {
    assertEquals(BigInteger.valueOf(42), Literals.parseIntToken("42"));
    assertEquals(BigInteger.valueOf(1000000),
                 Literals.parseIntToken("1_000_000"));
    assertEquals(BigInteger.valueOf(255), Literals.parseIntToken("0xff"));
    assertEquals(BigInteger.valueOf(0xdeadbeefL),
                 Literals.parseIntToken("0xdead_beef"));
  }

  @Test
  public void testBigInteger() {
    assertEquals(new BigInteger("123456789012345678901234567890"),
        Literals.parseIntToken("123456789012345678901234567890"));
  }

  @Test(expected=QuintRuntimeError.class)
  public void testBadInteger() {
    Literals.parseIntToken("12ab");
  }

  @Test
  public void testBooleans() {
    assertTrue(Literals.parseBoolToken("true"));
    assertFalse(Literals.parseBoolToken("false"));
  }

  @Test
  public void testStrings() {
    assertEquals("hello", Literals.extractStringLit("\"hello\""));
    assertEquals("", Literals.extractStringLit("\"\""));
  }
}

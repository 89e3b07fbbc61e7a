package exm.quint.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.antlr.runtime.CommonToken;
import org.junit.Test;

public class SourceSpanTest {

  private static CommonToken token(int line, int col, int start, int stop) {
    CommonToken t = new CommonToken(0, "tok");
    t.setLine(line);
    t.setCharPositionInLine(col);
    t.setStartIndex(start);
    t.setStopIndex(stop);
    return t;
  }

  @Test
  public void testFromTokens() {
    SourceSpan span = SourceSpan.fromTokens("a.qnt", token(2, 4, 20, 22),
                                            token(2, 10, 26, 29));
    assertEquals(1, span.startLine);
    assertEquals(4, span.startCol);
    assertEquals(20, span.startIndex);
    assertEquals(1, span.endLine);
    // Last character of the stop token
    assertEquals(13, span.endCol);
    assertEquals(29, span.endIndex);
    assertEquals("a.qnt:2:5-2:14", span.toString());
  }

  @Test
  public void testNoStopToken() {
    SourceSpan span = SourceSpan.fromTokens("a.qnt", token(1, 0, 0, 2),
                                            null);
    assertFalse(span.hasEnd());
    assertEquals("a.qnt:1:1", span.toString());
  }

  @Test
  public void testDefaultSource() {
    SourceSpan span = SourceSpan.fromTokens(null, token(1, 0, 0, 0),
                                            token(1, 0, 0, 0));
    assertEquals("<input>", span.source);
    assertTrue(span.hasEnd());
  }

  @Test
  public void testEquality() {
    SourceSpan a = new SourceSpan("a.qnt", 1, 2, 3, 1, 5, 6);
    SourceSpan b = new SourceSpan("a.qnt", 1, 2, 3, 1, 5, 6);
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertFalse(a.equals(new SourceSpan("a.qnt", 1, 2, 3)));
  }
}

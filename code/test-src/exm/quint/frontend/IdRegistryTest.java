package exm.quint.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Test;

import exm.quint.ast.SourceSpan;

public class IdRegistryTest {

  @Test
  public void testSequential() {
    IdRegistry ids = new IdRegistry();
    SourceSpan a = new SourceSpan("a.qnt", 1, 0, 10);
    SourceSpan b = new SourceSpan("a.qnt", 2, 0, 25);
    assertEquals(0, ids.issued());
    assertEquals(1, ids.next(a));
    assertEquals(2, ids.next(b));
    assertEquals(3, ids.next(a));
    assertEquals(3, ids.issued());

    SourceMap map = ids.sourceMap();
    assertEquals(3, map.size());
    assertSame(b, map.get(2));
    assertSame(a, map.get(3));
    assertFalse(map.contains(4));
    assertEquals(Arrays.asList(1L, 2L, 3L), new ArrayList<Long>(map.ids()));
  }

  @Test
  public void testRegistriesIndependent() {
    SourceSpan s = new SourceSpan("a.qnt", 1, 0, 10);
    IdRegistry first = new IdRegistry();
    first.next(s);
    first.next(s);
    assertEquals(1, new IdRegistry().next(s));
  }

  @Test(expected=NullPointerException.class)
  public void testSpanRequired() {
    new IdRegistry().next(null);
  }
}

package exm.quint.frontend.desugar;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import exm.quint.ast.SourceSpan;
import exm.quint.frontend.IdRegistry;
import exm.quint.ir.Exprs.Lambda;
import exm.quint.ir.Exprs.Let;
import exm.quint.ir.Exprs.Name;
import exm.quint.ir.LambdaParam;

public class TupleLambdasTest {
  private static final SourceSpan SPAN = new SourceSpan("t.qnt", 0, 0, 0);

  @Test
  public void testUnpack() {
    IdRegistry ids = new IdRegistry();
    LambdaParam a = new LambdaParam(ids.next(SPAN), "a");
    LambdaParam b = new LambdaParam(ids.next(SPAN), "b");
    Name body = new Name(ids.next(SPAN), "b");
    Lambda lambda = TupleLambdas.lower(ids, SPAN, Arrays.asList(a, b), body);

    String p = TupleLambdas.TUPLE_PARAM_PREFIX + lambda.id();
    assertEquals(1, lambda.params.size());
    assertEquals(p, lambda.params.get(0).name);
    assertEquals("(" + p + ") => let pureval a = item(" + p + ", 1); " +
                 "let pureval b = item(" + p + ", 2); b",
                 lambda.toString());

    Let outer = (Let)lambda.body;
    assertEquals(a.id(), outer.opdef.id());
    assertEquals(b.id(), ((Let)outer.body).opdef.id());
  }

  @Test
  public void testHoleSkipped() {
    IdRegistry ids = new IdRegistry();
    LambdaParam hole = new LambdaParam(ids.next(SPAN), LambdaParam.HOLE);
    LambdaParam c = new LambdaParam(ids.next(SPAN), "c");
    Lambda lambda = TupleLambdas.lower(ids, SPAN, Arrays.asList(hole, c),
                                       new Name(ids.next(SPAN), "c"));
    String p = TupleLambdas.TUPLE_PARAM_PREFIX + lambda.id();
    assertEquals("(" + p + ") => let pureval c = item(" + p + ", 2); c",
                 lambda.toString());
    assertTrue(((Let)lambda.body).body instanceof Name);
  }
}

package exm.quint.frontend.desugar;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Before;
import org.junit.Test;

import exm.quint.ast.SourceSpan;
import exm.quint.frontend.DiagnosticCode;
import exm.quint.frontend.Diagnostics;
import exm.quint.frontend.IdRegistry;
import exm.quint.ir.Exprs.Expr;
import exm.quint.ir.Exprs.IntLit;
import exm.quint.ir.Exprs.Name;

public class RecordSpreadsTest {
  private static final SourceSpan SPAN = new SourceSpan("r.qnt", 0, 0, 0);

  private IdRegistry ids;
  private Diagnostics diagnostics;

  @Before
  public void setUp() {
    ids = new IdRegistry();
    diagnostics = new Diagnostics();
  }

  @Test
  public void testEmptyRecord() {
    Expr rec = RecordSpreads.lower(ids, diagnostics, SPAN,
        Collections.<Expr>emptyList(), Collections.<String>emptyList(),
        Collections.<Expr>emptyList());
    assertEquals("Rec()", rec.toString());
  }

  @Test
  public void testPlainFields() {
    Expr rec = RecordSpreads.lower(ids, diagnostics, SPAN,
        Collections.<Expr>emptyList(), Arrays.asList("a", "b"),
        Arrays.<Expr>asList(new IntLit(ids.next(SPAN), 1),
                            new IntLit(ids.next(SPAN), 2)));
    assertEquals("Rec(\"a\", 1, \"b\", 2)", rec.toString());
    assertTrue(diagnostics.isEmpty());
  }

  @Test
  public void testSpreadOnly() {
    Expr base = new Name(ids.next(SPAN), "r");
    Expr rec = RecordSpreads.lower(ids, diagnostics, SPAN,
        Collections.singletonList(base), Collections.<String>emptyList(),
        Collections.<Expr>emptyList());
    assertSame(base, rec);
  }

  @Test
  public void testSpreadWithFields() {
    Expr rec = RecordSpreads.lower(ids, diagnostics, SPAN,
        Collections.<Expr>singletonList(new Name(ids.next(SPAN), "r")),
        Arrays.asList("a", "b"),
        Arrays.<Expr>asList(new IntLit(ids.next(SPAN), 1),
                            new IntLit(ids.next(SPAN), 2)));
    assertEquals("with(with(r, \"a\", 1), \"b\", 2)", rec.toString());
    assertTrue(diagnostics.isEmpty());
  }

  @Test
  public void testMultipleSpreads() {
    Expr rec = RecordSpreads.lower(ids, diagnostics, SPAN,
        Arrays.<Expr>asList(new Name(ids.next(SPAN), "r"),
                            new Name(ids.next(SPAN), "s")),
        Collections.singletonList("a"),
        Collections.<Expr>singletonList(new IntLit(ids.next(SPAN), 1)));
    assertEquals("with(r, \"a\", 1)", rec.toString());
    assertEquals(1, diagnostics.size());
    assertEquals(DiagnosticCode.QNT012, diagnostics.list().get(0).code);
    assertEquals(rec.id(), diagnostics.list().get(0).nodeId);
  }
}

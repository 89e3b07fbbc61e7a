package exm.quint.frontend.desugar;

import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.junit.Test;

import exm.quint.ast.ExprConstructs.MatchCase;
import exm.quint.ast.SourceSpan;
import exm.quint.frontend.IdRegistry;
import exm.quint.ir.Builtins;
import exm.quint.ir.Exprs.App;
import exm.quint.ir.Exprs.Expr;
import exm.quint.ir.Exprs.IntLit;
import exm.quint.ir.Exprs.Lambda;
import exm.quint.ir.Exprs.Name;

public class VariantMatchesTest {
  private static final SourceSpan SPAN = new SourceSpan("m.qnt", 0, 0, 0);

  @Test
  public void testCases() {
    IdRegistry ids = new IdRegistry();
    App match = VariantMatches.lower(ids, SPAN, new Name(ids.next(SPAN), "e"),
        Arrays.asList(new MatchCase(SPAN, "Some", "x"),
                      new MatchCase(SPAN, "None", null),
                      new MatchCase(SPAN, null, null)),
        Arrays.<Expr>asList(new Name(ids.next(SPAN), "x"),
                            new IntLit(ids.next(SPAN), 0),
                            new IntLit(ids.next(SPAN), -1)));
    assertEquals(Builtins.MATCH_VARIANT, match.opcode);
    assertEquals(7, match.args.size());
    assertEquals("matchVariant(e, \"Some\", (x) => x, \"None\", (_) => 0, " +
                 "\"_\", (_) => -1)", match.toString());
    assertEquals(Builtins.WILDCARD,
                 ((Lambda)match.arg(6)).params.get(0).name);
  }

  @Test(expected=IllegalArgumentException.class)
  public void testBodyCountMismatch() {
    IdRegistry ids = new IdRegistry();
    VariantMatches.lower(ids, SPAN, new Name(ids.next(SPAN), "e"),
        Arrays.asList(new MatchCase(SPAN, "A", null)),
        Arrays.<Expr>asList());
  }
}

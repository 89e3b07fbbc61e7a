package exm.quint.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import exm.quint.ast.SourceSpan;
import exm.quint.ir.Decls.AssumeDecl;
import exm.quint.ir.Decls.Declaration;
import exm.quint.ir.LambdaParam;

public class PlaceholdersTest {
  private static final SourceSpan SPAN = new SourceSpan("p.qnt", 4, 2, 50);

  @Test
  public void testExpression() {
    IdRegistry ids = new IdRegistry();
    assertEquals("let val __undefinedExprGenerated = true; " +
                 "__undefinedExprGenerated",
                 Placeholders.undefinedExpr(ids, SPAN).toString());
    assertEquals(4, ids.issued());
    for (long id: ids.sourceMap().ids()) {
      assertEquals(SPAN, ids.sourceMap().get(id));
    }
  }

  @Test
  public void testDefinition() {
    assertEquals("val __undefinedDefGenerated = true",
        Placeholders.undefinedDef(new IdRegistry(), SPAN).toString());
  }

  @Test
  public void testDeclarationNamedAfterId() {
    IdRegistry ids = new IdRegistry();
    Declaration decl = Placeholders.undefinedDecl(ids, SPAN);
    assertTrue(decl instanceof AssumeDecl);
    assertEquals(Placeholders.UNDEFINED_DECL + decl.id(),
                 ((AssumeDecl)decl).name);
  }

  @Test
  public void testParameterNamesUnique() {
    IdRegistry ids = new IdRegistry();
    LambdaParam p1 = Placeholders.undefinedParam(ids, SPAN);
    LambdaParam p2 = Placeholders.undefinedParam(ids, SPAN);
    assertEquals("__undefinedParam1", p1.name);
    assertEquals("__undefinedParam2", p2.name);
  }

  @Test
  public void testTypeAndVariant() {
    IdRegistry ids = new IdRegistry();
    assertEquals("undefinedType",
                 Placeholders.undefinedType(ids, SPAN).toString());
    assertEquals(Placeholders.UNDEFINED_FIELD,
                 Placeholders.undefinedVariant(ids, SPAN).label);
  }
}

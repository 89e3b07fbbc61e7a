package exm.quint.ir;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.quint.ir.Decls.Declaration;
import exm.quint.ir.Decls.ImportDecl;
import exm.quint.ir.Decls.OpDef;
import exm.quint.ir.Decls.VarDecl;
import exm.quint.ir.Exprs.IntLit;
import exm.quint.ir.Exprs.Lambda;
import exm.quint.ir.Exprs.Name;
import exm.quint.ir.Types.IntType;

public class DeclsTest {

  @Test
  public void testWithDoc() {
    OpDef def = new OpDef(7, "x", OpQualifier.VAL, null,
                          new IntLit(6, 1), null);
    Declaration documented = def.withDoc("The x\nvalue");
    assertEquals(7, documented.id());
    assertEquals("The x\nvalue", documented.doc);
    assertNull(def.doc);
    assertEquals("/// The x\n/// value\nval x = 1", documented.toString());
  }

  @Test
  public void testParams() {
    LambdaParam p = new LambdaParam(1, "p");
    OpDef def = new OpDef(4, "f", OpQualifier.DEF, null,
        new Lambda(3, Collections.singletonList(p), OpQualifier.DEF,
                   new Name(2, "p")), null);
    assertEquals(Collections.singletonList(p), def.params());
    assertEquals("def f = (p) => p", def.toString());
    OpDef val = new OpDef(6, "v", OpQualifier.VAL, null, new IntLit(5, 0),
                          null);
    assertEquals(0, val.params().size());
  }

  @Test
  public void testModuleLookup() {
    VarDecl var = new VarDecl(2, "n", new IntType(1), null);
    ImportDecl imp = new ImportDecl(3, "Foo", null, null, null, null);
    IrModule m = new IrModule(4, "M", Arrays.<Declaration>asList(imp, var),
                              null);
    assertSame(var, m.lookup("n"));
    assertNull(m.lookup("Foo"));
    assertNull(IrModule.declarationName(imp));
  }

  @Test
  public void testQualifiers() {
    assertEquals(OpQualifier.PUREDEF, OpQualifier.fromText("puredef"));
    assertEquals(OpQualifier.TEMPORAL, OpQualifier.fromText("temporal"));
    assertEquals(OpQualifier.DEF, OpQualifier.fromText(null));
    assertEquals(OpQualifier.DEF, OpQualifier.fromText("VAL"));
    assertEquals("nondet", OpQualifier.NONDET.toString());
  }
}

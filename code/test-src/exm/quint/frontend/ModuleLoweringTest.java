package exm.quint.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.quint.ast.ExprConstructs.LiteralKind;
import exm.quint.ast.ExprConstructs.LiteralOrId;
import exm.quint.ir.Decls.ExportDecl;
import exm.quint.ir.Decls.ImportDecl;
import exm.quint.ir.Decls.InstanceDecl;
import exm.quint.ir.Decls.OpDef;
import exm.quint.ir.IrModule;

public class ModuleLoweringTest {

  private final ConstructBuilder b = new ConstructBuilder();

  @Test
  public void testImports() {
    LoweringResult result = IrTrees.lower(b.module("M",
        b.importMod("Foo", null, null, null),
        b.importMod("Foo", "*", null, null),
        b.importMod("Foo", "x", "F", "\"./foo.qnt\"")));
    IrModule m = result.singleModule();
    ImportDecl plain = (ImportDecl)m.declarations.get(0);
    assertEquals("import Foo", plain.toString());
    assertNull(plain.defName);

    ImportDecl star = (ImportDecl)m.declarations.get(1);
    assertEquals("*", star.defName);

    ImportDecl full = (ImportDecl)m.declarations.get(2);
    assertEquals("x", full.defName);
    assertEquals("F", full.qualifiedName);
    assertEquals("./foo.qnt", full.fromSource);
    assertEquals("import Foo.x as F from \"./foo.qnt\"", full.toString());
    assertTrue(result.recoveryNotes.isEmpty());
  }

  @Test
  public void testExports() {
    IrModule m = IrTrees.lower(b.module("M",
        b.exportMod("Foo", null, "F"),
        b.exportMod("Foo", "*", null))).singleModule();
    assertEquals("export Foo as F", m.declarations.get(0).toString());
    assertEquals("*", ((ExportDecl)m.declarations.get(1)).defName);
  }

  @Test
  public void testInstance() {
    LoweringResult result = IrTrees.lower(b.module("M",
        b.instance("Proto", "P1", Arrays.asList("N", "Init"),
                   Arrays.asList(b.intLit(3), b.boolLit(true)), true,
                   "\"proto.qnt\"")));
    InstanceDecl inst =
        (InstanceDecl)result.singleModule().declarations.get(0);
    assertEquals("Proto", inst.protoName);
    assertEquals("P1", inst.qualifiedName);
    assertEquals(2, inst.overrides.size());
    assertEquals("N", inst.overrides.get(0).param.name);
    assertEquals("3", inst.overrides.get(0).expr.toString());
    assertEquals("Init", inst.overrides.get(1).param.name);
    assertTrue(inst.identityOverride);
    assertEquals("proto.qnt", inst.fromSource);
    assertEquals("module P1 = Proto(N = 3, Init = true, *) " +
                 "from \"proto.qnt\"", inst.toString());
    assertTrue(result.sourceMap.contains(inst.overrides.get(0).param.id()));
  }

  @Test
  public void testDeclarationDoc() {
    IrModule m = IrTrees.lower(b.module("M",
        b.documented(Arrays.asList("/// Initial value\n",
                                   "/// of the counter\n"),
                     b.val("init", b.intLit(0))),
        b.val("step", b.intLit(1)))).singleModule();
    OpDef init = (OpDef)m.declarations.get(0);
    assertEquals("Initial value\nof the counter", init.doc);
    assertNull(m.declarations.get(1).doc);
  }

  @Test
  public void testDocKeepsIdentifier() {
    IrModule plain = IrTrees.lower(new ConstructBuilder().module("M",
        new ConstructBuilder().val("x", new ConstructBuilder().intLit(0))))
        .singleModule();
    ConstructBuilder b2 = new ConstructBuilder();
    IrModule documented = IrTrees.lower(b2.module("M",
        b2.documented(Collections.singletonList("/// doc"),
                      b2.val("x", b2.intLit(0))))).singleModule();
    assertEquals(plain.declarations.get(0).id(),
                 documented.declarations.get(0).id());
  }

  @Test
  public void testSumTypeDocOnTypedef() {
    IrModule m = IrTrees.lower(b.module("M",
        b.documented(Collections.singletonList("/// A choice\n"),
                     b.typeSum("Choice", b.variant("Yes"),
                               b.variant("No"))))).singleModule();
    assertEquals("A choice", m.declarations.get(0).doc);
    assertNull(m.declarations.get(1).doc);
    assertNull(m.declarations.get(2).doc);
  }

  @Test
  public void testEmptyDoc() {
    IrModule m = IrTrees.lower(b.module("M",
        b.documented(Collections.singletonList("///\n"),
                     b.val("x", b.intLit(0))))).singleModule();
    assertNull(m.declarations.get(0).doc);
  }

  @Test
  public void testModuleDoc() {
    IrModule m = IrTrees.lower(b.moduleWithDoc("Counter",
        Arrays.asList("/// A counter\n", "/// that counts\n"),
        b.varDef("n", b.intType()))).singleModule();
    assertEquals("Counter", m.name);
    assertEquals("A counter\nthat counts", m.doc);
  }

  @Test
  public void testLeakIsReportedAndCleared() {
    LoweringSession session = new LoweringSession();
    session.exit(new LiteralOrId(b.span(), LiteralKind.NAME, "stray"));
    session.walk(b.module("A", b.val("x", b.intLit(1))));
    session.walk(b.module("B", b.val("y", b.intLit(2))));
    LoweringResult result = session.result();

    assertEquals(2, result.modules.size());
    assertEquals(1, result.recoveryNotes.size());
    RecoveryNote note = result.recoveryNotes.get(0);
    assertEquals("leak", note.category);
    assertTrue(note.text, note.text.contains("1 expression"));
    assertEquals("val y = 2",
                 result.modules.get(1).declarations.get(0).toString());
  }

  @Test
  public void testLeakCheckDisabled() {
    LoweringSession session = new LoweringSession(false);
    session.exit(new LiteralOrId(b.span(), LiteralKind.NAME, "stray"));
    session.walk(b.module("A"));
    session.walk(b.module("B", b.val("y", b.name("z"))));
    LoweringResult result = session.result();
    assertTrue(result.recoveryNotes.isEmpty());
    // The stray expression did not survive into the next module
    assertEquals("val y = z",
                 result.modules.get(1).declarations.get(0).toString());
  }

  @Test
  public void testModulesShareIdSpace() {
    LoweringSession session = new LoweringSession();
    session.walk(b.module("A", b.val("x", b.intLit(1))));
    session.walk(b.module("B", b.val("x", b.intLit(1))));
    LoweringResult result = session.result();
    assertFalse(result.modules.get(0).id() == result.modules.get(1).id());
    assertTrue(result.modules.get(0).id() < result.modules.get(1).id());
    assertEquals(result.modules.get(1).id(), result.sourceMap.size());
  }
}

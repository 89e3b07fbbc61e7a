package exm.quint.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.quint.ast.ConstructTree;
import exm.quint.ast.DeclConstructs.ConstDef;
import exm.quint.ast.DeclConstructs.VarDef;
import exm.quint.ast.TypeConstructs.TypeFun;
import exm.quint.ast.TypeConstructs.TypeOper;
import exm.quint.ast.TypeConstructs.TypeRec;
import exm.quint.ir.Decls.ConstDecl;
import exm.quint.ir.Decls.OpDef;
import exm.quint.ir.Types.ConcreteRow;
import exm.quint.ir.Types.ConstType;
import exm.quint.ir.Types.EmptyRow;
import exm.quint.ir.Types.RecordType;
import exm.quint.ir.Types.TupleType;
import exm.quint.ir.Types.Type;
import exm.quint.ir.Types.VarRow;
import exm.quint.ir.Types.VarType;

public class TypeLoweringTest {

  private final ConstructBuilder b = new ConstructBuilder();

  private LoweringResult lowerConst(ConstructTree type) {
    return IrTrees.lower(b.module("M", b.constDef("C", type)));
  }

  private Type lower(ConstructTree type) {
    LoweringResult result = lowerConst(type);
    assertTrue(result.recoveryNotes.toString(),
               result.recoveryNotes.isEmpty());
    return ((ConstDecl)result.singleModule().declarations.get(0)).type;
  }

  @Test
  public void testSimpleTypes() {
    assertEquals("int", lower(b.intType()).toString());
    assertEquals("bool", lower(b.boolType()).toString());
    assertEquals("str", lower(b.strType()).toString());
    assertEquals("set(str)", lower(b.setType(b.strType())).toString());
    assertEquals("list(set(int))",
                 lower(b.listType(b.setType(b.intType()))).toString());
    assertEquals("(str -> int)",
                 lower(b.funType(b.strType(), b.intType())).toString());
  }

  @Test
  public void testTypeNames() {
    assertTrue(lower(b.typeRef("a")) instanceof VarType);
    assertTrue(lower(b.typeRef("elem")) instanceof VarType);
    assertTrue(lower(b.typeRef("Temperature")) instanceof ConstType);
    assertEquals("Temperature", lower(b.typeRef("Temperature")).toString());
  }

  @Test
  public void testTupleType() {
    Type t = lower(b.tupleType(b.intType(), b.boolType(), b.strType()));
    assertEquals("(int, bool, str)", t.toString());
    ConcreteRow row = (ConcreteRow)((TupleType)t).fields;
    assertEquals("0", row.fields.get(0).name);
    assertEquals("2", row.fields.get(2).name);
    assertTrue(row.other instanceof EmptyRow);
  }

  @Test
  public void testRecordTypes() {
    RecordType closed = (RecordType)lower(b.recType(
        b.row(Arrays.asList("a", "b"), null, b.intType(), b.strType())));
    assertEquals("{ a: int, b: str }", closed.toString());
    assertNull(closed.fields.tailName());

    RecordType open = (RecordType)lower(b.recType(
        b.row(Arrays.asList("a"), "r", b.intType())));
    assertEquals("{ a: int | r }", open.toString());
    assertTrue(((ConcreteRow)open.fields).other instanceof VarRow);

    RecordType empty = (RecordType)lower(b.recType(
        b.row(Collections.<String>emptyList(), null)));
    assertEquals("{}", empty.toString());
  }

  @Test
  public void testDuplicateRowField() {
    LoweringResult result = lowerConst(b.recType(
        b.row(Arrays.asList("a", "a"), null, b.intType(), b.strType())));
    Type t = ((ConstDecl)result.singleModule().declarations.get(0)).type;
    assertEquals("{ a: int }", t.toString());
    assertEquals(1, result.recoveryNotes.size());
    assertEquals("row", result.recoveryNotes.get(0).category);
  }

  @Test
  public void testRowVariableClashesWithField() {
    LoweringResult result = lowerConst(b.recType(
        b.row(Arrays.asList("r"), "r", b.intType())));
    Type t = ((ConstDecl)result.singleModule().declarations.get(0)).type;
    assertEquals("{ r: int }", t.toString());
    assertEquals(1, result.recoveryNotes.size());
  }

  @Test
  public void testRecordWithoutRow() {
    LoweringSession session = new LoweringSession();
    session.exit(new TypeRec(b.span(), "{}"));
    session.exit(new ConstDef(b.span(), "const C", "C"));
    session.exit(b.module("M").construct());
    LoweringResult result = session.result();
    Type t = ((ConstDecl)result.singleModule().declarations.get(0)).type;
    assertEquals("{}", t.toString());
    assertEquals("row", result.recoveryNotes.get(0).category);
  }

  @Test
  public void testOperatorTypes() {
    assertEquals("(int, str) => bool", lower(b.operType(b.intType(),
        b.strType(), b.boolType())).toString());
    assertEquals("() => bool", lower(b.operType(b.boolType())).toString());
  }

  @Test
  public void testSignatures() {
    LoweringResult result = IrTrees.lower(b.module("M",
        // C-style: one type per parameter, then the result
        b.operDef("def", "f", b.params("x", "y"),
                  Arrays.asList(b.intType(), b.intType(), b.boolType()),
                  b.binary(">", b.name("x"), b.name("y"))),
        // ML-style: a single operator type
        b.operDef("def", "g", b.params("x"),
                  Arrays.asList(b.operType(b.intType(), b.intType())),
                  b.name("x")),
        b.operDef("val", "h", ConstructBuilder.none(),
                  Arrays.asList(b.intType()), b.intLit(1))));
    OpDef f = (OpDef)result.singleModule().declarations.get(0);
    assertEquals("(int, int) => bool", f.typeAnnotation.toString());
    OpDef g = (OpDef)result.singleModule().declarations.get(1);
    assertEquals("(int) => int", g.typeAnnotation.toString());
    OpDef h = (OpDef)result.singleModule().declarations.get(2);
    assertEquals("val h: int = 1", h.toString());
  }

  @Test
  public void testMissingType() {
    LoweringSession session = new LoweringSession();
    session.exit(new VarDef(b.span(), "var x", "x"));
    session.exit(b.module("M").construct());
    LoweringResult result = session.result();
    assertEquals("var x: undefinedType",
                 result.singleModule().declarations.get(0).toString());
    assertEquals("type", result.recoveryNotes.get(0).category);
  }

  @Test
  public void testFunctionTypeMissingArgument() {
    LoweringResult result = lowerConst(
        ConstructTree.of(new TypeFun(b.span(), "->"), b.intType()));
    Type t = ((ConstDecl)result.singleModule().declarations.get(0)).type;
    // The type that is present is the result
    assertEquals("(undefinedType -> int)", t.toString());
    assertEquals(1, result.recoveryNotes.size());
    assertEquals("type", result.recoveryNotes.get(0).category);
  }

  @Test
  public void testOperatorTypeMissingArgument() {
    LoweringResult result = lowerConst(ConstructTree.of(
        new TypeOper(b.span(), "=>", 3), b.intType(), b.boolType()));
    Type t = ((ConstDecl)result.singleModule().declarations.get(0)).type;
    assertEquals("(int, undefinedType) => bool", t.toString());
    assertEquals(1, result.recoveryNotes.size());
  }

  @Test
  public void testTypeOrderInFunction() {
    // set(a) -> list(b): argument first
    assertEquals("(set(a) -> list(b))", lower(b.funType(
        b.setType(b.typeRef("a")), b.listType(b.typeRef("b")))).toString());
  }
}

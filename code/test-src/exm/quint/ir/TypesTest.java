package exm.quint.ir;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import exm.quint.ir.Types.BoolType;
import exm.quint.ir.Types.ConcreteRow;
import exm.quint.ir.Types.EmptyRow;
import exm.quint.ir.Types.FunType;
import exm.quint.ir.Types.IntType;
import exm.quint.ir.Types.ListType;
import exm.quint.ir.Types.OperType;
import exm.quint.ir.Types.RecordType;
import exm.quint.ir.Types.RowField;
import exm.quint.ir.Types.SetType;
import exm.quint.ir.Types.StrType;
import exm.quint.ir.Types.SumType;
import exm.quint.ir.Types.TupleType;
import exm.quint.ir.Types.Type;
import exm.quint.ir.Types.VarRow;
import exm.quint.ir.Types.VarType;

public class TypesTest {

  private long nextId = 1;

  private IntType intT() {
    return new IntType(nextId++);
  }

  @Test
  public void testPrint() {
    assertEquals("set(int)", new SetType(nextId++, intT()).toString());
    assertEquals("list(str)",
                 new ListType(nextId++, new StrType(nextId++)).toString());
    assertEquals("(a -> bool)", new FunType(nextId++,
        new VarType(nextId++, "a"), new BoolType(nextId++)).toString());
    assertEquals("(int, str) => bool", new OperType(nextId++,
        Arrays.<Type>asList(intT(), new StrType(nextId++)),
        new BoolType(nextId++)).toString());
  }

  @Test
  public void testRows() {
    ConcreteRow tuple = new ConcreteRow(Arrays.asList(
        new RowField("0", intT()), new RowField("1", intT())),
        EmptyRow.INSTANCE);
    assertEquals("(int, int)", new TupleType(nextId++, tuple).toString());

    ConcreteRow open = new ConcreteRow(
        Collections.singletonList(new RowField("a", intT())),
        new VarRow("r"));
    assertEquals("{ a: int | r }",
                 new RecordType(nextId++, open).toString());
    assertEquals("r", open.tailName());
    assertEquals("a", open.getField("a").name);
    assertNull(open.getField("b"));
  }

  @Test
  public void testSum() {
    ConcreteRow row = new ConcreteRow(Arrays.asList(
        new RowField("A", intT()),
        new RowField("B", Types.unitType(nextId++))), EmptyRow.INSTANCE);
    SumType sum = new SumType(nextId++, row);
    assertEquals("A(int) | B", sum.toString());
    assertEquals(2, sum.children().size());
  }

  @Test
  public void testUnit() {
    RecordType unit = Types.unitType(nextId++);
    assertEquals("{}", unit.toString());
    assertTrue(Types.isUnit(unit));
    assertTrue(Types.isUnit(new RecordType(nextId++, EmptyRow.INSTANCE)));
    assertFalse(Types.isUnit(new RecordType(nextId++,
                                            new VarRow("r"))));
    assertFalse(Types.isUnit(intT()));
  }

  @Test(expected=IllegalArgumentException.class)
  public void testDuplicateField() {
    new ConcreteRow(Arrays.asList(new RowField("a", intT()),
                                  new RowField("a", intT())),
                    EmptyRow.INSTANCE);
  }

  @Test(expected=IllegalArgumentException.class)
  public void testRowVarClash() {
    new ConcreteRow(Arrays.asList(new RowField("r", intT())),
                    new VarRow("r"));
  }
}

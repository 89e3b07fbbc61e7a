/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.quint.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Types in the IR.
 *
 * Records, tuples and sums are built over rows.  A row is a list of
 * uniquely named fields plus a tail: the empty row for a closed row, or a
 * row variable for an open one.
 */
public class Types {

  public abstract static class Type extends IrNode {
    protected Type(long id) {
      super(id);
    }

    @Override
    public List<IrNode> children() {
      return Collections.emptyList();
    }
  }

  public static class IntType extends Type {
    public IntType(long id) {
      super(id);
    }

    @Override
    public String toString() {
      return "int";
    }
  }

  public static class BoolType extends Type {
    public BoolType(long id) {
      super(id);
    }

    @Override
    public String toString() {
      return "bool";
    }
  }

  public static class StrType extends Type {
    public StrType(long id) {
      super(id);
    }

    @Override
    public String toString() {
      return "str";
    }
  }

  /**
   * A type variable, e.g. a
   */
  public static class VarType extends Type {
    public final String name;

    public VarType(long id, String name) {
      super(id);
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  /**
   * A reference to a type declared with typedef, e.g. Temperature
   */
  public static class ConstType extends Type {
    public final String name;

    public ConstType(long id, String name) {
      super(id);
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static class SetType extends Type {
    public final Type elem;

    public SetType(long id, Type elem) {
      super(id);
      this.elem = Preconditions.checkNotNull(elem);
    }

    @Override
    public List<IrNode> children() {
      return ImmutableList.<IrNode>of(elem);
    }

    @Override
    public String toString() {
      return "set(" + elem + ")";
    }
  }

  public static class ListType extends Type {
    public final Type elem;

    public ListType(long id, Type elem) {
      super(id);
      this.elem = Preconditions.checkNotNull(elem);
    }

    @Override
    public List<IrNode> children() {
      return ImmutableList.<IrNode>of(elem);
    }

    @Override
    public String toString() {
      return "list(" + elem + ")";
    }
  }

  /**
   * A function (map) type, e.g. str -> int
   */
  public static class FunType extends Type {
    public final Type arg;
    public final Type res;

    public FunType(long id, Type arg, Type res) {
      super(id);
      this.arg = Preconditions.checkNotNull(arg);
      this.res = Preconditions.checkNotNull(res);
    }

    @Override
    public List<IrNode> children() {
      return ImmutableList.<IrNode>of(arg, res);
    }

    @Override
    public String toString() {
      return "(" + arg + " -> " + res + ")";
    }
  }

  /**
   * A tuple type: a row with fields named "0", "1", ...
   */
  public static class TupleType extends Type {
    public final Row fields;

    public TupleType(long id, Row fields) {
      super(id);
      this.fields = Preconditions.checkNotNull(fields);
    }

    @Override
    public List<IrNode> children() {
      return fields.types();
    }

    @Override
    public String toString() {
      List<String> parts = new ArrayList<String>();
      for (IrNode t: fields.types()) {
        parts.add(t.toString());
      }
      String tail = fields.tailName();
      return "(" + StringUtils.join(parts, ", ") +
             (tail == null ? "" : " | " + tail) + ")";
    }
  }

  public static class RecordType extends Type {
    public final Row fields;

    public RecordType(long id, Row fields) {
      super(id);
      this.fields = Preconditions.checkNotNull(fields);
    }

    @Override
    public List<IrNode> children() {
      return fields.types();
    }

    @Override
    public String toString() {
      String row = fields.toString();
      return row.isEmpty() ? "{}" : "{ " + row + " }";
    }
  }

  /**
   * A sum type: a closed row of variant labels and their payload types
   */
  public static class SumType extends Type {
    public final ConcreteRow fields;

    public SumType(long id, ConcreteRow fields) {
      super(id);
      this.fields = Preconditions.checkNotNull(fields);
    }

    @Override
    public List<IrNode> children() {
      return fields.types();
    }

    @Override
    public String toString() {
      List<String> parts = new ArrayList<String>();
      for (RowField f: fields.fields) {
        parts.add(isUnit(f.type) ? f.name : f.name + "(" + f.type + ")");
      }
      return StringUtils.join(parts, " | ");
    }
  }

  /**
   * An operator type, e.g. (int, str) => bool
   */
  public static class OperType extends Type {
    public final ImmutableList<Type> args;
    public final Type res;

    public OperType(long id, List<Type> args, Type res) {
      super(id);
      this.args = ImmutableList.copyOf(args);
      this.res = Preconditions.checkNotNull(res);
    }

    @Override
    public List<IrNode> children() {
      List<IrNode> result = new ArrayList<IrNode>(args);
      result.add(res);
      return result;
    }

    @Override
    public String toString() {
      return "(" + StringUtils.join(args, ", ") + ") => " + res;
    }
  }

  public abstract static class Row {
    /**
     * @return the field types in order, empty for a tail-only row
     */
    public List<IrNode> types() {
      return Collections.emptyList();
    }

    /**
     * @return the row variable of an open row, null if closed
     */
    public abstract String tailName();
  }

  /**
   * The closed, empty row
   */
  public static class EmptyRow extends Row {
    public static final EmptyRow INSTANCE = new EmptyRow();

    private EmptyRow() {
    }

    @Override
    public String tailName() {
      return null;
    }

    @Override
    public String toString() {
      return "";
    }
  }

  /**
   * An open row with no known fields
   */
  public static class VarRow extends Row {
    public final String name;

    public VarRow(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public String tailName() {
      return name;
    }

    @Override
    public String toString() {
      return "| " + name;
    }
  }

  public static class RowField {
    public final String name;
    public final Type type;

    public RowField(String name, Type type) {
      this.name = Preconditions.checkNotNull(name);
      this.type = Preconditions.checkNotNull(type);
    }

    @Override
    public String toString() {
      return name + ": " + type;
    }
  }

  /**
   * Fields followed by an empty or variable tail
   */
  public static class ConcreteRow extends Row {
    public final ImmutableList<RowField> fields;
    public final Row other;

    public ConcreteRow(List<RowField> fields, Row other) {
      Preconditions.checkArgument(!(other instanceof ConcreteRow),
                                  "nested concrete row");
      Set<String> names = new HashSet<String>();
      for (RowField f: fields) {
        Preconditions.checkArgument(names.add(f.name),
                                    "duplicate row field %s", f.name);
      }
      String tail = other.tailName();
      Preconditions.checkArgument(tail == null || !names.contains(tail),
                                  "row variable %s is also a field", tail);
      this.fields = ImmutableList.copyOf(fields);
      this.other = other;
    }

    @Override
    public List<IrNode> types() {
      List<IrNode> result = new ArrayList<IrNode>(fields.size());
      for (RowField f: fields) {
        result.add(f.type);
      }
      return result;
    }

    @Override
    public String tailName() {
      return other.tailName();
    }

    public RowField getField(String name) {
      for (RowField f: fields) {
        if (f.name.equals(name)) {
          return f;
        }
      }
      return null;
    }

    @Override
    public String toString() {
      String tail = other.tailName();
      String fieldStr = StringUtils.join(fields, ", ");
      if (tail == null) {
        return fieldStr;
      } else if (fields.isEmpty()) {
        return "| " + tail;
      }
      return fieldStr + " | " + tail;
    }
  }

  /**
   * The unit type is the empty, closed record
   */
  public static RecordType unitType(long id) {
    return new RecordType(id, new ConcreteRow(
                    Collections.<RowField>emptyList(), EmptyRow.INSTANCE));
  }

  public static boolean isUnit(Type t) {
    if (!(t instanceof RecordType)) {
      return false;
    }
    Row row = ((RecordType)t).fields;
    if (row instanceof EmptyRow) {
      return true;
    }
    return row instanceof ConcreteRow &&
           ((ConcreteRow)row).fields.isEmpty() &&
           ((ConcreteRow)row).other instanceof EmptyRow;
  }
}

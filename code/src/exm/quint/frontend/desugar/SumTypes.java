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
package exm.quint.frontend.desugar;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.quint.ast.SourceSpan;
import exm.quint.common.exceptions.QuintRuntimeError;
import exm.quint.frontend.IdRegistry;
import exm.quint.frontend.RecoveryLog;
import exm.quint.ir.Builtins;
import exm.quint.ir.Decls.Declaration;
import exm.quint.ir.Decls.OpDef;
import exm.quint.ir.Decls.TypeDef;
import exm.quint.ir.Exprs.App;
import exm.quint.ir.Exprs.Expr;
import exm.quint.ir.Exprs.Lambda;
import exm.quint.ir.Exprs.Name;
import exm.quint.ir.Exprs.StrLit;
import exm.quint.ir.LambdaParam;
import exm.quint.ir.OpQualifier;
import exm.quint.ir.Types;
import exm.quint.ir.Types.BoolType;
import exm.quint.ir.Types.ConcreteRow;
import exm.quint.ir.Types.ConstType;
import exm.quint.ir.Types.EmptyRow;
import exm.quint.ir.Types.FunType;
import exm.quint.ir.Types.IntType;
import exm.quint.ir.Types.ListType;
import exm.quint.ir.Types.OperType;
import exm.quint.ir.Types.RecordType;
import exm.quint.ir.Types.Row;
import exm.quint.ir.Types.RowField;
import exm.quint.ir.Types.SetType;
import exm.quint.ir.Types.StrType;
import exm.quint.ir.Types.SumType;
import exm.quint.ir.Types.TupleType;
import exm.quint.ir.Types.Type;
import exm.quint.ir.Types.VarType;

/**
 * Sum type definitions: the typedef plus one constructor operator per
 * variant.
 *
 * For type T = A(int) | B this produces, in order:
 * <pre>
 *   type T = A(int) | B
 *   def A: (int) => T = (__AParam) => variant("A", __AParam)
 *   val B: T = variant("B", Rec())
 * </pre>
 */
public class SumTypes {

  /**
   * One lowered alternative of a sum type
   */
  public static class Variant {
    public final String label;
    /** The unit type if the variant has no payload */
    public final Type payload;
    public final SourceSpan span;

    public Variant(String label, Type payload, SourceSpan span) {
      this.label = Preconditions.checkNotNull(label);
      this.payload = Preconditions.checkNotNull(payload);
      this.span = Preconditions.checkNotNull(span);
    }

    @Override
    public String toString() {
      return label + "(" + payload + ")";
    }
  }

  /**
   * @return name of the parameter of the constructor for a label
   */
  public static String constructorParam(String label) {
    return "__" + label + "Param";
  }

  /**
   * @param span span of the whole sum type definition
   * @param text source text, for recovery notes
   * @return the typedef followed by the constructors in variant order
   */
  public static List<Declaration> lower(IdRegistry ids, RecoveryLog recovery,
      SourceSpan span, String text, String typeName, List<Variant> variants) {
    List<Variant> unique = new ArrayList<Variant>(variants.size());
    Set<String> labels = new HashSet<String>();
    for (Variant v: variants) {
      if (labels.add(v.label)) {
        unique.add(v);
      } else {
        recovery.record("variant", v.span, text,
                        "dropping duplicate variant " + v.label +
                        " of " + typeName);
      }
    }

    List<RowField> fields = new ArrayList<RowField>(unique.size());
    for (Variant v: unique) {
      fields.add(new RowField(v.label, v.payload));
    }
    long typedefId = ids.next(span);
    SumType sumType = new SumType(ids.next(span),
                  new ConcreteRow(fields, EmptyRow.INSTANCE));

    List<Declaration> result = new ArrayList<Declaration>();
    result.add(new TypeDef(typedefId, typeName, sumType, null));
    for (Variant v: unique) {
      result.add(constructor(ids, typeName, v));
    }
    return result;
  }

  private static OpDef constructor(IdRegistry ids, String typeName,
                                   Variant v) {
    SourceSpan span = v.span;
    Expr label = new StrLit(ids.next(span), v.label);
    if (Types.isUnit(v.payload)) {
      Expr unit = new App(ids.next(span), Builtins.REC,
                          ImmutableList.<Expr>of());
      Expr body = new App(ids.next(span), Builtins.VARIANT,
                          ImmutableList.of(label, unit));
      return new OpDef(ids.next(span), v.label, OpQualifier.VAL,
                       new ConstType(ids.next(span), typeName), body, null);
    }

    String paramName = constructorParam(v.label);
    LambdaParam param = new LambdaParam(ids.next(span), paramName);
    Expr body = new App(ids.next(span), Builtins.VARIANT,
        ImmutableList.<Expr>of(label, new Name(ids.next(span), paramName)));
    Lambda lambda = new Lambda(ids.next(span), ImmutableList.of(param),
                               OpQualifier.DEF, body);
    // The payload type node already sits in the typedef
    Type payload = copyType(ids, span, v.payload);
    OperType type = new OperType(ids.next(span), ImmutableList.of(payload),
                                 new ConstType(ids.next(span), typeName));
    return new OpDef(ids.next(span), v.label, OpQualifier.DEF, type, lambda,
                     null);
  }

  /**
   * Copy a type, giving every node a fresh identifier
   */
  static Type copyType(IdRegistry ids, SourceSpan span, Type t) {
    long id = ids.next(span);
    if (t instanceof IntType) {
      return new IntType(id);
    } else if (t instanceof BoolType) {
      return new BoolType(id);
    } else if (t instanceof StrType) {
      return new StrType(id);
    } else if (t instanceof VarType) {
      return new VarType(id, ((VarType)t).name);
    } else if (t instanceof ConstType) {
      return new ConstType(id, ((ConstType)t).name);
    } else if (t instanceof SetType) {
      return new SetType(id, copyType(ids, span, ((SetType)t).elem));
    } else if (t instanceof ListType) {
      return new ListType(id, copyType(ids, span, ((ListType)t).elem));
    } else if (t instanceof FunType) {
      FunType ft = (FunType)t;
      return new FunType(id, copyType(ids, span, ft.arg),
                         copyType(ids, span, ft.res));
    } else if (t instanceof TupleType) {
      return new TupleType(id, copyRow(ids, span, ((TupleType)t).fields));
    } else if (t instanceof RecordType) {
      return new RecordType(id, copyRow(ids, span, ((RecordType)t).fields));
    } else if (t instanceof SumType) {
      return new SumType(id, (ConcreteRow)copyRow(ids, span,
                                                  ((SumType)t).fields));
    } else if (t instanceof OperType) {
      OperType ot = (OperType)t;
      List<Type> args = new ArrayList<Type>(ot.args.size());
      for (Type arg: ot.args) {
        args.add(copyType(ids, span, arg));
      }
      return new OperType(id, args, copyType(ids, span, ot.res));
    } else {
      throw new QuintRuntimeError("Unexpected type class: " + t.getClass());
    }
  }

  private static Row copyRow(IdRegistry ids, SourceSpan span, Row row) {
    if (!(row instanceof ConcreteRow)) {
      // Tails carry no identified nodes
      return row;
    }
    ConcreteRow cr = (ConcreteRow)row;
    List<RowField> fields = new ArrayList<RowField>(cr.fields.size());
    for (RowField f: cr.fields) {
      fields.add(new RowField(f.name, copyType(ids, span, f.type)));
    }
    return new ConcreteRow(fields, cr.other);
  }
}

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
package exm.quint.frontend;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;

import exm.quint.ast.SourceSpan;
import exm.quint.frontend.desugar.SumTypes;
import exm.quint.ir.Decls.AssumeDecl;
import exm.quint.ir.Decls.Declaration;
import exm.quint.ir.Decls.OpDef;
import exm.quint.ir.Exprs.BoolLit;
import exm.quint.ir.Exprs.Expr;
import exm.quint.ir.Exprs.Let;
import exm.quint.ir.Exprs.Name;
import exm.quint.ir.LambdaParam;
import exm.quint.ir.OpQualifier;
import exm.quint.ir.Types.EmptyRow;
import exm.quint.ir.Types.Row;
import exm.quint.ir.Types.Type;
import exm.quint.ir.Types.VarType;

/**
 * Nodes synthesized in place of children missing from a malformed tree.
 * Each placeholder gets fresh identifiers mapped to the span of the
 * construct being lowered.
 */
public class Placeholders {
  public static final String UNDEFINED_EXPR = "__undefinedExprGenerated";
  public static final String UNDEFINED_DEF = "__undefinedDefGenerated";
  public static final String UNDEFINED_DECL = "_undefinedDeclaration";
  public static final String UNDEFINED_PARAM = "__undefinedParam";
  public static final String UNDEFINED_TYPE = "undefinedType";
  public static final String UNDEFINED_FIELD = "__undefinedField";
  public static final String HOLE = "_";
  public static final String STAR = "*";

  /**
   * let val __undefinedExprGenerated = true; __undefinedExprGenerated
   */
  public static Expr undefinedExpr(IdRegistry ids, SourceSpan span) {
    OpDef def = new OpDef(ids.next(span), UNDEFINED_EXPR, OpQualifier.VAL,
                          null, new BoolLit(ids.next(span), true), null);
    return new Let(ids.next(span), def,
                   new Name(ids.next(span), UNDEFINED_EXPR));
  }

  /**
   * val __undefinedDefGenerated = true
   */
  public static OpDef undefinedDef(IdRegistry ids, SourceSpan span) {
    return new OpDef(ids.next(span), UNDEFINED_DEF, OpQualifier.VAL, null,
                     new BoolLit(ids.next(span), true), null);
  }

  public static Declaration undefinedDecl(IdRegistry ids, SourceSpan span) {
    long id = ids.next(span);
    return new AssumeDecl(id, UNDEFINED_DECL + id,
                          undefinedExpr(ids, span), null);
  }

  public static LambdaParam undefinedParam(IdRegistry ids,
                                           SourceSpan span) {
    long id = ids.next(span);
    return new LambdaParam(id, UNDEFINED_PARAM + id);
  }

  public static Type undefinedType(IdRegistry ids, SourceSpan span) {
    return new VarType(ids.next(span), UNDEFINED_TYPE);
  }

  public static SumTypes.Variant undefinedVariant(IdRegistry ids,
                                                  SourceSpan span) {
    return new SumTypes.Variant(UNDEFINED_FIELD, undefinedType(ids, span),
                                span);
  }

  static Supplier<Expr> exprs(final IdRegistry ids, final SourceSpan span) {
    return new Supplier<Expr>() {
      @Override
      public Expr get() {
        return undefinedExpr(ids, span);
      }
    };
  }

  static Supplier<OpDef> defs(final IdRegistry ids, final SourceSpan span) {
    return new Supplier<OpDef>() {
      @Override
      public OpDef get() {
        return undefinedDef(ids, span);
      }
    };
  }

  static Supplier<LambdaParam> params(final IdRegistry ids,
                                      final SourceSpan span) {
    return new Supplier<LambdaParam>() {
      @Override
      public LambdaParam get() {
        return undefinedParam(ids, span);
      }
    };
  }

  static Supplier<Type> types(final IdRegistry ids, final SourceSpan span) {
    return new Supplier<Type>() {
      @Override
      public Type get() {
        return undefinedType(ids, span);
      }
    };
  }

  static Supplier<SumTypes.Variant> variants(final IdRegistry ids,
                                             final SourceSpan span) {
    return new Supplier<SumTypes.Variant>() {
      @Override
      public SumTypes.Variant get() {
        return undefinedVariant(ids, span);
      }
    };
  }

  static Supplier<RecordElement> recordElements(final IdRegistry ids,
                                                final SourceSpan span) {
    return new Supplier<RecordElement>() {
      @Override
      public RecordElement get() {
        return new RecordElement(UNDEFINED_FIELD, undefinedExpr(ids, span));
      }
    };
  }

  static Supplier<Row> emptyRow() {
    return Suppliers.<Row>ofInstance(EmptyRow.INSTANCE);
  }

  static Supplier<ArgumentList> emptyArgs() {
    return Suppliers.ofInstance(ArgumentList.EMPTY);
  }

  static Supplier<String> name(String placeholder) {
    return Suppliers.ofInstance(placeholder);
  }

  private Placeholders() {
    // not instantiated
  }
}

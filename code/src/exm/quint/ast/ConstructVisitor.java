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
package exm.quint.ast;

import exm.quint.ast.DeclConstructs.AssumeDef;
import exm.quint.ast.DeclConstructs.ConstDef;
import exm.quint.ast.DeclConstructs.DocumentedDeclaration;
import exm.quint.ast.DeclConstructs.ExportMod;
import exm.quint.ast.DeclConstructs.ImportMod;
import exm.quint.ast.DeclConstructs.InstanceMod;
import exm.quint.ast.DeclConstructs.ModuleDef;
import exm.quint.ast.DeclConstructs.NondetOperDef;
import exm.quint.ast.DeclConstructs.OperDef;
import exm.quint.ast.DeclConstructs.TypeAbstractDef;
import exm.quint.ast.DeclConstructs.TypeAliasDef;
import exm.quint.ast.DeclConstructs.TypeSumDef;
import exm.quint.ast.DeclConstructs.TypeSumVariant;
import exm.quint.ast.DeclConstructs.VarDef;
import exm.quint.ast.ExprConstructs.ArgList;
import exm.quint.ast.ExprConstructs.Assign;
import exm.quint.ast.ExprConstructs.BinaryOp;
import exm.quint.ast.ExprConstructs.BooleanBlock;
import exm.quint.ast.ExprConstructs.DotCall;
import exm.quint.ast.ExprConstructs.IdentOrHole;
import exm.quint.ast.ExprConstructs.IdentOrStar;
import exm.quint.ast.ExprConstructs.IfElse;
import exm.quint.ast.ExprConstructs.LambdaTupleSugar;
import exm.quint.ast.ExprConstructs.LambdaUnsugared;
import exm.quint.ast.ExprConstructs.LetIn;
import exm.quint.ast.ExprConstructs.ListApp;
import exm.quint.ast.ExprConstructs.ListLiteral;
import exm.quint.ast.ExprConstructs.LiteralOrId;
import exm.quint.ast.ExprConstructs.MatchSum;
import exm.quint.ast.ExprConstructs.Nondet;
import exm.quint.ast.ExprConstructs.OperApp;
import exm.quint.ast.ExprConstructs.PairLiteral;
import exm.quint.ast.ExprConstructs.Parameter;
import exm.quint.ast.ExprConstructs.RecElem;
import exm.quint.ast.ExprConstructs.RecordLiteral;
import exm.quint.ast.ExprConstructs.TupleLiteral;
import exm.quint.ast.ExprConstructs.UnaryMinus;
import exm.quint.ast.TypeConstructs.PrimitiveType;
import exm.quint.ast.TypeConstructs.Row;
import exm.quint.ast.TypeConstructs.TypeConstOrVar;
import exm.quint.ast.TypeConstructs.TypeFun;
import exm.quint.ast.TypeConstructs.TypeList;
import exm.quint.ast.TypeConstructs.TypeOper;
import exm.quint.ast.TypeConstructs.TypeRec;
import exm.quint.ast.TypeConstructs.TypeSet;
import exm.quint.ast.TypeConstructs.TypeTuple;

/**
 * One exit hook per construct.  The state is passed explicitly so that
 * implementations can be shared between independent lowering sessions.
 *
 * @param <S> per-walk state threaded through every call
 */
public interface ConstructVisitor<S> {

  // Modules and declarations
  void exitModule(S state, ModuleDef c);
  void exitConst(S state, ConstDef c);
  void exitVar(S state, VarDef c);
  void exitAssume(S state, AssumeDef c);
  void exitOperDef(S state, OperDef c);
  void exitNondetOperDef(S state, NondetOperDef c);
  void exitImport(S state, ImportMod c);
  void exitExport(S state, ExportMod c);
  void exitInstance(S state, InstanceMod c);
  void exitTypeAbstractDef(S state, TypeAbstractDef c);
  void exitTypeAliasDef(S state, TypeAliasDef c);
  void exitTypeSumDef(S state, TypeSumDef c);
  void exitTypeSumVariant(S state, TypeSumVariant c);
  void exitDocumentedDeclaration(S state, DocumentedDeclaration c);

  // Expressions
  void exitLiteralOrId(S state, LiteralOrId c);
  void exitListApp(S state, ListApp c);
  void exitOperApp(S state, OperApp c);
  void exitDotCall(S state, DotCall c);
  void exitArgList(S state, ArgList c);
  void exitLambdaUnsugared(S state, LambdaUnsugared c);
  void exitLambdaTupleSugar(S state, LambdaTupleSugar c);
  void exitIdentOrHole(S state, IdentOrHole c);
  void exitParameter(S state, Parameter c);
  void exitIdentOrStar(S state, IdentOrStar c);
  void exitTuple(S state, TupleLiteral c);
  void exitPair(S state, PairLiteral c);
  void exitList(S state, ListLiteral c);
  void exitRecElem(S state, RecElem c);
  void exitRecord(S state, RecordLiteral c);
  void exitBinaryOp(S state, BinaryOp c);
  void exitUnaryMinus(S state, UnaryMinus c);
  void exitAssign(S state, Assign c);
  void exitBooleanBlock(S state, BooleanBlock c);
  void exitIfElse(S state, IfElse c);
  void exitMatchSum(S state, MatchSum c);
  void exitLetIn(S state, LetIn c);
  void exitNondet(S state, Nondet c);

  // Types
  void exitPrimitiveType(S state, PrimitiveType c);
  void exitTypeConstOrVar(S state, TypeConstOrVar c);
  void exitTypeSet(S state, TypeSet c);
  void exitTypeList(S state, TypeList c);
  void exitTypeFun(S state, TypeFun c);
  void exitTypeTuple(S state, TypeTuple c);
  void exitRow(S state, Row c);
  void exitTypeRec(S state, TypeRec c);
  void exitTypeOper(S state, TypeOper c);
}

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
 * Visitor that sends every construct to a single method, for tests that
 * only care about the order in which constructs complete.
 */
public abstract class UniformVisitor<S> implements ConstructVisitor<S> {

  protected abstract void visit(S state, Construct c);

  @Override
  public void exitModule(S state, ModuleDef c) {
    visit(state, c);
  }

  @Override
  public void exitConst(S state, ConstDef c) {
    visit(state, c);
  }

  @Override
  public void exitVar(S state, VarDef c) {
    visit(state, c);
  }

  @Override
  public void exitAssume(S state, AssumeDef c) {
    visit(state, c);
  }

  @Override
  public void exitOperDef(S state, OperDef c) {
    visit(state, c);
  }

  @Override
  public void exitNondetOperDef(S state, NondetOperDef c) {
    visit(state, c);
  }

  @Override
  public void exitImport(S state, ImportMod c) {
    visit(state, c);
  }

  @Override
  public void exitExport(S state, ExportMod c) {
    visit(state, c);
  }

  @Override
  public void exitInstance(S state, InstanceMod c) {
    visit(state, c);
  }

  @Override
  public void exitTypeAbstractDef(S state, TypeAbstractDef c) {
    visit(state, c);
  }

  @Override
  public void exitTypeAliasDef(S state, TypeAliasDef c) {
    visit(state, c);
  }

  @Override
  public void exitTypeSumDef(S state, TypeSumDef c) {
    visit(state, c);
  }

  @Override
  public void exitTypeSumVariant(S state, TypeSumVariant c) {
    visit(state, c);
  }

  @Override
  public void exitDocumentedDeclaration(S state, DocumentedDeclaration c) {
    visit(state, c);
  }

  @Override
  public void exitLiteralOrId(S state, LiteralOrId c) {
    visit(state, c);
  }

  @Override
  public void exitListApp(S state, ListApp c) {
    visit(state, c);
  }

  @Override
  public void exitOperApp(S state, OperApp c) {
    visit(state, c);
  }

  @Override
  public void exitDotCall(S state, DotCall c) {
    visit(state, c);
  }

  @Override
  public void exitArgList(S state, ArgList c) {
    visit(state, c);
  }

  @Override
  public void exitLambdaUnsugared(S state, LambdaUnsugared c) {
    visit(state, c);
  }

  @Override
  public void exitLambdaTupleSugar(S state, LambdaTupleSugar c) {
    visit(state, c);
  }

  @Override
  public void exitIdentOrHole(S state, IdentOrHole c) {
    visit(state, c);
  }

  @Override
  public void exitParameter(S state, Parameter c) {
    visit(state, c);
  }

  @Override
  public void exitIdentOrStar(S state, IdentOrStar c) {
    visit(state, c);
  }

  @Override
  public void exitTuple(S state, TupleLiteral c) {
    visit(state, c);
  }

  @Override
  public void exitPair(S state, PairLiteral c) {
    visit(state, c);
  }

  @Override
  public void exitList(S state, ListLiteral c) {
    visit(state, c);
  }

  @Override
  public void exitRecElem(S state, RecElem c) {
    visit(state, c);
  }

  @Override
  public void exitRecord(S state, RecordLiteral c) {
    visit(state, c);
  }

  @Override
  public void exitBinaryOp(S state, BinaryOp c) {
    visit(state, c);
  }

  @Override
  public void exitUnaryMinus(S state, UnaryMinus c) {
    visit(state, c);
  }

  @Override
  public void exitAssign(S state, Assign c) {
    visit(state, c);
  }

  @Override
  public void exitBooleanBlock(S state, BooleanBlock c) {
    visit(state, c);
  }

  @Override
  public void exitIfElse(S state, IfElse c) {
    visit(state, c);
  }

  @Override
  public void exitMatchSum(S state, MatchSum c) {
    visit(state, c);
  }

  @Override
  public void exitLetIn(S state, LetIn c) {
    visit(state, c);
  }

  @Override
  public void exitNondet(S state, Nondet c) {
    visit(state, c);
  }

  @Override
  public void exitPrimitiveType(S state, PrimitiveType c) {
    visit(state, c);
  }

  @Override
  public void exitTypeConstOrVar(S state, TypeConstOrVar c) {
    visit(state, c);
  }

  @Override
  public void exitTypeSet(S state, TypeSet c) {
    visit(state, c);
  }

  @Override
  public void exitTypeList(S state, TypeList c) {
    visit(state, c);
  }

  @Override
  public void exitTypeFun(S state, TypeFun c) {
    visit(state, c);
  }

  @Override
  public void exitTypeTuple(S state, TypeTuple c) {
    visit(state, c);
  }

  @Override
  public void exitRow(S state, Row c) {
    visit(state, c);
  }

  @Override
  public void exitTypeRec(S state, TypeRec c) {
    visit(state, c);
  }

  @Override
  public void exitTypeOper(S state, TypeOper c) {
    visit(state, c);
  }
}

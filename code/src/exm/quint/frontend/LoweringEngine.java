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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

import com.google.common.collect.ImmutableList;

import exm.quint.ast.Construct;
import exm.quint.ast.ConstructVisitor;
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
import exm.quint.ast.SourceSpan;
import exm.quint.ast.Terminal;
import exm.quint.ast.TypeConstructs;
import exm.quint.ast.TypeConstructs.PrimitiveType;
import exm.quint.ast.TypeConstructs.TypeConstOrVar;
import exm.quint.ast.TypeConstructs.TypeFun;
import exm.quint.ast.TypeConstructs.TypeOper;
import exm.quint.ast.TypeConstructs.TypeRec;
import exm.quint.ast.TypeConstructs.TypeSet;
import exm.quint.ast.TypeConstructs.TypeTuple;
import exm.quint.common.exceptions.QuintRuntimeError;
import exm.quint.frontend.desugar.Operators;
import exm.quint.frontend.desugar.RecordSpreads;
import exm.quint.frontend.desugar.SumTypes;
import exm.quint.frontend.desugar.TupleLambdas;
import exm.quint.frontend.desugar.VariantMatches;
import exm.quint.ir.Builtins;
import exm.quint.ir.Decls.AssumeDecl;
import exm.quint.ir.Decls.ConstDecl;
import exm.quint.ir.Decls.Declaration;
import exm.quint.ir.Decls.ExportDecl;
import exm.quint.ir.Decls.ImportDecl;
import exm.quint.ir.Decls.InstanceDecl;
import exm.quint.ir.Decls.InstanceOverride;
import exm.quint.ir.Decls.OpDef;
import exm.quint.ir.Decls.TypeDef;
import exm.quint.ir.Decls.VarDecl;
import exm.quint.ir.Exprs.App;
import exm.quint.ir.Exprs.BoolLit;
import exm.quint.ir.Exprs.Expr;
import exm.quint.ir.Exprs.IntLit;
import exm.quint.ir.Exprs.Lambda;
import exm.quint.ir.Exprs.Let;
import exm.quint.ir.Exprs.Name;
import exm.quint.ir.Exprs.StrLit;
import exm.quint.ir.IrModule;
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
import exm.quint.ir.Types.TupleType;
import exm.quint.ir.Types.Type;
import exm.quint.ir.Types.VarType;
import exm.quint.ir.Types.VarRow;

/**
 * Reduction rules: one per construct.
 *
 * Each rule pops the lowered sub-constructs from the category stacks of
 * the state, builds an IR node with a fresh identifier and pushes it onto
 * the stack of its own category.  Missing sub-constructs are replaced by
 * placeholders, so a rule never fails on a malformed tree.
 *
 * The engine itself holds no state and can be shared between sessions.
 */
public class LoweringEngine implements ConstructVisitor<LoweringState> {

  /** Tuple item access written as a field: e._1 to e._99 */
  private static final Pattern TUPLE_ITEM =
                                    Pattern.compile("^_([1-9][0-9]?)$");

  /* ---------------------------------------------------------------- *
   * Modules and declarations
   * ---------------------------------------------------------------- */

  @Override
  public void exitModule(LoweringState s, ModuleDef c) {
    List<Declaration> decls = s.decls.drain();
    if (s.checkLeaks) {
      checkLeaks(s, c);
    }
    s.resetStacks();
    IrModule module = new IrModule(s.ids.next(c.span()), c.name, decls,
                                   DocComments.join(c.docLines));
    LogHelper.debug(c.span(), "lowered module " + c.name + " with " +
                    decls.size() + " declarations");
    s.addModule(module);
  }

  /**
   * Anything left on the stacks at the end of a module was pushed by a
   * construct that no parent consumed.
   */
  private void checkLeaks(LoweringState s, ModuleDef c) {
    List<String> leaked = new ArrayList<String>();
    for (CategoryStack<?> stack: s.nonDeclarationStacks()) {
      if (!stack.isEmpty()) {
        leaked.add(stack.size() + " " + stack.category());
      }
    }
    if (!leaked.isEmpty()) {
      String msg = "unconsumed elements at end of module " + c.name + ": " +
                   StringUtils.join(leaked, ", ");
      LogHelper.warn(c.span(), msg);
      s.recovery.add(new RecoveryNote("leak", c.span(), msg));
    }
  }

  @Override
  public void exitConst(LoweringState s, ConstDef c) {
    Type type = s.types.pop(c, Placeholders.types(s.ids, c.span()));
    s.pushDeclaration(new ConstDecl(s.ids.next(c.span()), c.name, type,
                                    null));
  }

  @Override
  public void exitVar(LoweringState s, VarDef c) {
    Type type = s.types.pop(c, Placeholders.types(s.ids, c.span()));
    s.pushDeclaration(new VarDecl(s.ids.next(c.span()), c.name, type,
                                  null));
  }

  @Override
  public void exitAssume(LoweringState s, AssumeDef c) {
    Expr assumption = s.exprs.pop(c, Placeholders.exprs(s.ids, c.span()));
    String name = s.identOrHoles.pop(c, Placeholders.name(Placeholders.HOLE));
    s.pushDeclaration(new AssumeDecl(s.ids.next(c.span()), name,
                                     assumption, null));
  }

  @Override
  public void exitOperDef(LoweringState s, OperDef c) {
    SourceSpan span = c.span();
    OpQualifier qualifier = OpQualifier.fromText(c.qualifier);

    Expr body;
    if (c.hasBody) {
      body = s.exprs.pop(c, Placeholders.exprs(s.ids, span));
    } else {
      // Header without a body, e.g. after a parse error
      body = new BoolLit(s.ids.next(span), true);
    }

    Type type = null;
    if (c.typeCount == 1) {
      type = s.types.pop(c, Placeholders.types(s.ids, span));
    } else if (c.typeCount > 1) {
      List<Type> sig = s.types.popMany(c.typeCount, c,
                                       Placeholders.types(s.ids, span));
      type = new OperType(s.ids.next(span), sig.subList(0, sig.size() - 1),
                          sig.get(sig.size() - 1));
    }

    if (c.paramCount > 0) {
      List<LambdaParam> params = s.params.popMany(c.paramCount, c,
                                      Placeholders.params(s.ids, span));
      body = new Lambda(s.ids.next(span), params, qualifier, body);
    }

    s.pushDeclaration(new OpDef(s.ids.next(span), c.name, qualifier, type,
                                body, null));
  }

  @Override
  public void exitNondetOperDef(LoweringState s, NondetOperDef c) {
    Expr expr = s.exprs.pop(c, Placeholders.exprs(s.ids, c.span()));
    Type type = null;
    if (c.hasType) {
      type = s.types.pop(c, Placeholders.types(s.ids, c.span()));
    }
    s.pushDeclaration(new OpDef(s.ids.next(c.span()), c.name,
                                OpQualifier.NONDET, type, expr, null));
  }

  @Override
  public void exitImport(LoweringState s, ImportMod c) {
    String defName = null;
    if (c.hasIdentOrStar) {
      defName = s.identOrStars.pop(c, Placeholders.name(Placeholders.STAR));
    }
    s.pushDeclaration(new ImportDecl(s.ids.next(c.span()), c.protoName,
        defName, c.alias, unquote(c.fromSource), null));
  }

  @Override
  public void exitExport(LoweringState s, ExportMod c) {
    String defName = null;
    if (c.hasIdentOrStar) {
      defName = s.identOrStars.pop(c, Placeholders.name(Placeholders.STAR));
    }
    s.pushDeclaration(new ExportDecl(s.ids.next(c.span()), c.protoName,
                                     defName, c.alias, null));
  }

  @Override
  public void exitInstance(LoweringState s, InstanceMod c) {
    List<Expr> values = s.exprs.popMany(c.overrideNames.size(), c,
                                        Placeholders.exprs(s.ids, c.span()));
    List<InstanceOverride> overrides = new ArrayList<InstanceOverride>();
    for (int i = 0; i < c.overrideNames.size(); i++) {
      Terminal name = c.overrideNames.get(i);
      LambdaParam param = new LambdaParam(s.ids.next(name.span), name.text);
      overrides.add(new InstanceOverride(param, values.get(i)));
    }
    s.pushDeclaration(new InstanceDecl(s.ids.next(c.span()), c.protoName,
        c.qualifiedName, overrides, c.identityOverride,
        unquote(c.fromSource), null));
  }

  @Override
  public void exitTypeAbstractDef(LoweringState s, TypeAbstractDef c) {
    TypeDef def = new TypeDef(s.ids.next(c.span()), c.name, null, null);
    checkTypeName(s, def);
    s.pushDeclaration(def);
  }

  @Override
  public void exitTypeAliasDef(LoweringState s, TypeAliasDef c) {
    Type type = s.types.pop(c, Placeholders.types(s.ids, c.span()));
    TypeDef def = new TypeDef(s.ids.next(c.span()), c.name, type, null);
    checkTypeName(s, def);
    s.pushDeclaration(def);
  }

  @Override
  public void exitTypeSumDef(LoweringState s, TypeSumDef c) {
    List<SumTypes.Variant> variants = s.variants.popMany(c.variantCount, c,
                                  Placeholders.variants(s.ids, c.span()));
    List<Declaration> decls = SumTypes.lower(s.ids, s.recovery, c.span(),
                                             c.text(), c.name, variants);
    checkTypeName(s, (TypeDef)decls.get(0));
    s.pushDeclarations(decls);
  }

  @Override
  public void exitTypeSumVariant(LoweringState s, TypeSumVariant c) {
    Type payload;
    if (c.hasPayload) {
      payload = s.types.pop(c, Placeholders.types(s.ids, c.span()));
    } else {
      payload = Types.unitType(s.ids.next(c.span()));
    }
    s.variants.push(new SumTypes.Variant(c.label, payload, c.span()));
  }

  @Override
  public void exitDocumentedDeclaration(LoweringState s,
                                        DocumentedDeclaration c) {
    String doc = DocComments.join(c.docLines);
    if (doc == null) {
      return;
    }
    int i = s.lastDeclarationGroupStart;
    if (i < 0 || i >= s.decls.size()) {
      s.recovery.record("declaration", c.span(), c.text(),
                        "no declaration to attach documentation to: " +
                        c.text());
      return;
    }
    s.decls.replace(i, s.decls.get(i).withDoc(doc));
  }

  private void checkTypeName(LoweringState s, TypeDef def) {
    if (Character.isLowerCase(def.name.charAt(0))) {
      s.diagnostics.add(def.id(), DiagnosticCode.QNT007);
    }
  }

  private static String unquote(String path) {
    return path == null ? null : StringUtils.unwrap(path, '"');
  }

  /* ---------------------------------------------------------------- *
   * Expressions
   * ---------------------------------------------------------------- */

  @Override
  public void exitLiteralOrId(LoweringState s, LiteralOrId c) {
    long id = s.ids.next(c.span());
    Expr e;
    switch (c.kind) {
      case NAME:
        e = new Name(id, c.token);
        break;
      case INT:
        e = new IntLit(id, Literals.parseIntToken(c.token));
        break;
      case BOOL:
        e = new BoolLit(id, Literals.parseBoolToken(c.token));
        break;
      case STRING:
        e = new StrLit(id, Literals.extractStringLit(c.token));
        break;
      default:
        throw new QuintRuntimeError("Unexpected literal kind: " + c.kind);
    }
    s.exprs.push(e);
  }

  @Override
  public void exitListApp(LoweringState s, ListApp c) {
    pushApp(s, c, Builtins.NTH, popExprs(s, c, 2));
  }

  @Override
  public void exitOperApp(LoweringState s, OperApp c) {
    List<Expr> args = ImmutableList.of();
    if (c.hasArgList) {
      args = s.argLists.pop(c, Placeholders.emptyArgs()).args;
    }
    pushApp(s, c, c.name, args);
  }

  @Override
  public void exitDotCall(LoweringState s, DotCall c) {
    SourceSpan span = c.span();
    if (c.hasParens) {
      // e.f(args) is f(e, args)
      List<Expr> args = ImmutableList.of();
      if (c.hasArgList) {
        args = s.argLists.pop(c, Placeholders.emptyArgs()).args;
      }
      Expr callee = s.exprs.pop(c, Placeholders.exprs(s.ids, span));
      List<Expr> allArgs = new ArrayList<Expr>(args.size() + 1);
      allArgs.add(callee);
      allArgs.addAll(args);
      pushApp(s, c, c.name, allArgs);
      return;
    }

    Expr callee = s.exprs.pop(c, Placeholders.exprs(s.ids, span));
    Matcher m = TUPLE_ITEM.matcher(c.name);
    if (m.matches()) {
      Expr index = new IntLit(s.ids.next(span), Long.parseLong(m.group(1)));
      pushApp(s, c, Builtins.ITEM, ImmutableList.of(callee, index));
    } else {
      Expr field = new StrLit(s.ids.next(span), c.name);
      pushApp(s, c, Builtins.FIELD, ImmutableList.of(callee, field));
    }
  }

  @Override
  public void exitArgList(LoweringState s, ArgList c) {
    s.argLists.push(new ArgumentList(popExprs(s, c, c.argCount)));
  }

  @Override
  public void exitLambdaUnsugared(LoweringState s, LambdaUnsugared c) {
    Expr body = s.exprs.pop(c, Placeholders.exprs(s.ids, c.span()));
    List<LambdaParam> params = s.params.popMany(c.paramCount, c,
                                  Placeholders.params(s.ids, c.span()));
    s.exprs.push(new Lambda(s.ids.next(c.span()), params, OpQualifier.DEF,
                            body));
  }

  @Override
  public void exitLambdaTupleSugar(LoweringState s, LambdaTupleSugar c) {
    Expr body = s.exprs.pop(c, Placeholders.exprs(s.ids, c.span()));
    List<LambdaParam> params = s.params.popMany(c.paramCount, c,
                                  Placeholders.params(s.ids, c.span()));
    s.exprs.push(TupleLambdas.lower(s.ids, c.span(), params, body));
  }

  @Override
  public void exitIdentOrHole(LoweringState s, IdentOrHole c) {
    s.identOrHoles.push(c.token);
  }

  @Override
  public void exitParameter(LoweringState s, Parameter c) {
    String name = s.identOrHoles.pop(c, Placeholders.name(Placeholders.HOLE));
    s.params.push(new LambdaParam(s.ids.next(c.span()), name));
  }

  @Override
  public void exitIdentOrStar(LoweringState s, IdentOrStar c) {
    s.identOrStars.push(c.token);
  }

  @Override
  public void exitTuple(LoweringState s, TupleLiteral c) {
    pushApp(s, c, Builtins.TUP, popExprs(s, c, c.elemCount));
  }

  @Override
  public void exitPair(LoweringState s, PairLiteral c) {
    pushApp(s, c, Builtins.TUP, popExprs(s, c, 2));
  }

  @Override
  public void exitList(LoweringState s, ListLiteral c) {
    pushApp(s, c, Builtins.LIST, popExprs(s, c, c.elemCount));
  }

  @Override
  public void exitRecElem(LoweringState s, RecElem c) {
    Expr value = s.exprs.pop(c, Placeholders.exprs(s.ids, c.span()));
    s.recordElems.push(new RecordElement(c.label, value));
  }

  @Override
  public void exitRecord(LoweringState s, RecordLiteral c) {
    List<RecordElement> elems = s.recordElems.popMany(c.elemCount, c,
                            Placeholders.recordElements(s.ids, c.span()));
    List<Expr> spreads = new ArrayList<Expr>();
    List<String> names = new ArrayList<String>();
    List<Expr> values = new ArrayList<Expr>();
    for (RecordElement elem: elems) {
      if (elem.isSpread()) {
        spreads.add(elem.value);
      } else {
        names.add(elem.label);
        values.add(elem.value);
      }
    }
    s.exprs.push(RecordSpreads.lower(s.ids, s.diagnostics, c.span(),
                                     spreads, names, values));
  }

  @Override
  public void exitBinaryOp(LoweringState s, BinaryOp c) {
    pushApp(s, c, Operators.binaryOpcode(c.op), popExprs(s, c, 2));
  }

  @Override
  public void exitUnaryMinus(LoweringState s, UnaryMinus c) {
    pushApp(s, c, Builtins.IUMINUS, popExprs(s, c, 1));
  }

  @Override
  public void exitAssign(LoweringState s, Assign c) {
    Expr value = s.exprs.pop(c, Placeholders.exprs(s.ids, c.span()));
    Expr target = new Name(s.ids.next(c.nameSpan), c.name);
    pushApp(s, c, Builtins.ASSIGN, ImmutableList.of(target, value));
  }

  @Override
  public void exitBooleanBlock(LoweringState s, BooleanBlock c) {
    pushApp(s, c, Operators.blockOpcode(c.keyword),
            popExprs(s, c, c.exprCount));
  }

  @Override
  public void exitIfElse(LoweringState s, IfElse c) {
    pushApp(s, c, Builtins.ITE, popExprs(s, c, 3));
  }

  @Override
  public void exitMatchSum(LoweringState s, MatchSum c) {
    // The matched expression comes first, so missing case bodies are the
    // ones replaced by placeholders
    List<Expr> exprs = popExprs(s, c, c.cases.size() + 1);
    s.exprs.push(VariantMatches.lower(s.ids, c.span(), exprs.get(0),
                              c.cases, exprs.subList(1, exprs.size())));
  }

  @Override
  public void exitLetIn(LoweringState s, LetIn c) {
    lowerLet(s, c);
  }

  @Override
  public void exitNondet(LoweringState s, Nondet c) {
    lowerLet(s, c);
  }

  /**
   * The definition was pushed onto the declaration stack before the
   * expression it scopes over was lowered.
   */
  private void lowerLet(LoweringState s, Construct c) {
    SourceSpan span = c.span();
    Expr body = s.exprs.pop(c, Placeholders.exprs(s.ids, span));
    Declaration decl = s.decls.pop(c, Placeholders.defs(s.ids, span));
    OpDef def;
    if (decl instanceof OpDef) {
      def = (OpDef)decl;
    } else {
      s.recovery.record("declaration", span, c.text(),
                        "expected an operator definition in let, found: " +
                        decl);
      def = Placeholders.undefinedDef(s.ids, span);
    }
    s.exprs.push(new Let(s.ids.next(span), def, body));
  }

  private List<Expr> popExprs(LoweringState s, Construct c, int n) {
    return s.exprs.popMany(n, c, Placeholders.exprs(s.ids, c.span()));
  }

  private void pushApp(LoweringState s, Construct c, String opcode,
                       List<Expr> args) {
    s.exprs.push(new App(s.ids.next(c.span()), opcode, args));
  }

  /* ---------------------------------------------------------------- *
   * Types and rows
   * ---------------------------------------------------------------- */

  @Override
  public void exitPrimitiveType(LoweringState s, PrimitiveType c) {
    long id = s.ids.next(c.span());
    Type t;
    if (c.keyword.equals("int")) {
      t = new IntType(id);
    } else if (c.keyword.equals("bool")) {
      t = new BoolType(id);
    } else if (c.keyword.equals("str")) {
      t = new StrType(id);
    } else {
      throw new QuintRuntimeError("Unexpected primitive type: " + c.keyword);
    }
    s.types.push(t);
  }

  @Override
  public void exitTypeConstOrVar(LoweringState s, TypeConstOrVar c) {
    long id = s.ids.next(c.span());
    if (Character.isLowerCase(c.name.charAt(0))) {
      s.types.push(new VarType(id, c.name));
    } else {
      s.types.push(new ConstType(id, c.name));
    }
  }

  @Override
  public void exitTypeSet(LoweringState s, TypeSet c) {
    Type elem = s.types.pop(c, Placeholders.types(s.ids, c.span()));
    s.types.push(new SetType(s.ids.next(c.span()), elem));
  }

  @Override
  public void exitTypeList(LoweringState s, TypeConstructs.TypeList c) {
    Type elem = s.types.pop(c, Placeholders.types(s.ids, c.span()));
    s.types.push(new ListType(s.ids.next(c.span()), elem));
  }

  @Override
  public void exitTypeFun(LoweringState s, TypeFun c) {
    Type res = s.types.pop(c, Placeholders.types(s.ids, c.span()));
    Type arg = s.types.pop(c, Placeholders.types(s.ids, c.span()));
    s.types.push(new FunType(s.ids.next(c.span()), arg, res));
  }

  @Override
  public void exitTypeTuple(LoweringState s, TypeTuple c) {
    List<Type> elems = s.types.popMany(c.elemCount, c,
                                Placeholders.types(s.ids, c.span()));
    List<RowField> fields = new ArrayList<RowField>(elems.size());
    for (int i = 0; i < elems.size(); i++) {
      fields.add(new RowField(Integer.toString(i), elems.get(i)));
    }
    s.types.push(new TupleType(s.ids.next(c.span()),
                    new ConcreteRow(fields, EmptyRow.INSTANCE)));
  }

  @Override
  public void exitRow(LoweringState s, TypeConstructs.Row c) {
    List<Type> fieldTypes = s.types.popMany(c.labels.size(), c,
                                Placeholders.types(s.ids, c.span()));
    List<RowField> fields = new ArrayList<RowField>(fieldTypes.size());
    Set<String> names = new HashSet<String>();
    for (int i = 0; i < c.labels.size(); i++) {
      String label = c.labels.get(i);
      if (names.add(label)) {
        fields.add(new RowField(label, fieldTypes.get(i)));
      } else {
        s.recovery.record("row", c.span(), c.text(),
                          "dropping duplicate field " + label);
      }
    }

    Row tail = EmptyRow.INSTANCE;
    if (c.rowVar != null) {
      if (names.contains(c.rowVar)) {
        s.recovery.record("row", c.span(), c.text(),
                          "closing row whose variable " + c.rowVar +
                          " is also a field");
      } else {
        tail = new VarRow(c.rowVar);
      }
    }
    s.rows.push(new ConcreteRow(fields, tail));
  }

  @Override
  public void exitTypeRec(LoweringState s, TypeRec c) {
    Row row = s.rows.pop(c, Placeholders.emptyRow());
    s.types.push(new RecordType(s.ids.next(c.span()), row));
  }

  @Override
  public void exitTypeOper(LoweringState s, TypeOper c) {
    // The result is the last type pushed
    Type res = s.types.pop(c, Placeholders.types(s.ids, c.span()));
    List<Type> args = s.types.popMany(c.typeCount - 1, c,
                                Placeholders.types(s.ids, c.span()));
    s.types.push(new OperType(s.ids.next(c.span()), args, res));
  }
}

package exm.quint.frontend;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import exm.quint.ast.ConstructTree;
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
import exm.quint.ast.ExprConstructs.LiteralKind;
import exm.quint.ast.ExprConstructs.LiteralOrId;
import exm.quint.ast.ExprConstructs.MatchCase;
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

/**
 * Builds construct trees the way the parser would hand them over.  Every
 * construct gets its own span, one column further along.
 */
public class ConstructBuilder {
  public static final String SOURCE = "test.qnt";

  private int col = 0;

  public SourceSpan span() {
    int c = col++;
    return new SourceSpan(SOURCE, 0, c, c, 0, c, c);
  }

  private static ConstructTree[] arr(List<ConstructTree> trees) {
    return trees.toArray(new ConstructTree[trees.size()]);
  }

  private static List<ConstructTree> concat(List<ConstructTree> a,
                                            List<ConstructTree> b) {
    List<ConstructTree> result = new ArrayList<ConstructTree>(a);
    result.addAll(b);
    return result;
  }

  /* Declarations */

  public ConstructTree module(String name, ConstructTree... decls) {
    return moduleWithDoc(name, Collections.<String>emptyList(), decls);
  }

  public ConstructTree moduleWithDoc(String name, List<String> docLines,
                                     ConstructTree... decls) {
    return ConstructTree.of(new ModuleDef(span(), "module " + name, name,
                                          docLines), decls);
  }

  public ConstructTree constDef(String name, ConstructTree type) {
    return ConstructTree.of(new ConstDef(span(), "const " + name, name),
                            type);
  }

  public ConstructTree varDef(String name, ConstructTree type) {
    return ConstructTree.of(new VarDef(span(), "var " + name, name), type);
  }

  public ConstructTree assume(String name, ConstructTree expr) {
    return ConstructTree.of(new AssumeDef(span(), "assume " + name),
                            identOrHole(name), expr);
  }

  /**
   * @param body null for a definition without a body
   */
  public ConstructTree operDef(String qualifier, String name,
      List<ConstructTree> params, List<ConstructTree> types,
      ConstructTree body) {
    List<ConstructTree> children = concat(params, types);
    if (body != null) {
      children.add(body);
    }
    return ConstructTree.of(new OperDef(span(), qualifier + " " + name,
        qualifier, name, params.size(), types.size(), body != null),
        arr(children));
  }

  public ConstructTree val(String name, ConstructTree body) {
    return operDef("val", name, Collections.<ConstructTree>emptyList(),
                   Collections.<ConstructTree>emptyList(), body);
  }

  public ConstructTree def(String name, List<ConstructTree> params,
                           ConstructTree body) {
    return operDef("def", name, params,
                   Collections.<ConstructTree>emptyList(), body);
  }

  public ConstructTree nondetDef(String name, ConstructTree type,
                                 ConstructTree expr) {
    NondetOperDef c = new NondetOperDef(span(), "nondet " + name, name,
                                        type != null);
    if (type == null) {
      return ConstructTree.of(c, expr);
    }
    return ConstructTree.of(c, type, expr);
  }

  public ConstructTree importMod(String proto, String identOrStar,
                                 String alias, String fromSource) {
    ImportMod c = new ImportMod(span(), "import " + proto, proto, alias,
                                identOrStar != null, fromSource);
    if (identOrStar == null) {
      return ConstructTree.of(c);
    }
    return ConstructTree.of(c, identOrStar(identOrStar));
  }

  public ConstructTree exportMod(String proto, String identOrStar,
                                 String alias) {
    ExportMod c = new ExportMod(span(), "export " + proto, proto, alias,
                                identOrStar != null);
    if (identOrStar == null) {
      return ConstructTree.of(c);
    }
    return ConstructTree.of(c, identOrStar(identOrStar));
  }

  public ConstructTree instance(String proto, String qualifiedName,
      List<String> names, List<ConstructTree> values,
      boolean identityOverride, String fromSource) {
    List<Terminal> terminals = new ArrayList<Terminal>();
    for (String n: names) {
      terminals.add(new Terminal(n, span()));
    }
    return ConstructTree.of(new InstanceMod(span(), "module " + proto,
        proto, qualifiedName, terminals, identityOverride, fromSource),
        arr(values));
  }

  public ConstructTree typeAbstract(String name) {
    return ConstructTree.of(new TypeAbstractDef(span(), "type " + name,
                                                name));
  }

  public ConstructTree typeAlias(String name, ConstructTree type) {
    return ConstructTree.of(new TypeAliasDef(span(), "type " + name, name),
                            type);
  }

  public ConstructTree typeSum(String name, ConstructTree... variants) {
    return ConstructTree.of(new TypeSumDef(span(), "type " + name, name,
                                           variants.length), variants);
  }

  public ConstructTree variant(String label) {
    return ConstructTree.of(new TypeSumVariant(span(), label, label,
                                               false));
  }

  public ConstructTree variant(String label, ConstructTree payload) {
    return ConstructTree.of(new TypeSumVariant(span(), label, label, true),
                            payload);
  }

  public ConstructTree documented(List<String> docLines,
                                  ConstructTree decl) {
    return ConstructTree.of(new DocumentedDeclaration(span(), "doc",
                                                      docLines), decl);
  }

  /* Expressions */

  public ConstructTree name(String name) {
    return ConstructTree.of(new LiteralOrId(span(), LiteralKind.NAME, name));
  }

  public ConstructTree intLit(String token) {
    return ConstructTree.of(new LiteralOrId(span(), LiteralKind.INT, token));
  }

  public ConstructTree intLit(long value) {
    return intLit(Long.toString(value));
  }

  public ConstructTree boolLit(boolean value) {
    return ConstructTree.of(new LiteralOrId(span(), LiteralKind.BOOL,
                                            Boolean.toString(value)));
  }

  public ConstructTree strLit(String value) {
    return ConstructTree.of(new LiteralOrId(span(), LiteralKind.STRING,
                                            "\"" + value + "\""));
  }

  public ConstructTree binary(String op, ConstructTree left,
                              ConstructTree right) {
    return ConstructTree.of(new BinaryOp(span(), op, op), left, right);
  }

  public ConstructTree unaryMinus(ConstructTree operand) {
    return ConstructTree.of(new UnaryMinus(span(), "-"), operand);
  }

  public ConstructTree argList(ConstructTree... args) {
    return ConstructTree.of(new ArgList(span(), "args", args.length), args);
  }

  public ConstructTree app(String name, ConstructTree... args) {
    OperApp c = new OperApp(span(), name + "(...)", name, args.length > 0);
    if (args.length == 0) {
      return ConstructTree.of(c);
    }
    return ConstructTree.of(c, argList(args));
  }

  /**
   * e.name without parentheses
   */
  public ConstructTree dot(ConstructTree callee, String name) {
    return ConstructTree.of(new DotCall(span(), "." + name, name, false,
                                        false), callee);
  }

  /**
   * e.name(args)
   */
  public ConstructTree dotCall(ConstructTree callee, String name,
                               ConstructTree... args) {
    DotCall c = new DotCall(span(), "." + name + "()", name, true,
                            args.length > 0);
    if (args.length == 0) {
      return ConstructTree.of(c, callee);
    }
    return ConstructTree.of(c, callee, argList(args));
  }

  public ConstructTree listApp(ConstructTree list, ConstructTree index) {
    return ConstructTree.of(new ListApp(span(), "[]"), list, index);
  }

  public ConstructTree identOrHole(String token) {
    return ConstructTree.of(new IdentOrHole(span(), token));
  }

  public ConstructTree identOrStar(String token) {
    return ConstructTree.of(new IdentOrStar(span(), token));
  }

  public ConstructTree param(String name) {
    return ConstructTree.of(new Parameter(span(), name), identOrHole(name));
  }

  public List<ConstructTree> params(String... names) {
    List<ConstructTree> result = new ArrayList<ConstructTree>();
    for (String n: names) {
      result.add(param(n));
    }
    return result;
  }

  public ConstructTree lambda(List<ConstructTree> params,
                              ConstructTree body) {
    return ConstructTree.of(new LambdaUnsugared(span(), "=>", params.size()),
                            arr(concat(params, Arrays.asList(body))));
  }

  public ConstructTree tupleLambda(List<ConstructTree> params,
                                   ConstructTree body) {
    return ConstructTree.of(new LambdaTupleSugar(span(), "(()) =>",
                                                 params.size()),
                            arr(concat(params, Arrays.asList(body))));
  }

  public ConstructTree tuple(ConstructTree... elems) {
    return ConstructTree.of(new TupleLiteral(span(), "()", elems.length),
                            elems);
  }

  public ConstructTree pair(ConstructTree a, ConstructTree b) {
    return ConstructTree.of(new PairLiteral(span(), "->"), a, b);
  }

  public ConstructTree list(ConstructTree... elems) {
    return ConstructTree.of(new ListLiteral(span(), "[]", elems.length),
                            elems);
  }

  public ConstructTree field(String label, ConstructTree value) {
    return ConstructTree.of(new RecElem(span(), label + ":", label), value);
  }

  public ConstructTree spread(ConstructTree value) {
    return ConstructTree.of(new RecElem(span(), "...", null), value);
  }

  public ConstructTree record(ConstructTree... elems) {
    return ConstructTree.of(new RecordLiteral(span(), "{}", elems.length),
                            elems);
  }

  public ConstructTree assign(String name, ConstructTree value) {
    return ConstructTree.of(new Assign(span(), name + "' =",
                                       new Terminal(name, span())), value);
  }

  public ConstructTree block(String keyword, ConstructTree... exprs) {
    return ConstructTree.of(new BooleanBlock(span(), keyword + " {}",
                                             keyword, exprs.length), exprs);
  }

  public ConstructTree ifElse(ConstructTree cond, ConstructTree thenExpr,
                              ConstructTree elseExpr) {
    return ConstructTree.of(new IfElse(span(), "if"), cond, thenExpr,
                            elseExpr);
  }

  public MatchCase matchCase(String label, String param) {
    return new MatchCase(span(), label, param);
  }

  public ConstructTree match(ConstructTree scrutinee, List<MatchCase> cases,
                             ConstructTree... bodies) {
    List<ConstructTree> children = new ArrayList<ConstructTree>();
    children.add(scrutinee);
    children.addAll(Arrays.asList(bodies));
    return ConstructTree.of(new MatchSum(span(), "match", cases),
                            arr(children));
  }

  public ConstructTree letIn(ConstructTree def, ConstructTree body) {
    return ConstructTree.of(new LetIn(span(), "let"), def, body);
  }

  public ConstructTree nondet(String name, ConstructTree value,
                              ConstructTree body) {
    return ConstructTree.of(new Nondet(span(), "nondet " + name),
                            nondetDef(name, null, value), body);
  }

  /* Types */

  public ConstructTree primitive(String keyword) {
    return ConstructTree.of(new PrimitiveType(span(), keyword));
  }

  public ConstructTree intType() {
    return primitive("int");
  }

  public ConstructTree boolType() {
    return primitive("bool");
  }

  public ConstructTree strType() {
    return primitive("str");
  }

  public ConstructTree typeRef(String name) {
    return ConstructTree.of(new TypeConstOrVar(span(), name));
  }

  public ConstructTree setType(ConstructTree elem) {
    return ConstructTree.of(new TypeSet(span(), "set"), elem);
  }

  public ConstructTree listType(ConstructTree elem) {
    return ConstructTree.of(new TypeConstructs.TypeList(span(), "list"),
                            elem);
  }

  public ConstructTree funType(ConstructTree arg, ConstructTree res) {
    return ConstructTree.of(new TypeFun(span(), "->"), arg, res);
  }

  public ConstructTree tupleType(ConstructTree... elems) {
    return ConstructTree.of(new TypeTuple(span(), "()", elems.length),
                            elems);
  }

  public ConstructTree row(List<String> labels, String rowVar,
                           ConstructTree... types) {
    return ConstructTree.of(new TypeConstructs.Row(span(), "row", labels,
                                                   rowVar), types);
  }

  public ConstructTree recType(ConstructTree row) {
    return ConstructTree.of(new TypeRec(span(), "{}"), row);
  }

  public ConstructTree operType(ConstructTree... types) {
    return ConstructTree.of(new TypeOper(span(), "=>", types.length),
                            types);
  }

  public static List<ConstructTree> none() {
    return Collections.<ConstructTree>emptyList();
  }
}

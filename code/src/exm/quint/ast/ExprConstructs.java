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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Expression constructs, plus the small helper constructs (parameters,
 * argument lists, record elements) that only occur inside expressions.
 */
public class ExprConstructs {

  public static enum LiteralKind {
    NAME, INT, BOOL, STRING
  }

  /**
   * An identifier or a literal, e.g. foo, 42, "hello", false
   */
  public static class LiteralOrId extends Construct {
    public final LiteralKind kind;
    /** Token text as scanned, including quotes for strings */
    public final String token;

    public LiteralOrId(SourceSpan span, LiteralKind kind, String token) {
      super(span, token);
      this.kind = Preconditions.checkNotNull(kind);
      this.token = Preconditions.checkNotNull(token);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitLiteralOrId(state, this);
    }
  }

  /**
   * List access, e.g. f[10]
   */
  public static class ListApp extends Construct {
    public ListApp(SourceSpan span, String text) {
      super(span, text);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitListApp(state, this);
    }
  }

  /**
   * Operator application in the normal form, e.g. MyOper("foo", 42)
   */
  public static class OperApp extends Construct {
    public final String name;
    /** false for an empty argument list, e.g. Set() */
    public final boolean hasArgList;

    public OperApp(SourceSpan span, String text, String name,
                   boolean hasArgList) {
      super(span, text);
      this.name = Preconditions.checkNotNull(name);
      this.hasArgList = hasArgList;
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitOperApp(state, this);
    }
  }

  /**
   * e.f(args), e.f() or e.f
   */
  public static class DotCall extends Construct {
    public final String name;
    public final boolean hasParens;
    public final boolean hasArgList;

    public DotCall(SourceSpan span, String text, String name,
                   boolean hasParens, boolean hasArgList) {
      super(span, text);
      Preconditions.checkArgument(hasParens || !hasArgList,
          "arguments without parentheses in %s", text);
      this.name = Preconditions.checkNotNull(name);
      this.hasParens = hasParens;
      this.hasArgList = hasArgList;
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitDotCall(state, this);
    }
  }

  /**
   * A non-empty list of call arguments
   */
  public static class ArgList extends Construct {
    public final int argCount;

    public ArgList(SourceSpan span, String text, int argCount) {
      super(span, text);
      this.argCount = checkCount(argCount, "arguments");
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitArgList(state, this);
    }
  }

  /**
   * (p1, ..., pn) => body
   */
  public static class LambdaUnsugared extends Construct {
    public final int paramCount;

    public LambdaUnsugared(SourceSpan span, String text, int paramCount) {
      super(span, text);
      this.paramCount = checkCount(paramCount, "parameters");
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitLambdaUnsugared(state, this);
    }
  }

  /**
   * ((p1, ..., pn)) => body: a single tuple parameter unpacked by name
   */
  public static class LambdaTupleSugar extends Construct {
    public final int paramCount;

    public LambdaTupleSugar(SourceSpan span, String text, int paramCount) {
      super(span, text);
      this.paramCount = checkCount(paramCount, "parameters");
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitLambdaTupleSugar(state, this);
    }
  }

  /**
   * An identifier or the hole '_'
   */
  public static class IdentOrHole extends Construct {
    public static final String HOLE = "_";

    public final String token;

    public IdentOrHole(SourceSpan span, String token) {
      super(span, token);
      this.token = Preconditions.checkNotNull(token);
    }

    public boolean isHole() {
      return token.equals(HOLE);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitIdentOrHole(state, this);
    }
  }

  /**
   * A lambda or operator parameter wrapping an identOrHole
   */
  public static class Parameter extends Construct {
    public Parameter(SourceSpan span, String text) {
      super(span, text);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitParameter(state, this);
    }
  }

  /**
   * An identifier or '*' in an import or export
   */
  public static class IdentOrStar extends Construct {
    public static final String STAR = "*";

    public final String token;

    public IdentOrStar(SourceSpan span, String token) {
      super(span, token);
      this.token = Preconditions.checkNotNull(token);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitIdentOrStar(state, this);
    }
  }

  /**
   * Tuple constructor, e.g. (1, 2, 3)
   */
  public static class TupleLiteral extends Construct {
    public final int elemCount;

    public TupleLiteral(SourceSpan span, String text, int elemCount) {
      super(span, text);
      this.elemCount = checkCount(elemCount, "elements");
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitTuple(state, this);
    }
  }

  /**
   * Pair constructor, e.g. 2 -> 3
   */
  public static class PairLiteral extends Construct {
    public PairLiteral(SourceSpan span, String text) {
      super(span, text);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitPair(state, this);
    }
  }

  /**
   * List constructor, e.g. [1, 2, 3]
   */
  public static class ListLiteral extends Construct {
    public final int elemCount;

    public ListLiteral(SourceSpan span, String text, int elemCount) {
      super(span, text);
      this.elemCount = checkCount(elemCount, "elements");
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitList(state, this);
    }
  }

  /**
   * One element of a record literal: label: expr, or ...expr
   */
  public static class RecElem extends Construct {
    /** null for a spread */
    public final String label;

    public RecElem(SourceSpan span, String text, String label) {
      super(span, text);
      this.label = label;
    }

    public boolean isSpread() {
      return label == null;
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitRecElem(state, this);
    }
  }

  /**
   * Record constructor, e.g. { name: "igor", year: 2021 }
   */
  public static class RecordLiteral extends Construct {
    public final int elemCount;

    public RecordLiteral(SourceSpan span, String text, int elemCount) {
      super(span, text);
      this.elemCount = checkCount(elemCount, "elements");
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitRecord(state, this);
    }
  }

  /**
   * An infix operator application, e.g. x + y, p implies q
   */
  public static class BinaryOp extends Construct {
    /**
     * Operator tokens the grammar produces.  '=' comes from the parser's
     * recovery rule for a mistyped '=='.
     */
    public static final ImmutableSet<String> OPERATORS = ImmutableSet.of(
        "+", "-", "*", "/", "%", "^",
        ">", ">=", "<", "<=", "==", "!=", "=",
        "and", "or", "implies", "iff");

    public final String op;

    public BinaryOp(SourceSpan span, String text, String op) {
      super(span, text);
      Preconditions.checkArgument(OPERATORS.contains(op),
                                  "not a binary operator: %s", op);
      this.op = op;
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitBinaryOp(state, this);
    }
  }

  /**
   * Unary minus, e.g. -x
   */
  public static class UnaryMinus extends Construct {
    public UnaryMinus(SourceSpan span, String text) {
      super(span, text);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitUnaryMinus(state, this);
    }
  }

  /**
   * x' = e
   */
  public static class Assign extends Construct {
    public final String name;
    /** Span of the assigned name */
    public final SourceSpan nameSpan;

    public Assign(SourceSpan span, String text, Terminal name) {
      super(span, text);
      this.name = name.text;
      this.nameSpan = name.span;
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitAssign(state, this);
    }
  }

  /**
   * and { ... }, or { ... }, all { ... }, any { ... }
   */
  public static class BooleanBlock extends Construct {
    public static final ImmutableSet<String> KEYWORDS =
                            ImmutableSet.of("and", "or", "all", "any");

    public final String keyword;
    public final int exprCount;

    public BooleanBlock(SourceSpan span, String text, String keyword,
                        int exprCount) {
      super(span, text);
      Preconditions.checkArgument(KEYWORDS.contains(keyword),
                                  "not a block keyword: %s", keyword);
      this.keyword = keyword;
      this.exprCount = checkCount(exprCount, "expressions");
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitBooleanBlock(state, this);
    }
  }

  /**
   * if (p) e1 else e2
   */
  public static class IfElse extends Construct {
    public IfElse(SourceSpan span, String text) {
      super(span, text);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitIfElse(state, this);
    }
  }

  /**
   * One case of a match: Label(param) => e, Label(_) => e, or _ => e
   */
  public static class MatchCase {
    /** null for the wildcard case */
    public final String label;
    /** null if no name is bound */
    public final String param;
    public final SourceSpan span;

    public MatchCase(SourceSpan span, String label, String param) {
      this.span = Preconditions.checkNotNull(span);
      this.label = label;
      this.param = param;
    }

    public boolean isWildcard() {
      return label == null;
    }
  }

  /**
   * match e { | A(x) => e1 | B(_) => e2 | _ => e3 }
   */
  public static class MatchSum extends Construct {
    public final ImmutableList<MatchCase> cases;

    public MatchSum(SourceSpan span, String text, List<MatchCase> cases) {
      super(span, text);
      this.cases = ImmutableList.copyOf(cases);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitMatchSum(state, this);
    }
  }

  /**
   * An operator definition followed by the expression it scopes over
   */
  public static class LetIn extends Construct {
    public LetIn(SourceSpan span, String text) {
      super(span, text);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitLetIn(state, this);
    }
  }

  /**
   * nondet x = e1; e2
   */
  public static class Nondet extends Construct {
    public Nondet(SourceSpan span, String text) {
      super(span, text);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitNondet(state, this);
    }
  }
}

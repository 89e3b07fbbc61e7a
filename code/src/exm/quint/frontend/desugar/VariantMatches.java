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
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.quint.ast.ExprConstructs.MatchCase;
import exm.quint.ast.SourceSpan;
import exm.quint.frontend.IdRegistry;
import exm.quint.ir.Builtins;
import exm.quint.ir.Exprs.App;
import exm.quint.ir.Exprs.Expr;
import exm.quint.ir.Exprs.Lambda;
import exm.quint.ir.Exprs.StrLit;
import exm.quint.ir.LambdaParam;
import exm.quint.ir.OpQualifier;

/**
 * match e { | A(x) => e1 | _ => e2 } becomes
 * matchVariant(e, "A", (x) => e1, "_", (_) => e2)
 */
public class VariantMatches {

  /**
   * @param cases the cases in source order
   * @param bodies lowered body of each case
   */
  public static App lower(IdRegistry ids, SourceSpan span, Expr scrutinee,
                          List<MatchCase> cases, List<Expr> bodies) {
    Preconditions.checkArgument(cases.size() == bodies.size(),
        "%s cases but %s bodies", cases.size(), bodies.size());
    List<Expr> args = new ArrayList<Expr>(1 + 2 * cases.size());
    args.add(scrutinee);
    for (int i = 0; i < cases.size(); i++) {
      MatchCase c = cases.get(i);
      String label = c.isWildcard() ? Builtins.WILDCARD : c.label;
      String paramName = c.param == null ? LambdaParam.HOLE : c.param;
      args.add(new StrLit(ids.next(c.span), label));
      LambdaParam param = new LambdaParam(ids.next(c.span), paramName);
      args.add(new Lambda(ids.next(c.span), ImmutableList.of(param),
                          OpQualifier.DEF, bodies.get(i)));
    }
    return new App(ids.next(span), Builtins.MATCH_VARIANT, args);
  }
}

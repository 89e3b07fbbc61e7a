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

import exm.quint.ast.SourceSpan;
import exm.quint.frontend.DiagnosticCode;
import exm.quint.frontend.Diagnostics;
import exm.quint.frontend.IdRegistry;
import exm.quint.ir.Builtins;
import exm.quint.ir.Exprs.App;
import exm.quint.ir.Exprs.Expr;
import exm.quint.ir.Exprs.StrLit;

/**
 * Record literals, with or without a spread.
 *
 * { a: 1, b: 2 } becomes Rec("a", 1, "b", 2), while { ...r, a: 1, b: 2 }
 * becomes with(with(r, "a", 1), "b", 2).
 */
public class RecordSpreads {

  /**
   * @param spreads spread expressions in source order
   * @param names labels of the plain fields
   * @param values values of the plain fields
   * @return the lowered record.  With more than one spread, a QNT012
   *        diagnostic is reported and the first spread is the base.
   */
  public static Expr lower(IdRegistry ids, Diagnostics diagnostics,
                           SourceSpan span, List<Expr> spreads,
                           List<String> names, List<Expr> values) {
    Preconditions.checkArgument(names.size() == values.size());
    if (spreads.isEmpty()) {
      List<Expr> args = new ArrayList<Expr>(2 * names.size());
      for (int i = 0; i < names.size(); i++) {
        args.add(new StrLit(ids.next(span), names.get(i)));
        args.add(values.get(i));
      }
      return new App(ids.next(span), Builtins.REC, args);
    }

    Expr result = spreads.get(0);
    for (int i = 0; i < names.size(); i++) {
      result = new App(ids.next(span), Builtins.WITH,
          ImmutableList.<Expr>of(result, new StrLit(ids.next(span),
                                 names.get(i)), values.get(i)));
    }
    if (spreads.size() > 1) {
      diagnostics.add(result.id(), DiagnosticCode.QNT012);
    }
    return result;
  }
}

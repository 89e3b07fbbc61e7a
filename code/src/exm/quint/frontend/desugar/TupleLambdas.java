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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.quint.ast.SourceSpan;
import exm.quint.frontend.IdRegistry;
import exm.quint.ir.Builtins;
import exm.quint.ir.Decls.OpDef;
import exm.quint.ir.Exprs.App;
import exm.quint.ir.Exprs.Expr;
import exm.quint.ir.Exprs.IntLit;
import exm.quint.ir.Exprs.Lambda;
import exm.quint.ir.Exprs.Let;
import exm.quint.ir.Exprs.Name;
import exm.quint.ir.LambdaParam;
import exm.quint.ir.OpQualifier;

/**
 * Lambdas over a single tuple parameter.
 *
 * ((a, b)) => e becomes
 * <pre>
 *   (__tupledLambdaParamN) =>
 *     let pureval a = item(__tupledLambdaParamN, 1);
 *     let pureval b = item(__tupledLambdaParamN, 2);
 *     e
 * </pre>
 * where N is the identifier of the resulting lambda.
 */
public class TupleLambdas {
  public static final String TUPLE_PARAM_PREFIX = "__tupledLambdaParam";

  /**
   * @param params the names unpacked from the tuple, in order
   * @param body lowered body
   * @return the single-parameter lambda
   */
  public static Lambda lower(IdRegistry ids, SourceSpan span,
                             List<LambdaParam> params, Expr body) {
    long lambdaId = ids.next(span);
    String tupleName = TUPLE_PARAM_PREFIX + lambdaId;
    LambdaParam tupleParam = new LambdaParam(ids.next(span), tupleName);

    // Build from the innermost binding out so that the first parameter's
    // binding encloses the others
    Expr result = body;
    for (int i = params.size() - 1; i >= 0; i--) {
      LambdaParam p = params.get(i);
      if (p.isHole()) {
        continue;
      }
      Expr item = new App(ids.next(span), Builtins.ITEM,
          ImmutableList.<Expr>of(new Name(ids.next(span), tupleName),
                                 new IntLit(ids.next(span), i + 1)));
      // The definition takes over the identifier of the parameter it
      // replaces
      OpDef def = new OpDef(p.id(), p.name, OpQualifier.PUREVAL, null,
                            item, null);
      result = new Let(ids.next(span), def, result);
    }
    return new Lambda(lambdaId, ImmutableList.of(tupleParam),
                      OpQualifier.DEF, result);
  }
}

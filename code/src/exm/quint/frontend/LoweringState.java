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
import java.util.Collections;
import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.quint.frontend.desugar.SumTypes;
import exm.quint.ir.Decls.Declaration;
import exm.quint.ir.Exprs.Expr;
import exm.quint.ir.IrModule;
import exm.quint.ir.LambdaParam;
import exm.quint.ir.Types.Row;
import exm.quint.ir.Types.Type;

/**
 * Everything that changes while lowering one session: identifiers,
 * category stacks, diagnostics, recovery notes and finished modules.
 * Passed explicitly to every reduction rule.
 */
public class LoweringState {
  final IdRegistry ids = new IdRegistry();
  final Diagnostics diagnostics = new Diagnostics();
  final RecoveryLog recovery = new RecoveryLog();

  final CategoryStack<Expr> exprs =
          new CategoryStack<Expr>("expression", recovery);
  final CategoryStack<Declaration> decls =
          new CategoryStack<Declaration>("declaration", recovery);
  final CategoryStack<LambdaParam> params =
          new CategoryStack<LambdaParam>("parameter", recovery);
  final CategoryStack<Type> types =
          new CategoryStack<Type>("type", recovery);
  final CategoryStack<Row> rows =
          new CategoryStack<Row>("row", recovery);
  final CategoryStack<SumTypes.Variant> variants =
          new CategoryStack<SumTypes.Variant>("variant", recovery);
  final CategoryStack<String> identOrHoles =
          new CategoryStack<String>("identOrHole", recovery);
  final CategoryStack<String> identOrStars =
          new CategoryStack<String>("identOrStar", recovery);
  final CategoryStack<ArgumentList> argLists =
          new CategoryStack<ArgumentList>("argument list", recovery);
  final CategoryStack<RecordElement> recordElems =
          new CategoryStack<RecordElement>("record element", recovery);

  private final List<IrModule> modules = new ArrayList<IrModule>();

  /** Whether module completion checks for leftover stack content */
  final boolean checkLeaks;

  /**
   * Index in the declaration stack of the first declaration pushed by the
   * most recent declaration construct, -1 if none
   */
  int lastDeclarationGroupStart = -1;

  public LoweringState(boolean checkLeaks) {
    this.checkLeaks = checkLeaks;
  }

  public IdRegistry ids() {
    return ids;
  }

  public Diagnostics diagnostics() {
    return diagnostics;
  }

  public RecoveryLog recovery() {
    return recovery;
  }

  public List<IrModule> modules() {
    return Collections.unmodifiableList(modules);
  }

  void addModule(IrModule module) {
    modules.add(module);
  }

  /**
   * Push the declarations produced by one declaration construct
   */
  void pushDeclarations(List<? extends Declaration> group) {
    lastDeclarationGroupStart = decls.size();
    for (Declaration d: group) {
      decls.push(d);
    }
  }

  void pushDeclaration(Declaration d) {
    pushDeclarations(ImmutableList.of(d));
  }

  /**
   * @return all stacks except declarations, which a module consumes
   */
  List<CategoryStack<?>> nonDeclarationStacks() {
    return ImmutableList.<CategoryStack<?>>of(exprs, params, types, rows,
        variants, identOrHoles, identOrStars, argLists, recordElems);
  }

  void resetStacks() {
    decls.clear();
    for (CategoryStack<?> stack: nonDeclarationStacks()) {
      stack.clear();
    }
    lastDeclarationGroupStart = -1;
  }
}

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

import java.util.List;

import com.google.common.collect.ImmutableList;

import exm.quint.ir.IrModule;

/**
 * Output of a lowering session, handed to later phases
 */
public class LoweringResult {
  public final ImmutableList<IrModule> modules;
  public final SourceMap sourceMap;
  public final ImmutableList<Diagnostic> diagnostics;
  public final ImmutableList<RecoveryNote> recoveryNotes;

  public LoweringResult(List<IrModule> modules, SourceMap sourceMap,
                        List<Diagnostic> diagnostics,
                        List<RecoveryNote> recoveryNotes) {
    this.modules = ImmutableList.copyOf(modules);
    this.sourceMap = sourceMap;
    this.diagnostics = ImmutableList.copyOf(diagnostics);
    this.recoveryNotes = ImmutableList.copyOf(recoveryNotes);
  }

  public boolean hasDiagnostics() {
    return !diagnostics.isEmpty();
  }

  /**
   * @return the only module
   * @throws IllegalStateException if there is not exactly one module
   */
  public IrModule singleModule() {
    if (modules.size() != 1) {
      throw new IllegalStateException("Expected one module, got " +
                                      modules.size());
    }
    return modules.get(0);
  }
}

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

import com.google.common.base.Preconditions;

import exm.quint.ast.SourceSpan;

/**
 * A repair made by the lowering engine to get past a malformed tree.
 * Not a user-facing error: the parser reports the underlying syntax
 * error.
 */
public class RecoveryNote {
  /** Category stack that underflowed, or "leak" */
  public final String category;
  public final SourceSpan span;
  /** Text of the construct being lowered */
  public final String text;

  public RecoveryNote(String category, SourceSpan span, String text) {
    this.category = Preconditions.checkNotNull(category);
    this.span = Preconditions.checkNotNull(span);
    this.text = text;
  }

  @Override
  public String toString() {
    return span + ": " + category + ": " + text;
  }
}

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

import exm.quint.ir.Exprs.Expr;

/**
 * One element of a record literal: a labelled field or a spread.  Never
 * part of the output, so carries no identifier.
 */
class RecordElement {
  /** null for a spread */
  final String label;
  final Expr value;

  RecordElement(String label, Expr value) {
    this.label = label;
    this.value = Preconditions.checkNotNull(value);
  }

  boolean isSpread() {
    return label == null;
  }

  @Override
  public String toString() {
    return (label == null ? "..." : label + ": ") + value;
  }
}

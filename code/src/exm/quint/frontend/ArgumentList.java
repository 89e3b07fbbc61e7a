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

import exm.quint.ir.Exprs.Expr;

/**
 * The arguments of a call, waiting for the call construct.  Never part of
 * the output, so carries no identifier.
 */
class ArgumentList {
  static final ArgumentList EMPTY =
                      new ArgumentList(ImmutableList.<Expr>of());

  final ImmutableList<Expr> args;

  ArgumentList(List<Expr> args) {
    this.args = ImmutableList.copyOf(args);
  }

  @Override
  public String toString() {
    return "args" + args;
  }
}

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

import com.google.common.base.Preconditions;

/**
 * A completed syntax construct, as handed over by the parser.
 *
 * Each grammar production the front end handles is exactly one subclass,
 * see {@link DeclConstructs}, {@link ExprConstructs} and
 * {@link TypeConstructs}.  A construct only carries what the parser matched
 * directly: its span, its text, terminal tokens and the number of
 * sub-constructs of each kind.  The sub-constructs themselves have already
 * been lowered by the time the construct is visited.
 */
public abstract class Construct {

  private final SourceSpan span;

  /** Matched source text, used for log messages */
  private final String text;

  protected Construct(SourceSpan span, String text) {
    this.span = Preconditions.checkNotNull(span, "span");
    this.text = text == null ? "" : text;
  }

  public SourceSpan span() {
    return span;
  }

  public String text() {
    return text;
  }

  /**
   * Dispatch to the reduction rule for this construct
   */
  public abstract <S> void accept(ConstructVisitor<S> visitor, S state);

  protected static int checkCount(int count, String what) {
    Preconditions.checkArgument(count >= 0, "negative number of %s: %s",
                                what, count);
    return count;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "@" + span + " '" + text + "'";
  }
}

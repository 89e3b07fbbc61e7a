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

import org.antlr.runtime.Token;

import com.google.common.base.Preconditions;

/**
 * A terminal token scanned directly by a construct, with its own span.
 */
public class Terminal {
  public final String text;
  public final SourceSpan span;

  public Terminal(String text, SourceSpan span) {
    this.text = Preconditions.checkNotNull(text, "text");
    this.span = Preconditions.checkNotNull(span, "span");
  }

  public static Terminal fromToken(String source, Token token) {
    return new Terminal(token.getText(),
                        SourceSpan.fromTokens(source, token, token));
  }

  @Override
  public String toString() {
    return text;
  }
}

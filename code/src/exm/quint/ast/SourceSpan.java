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

import org.antlr.runtime.CommonToken;
import org.antlr.runtime.Token;

import exm.quint.common.Settings;

/**
 * Simple immutable class to record the source range of a construct.
 *
 * Lines are 0-based, columns are 0-based, indices are absolute character
 * offsets into the source.  The end position is -1 if unknown.
 */
public class SourceSpan {
  public static final int UNKNOWN = -1;

  public final String source;
  public final int startLine;
  public final int startCol;
  public final int startIndex;
  public final int endLine;
  public final int endCol;
  public final int endIndex;

  public SourceSpan(String source, int startLine, int startCol,
                    int startIndex, int endLine, int endCol, int endIndex) {
    super();
    this.source = source;
    this.startLine = startLine;
    this.startCol = startCol;
    this.startIndex = startIndex;
    this.endLine = endLine;
    this.endCol = endCol;
    this.endIndex = endIndex;
  }

  public SourceSpan(String source, int startLine, int startCol,
                    int startIndex) {
    this(source, startLine, startCol, startIndex,
         UNKNOWN, UNKNOWN, UNKNOWN);
  }

  /**
   * Build a span from the first and last tokens the parser matched for a
   * construct.
   * @param source name of the source, null for the configured default
   * @param start first token
   * @param stop last token, null if the parser stopped before matching one
   * @return the span of the construct
   */
  public static SourceSpan fromTokens(String source, Token start,
                                      Token stop) {
    if (source == null) {
      source = Settings.get(Settings.DEFAULT_SOURCE_NAME);
    }
    // ANTLR lines are 1-based
    int startLine = start.getLine() - 1;
    int startCol = start.getCharPositionInLine();
    int startIndex = startIndex(start);
    if (stop == null) {
      return new SourceSpan(source, startLine, startCol, startIndex);
    }

    int stopIndex = stopIndex(stop);
    int stopStart = startIndex(stop);
    int endCol = stop.getCharPositionInLine();
    if (stopIndex > 0 && stopStart != UNKNOWN) {
      // Column of the last character of a multi-character stop token
      endCol += stopIndex - stopStart;
    }
    return new SourceSpan(source, startLine, startCol, startIndex,
                          stop.getLine() - 1, endCol, stopIndex);
  }

  private static int startIndex(Token t) {
    if (t instanceof CommonToken) {
      return ((CommonToken)t).getStartIndex();
    }
    return UNKNOWN;
  }

  private static int stopIndex(Token t) {
    if (t instanceof CommonToken) {
      return ((CommonToken)t).getStopIndex();
    }
    return UNKNOWN;
  }

  public boolean hasEnd() {
    return endLine != UNKNOWN;
  }

  public String toString() {
    String start = source + ":" + (startLine + 1) + ":" + (startCol + 1);
    if (hasEnd()) {
      return start + "-" + (endLine + 1) + ":" + (endCol + 1);
    }
    return start;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + ((source == null) ? 0 : source.hashCode());
    result = prime * result + startLine;
    result = prime * result + startCol;
    result = prime * result + startIndex;
    result = prime * result + endLine;
    result = prime * result + endCol;
    result = prime * result + endIndex;
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof SourceSpan))
      return false;
    SourceSpan other = (SourceSpan) obj;
    if (source == null) {
      if (other.source != null)
        return false;
    } else if (!source.equals(other.source)) {
      return false;
    }
    return startLine == other.startLine && startCol == other.startCol &&
           startIndex == other.startIndex && endLine == other.endLine &&
           endCol == other.endCol && endIndex == other.endIndex;
  }
}

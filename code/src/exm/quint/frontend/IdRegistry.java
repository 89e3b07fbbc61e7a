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
 * Issues node identifiers for one lowering session.  Identifiers start at
 * 1 and are strictly increasing; each is entered in the source map as it
 * is issued.
 */
public class IdRegistry {
  private final SourceMap sourceMap = new SourceMap();

  private long nextId = 1;

  public long next(SourceSpan span) {
    Preconditions.checkNotNull(span);
    long id = nextId++;
    sourceMap.put(id, span);
    return id;
  }

  /**
   * @return the number of identifiers issued so far
   */
  public long issued() {
    return nextId - 1;
  }

  public SourceMap sourceMap() {
    return sourceMap;
  }
}

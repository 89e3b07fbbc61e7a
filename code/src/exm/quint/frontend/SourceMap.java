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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import exm.quint.ast.SourceSpan;

/**
 * Source span of every identifier issued in a session.  Only the
 * {@link IdRegistry} adds entries.
 */
public class SourceMap {
  private final Map<Long, SourceSpan> spans =
                                  new LinkedHashMap<Long, SourceSpan>();

  void put(long id, SourceSpan span) {
    SourceSpan prev = spans.put(id, span);
    assert(prev == null) : "id " + id + " issued twice";
  }

  /**
   * @return the span, or null if the id was never issued
   */
  public SourceSpan get(long id) {
    return spans.get(id);
  }

  public boolean contains(long id) {
    return spans.containsKey(id);
  }

  public int size() {
    return spans.size();
  }

  /**
   * @return issued ids in increasing order
   */
  public Set<Long> ids() {
    return Collections.unmodifiableSet(spans.keySet());
  }
}

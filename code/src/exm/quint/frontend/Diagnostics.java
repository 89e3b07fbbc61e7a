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

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;

/**
 * Collects structural errors without interrupting lowering.
 */
public class Diagnostics {
  private final List<Diagnostic> diagnostics = new ArrayList<Diagnostic>();

  public Diagnostic add(long nodeId, DiagnosticCode code) {
    return add(nodeId, code, code.defaultMessage);
  }

  public Diagnostic add(long nodeId, DiagnosticCode code, String message) {
    Diagnostic d = new Diagnostic(nodeId, code, message);
    diagnostics.add(d);
    return d;
  }

  public List<Diagnostic> list() {
    return Collections.unmodifiableList(diagnostics);
  }

  public int size() {
    return diagnostics.size();
  }

  public boolean isEmpty() {
    return diagnostics.isEmpty();
  }

  /**
   * @return diagnostics grouped by the node they refer to
   */
  public ListMultimap<Long, Diagnostic> byNode() {
    ListMultimap<Long, Diagnostic> result = ArrayListMultimap.create();
    for (Diagnostic d: diagnostics) {
      result.put(d.nodeId, d);
    }
    return result;
  }

  @Override
  public String toString() {
    return diagnostics.toString();
  }
}

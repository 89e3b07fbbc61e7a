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

/**
 * A user-facing structural error attached to the offending IR node
 */
public class Diagnostic {
  public final long nodeId;
  public final DiagnosticCode code;
  public final String message;

  public Diagnostic(long nodeId, DiagnosticCode code, String message) {
    this.nodeId = nodeId;
    this.code = Preconditions.checkNotNull(code);
    this.message = Preconditions.checkNotNull(message);
  }

  @Override
  public String toString() {
    return code + " [node " + nodeId + "]: " + message;
  }
}

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

import exm.quint.ast.SourceSpan;

/**
 * Recovery notes of one session, in the order they were made.
 */
public class RecoveryLog {
  private final List<RecoveryNote> notes = new ArrayList<RecoveryNote>();

  /**
   * Record a note and log it at debug level
   */
  public RecoveryNote record(String category, SourceSpan span, String text,
                             String logMsg) {
    RecoveryNote note = new RecoveryNote(category, span, text);
    notes.add(note);
    LogHelper.debug(span, logMsg);
    return note;
  }

  /**
   * Record a note that the caller has already logged
   */
  public void add(RecoveryNote note) {
    notes.add(note);
  }

  public List<RecoveryNote> notes() {
    return Collections.unmodifiableList(notes);
  }

  public int size() {
    return notes.size();
  }
}

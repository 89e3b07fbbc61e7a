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
package exm.quint.ir;

import java.util.Locale;

/**
 * Evaluation discipline of an operator definition or lambda
 */
public enum OpQualifier {
  VAL, DEF, PUREVAL, PUREDEF, ACTION, RUN, TEMPORAL, NONDET;

  /**
   * @return keyword as written in source
   */
  public String text() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Resolve a qualifier keyword.
   * @param text keyword, may be null if the qualifier was omitted
   * @return the qualifier, DEF if text is null or not a qualifier
   */
  public static OpQualifier fromText(String text) {
    if (text != null) {
      for (OpQualifier q: values()) {
        if (q.text().equals(text)) {
          return q;
        }
      }
    }
    return DEF;
  }

  @Override
  public String toString() {
    return text();
  }
}

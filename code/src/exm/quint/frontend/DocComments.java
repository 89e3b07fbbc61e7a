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
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * Documentation comments
 */
public class DocComments {
  /** Length of the "/// " marker on each line */
  public static final int MARKER_LENGTH = 4;

  /**
   * Join documentation comment lines.
   * @param lines raw comment tokens, each starting with the marker and
   *        possibly ending with a line terminator
   * @return the documentation, or null if there is none
   */
  public static String join(List<String> lines) {
    if (lines.isEmpty()) {
      return null;
    }
    List<String> stripped = new ArrayList<String>(lines.size());
    for (String line: lines) {
      String text = StringUtils.chomp(line);
      stripped.add(text.length() <= MARKER_LENGTH ? "" :
                   text.substring(MARKER_LENGTH));
    }
    String doc = StringUtils.join(stripped, "\n");
    return doc.isEmpty() ? null : doc;
  }
}

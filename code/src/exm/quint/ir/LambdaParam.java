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

import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * A lambda or operator parameter.  The name is "_" for an anonymous
 * parameter.
 */
public class LambdaParam extends IrNode {
  public static final String HOLE = "_";

  public final String name;

  public LambdaParam(long id, String name) {
    super(id);
    this.name = Preconditions.checkNotNull(name);
  }

  public boolean isHole() {
    return name.equals(HOLE);
  }

  @Override
  public List<IrNode> children() {
    return Collections.emptyList();
  }

  @Override
  public String toString() {
    return name;
  }
}

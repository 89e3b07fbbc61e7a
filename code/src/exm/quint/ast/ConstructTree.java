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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A construct together with its sub-constructs in source order: the shape
 * of the concrete syntax tree the parser builds.
 */
public class ConstructTree {
  private final Construct construct;
  private final ImmutableList<ConstructTree> children;

  public ConstructTree(Construct construct, List<ConstructTree> children) {
    this.construct = Preconditions.checkNotNull(construct);
    this.children = ImmutableList.copyOf(children);
  }

  public static ConstructTree of(Construct construct,
                                 ConstructTree... children) {
    return new ConstructTree(construct, Arrays.asList(children));
  }

  public Construct construct() {
    return construct;
  }

  public List<ConstructTree> children() {
    return children;
  }

  public String printTree() {
    StringWriter sw = new StringWriter();
    PrintWriter writer = new PrintWriter(sw);
    printTree(writer, 0);
    writer.flush();
    return sw.toString();
  }

  private void printTree(PrintWriter writer, int indent) {
    for (int i = 0; i < indent; i++)
      writer.print(' ');
    writer.println(construct.getClass().getSimpleName() + " " +
                   construct.text());
    for (ConstructTree child: children)
      child.printTree(writer, indent + 2);
  }
}

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

import java.util.ArrayDeque;
import java.util.Deque;

import org.apache.log4j.Logger;

public class ConstructWalk {

  /**
   * Bottom-up walk: every construct is visited after all of its
   * sub-constructs, siblings left to right.
   *
   * The walk is iterative so that long operator chains don't exhaust
   * the Java stack.
   * @param logger
   * @param tree
   * @param visitor
   * @param state
   */
  public static <S> void walk(Logger logger, ConstructTree tree,
                              ConstructVisitor<S> visitor, S state) {
    Deque<ConstructTree> pending = new ArrayDeque<ConstructTree>();
    // Reverse post-order: root first, right-most subtree next
    Deque<ConstructTree> order = new ArrayDeque<ConstructTree>();
    pending.push(tree);
    while (!pending.isEmpty()) {
      ConstructTree curr = pending.pop();
      order.push(curr);
      for (ConstructTree child: curr.children()) {
        pending.push(child);
      }
    }

    while (!order.isEmpty()) {
      Construct c = order.pop().construct();
      if (logger.isTraceEnabled()) {
        logger.trace("exit " + c);
      }
      c.accept(visitor, state);
    }
  }
}

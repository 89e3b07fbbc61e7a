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

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;

import exm.quint.ast.Construct;

/**
 * Already-lowered children of one syntactic category waiting for their
 * parent construct.
 *
 * Popping from a stack that holds too few elements never fails: the
 * missing elements are replaced with placeholders and the repair is
 * recorded in the session's recovery log.
 */
public class CategoryStack<T> {
  private final String category;
  private final RecoveryLog recovery;
  private final ArrayList<T> elems = new ArrayList<T>();

  public CategoryStack(String category, RecoveryLog recovery) {
    this.category = Preconditions.checkNotNull(category);
    this.recovery = Preconditions.checkNotNull(recovery);
  }

  public String category() {
    return category;
  }

  public void push(T elem) {
    elems.add(Preconditions.checkNotNull(elem));
  }

  public int size() {
    return elems.size();
  }

  public boolean isEmpty() {
    return elems.isEmpty();
  }

  T get(int index) {
    return elems.get(index);
  }

  void replace(int index, T elem) {
    elems.set(index, Preconditions.checkNotNull(elem));
  }

  /**
   * Pop the top element.
   * @param at construct being lowered
   * @param placeholder supplies a replacement if the stack is empty
   */
  public T pop(Construct at, Supplier<? extends T> placeholder) {
    if (elems.isEmpty()) {
      underflow(at, 1);
      return placeholder.get();
    }
    return elems.remove(elems.size() - 1);
  }

  /**
   * Pop the top n elements.
   * @return the elements in the order they were pushed.  If fewer than n
   *    were available, all of them followed by placeholders.
   */
  public List<T> popMany(int n, Construct at,
                         Supplier<? extends T> placeholder) {
    Preconditions.checkArgument(n >= 0);
    if (n == 0) {
      return Collections.emptyList();
    }
    List<T> result;
    if (elems.size() >= n) {
      List<T> top = elems.subList(elems.size() - n, elems.size());
      result = new ArrayList<T>(top);
      top.clear();
    } else {
      int missing = n - elems.size();
      underflow(at, missing);
      result = new ArrayList<T>(elems);
      elems.clear();
      for (int i = 0; i < missing; i++) {
        result.add(placeholder.get());
      }
    }
    return result;
  }

  /**
   * Remove all elements.
   * @return the elements in the order they were pushed
   */
  public List<T> drain() {
    List<T> result = new ArrayList<T>(elems);
    elems.clear();
    return result;
  }

  public void clear() {
    elems.clear();
  }

  private void underflow(Construct at, int missing) {
    recovery.record(category, at.span(), at.text(),
        "generating " + missing + " undefined " + category +
        " to fill hole in: " + at.text());
  }

  @Override
  public String toString() {
    return category + elems.toString();
  }
}

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

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * Type constructs.
 */
public class TypeConstructs {

  /**
   * int, bool or str
   */
  public static class PrimitiveType extends Construct {
    public static final ImmutableSet<String> KEYWORDS =
                                    ImmutableSet.of("int", "bool", "str");

    public final String keyword;

    public PrimitiveType(SourceSpan span, String keyword) {
      super(span, keyword);
      Preconditions.checkArgument(KEYWORDS.contains(keyword),
                                  "not a primitive type: %s", keyword);
      this.keyword = keyword;
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitPrimitiveType(state, this);
    }
  }

  /**
   * A type variable, a type constant, or a reference to a type alias
   */
  public static class TypeConstOrVar extends Construct {
    public final String name;

    public TypeConstOrVar(SourceSpan span, String name) {
      super(span, name);
      Preconditions.checkArgument(name != null && !name.isEmpty(),
                                  "empty type name");
      this.name = name;
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitTypeConstOrVar(state, this);
    }
  }

  /**
   * set(T)
   */
  public static class TypeSet extends Construct {
    public TypeSet(SourceSpan span, String text) {
      super(span, text);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitTypeSet(state, this);
    }
  }

  /**
   * list(T)
   */
  public static class TypeList extends Construct {
    public TypeList(SourceSpan span, String text) {
      super(span, text);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitTypeList(state, this);
    }
  }

  /**
   * T1 -> T2
   */
  public static class TypeFun extends Construct {
    public TypeFun(SourceSpan span, String text) {
      super(span, text);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitTypeFun(state, this);
    }
  }

  /**
   * (T1, ..., Tn)
   */
  public static class TypeTuple extends Construct {
    public final int elemCount;

    public TypeTuple(SourceSpan span, String text, int elemCount) {
      super(span, text);
      this.elemCount = checkCount(elemCount, "elements");
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitTypeTuple(state, this);
    }
  }

  /**
   * The fields of a record type: l1: T1, ..., ln: Tn [| rowVar]
   */
  public static class Row extends Construct {
    /** Field labels, one type sub-construct each */
    public final ImmutableList<String> labels;
    /** Name of the row variable for an open row, null if closed */
    public final String rowVar;

    public Row(SourceSpan span, String text, List<String> labels,
               String rowVar) {
      super(span, text);
      this.labels = ImmutableList.copyOf(labels);
      this.rowVar = rowVar;
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitRow(state, this);
    }
  }

  /**
   * { row }
   */
  public static class TypeRec extends Construct {
    public TypeRec(SourceSpan span, String text) {
      super(span, text);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitTypeRec(state, this);
    }
  }

  /**
   * (T1, ..., Tn) => R
   */
  public static class TypeOper extends Construct {
    /** Number of types including the result */
    public final int typeCount;

    public TypeOper(SourceSpan span, String text, int typeCount) {
      super(span, text);
      Preconditions.checkArgument(typeCount >= 1,
                                  "operator type without result: %s", text);
      this.typeCount = typeCount;
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitTypeOper(state, this);
    }
  }
}

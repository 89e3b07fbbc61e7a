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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.quint.ir.Decls.OpDef;

/**
 * Expressions in the IR.
 */
public class Exprs {

  public abstract static class Expr extends IrNode {
    protected Expr(long id) {
      super(id);
    }

    @Override
    public List<IrNode> children() {
      return Collections.emptyList();
    }
  }

  /**
   * A reference to a name in scope
   */
  public static class Name extends Expr {
    public final String name;

    public Name(long id, String name) {
      super(id);
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public String toString() {
      return name;
    }
  }

  public static class IntLit extends Expr {
    public final BigInteger value;

    public IntLit(long id, BigInteger value) {
      super(id);
      this.value = Preconditions.checkNotNull(value);
    }

    public IntLit(long id, long value) {
      this(id, BigInteger.valueOf(value));
    }

    @Override
    public String toString() {
      return value.toString();
    }
  }

  public static class BoolLit extends Expr {
    public final boolean value;

    public BoolLit(long id, boolean value) {
      super(id);
      this.value = value;
    }

    @Override
    public String toString() {
      return Boolean.toString(value);
    }
  }

  public static class StrLit extends Expr {
    /** Value without quotes */
    public final String value;

    public StrLit(long id, String value) {
      super(id);
      this.value = Preconditions.checkNotNull(value);
    }

    @Override
    public String toString() {
      return "\"" + value + "\"";
    }
  }

  /**
   * Application of a builtin or user-defined operator
   */
  public static class App extends Expr {
    public final String opcode;
    public final ImmutableList<Expr> args;

    public App(long id, String opcode, List<Expr> args) {
      super(id);
      this.opcode = Preconditions.checkNotNull(opcode);
      this.args = ImmutableList.copyOf(args);
    }

    public Expr arg(int i) {
      return args.get(i);
    }

    @Override
    public List<IrNode> children() {
      return new ArrayList<IrNode>(args);
    }

    @Override
    public String toString() {
      return opcode + "(" + StringUtils.join(args, ", ") + ")";
    }
  }

  public static class Lambda extends Expr {
    public final ImmutableList<LambdaParam> params;
    public final OpQualifier qualifier;
    public final Expr body;

    public Lambda(long id, List<LambdaParam> params, OpQualifier qualifier,
                  Expr body) {
      super(id);
      this.params = ImmutableList.copyOf(params);
      this.qualifier = Preconditions.checkNotNull(qualifier);
      this.body = Preconditions.checkNotNull(body);
    }

    @Override
    public List<IrNode> children() {
      List<IrNode> result = new ArrayList<IrNode>(params);
      result.add(body);
      return result;
    }

    @Override
    public String toString() {
      return "(" + StringUtils.join(params, ", ") + ") => " + body;
    }
  }

  /**
   * A single operator definition scoped over an expression
   */
  public static class Let extends Expr {
    public final OpDef opdef;
    public final Expr body;

    public Let(long id, OpDef opdef, Expr body) {
      super(id);
      this.opdef = Preconditions.checkNotNull(opdef);
      this.body = Preconditions.checkNotNull(body);
    }

    @Override
    public List<IrNode> children() {
      return ImmutableList.<IrNode>of(opdef, body);
    }

    @Override
    public String toString() {
      return "let " + opdef + "; " + body;
    }
  }
}

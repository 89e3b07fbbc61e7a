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
package exm.quint.frontend.desugar;

import com.google.common.collect.ImmutableMap;

import exm.quint.common.exceptions.QuintRuntimeError;
import exm.quint.ir.Builtins;

/**
 * Resolution of operator tokens and block keywords to builtin opcodes.
 */
public class Operators {

  private static final ImmutableMap<String, String> BINARY =
      ImmutableMap.<String, String>builder()
        .put("+", Builtins.IADD)
        .put("-", Builtins.ISUB)
        .put("*", Builtins.IMUL)
        .put("/", Builtins.IDIV)
        .put("%", Builtins.IMOD)
        .put("^", Builtins.IPOW)
        .put(">", Builtins.IGT)
        .put(">=", Builtins.IGTE)
        .put("<", Builtins.ILT)
        .put("<=", Builtins.ILTE)
        .put("==", Builtins.EQ)
        .put("!=", Builtins.NEQ)
        // Parser recovery for '=' written instead of '=='
        .put("=", Builtins.EQ)
        .put("and", Builtins.AND)
        .put("or", Builtins.OR)
        .put("implies", Builtins.IMPLIES)
        .put("iff", Builtins.IFF)
        .build();

  private static final ImmutableMap<String, String> BLOCKS =
      ImmutableMap.of(
        "and", Builtins.AND,
        "or", Builtins.OR,
        "all", Builtins.ACTION_ALL,
        "any", Builtins.ACTION_ANY);

  /**
   * @param op infix operator token
   * @return the builtin opcode
   * @throws QuintRuntimeError if the token is not an infix operator
   */
  public static String binaryOpcode(String op) {
    String opcode = BINARY.get(op);
    if (opcode == null) {
      throw new QuintRuntimeError("Unknown binary operator: " + op);
    }
    return opcode;
  }

  /**
   * @param keyword one of and, or, all, any
   * @return the builtin opcode for a block of expressions
   */
  public static String blockOpcode(String keyword) {
    String opcode = BLOCKS.get(keyword);
    if (opcode == null) {
      throw new QuintRuntimeError("Unknown block keyword: " + keyword);
    }
    return opcode;
  }

  public static boolean isBinaryOperator(String op) {
    return BINARY.containsKey(op);
  }
}

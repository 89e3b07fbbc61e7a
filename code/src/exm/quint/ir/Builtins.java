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

/**
 * Opcodes of builtin operators emitted by lowering.
 */
public class Builtins {
  // Integer arithmetic
  public static final String IADD = "iadd";
  public static final String ISUB = "isub";
  public static final String IMUL = "imul";
  public static final String IDIV = "idiv";
  public static final String IMOD = "imod";
  public static final String IPOW = "ipow";
  public static final String IUMINUS = "iuminus";

  // Comparison
  public static final String IGT = "igt";
  public static final String IGTE = "igte";
  public static final String ILT = "ilt";
  public static final String ILTE = "ilte";
  public static final String EQ = "eq";
  public static final String NEQ = "neq";

  // Logic and actions
  public static final String AND = "and";
  public static final String OR = "or";
  public static final String IMPLIES = "implies";
  public static final String IFF = "iff";
  public static final String ACTION_ALL = "actionAll";
  public static final String ACTION_ANY = "actionAny";
  public static final String ASSIGN = "assign";
  public static final String ITE = "ite";

  // Collections, records, tuples and variants
  public static final String TUP = "Tup";
  public static final String LIST = "List";
  public static final String NTH = "nth";
  public static final String REC = "Rec";
  public static final String WITH = "with";
  public static final String FIELD = "field";
  public static final String ITEM = "item";
  public static final String VARIANT = "variant";
  public static final String MATCH_VARIANT = "matchVariant";

  /** Label and parameter name of a wildcard match case */
  public static final String WILDCARD = "_";
}

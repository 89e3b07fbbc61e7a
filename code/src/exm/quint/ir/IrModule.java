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

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.quint.ir.Decls.Declaration;

/**
 * A lowered module: its declarations in source order.
 */
public class IrModule extends IrNode {
  public final String name;
  public final ImmutableList<Declaration> declarations;
  /** null if undocumented */
  public final String doc;

  public IrModule(long id, String name, List<Declaration> declarations,
                  String doc) {
    super(id);
    this.name = Preconditions.checkNotNull(name);
    this.declarations = ImmutableList.copyOf(declarations);
    this.doc = doc;
  }

  /**
   * @return the first declaration with the given name, or null
   */
  public Declaration lookup(String declName) {
    for (Declaration d: declarations) {
      if (declName.equals(declarationName(d))) {
        return d;
      }
    }
    return null;
  }

  /**
   * @return the name a declaration binds, null for imports, exports and
   *        instances
   */
  public static String declarationName(Declaration d) {
    if (d instanceof Decls.ConstDecl) {
      return ((Decls.ConstDecl)d).name;
    } else if (d instanceof Decls.VarDecl) {
      return ((Decls.VarDecl)d).name;
    } else if (d instanceof Decls.AssumeDecl) {
      return ((Decls.AssumeDecl)d).name;
    } else if (d instanceof Decls.TypeDef) {
      return ((Decls.TypeDef)d).name;
    } else if (d instanceof Decls.OpDef) {
      return ((Decls.OpDef)d).name;
    }
    return null;
  }

  @Override
  public List<IrNode> children() {
    return new ArrayList<IrNode>(declarations);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (doc != null) {
      sb.append("/// ").append(doc.replace("\n", "\n/// ")).append('\n');
    }
    sb.append("module ").append(name).append(" {\n");
    for (Declaration d: declarations) {
      sb.append("  ").append(d.toString().replace("\n", "\n  "))
        .append('\n');
    }
    sb.append("}");
    return sb.toString();
  }
}

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
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import exm.quint.ir.Exprs.Expr;
import exm.quint.ir.Exprs.Lambda;
import exm.quint.ir.Types.Type;

/**
 * Module-level declarations.
 *
 * Each declaration may carry a documentation string.  Since nodes are
 * immutable, documentation is attached by rebuilding the declaration with
 * {@link Declaration#withDoc(String)}, which keeps the identifier.
 */
public class Decls {

  public abstract static class Declaration extends IrNode {
    /** null if undocumented */
    public final String doc;

    protected Declaration(long id, String doc) {
      super(id);
      this.doc = doc;
    }

    /**
     * @return a copy of this declaration with the given documentation
     */
    public abstract Declaration withDoc(String doc);

    protected String docPrefix() {
      return doc == null ? "" : "/// " + doc.replace("\n", "\n/// ") + "\n";
    }
  }

  /**
   * const name: type
   */
  public static class ConstDecl extends Declaration {
    public final String name;
    public final Type type;

    public ConstDecl(long id, String name, Type type, String doc) {
      super(id, doc);
      this.name = Preconditions.checkNotNull(name);
      this.type = Preconditions.checkNotNull(type);
    }

    @Override
    public ConstDecl withDoc(String doc) {
      return new ConstDecl(id, name, type, doc);
    }

    @Override
    public List<IrNode> children() {
      return ImmutableList.<IrNode>of(type);
    }

    @Override
    public String toString() {
      return docPrefix() + "const " + name + ": " + type;
    }
  }

  /**
   * var name: type
   */
  public static class VarDecl extends Declaration {
    public final String name;
    public final Type type;

    public VarDecl(long id, String name, Type type, String doc) {
      super(id, doc);
      this.name = Preconditions.checkNotNull(name);
      this.type = Preconditions.checkNotNull(type);
    }

    @Override
    public VarDecl withDoc(String doc) {
      return new VarDecl(id, name, type, doc);
    }

    @Override
    public List<IrNode> children() {
      return ImmutableList.<IrNode>of(type);
    }

    @Override
    public String toString() {
      return docPrefix() + "var " + name + ": " + type;
    }
  }

  public static class AssumeDecl extends Declaration {
    /** "_" for an anonymous assumption */
    public final String name;
    public final Expr assumption;

    public AssumeDecl(long id, String name, Expr assumption, String doc) {
      super(id, doc);
      this.name = Preconditions.checkNotNull(name);
      this.assumption = Preconditions.checkNotNull(assumption);
    }

    @Override
    public AssumeDecl withDoc(String doc) {
      return new AssumeDecl(id, name, assumption, doc);
    }

    @Override
    public List<IrNode> children() {
      return ImmutableList.<IrNode>of(assumption);
    }

    @Override
    public String toString() {
      return docPrefix() + "assume " + name + " = " + assumption;
    }
  }

  /**
   * A type definition: abstract (no type), alias, or sum type
   */
  public static class TypeDef extends Declaration {
    public final String name;
    /** null for an abstract type */
    public final Type type;

    public TypeDef(long id, String name, Type type, String doc) {
      super(id, doc);
      this.name = Preconditions.checkNotNull(name);
      this.type = type;
    }

    public boolean isAbstract() {
      return type == null;
    }

    @Override
    public TypeDef withDoc(String doc) {
      return new TypeDef(id, name, type, doc);
    }

    @Override
    public List<IrNode> children() {
      if (type == null) {
        return Collections.emptyList();
      }
      return ImmutableList.<IrNode>of(type);
    }

    @Override
    public String toString() {
      return docPrefix() + "type " + name + (type == null ? "" : " = " + type);
    }
  }

  /**
   * An operator definition.  Parameters are those of the lambda that
   * forms the body, if any.
   */
  public static class OpDef extends Declaration {
    public final String name;
    public final OpQualifier qualifier;
    /** null if not annotated */
    public final Type typeAnnotation;
    public final Expr expr;

    public OpDef(long id, String name, OpQualifier qualifier,
                 Type typeAnnotation, Expr expr, String doc) {
      super(id, doc);
      this.name = Preconditions.checkNotNull(name);
      this.qualifier = Preconditions.checkNotNull(qualifier);
      this.typeAnnotation = typeAnnotation;
      this.expr = Preconditions.checkNotNull(expr);
    }

    public List<LambdaParam> params() {
      if (expr instanceof Lambda) {
        return ((Lambda)expr).params;
      }
      return Collections.emptyList();
    }

    @Override
    public OpDef withDoc(String doc) {
      return new OpDef(id, name, qualifier, typeAnnotation, expr, doc);
    }

    @Override
    public List<IrNode> children() {
      List<IrNode> result = new ArrayList<IrNode>(2);
      if (typeAnnotation != null) {
        result.add(typeAnnotation);
      }
      result.add(expr);
      return result;
    }

    @Override
    public String toString() {
      return docPrefix() + qualifier + " " + name +
          (typeAnnotation == null ? "" : ": " + typeAnnotation) +
          " = " + expr;
    }
  }

  /**
   * import protoName[.defName] [as qualifiedName] [from "fromSource"]
   */
  public static class ImportDecl extends Declaration {
    public final String protoName;
    /** A definition name or "*", null to import the module itself */
    public final String defName;
    /** Alias, null if none */
    public final String qualifiedName;
    /** Path without quotes, null if none */
    public final String fromSource;

    public ImportDecl(long id, String protoName, String defName,
                      String qualifiedName, String fromSource, String doc) {
      super(id, doc);
      this.protoName = Preconditions.checkNotNull(protoName);
      this.defName = defName;
      this.qualifiedName = qualifiedName;
      this.fromSource = fromSource;
    }

    @Override
    public ImportDecl withDoc(String doc) {
      return new ImportDecl(id, protoName, defName, qualifiedName,
                            fromSource, doc);
    }

    @Override
    public List<IrNode> children() {
      return Collections.emptyList();
    }

    @Override
    public String toString() {
      return docPrefix() + "import " + protoName +
          (defName == null ? "" : "." + defName) +
          (qualifiedName == null ? "" : " as " + qualifiedName) +
          (fromSource == null ? "" : " from \"" + fromSource + "\"");
    }
  }

  /**
   * export protoName[.defName] [as qualifiedName]
   */
  public static class ExportDecl extends Declaration {
    public final String protoName;
    public final String defName;
    public final String qualifiedName;

    public ExportDecl(long id, String protoName, String defName,
                      String qualifiedName, String doc) {
      super(id, doc);
      this.protoName = Preconditions.checkNotNull(protoName);
      this.defName = defName;
      this.qualifiedName = qualifiedName;
    }

    @Override
    public ExportDecl withDoc(String doc) {
      return new ExportDecl(id, protoName, defName, qualifiedName, doc);
    }

    @Override
    public List<IrNode> children() {
      return Collections.emptyList();
    }

    @Override
    public String toString() {
      return docPrefix() + "export " + protoName +
          (defName == null ? "" : "." + defName) +
          (qualifiedName == null ? "" : " as " + qualifiedName);
    }
  }

  /**
   * One "name = expr" of an instance
   */
  public static class InstanceOverride {
    public final LambdaParam param;
    public final Expr expr;

    public InstanceOverride(LambdaParam param, Expr expr) {
      this.param = Preconditions.checkNotNull(param);
      this.expr = Preconditions.checkNotNull(expr);
    }

    @Override
    public String toString() {
      return param + " = " + expr;
    }
  }

  /**
   * Instantiation of a module with some constants overridden
   */
  public static class InstanceDecl extends Declaration {
    public final String protoName;
    /** null for an anonymous instance */
    public final String qualifiedName;
    public final ImmutableList<InstanceOverride> overrides;
    /** true if constants that are not overridden keep their names */
    public final boolean identityOverride;
    public final String fromSource;

    public InstanceDecl(long id, String protoName, String qualifiedName,
                        List<InstanceOverride> overrides,
                        boolean identityOverride, String fromSource,
                        String doc) {
      super(id, doc);
      this.protoName = Preconditions.checkNotNull(protoName);
      this.qualifiedName = qualifiedName;
      this.overrides = ImmutableList.copyOf(overrides);
      this.identityOverride = identityOverride;
      this.fromSource = fromSource;
    }

    @Override
    public InstanceDecl withDoc(String doc) {
      return new InstanceDecl(id, protoName, qualifiedName, overrides,
                              identityOverride, fromSource, doc);
    }

    @Override
    public List<IrNode> children() {
      List<IrNode> result = new ArrayList<IrNode>();
      for (InstanceOverride o: overrides) {
        result.add(o.param);
        result.add(o.expr);
      }
      return result;
    }

    @Override
    public String toString() {
      List<String> args = new ArrayList<String>();
      for (InstanceOverride o: overrides) {
        args.add(o.toString());
      }
      if (identityOverride) {
        args.add("*");
      }
      return docPrefix() + "module " +
          (qualifiedName == null ? "_" : qualifiedName) + " = " +
          protoName + "(" + StringUtils.join(args, ", ") + ")" +
          (fromSource == null ? "" : " from \"" + fromSource + "\"");
    }
  }
}

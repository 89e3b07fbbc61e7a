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

/**
 * Constructs for modules and the declarations inside them.
 */
public class DeclConstructs {

  /**
   * module name { declarations }
   */
  public static class ModuleDef extends Construct {
    public final String name;
    /** Raw documentation comment lines preceding the module */
    public final ImmutableList<String> docLines;

    public ModuleDef(SourceSpan span, String text, String name,
                     List<String> docLines) {
      super(span, text);
      this.name = Preconditions.checkNotNull(name);
      this.docLines = ImmutableList.copyOf(docLines);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitModule(state, this);
    }
  }

  /**
   * const name: type
   */
  public static class ConstDef extends Construct {
    public final String name;

    public ConstDef(SourceSpan span, String text, String name) {
      super(span, text);
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitConst(state, this);
    }
  }

  /**
   * var name: type
   */
  public static class VarDef extends Construct {
    public final String name;

    public VarDef(SourceSpan span, String text, String name) {
      super(span, text);
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitVar(state, this);
    }
  }

  /**
   * assume name = expr.  The name is an identOrHole sub-construct.
   */
  public static class AssumeDef extends Construct {
    public AssumeDef(SourceSpan span, String text) {
      super(span, text);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitAssume(state, this);
    }
  }

  /**
   * qualifier name(params): types = body
   *
   * Parameters may be given C-style, with one type per parameter plus the
   * result type, or ML-style, with a single operator type.
   */
  public static class OperDef extends Construct {
    /** Qualifier keyword as written, null if omitted */
    public final String qualifier;
    public final String name;
    public final int paramCount;
    public final int typeCount;
    /** False for a header without a body */
    public final boolean hasBody;

    public OperDef(SourceSpan span, String text, String qualifier,
            String name, int paramCount, int typeCount, boolean hasBody) {
      super(span, text);
      this.qualifier = qualifier;
      this.name = Preconditions.checkNotNull(name);
      this.paramCount = checkCount(paramCount, "parameters");
      this.typeCount = checkCount(typeCount, "types");
      this.hasBody = hasBody;
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitOperDef(state, this);
    }
  }

  /**
   * nondet name: type = expr
   */
  public static class NondetOperDef extends Construct {
    public final String name;
    public final boolean hasType;

    public NondetOperDef(SourceSpan span, String text, String name,
                         boolean hasType) {
      super(span, text);
      this.name = Preconditions.checkNotNull(name);
      this.hasType = hasType;
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitNondetOperDef(state, this);
    }
  }

  /**
   * import Proto[.x | .*] [as Alias] [from "path"]
   */
  public static class ImportMod extends Construct {
    public final String protoName;
    /** null if no alias */
    public final String alias;
    /** true if an identOrStar sub-construct is present */
    public final boolean hasIdentOrStar;
    /** The path token including quotes, null if absent */
    public final String fromSource;

    public ImportMod(SourceSpan span, String text, String protoName,
                     String alias, boolean hasIdentOrStar,
                     String fromSource) {
      super(span, text);
      this.protoName = Preconditions.checkNotNull(protoName);
      this.alias = alias;
      this.hasIdentOrStar = hasIdentOrStar;
      this.fromSource = fromSource;
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitImport(state, this);
    }
  }

  /**
   * export Proto[.x | .*] [as Alias]
   */
  public static class ExportMod extends Construct {
    public final String protoName;
    public final String alias;
    public final boolean hasIdentOrStar;

    public ExportMod(SourceSpan span, String text, String protoName,
                     String alias, boolean hasIdentOrStar) {
      super(span, text);
      this.protoName = Preconditions.checkNotNull(protoName);
      this.alias = alias;
      this.hasIdentOrStar = hasIdentOrStar;
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitExport(state, this);
    }
  }

  /**
   * module Name = Proto(x = a, y = b[, *]) [from "path"]
   */
  public static class InstanceMod extends Construct {
    public final String protoName;
    /** null for an anonymous instance */
    public final String qualifiedName;
    /** Overridden names, one expression sub-construct each */
    public final ImmutableList<Terminal> overrideNames;
    /** true if the override list ends with * */
    public final boolean identityOverride;
    public final String fromSource;

    public InstanceMod(SourceSpan span, String text, String protoName,
                       String qualifiedName, List<Terminal> overrideNames,
                       boolean identityOverride, String fromSource) {
      super(span, text);
      this.protoName = Preconditions.checkNotNull(protoName);
      this.qualifiedName = qualifiedName;
      this.overrideNames = ImmutableList.copyOf(overrideNames);
      this.identityOverride = identityOverride;
      this.fromSource = fromSource;
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitInstance(state, this);
    }
  }

  /**
   * type T
   */
  public static class TypeAbstractDef extends Construct {
    public final String name;

    public TypeAbstractDef(SourceSpan span, String text, String name) {
      super(span, text);
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitTypeAbstractDef(state, this);
    }
  }

  /**
   * type T = type
   */
  public static class TypeAliasDef extends Construct {
    public final String name;

    public TypeAliasDef(SourceSpan span, String text, String name) {
      super(span, text);
      this.name = Preconditions.checkNotNull(name);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitTypeAliasDef(state, this);
    }
  }

  /**
   * type T = | A(t1) | B | ...
   */
  public static class TypeSumDef extends Construct {
    public final String name;
    public final int variantCount;

    public TypeSumDef(SourceSpan span, String text, String name,
                      int variantCount) {
      super(span, text);
      this.name = Preconditions.checkNotNull(name);
      this.variantCount = checkCount(variantCount, "variants");
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitTypeSumDef(state, this);
    }
  }

  /**
   * One alternative of a sum type: Label or Label(type)
   */
  public static class TypeSumVariant extends Construct {
    public final String label;
    public final boolean hasPayload;

    public TypeSumVariant(SourceSpan span, String text, String label,
                          boolean hasPayload) {
      super(span, text);
      this.label = Preconditions.checkNotNull(label);
      this.hasPayload = hasPayload;
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitTypeSumVariant(state, this);
    }
  }

  /**
   * A declaration preceded by documentation comments.  Completes right
   * after the declaration it documents.
   */
  public static class DocumentedDeclaration extends Construct {
    public final ImmutableList<String> docLines;

    public DocumentedDeclaration(SourceSpan span, String text,
                                 List<String> docLines) {
      super(span, text);
      this.docLines = ImmutableList.copyOf(docLines);
    }

    @Override
    public <S> void accept(ConstructVisitor<S> visitor, S state) {
      visitor.exitDocumentedDeclaration(state, this);
    }
  }
}

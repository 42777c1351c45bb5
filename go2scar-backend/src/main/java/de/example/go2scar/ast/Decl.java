package de.example.go2scar.ast;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Top-level Go declarations (imports are carried separately by {@link SourceFile}).
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind", defaultImpl = Decl.Unsupported.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = Decl.Function.class, name = "Function"),
    @JsonSubTypes.Type(value = Decl.TypeDecl.class, name = "TypeDecl"),
    @JsonSubTypes.Type(value = Decl.ValueGroup.class, name = "ValueGroup"),
    @JsonSubTypes.Type(value = Decl.Unsupported.class, name = "Unsupported")
})
public sealed interface Decl
    permits Decl.Function, Decl.TypeDecl, Decl.ValueGroup, Decl.Unsupported {

  void accept(Visitor v);

  interface Visitor {
    void visit(Function d);
    void visit(TypeDecl d);
    void visit(ValueGroup d);
    void visit(Unsupported d);
  }

  /** A parameter, result or receiver. {@code name} is null when the source leaves it unnamed. */
  record Param(String name, TypeNode type) {
    public Param {
      Objects.requireNonNull(type, "type");
    }
  }

  /** {@code name} is null for embedded fields. */
  record Field(String name, TypeNode type) {
    public Field {
      Objects.requireNonNull(type, "type");
    }
  }

  /** An interface method; {@code name} is null for an embedded interface. */
  record Method(String name, List<Param> params, List<Param> results) {
    public Method {
      params = params == null ? List.of() : List.copyOf(params);
      results = results == null ? List.of() : List.copyOf(results);
    }
  }

  /** One name of a {@code var} or {@code const} spec, with its optional type and value. */
  record Binding(String name, TypeNode type, Expr init) {
    public Binding {
      Objects.requireNonNull(name, "name");
    }
  }

  /**
   * Functions and methods. Results are flattened: {@code (a, b int)} arrives as two entries.
   * {@code body} is null for functions implemented outside Go.
   */
  record Function(String name, Param receiver, List<Param> params, List<Param> results,
                  Stmt.Block body) implements Decl {
    public Function {
      Objects.requireNonNull(name, "name");
      params = params == null ? List.of() : List.copyOf(params);
      results = results == null ? List.of() : List.copyOf(results);
    }

    @JsonIgnore
    public boolean isProgramEntry() {
      return receiver == null && "main".equals(name);
    }

    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  record TypeDecl(String name, TypeSpec spec) implements Decl {
    public TypeDecl {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(spec, "spec");
    }

    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  /** {@code keyword} is {@code var} or {@code const}. */
  record ValueGroup(String keyword, List<Binding> entries) implements Decl {
    public ValueGroup {
      entries = entries == null ? List.of() : List.copyOf(entries);
    }

    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Unsupported() implements Decl {
    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind", defaultImpl = OtherSpec.class)
  @JsonSubTypes({
      @JsonSubTypes.Type(value = Struct.class, name = "Struct"),
      @JsonSubTypes.Type(value = Interface.class, name = "Interface"),
      @JsonSubTypes.Type(value = OtherSpec.class, name = "Other")
  })
  sealed interface TypeSpec permits Struct, Interface, OtherSpec {
    void accept(SpecVisitor v);
  }

  interface SpecVisitor {
    void visit(Struct s);
    void visit(Interface s);
    void visit(OtherSpec s);
  }

  record Struct(List<Field> fields) implements TypeSpec {
    public Struct {
      fields = fields == null ? List.of() : List.copyOf(fields);
    }

    @Override
    public void accept(SpecVisitor v) { v.visit(this); }
  }

  record Interface(List<Method> methods) implements TypeSpec {
    public Interface {
      methods = methods == null ? List.of() : List.copyOf(methods);
    }

    @Override
    public void accept(SpecVisitor v) { v.visit(this); }
  }

  /** Aliases and named non-struct types such as {@code type Celsius float64}. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record OtherSpec() implements TypeSpec {
    @Override
    public void accept(SpecVisitor v) { v.visit(this); }
  }
}

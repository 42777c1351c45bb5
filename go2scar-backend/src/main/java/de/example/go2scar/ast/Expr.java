package de.example.go2scar.ast;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Go expressions.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind", defaultImpl = Expr.Unsupported.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = Expr.Identifier.class, name = "Identifier"),
    @JsonSubTypes.Type(value = Expr.Literal.class, name = "Literal"),
    @JsonSubTypes.Type(value = Expr.BinaryOp.class, name = "BinaryOp"),
    @JsonSubTypes.Type(value = Expr.UnaryOp.class, name = "UnaryOp"),
    @JsonSubTypes.Type(value = Expr.Call.class, name = "Call"),
    @JsonSubTypes.Type(value = Expr.Selector.class, name = "Selector"),
    @JsonSubTypes.Type(value = Expr.Index.class, name = "Index"),
    @JsonSubTypes.Type(value = Expr.CompositeLiteral.class, name = "CompositeLiteral"),
    @JsonSubTypes.Type(value = Expr.TypeAssertion.class, name = "TypeAssertion"),
    @JsonSubTypes.Type(value = Expr.TypeExpr.class, name = "TypeExpr"),
    @JsonSubTypes.Type(value = Expr.Unsupported.class, name = "Unsupported")
})
public sealed interface Expr
    permits Expr.Identifier, Expr.Literal, Expr.BinaryOp, Expr.UnaryOp, Expr.Call,
            Expr.Selector, Expr.Index, Expr.CompositeLiteral, Expr.TypeAssertion,
            Expr.TypeExpr, Expr.Unsupported {

  <T> T accept(Visitor<T> v);

  interface Visitor<T> {
    T visit(Identifier e);
    T visit(Literal e);
    T visit(BinaryOp e);
    T visit(UnaryOp e);
    T visit(Call e);
    T visit(Selector e);
    T visit(Index e);
    T visit(CompositeLiteral e);
    T visit(TypeAssertion e);
    T visit(TypeExpr e);
    T visit(Unsupported e);
  }

  enum LiteralKind { INT, FLOAT, IMAG, CHAR, STRING }

  record Identifier(String name) implements Expr {
    public Identifier {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }

  /**
   * A basic literal. {@code text} is the literal exactly as written in the source,
   * quotes and escapes included.
   */
  record Literal(LiteralKind literalKind, String text) implements Expr {
    public Literal {
      Objects.requireNonNull(literalKind, "literalKind");
      Objects.requireNonNull(text, "text");
    }

    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }

  record BinaryOp(String op, Expr left, Expr right) implements Expr {
    public BinaryOp {
      Objects.requireNonNull(op, "op");
      Objects.requireNonNull(left, "left");
      Objects.requireNonNull(right, "right");
    }

    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }

  record UnaryOp(String op, Expr operand) implements Expr {
    public UnaryOp {
      Objects.requireNonNull(op, "op");
      Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }

  record Call(Expr callee, List<Expr> args) implements Expr {
    public Call {
      Objects.requireNonNull(callee, "callee");
      args = args == null ? List.of() : List.copyOf(args);
    }

    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }

  record Selector(Expr owner, String member) implements Expr {
    public Selector {
      Objects.requireNonNull(owner, "owner");
      Objects.requireNonNull(member, "member");
    }

    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }

  record Index(Expr collection, Expr index) implements Expr {
    public Index {
      Objects.requireNonNull(collection, "collection");
      Objects.requireNonNull(index, "index");
    }

    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }

  /** {@code type} is null for elided types inside an outer composite literal. */
  record CompositeLiteral(TypeNode type, List<Expr> elements) implements Expr {
    public CompositeLiteral {
      elements = elements == null ? List.of() : List.copyOf(elements);
    }

    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }

  record TypeAssertion(TypeNode type, Expr operand) implements Expr {
    public TypeAssertion {
      Objects.requireNonNull(type, "type");
      Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }

  /** A type in expression position, e.g. the first argument of {@code make}. */
  record TypeExpr(TypeNode type) implements Expr {
    public TypeExpr {
      Objects.requireNonNull(type, "type");
    }

    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Unsupported() implements Expr {
    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }
}

package de.example.go2scar.ast;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Go statements. Optional parts (init statements, conditions, else branches) are null when absent.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind", defaultImpl = Stmt.Unsupported.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = Stmt.ExprStmt.class, name = "ExprStmt"),
    @JsonSubTypes.Type(value = Stmt.Assign.class, name = "Assign"),
    @JsonSubTypes.Type(value = Stmt.LocalDecl.class, name = "LocalDecl"),
    @JsonSubTypes.Type(value = Stmt.If.class, name = "If"),
    @JsonSubTypes.Type(value = Stmt.ClassicFor.class, name = "ClassicFor"),
    @JsonSubTypes.Type(value = Stmt.ForEach.class, name = "ForEach"),
    @JsonSubTypes.Type(value = Stmt.Return.class, name = "Return"),
    @JsonSubTypes.Type(value = Stmt.Block.class, name = "Block"),
    @JsonSubTypes.Type(value = Stmt.IncDec.class, name = "IncDec"),
    @JsonSubTypes.Type(value = Stmt.Switch.class, name = "Switch"),
    @JsonSubTypes.Type(value = Stmt.Case.class, name = "Case"),
    @JsonSubTypes.Type(value = Stmt.Break.class, name = "Break"),
    @JsonSubTypes.Type(value = Stmt.Continue.class, name = "Continue"),
    @JsonSubTypes.Type(value = Stmt.TypeSwitch.class, name = "TypeSwitch"),
    @JsonSubTypes.Type(value = Stmt.Unsupported.class, name = "Unsupported")
})
public sealed interface Stmt
    permits Stmt.ExprStmt, Stmt.Assign, Stmt.LocalDecl, Stmt.If, Stmt.ClassicFor,
            Stmt.ForEach, Stmt.Return, Stmt.Block, Stmt.IncDec, Stmt.Switch, Stmt.Case,
            Stmt.Break, Stmt.Continue, Stmt.TypeSwitch, Stmt.Unsupported {

  void accept(Visitor v);

  interface Visitor {
    void visit(ExprStmt s);
    void visit(Assign s);
    void visit(LocalDecl s);
    void visit(If s);
    void visit(ClassicFor s);
    void visit(ForEach s);
    void visit(Return s);
    void visit(Block s);
    void visit(IncDec s);
    void visit(Switch s);
    void visit(Case s);
    void visit(Break s);
    void visit(Continue s);
    void visit(TypeSwitch s);
    void visit(Unsupported s);
  }

  record ExprStmt(Expr expr) implements Stmt {
    public ExprStmt {
      Objects.requireNonNull(expr, "expr");
    }

    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  /** {@code op} is {@code =}, {@code :=} or a compound operator such as {@code +=}. */
  record Assign(String op, List<Expr> lhs, List<Expr> rhs) implements Stmt {
    public Assign {
      Objects.requireNonNull(op, "op");
      lhs = lhs == null ? List.of() : List.copyOf(lhs);
      rhs = rhs == null ? List.of() : List.copyOf(rhs);
    }

    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  record LocalDecl(TypeNode type, String name, Expr init) implements Stmt {
    public LocalDecl {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  /** {@code elseBranch} is either another {@link If} or a {@link Block}. */
  record If(Stmt init, Expr cond, Block body, Stmt elseBranch) implements Stmt {
    public If {
      Objects.requireNonNull(cond, "cond");
      Objects.requireNonNull(body, "body");
    }

    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  record ClassicFor(Stmt init, Expr cond, Stmt post, Block body) implements Stmt {
    public ClassicFor {
      Objects.requireNonNull(body, "body");
    }

    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  record ForEach(Expr key, Expr value, Expr source, Block body) implements Stmt {
    public ForEach {
      Objects.requireNonNull(source, "source");
      Objects.requireNonNull(body, "body");
    }

    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  record Return(List<Expr> results) implements Stmt {
    public Return {
      results = results == null ? List.of() : List.copyOf(results);
    }

    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  record Block(List<Stmt> statements) implements Stmt {
    public Block {
      statements = statements == null ? List.of() : List.copyOf(statements);
    }

    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  /** {@code op} is {@code ++} or {@code --}. */
  record IncDec(String op, Expr operand) implements Stmt {
    public IncDec {
      Objects.requireNonNull(op, "op");
      Objects.requireNonNull(operand, "operand");
    }

    @JsonIgnore
    public boolean isIncrement() {
      return "++".equals(op);
    }

    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  /** The body holds {@link Case} clauses. */
  record Switch(Stmt init, Expr tag, Block body) implements Stmt {
    public Switch {
      Objects.requireNonNull(body, "body");
    }

    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  /** A clause without labels is the {@code default} clause. */
  record Case(List<Expr> labels, List<Stmt> body) implements Stmt {
    public Case {
      labels = labels == null ? List.of() : List.copyOf(labels);
      body = body == null ? List.of() : List.copyOf(body);
    }

    @JsonIgnore
    public boolean isDefault() {
      return labels.isEmpty();
    }

    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  record Break() implements Stmt {
    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  record Continue() implements Stmt {
    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  /** {@code switch x := v.(type)}. Never translated. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record TypeSwitch() implements Stmt {
    @Override
    public void accept(Visitor v) { v.visit(this); }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Unsupported() implements Stmt {
    @Override
    public void accept(Visitor v) { v.visit(this); }
  }
}

package de.example.go2scar;

import de.example.go2scar.ast.Expr;
import de.example.go2scar.ast.Stmt;
import de.example.go2scar.ast.TypeNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Go statements -> Scar lines. Nested bodies always go through
 * {@link OutputBuffer#indent(Runnable)}; statements without a Scar form produce
 * one placeholder line.
 */
@Component
public final class StatementEmitter {
  private final ExpressionTranslator expr;
  private final TypeMapper typeMapper;

  public StatementEmitter(ExpressionTranslator expr, TypeMapper typeMapper) {
    this.expr = expr;
    this.typeMapper = typeMapper;
  }

  public void emit(TranslationState state, Stmt s) {
    s.accept(new Writer(state));
  }

  public void emitAll(TranslationState state, List<Stmt> statements) {
    Writer w = new Writer(state);
    for (Stmt s : statements) {
      s.accept(w);
    }
  }

  // empty when there is neither a type nor a value
  public Optional<String> bindingLine(TypeNode type, String name, Expr init) {
    String typ = type == null ? "" : typeMapper.map(type);

    if (init != null) {
      String val = expr.translate(init);
      if (!typ.isEmpty()) return Optional.of(typ + " " + name + " = " + val);
      return Optional.of(name + " = " + val);
    }
    if (!typ.isEmpty()) return Optional.of(typ + " " + name);
    return Optional.empty();
  }

  // one-line rendering of a for-loop post, if it has one
  Optional<String> renderInline(Stmt s) {
    TranslationState scratch = new TranslationState();
    emit(scratch, s);
    String text = scratch.text().trim();
    if (scratch.placeholders() > 0 || text.isEmpty() || text.contains("\n")) {
      return Optional.empty();
    }
    return Optional.of(text);
  }

  // a single bound name only; parallel inits such as i, j := 0, n-1 have no header form
  static Optional<String> loopVariable(Stmt init) {
    if (init instanceof Stmt.LocalDecl d) {
      return Optional.of(d.name());
    }
    if (init instanceof Stmt.Assign a
        && a.lhs().size() == 1
        && a.lhs().get(0) instanceof Expr.Identifier id) {
      return Optional.of(id.name());
    }
    return Optional.empty();
  }

  private final class Writer implements Stmt.Visitor {
    private final TranslationState state;
    private final OutputBuffer out;

    Writer(TranslationState state) {
      this.state = state;
      this.out = state.out();
    }

    private void body(Stmt b) {
      out.indent(() -> b.accept(this));
    }

    @Override
    public void visit(Stmt.ExprStmt s) {
      out.line(expr.translate(s.expr()));
    }

    @Override
    public void visit(Stmt.Assign s) {
      if (s.lhs().size() != 1 || s.rhs().size() != 1) {
        state.placeholder("multi-value assignment not supported");
        return;
      }

      String lhs = expr.translate(s.lhs().get(0));
      String rhs = expr.translate(s.rhs().get(0));
      String op = s.op();

      if (op.equals("=") || op.equals(":=") || !op.endsWith("=")) {
        out.line(lhs + " = " + rhs);
        return;
      }

      // x op= y
      String binary = op.substring(0, op.length() - 1);
      out.line(lhs + " = " + lhs + " " + binary + " " + rhs);
    }

    @Override
    public void visit(Stmt.LocalDecl s) {
      bindingLine(s.type(), s.name(), s.init()).ifPresent(out::line);
    }

    @Override
    public void visit(Stmt.If s) {
      emitBranch(s, "if");
    }

    // else-if chains stay at the depth of the first if
    private void emitBranch(Stmt.If s, String keyword) {
      if (s.init() != null) s.init().accept(this);

      out.line(keyword + " " + expr.translate(s.cond()) + ":");
      body(s.body());

      Stmt alt = s.elseBranch();
      if (alt instanceof Stmt.If elseIf) {
        emitBranch(elseIf, "elif");
      } else if (alt != null) {
        out.line("else:");
        body(alt);
      }
    }

    @Override
    public void visit(Stmt.ClassicFor s) {
      String header;
      if (s.init() != null && s.cond() != null && s.post() != null) {
        String cond = expr.translate(s.cond());
        Optional<String> loopVar = loopVariable(s.init());
        Optional<String> post = renderInline(s.post());
        header = loopVar.isPresent() && post.isPresent()
            ? "for " + loopVar.get() + "; " + cond + "; " + post.get() + ":"
            : "while " + cond + ":";
      } else if (s.cond() != null) {
        header = "while " + expr.translate(s.cond()) + ":";
      } else {
        header = "while true:";
      }

      out.line(header);
      body(s.body());
    }

    @Override
    public void visit(Stmt.ForEach s) {
      String source = expr.translate(s.source());
      if (s.key() != null && s.value() != null) {
        out.line("for " + expr.translate(s.key()) + ", " + expr.translate(s.value()) + " in " + source + ":");
      } else if (s.key() != null) {
        out.line("for " + expr.translate(s.key()) + " in " + source + ":");
      } else {
        out.line("for _ in " + source + ":");
      }
      body(s.body());
    }

    @Override
    public void visit(Stmt.Return s) {
      if (s.results().isEmpty()) {
        out.line("return");
      } else {
        out.line("return " + expr.translateAll(s.results()));
      }
    }

    @Override
    public void visit(Stmt.Block s) {
      for (Stmt inner : s.statements()) {
        inner.accept(this);
      }
    }

    @Override
    public void visit(Stmt.IncDec s) {
      String x = expr.translate(s.operand());
      out.line(x + " = " + x + (s.isIncrement() ? " + 1" : " - 1"));
    }

    @Override
    public void visit(Stmt.Switch s) {
      if (s.init() != null) s.init().accept(this);

      if (s.tag() != null) {
        out.line("switch " + expr.translate(s.tag()) + ":");
      } else {
        out.line("switch:");
      }
      body(s.body());
    }

    @Override
    public void visit(Stmt.Case s) {
      if (s.isDefault()) {
        out.line("default:");
      } else {
        out.line("case " + expr.translateAll(s.labels()) + ":");
      }
      out.indent(() -> s.body().forEach(inner -> inner.accept(this)));
    }

    @Override
    public void visit(Stmt.Break s) {
      out.line("break");
    }

    @Override
    public void visit(Stmt.Continue s) {
      out.line("continue");
    }

    @Override
    public void visit(Stmt.TypeSwitch s) {
      state.placeholder("type switch not supported");
    }

    @Override
    public void visit(Stmt.Unsupported s) {
      state.placeholder("unknown statement");
    }
  }
}

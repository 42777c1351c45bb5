package de.example.go2scar;

import de.example.go2scar.ast.Decl;
import de.example.go2scar.ast.TypeNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public final class DeclarationEmitter {
  private final StatementEmitter statements;
  private final TypeMapper typeMapper;

  public DeclarationEmitter(StatementEmitter statements, TypeMapper typeMapper) {
    this.statements = statements;
    this.typeMapper = typeMapper;
  }

  public void emit(TranslationState state, Decl d) {
    d.accept(new Writer(state));
  }

  // return type only for a single result
  String signature(Decl.Function f) {
    List<String> params = new ArrayList<>();
    if (f.receiver() != null) {
      params.add("this " + typeMapper.map(receiverType(f.receiver().type())));
    }
    f.params().forEach(p -> params.add(param(p)));

    String ret = f.results().size() == 1 ? " -> " + typeMapper.map(f.results().get(0).type()) : "";
    return "fn " + f.name() + "(" + String.join(", ", params) + ")" + ret;
  }

  // Interface methods keep the first result even when there are several.
  String signature(Decl.Method m) {
    List<String> params = m.params().stream().map(this::param).toList();
    String ret = m.results().isEmpty() ? "" : " -> " + typeMapper.map(m.results().get(0).type());
    return "fn " + m.name() + "(" + String.join(", ", params) + ")" + ret;
  }

  private String param(Decl.Param p) {
    String type = typeMapper.map(p.type());
    return p.name() == null ? type : type + " " + p.name();
  }

  // the receiver is always addressed through "this", pointer or not
  private static TypeNode receiverType(TypeNode t) {
    return t instanceof TypeNode.Pointer ptr ? ptr.base() : t;
  }

  private final class Writer implements Decl.Visitor, Decl.SpecVisitor {
    private final TranslationState state;
    private final OutputBuffer out;
    private String typeName;

    Writer(TranslationState state) {
      this.state = state;
      this.out = state.out();
    }

    @Override
    public void visit(Decl.Function d) {
      if (d.isProgramEntry()) {
        if (d.body() != null) statements.emitAll(state, d.body().statements());
        return;
      }

      out.line(signature(d) + ":");
      if (d.body() != null) {
        out.indent(() -> statements.emitAll(state, d.body().statements()));
      }
      out.blank();
    }

    @Override
    public void visit(Decl.TypeDecl d) {
      typeName = d.name();
      d.spec().accept(this);
    }

    @Override
    public void visit(Decl.ValueGroup d) {
      for (Decl.Binding b : d.entries()) {
        statements.bindingLine(b.type(), b.name(), b.init()).ifPresent(out::line);
      }
      out.blank();
    }

    @Override
    public void visit(Decl.Unsupported d) {
      state.placeholder("unknown declaration");
    }

    // Field listing only: no constructor parameters are generated.
    @Override
    public void visit(Decl.Struct s) {
      out.line("class " + typeName + ":");
      out.indent(() -> {
        out.line("init:");
        out.indent(() -> s.fields().stream()
            .filter(f -> f.name() != null)
            .forEach(f -> out.line(typeMapper.map(f.type()) + " this." + f.name())));
      });
      out.blank();
    }

    @Override
    public void visit(Decl.Interface s) {
      out.line("interface " + typeName + ":");
      out.indent(() -> s.methods().stream()
          .filter(m -> m.name() != null)
          .forEach(m -> out.line(signature(m))));
      out.blank();
    }

    @Override
    public void visit(Decl.OtherSpec s) {
      state.placeholder("type " + typeName + " not supported");
      out.blank();
    }
  }
}

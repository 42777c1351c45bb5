package de.example.go2scar;

import de.example.go2scar.ast.Expr;
import de.example.go2scar.ast.TypeNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Rewrites for the handful of Go calls that have their own Scar syntax.
 *
 * A call qualifies when its callee is a bare identifier or a {@code fmt.Name}
 * selector listed here. A rewrite may still decline (empty result) when the
 * arguments do not have the expected shape; the caller then falls back to
 * ordinary call syntax.
 */
@Component
public final class BuiltinCalls {

  @FunctionalInterface
  interface Rewrite {
    Optional<String> apply(List<Expr> args, ExpressionTranslator expr);
  }

  private final TypeMapper typeMapper;
  private final Map<String, Rewrite> rewrites;

  public BuiltinCalls(TypeMapper typeMapper) {
    this.typeMapper = typeMapper;
    this.rewrites = Map.of(
        "print", this::print,
        "println", this::print,
        "fmt.Print", this::print,
        "fmt.Println", this::print,
        "printf", this::printf,
        "fmt.Printf", this::printf,
        "make", this::make,
        "len", this::len,
        "append", this::append
    );
  }

  public Optional<String> rewrite(Expr.Call call, ExpressionTranslator expr) {
    return builtinName(call.callee())
        .map(rewrites::get)
        .flatMap(r -> r.apply(call.args(), expr));
  }

  static Optional<String> builtinName(Expr callee) {
    if (callee instanceof Expr.Identifier id) {
      return Optional.of(id.name());
    }
    if (callee instanceof Expr.Selector sel
        && sel.owner() instanceof Expr.Identifier owner
        && owner.name().equals("fmt")) {
      return Optional.of("fmt." + sel.member());
    }
    return Optional.empty();
  }

  // Only the first argument is printed.
  private Optional<String> print(List<Expr> args, ExpressionTranslator expr) {
    if (args.isEmpty()) return Optional.empty();
    return Optional.of("print " + expr.translate(args.get(0)));
  }

  private Optional<String> printf(List<Expr> args, ExpressionTranslator expr) {
    if (args.isEmpty()) return Optional.empty();

    String format = expr.translate(args.get(0));
    if (args.size() == 1) return Optional.of("print " + format);

    String rest = args.subList(1, args.size()).stream()
        .map(expr::translate)
        .collect(Collectors.joining(", "));
    return Optional.of("print " + format + " | " + rest);
  }

  private Optional<String> make(List<Expr> args, ExpressionTranslator expr) {
    if (args.isEmpty() || !(args.get(0) instanceof Expr.TypeExpr te)) return Optional.empty();

    TypeNode type = te.type();
    if (typeMapper.isSequence(type)) {
      String size = args.size() > 1 ? expr.translate(args.get(1)) : "";
      return Optional.of("new " + typeMapper.map(type) + "(" + size + ")");
    }
    if (typeMapper.isMap(type)) {
      return Optional.of("[]");
    }
    return Optional.empty();
  }

  private Optional<String> len(List<Expr> args, ExpressionTranslator expr) {
    if (args.isEmpty()) return Optional.empty();
    return Optional.of("len(" + expr.translate(args.get(0)) + ")");
  }

  // Scar's add takes a single element; further variadic elements are dropped.
  private Optional<String> append(List<Expr> args, ExpressionTranslator expr) {
    if (args.size() < 2) return Optional.empty();
    return Optional.of(expr.translate(args.get(0)) + ".add(" + expr.translate(args.get(1)) + ")");
  }
}

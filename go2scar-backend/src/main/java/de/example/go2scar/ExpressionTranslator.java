package de.example.go2scar;

import de.example.go2scar.ast.Expr;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Go expression -> Scar expression text. Pure and total: shapes without a Scar
 * rendering come back as a visible {@code #} placeholder.
 */
@Component
public final class ExpressionTranslator implements Expr.Visitor<String> {
  static final String UNKNOWN_EXPRESSION = "# unknown expression";
  static final String COMPOSITE_LITERAL = "# composite literal";

  private final TypeMapper typeMapper;
  private final BuiltinCalls builtins;

  public ExpressionTranslator(TypeMapper typeMapper, BuiltinCalls builtins) {
    this.typeMapper = typeMapper;
    this.builtins = builtins;
  }

  public String translate(Expr e) {
    if (e == null) return "";
    return e.accept(this);
  }

  public String translateAll(List<Expr> exprs) {
    return exprs.stream().map(this::translate).collect(Collectors.joining(", "));
  }

  @Override
  public String visit(Expr.Identifier e) {
    return e.name();
  }

  @Override
  public String visit(Expr.Literal e) {
    return e.text();
  }

  @Override
  public String visit(Expr.BinaryOp e) {
    return translate(e.left()) + " " + e.op() + " " + translate(e.right());
  }

  @Override
  public String visit(Expr.UnaryOp e) {
    return e.op() + translate(e.operand());
  }

  @Override
  public String visit(Expr.Call e) {
    return builtins.rewrite(e, this)
        .orElseGet(() -> translate(e.callee()) + "(" + translateAll(e.args()) + ")");
  }

  @Override
  public String visit(Expr.Selector e) {
    return translate(e.owner()) + "." + e.member();
  }

  @Override
  public String visit(Expr.Index e) {
    return translate(e.collection()) + "[" + translate(e.index()) + "]";
  }

  // Struct literals have no Scar initializer syntax.
  @Override
  public String visit(Expr.CompositeLiteral e) {
    if (!typeMapper.isSequence(e.type())) return COMPOSITE_LITERAL;
    return "[" + translateAll(e.elements()) + "]";
  }

  @Override
  public String visit(Expr.TypeAssertion e) {
    return "(" + typeMapper.map(e.type()) + ")" + translate(e.operand());
  }

  @Override
  public String visit(Expr.TypeExpr e) {
    return typeMapper.map(e.type());
  }

  @Override
  public String visit(Expr.Unsupported e) {
    return UNKNOWN_EXPRESSION;
  }
}

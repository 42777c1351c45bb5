package de.example.go2scar;

import de.example.go2scar.ast.Expr;
import de.example.go2scar.ast.Stmt;
import de.example.go2scar.ast.TypeNode;

import java.util.List;

/**
 * Short-hand constructors for hand-built ASTs in tests.
 */
public final class Nodes {

  private Nodes() {
  }

  public static Expr.Identifier id(String name) {
    return new Expr.Identifier(name);
  }

  public static Expr.Literal num(String text) {
    return new Expr.Literal(Expr.LiteralKind.INT, text);
  }

  public static Expr.Literal str(String quoted) {
    return new Expr.Literal(Expr.LiteralKind.STRING, quoted);
  }

  public static Expr.BinaryOp bin(Expr left, String op, Expr right) {
    return new Expr.BinaryOp(op, left, right);
  }

  public static Expr.Selector sel(String owner, String member) {
    return new Expr.Selector(id(owner), member);
  }

  public static Expr.Call call(Expr callee, Expr... args) {
    return new Expr.Call(callee, List.of(args));
  }

  public static Expr.Call call(String callee, Expr... args) {
    return call(id(callee), args);
  }

  public static Expr.TypeExpr typeExpr(TypeNode type) {
    return new Expr.TypeExpr(type);
  }

  public static TypeNode.Named named(String name) {
    return new TypeNode.Named(name);
  }

  public static TypeNode.Array listOf(TypeNode elem) {
    return new TypeNode.Array(elem);
  }

  public static Stmt.ExprStmt exprStmt(Expr e) {
    return new Stmt.ExprStmt(e);
  }

  public static Stmt.Assign assign(Expr lhs, String op, Expr rhs) {
    return new Stmt.Assign(op, List.of(lhs), List.of(rhs));
  }

  public static Stmt.IncDec inc(String name) {
    return new Stmt.IncDec("++", id(name));
  }

  public static Stmt.Return ret(Expr... results) {
    return new Stmt.Return(List.of(results));
  }

  public static Stmt.Block block(Stmt... statements) {
    return new Stmt.Block(List.of(statements));
  }
}

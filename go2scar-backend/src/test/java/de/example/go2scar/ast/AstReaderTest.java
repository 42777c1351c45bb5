package de.example.go2scar.ast;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.example.go2scar.Fixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AstReaderTest {

  private final AstReader reader = new AstReader(new ObjectMapper());

  @Test
  void readsDeclarationsInSourceOrder() {
    SourceFile file = reader.read(Fixtures.read("hello.go.json"));

    assertEquals("main", file.packageName());
    assertEquals(List.of("\"fmt\"", "strings", "net/http", "strconv"), file.imports());
    assertEquals(5, file.declarations().size());
    assertInstanceOf(Decl.TypeDecl.class, file.declarations().get(0));
    assertInstanceOf(Decl.ValueGroup.class, file.declarations().get(2));

    Decl.Function sum = assertInstanceOf(Decl.Function.class, file.declarations().get(3));
    assertEquals("Sum", sum.name());
    assertEquals(new TypeNode.Pointer(new TypeNode.Named("Point")), sum.receiver().type());
    assertTrue(sum.params().isEmpty());
  }

  @Test
  void readsNestedStatements() {
    SourceFile file = reader.read(Fixtures.read("hello.go.json"));
    Decl.Function main = assertInstanceOf(Decl.Function.class, file.declarations().get(4));

    assertTrue(main.isProgramEntry());
    Stmt.ClassicFor loop = assertInstanceOf(Stmt.ClassicFor.class, main.body().statements().get(1));
    Stmt.IncDec post = assertInstanceOf(Stmt.IncDec.class, loop.post());
    assertTrue(post.isIncrement());
    assertEquals(new Expr.Identifier("i"), post.operand());
  }

  @Test
  void unknownKindsBecomeUnsupportedNodes() {
    SourceFile file = reader.read("""
        {
          "packageName": "p",
          "declarations": [
            { "kind": "Function", "name": "f", "body": { "kind": "Block", "statements": [
              { "kind": "DeferStmt", "call": { "kind": "Identifier", "name": "close" } },
              { "kind": "ExprStmt", "expr": { "kind": "FuncLit", "body": {} } }
            ] } },
            { "kind": "TypeDecl", "name": "Celsius", "spec": { "kind": "Alias", "target": "float64" } },
            { "kind": "BadDecl" }
          ]
        }
        """);

    Decl.Function f = assertInstanceOf(Decl.Function.class, file.declarations().get(0));
    assertInstanceOf(Stmt.Unsupported.class, f.body().statements().get(0));
    Stmt.ExprStmt es = assertInstanceOf(Stmt.ExprStmt.class, f.body().statements().get(1));
    assertInstanceOf(Expr.Unsupported.class, es.expr());

    Decl.TypeDecl celsius = assertInstanceOf(Decl.TypeDecl.class, file.declarations().get(1));
    assertInstanceOf(Decl.OtherSpec.class, celsius.spec());
    assertInstanceOf(Decl.Unsupported.class, file.declarations().get(2));
  }

  @Test
  void missingListsReadAsEmpty() {
    SourceFile file = reader.read("{ \"packageName\": \"p\" }");

    assertTrue(file.imports().isEmpty());
    assertTrue(file.declarations().isEmpty());
  }

  @Test
  void malformedJsonIsRejected() {
    AstFormatException e = assertThrows(AstFormatException.class, () -> reader.read("{ \"packageName\": "));
    assertTrue(e.getMessage().startsWith("Malformed AST document"));
  }

  @Test
  void missingRequiredPartsAreRejected() {
    assertThrows(AstFormatException.class, () -> reader.read("""
        { "declarations": [ { "kind": "Function", "body": { "kind": "Block" } } ] }
        """));
  }

  @Test
  void nonObjectDocumentsAreRejected() {
    assertThrows(AstFormatException.class, () -> reader.read("[1, 2]"));
    assertThrows(AstFormatException.class, () -> reader.read("null"));
    assertThrows(AstFormatException.class, () -> reader.read("   "));
  }
}

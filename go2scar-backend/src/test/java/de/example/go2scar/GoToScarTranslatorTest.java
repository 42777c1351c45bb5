package de.example.go2scar;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.example.go2scar.ast.AstReader;
import de.example.go2scar.ast.Decl;
import de.example.go2scar.ast.SourceFile;
import de.example.go2scar.ast.Stmt;
import org.junit.jupiter.api.Test;

import java.util.List;

import static de.example.go2scar.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class GoToScarTranslatorTest {

  private final GoToScarTranslator translator = Translators.translator();

  @Test
  void translatesAWholeFile() {
    SourceFile file = new AstReader(new ObjectMapper()).read(Fixtures.read("hello.go.json"));

    assertEquals(Fixtures.read("hello.scar"), translator.translate(file));
  }

  @Test
  void noImportsMeansNoLeadingBlankLine() {
    SourceFile file = new SourceFile("main", List.of("fmt"), List.of(
        new Decl.Function("main", null, List.of(), List.of(),
            block(exprStmt(call(sel("fmt", "Println"), str("\"hi\"")))))));

    assertEquals("print \"hi\"\n", translator.translate(file));
  }

  @Test
  void importsComeFirstFollowedByABlankLine() {
    SourceFile file = new SourceFile("util", List.of("os", "math"), List.of(
        new Decl.ValueGroup("var", List.of(new Decl.Binding("x", named("int"), null)))));

    assertEquals("import \"std/os\"\nimport \"std/math\"\n\nint x\n\n", translator.translate(file));
  }

  @Test
  void emptyFileProducesEmptyText() {
    assertEquals("", translator.translate(new SourceFile("empty", List.of(), List.of())));
  }

  @Test
  void eachTranslationStartsFromAFreshState() {
    SourceFile file = new SourceFile("p", List.of("time"), List.of(
        new Decl.Function("tick", null, List.of(), List.of(), block(new Stmt.Unsupported()))));

    String first = translator.translate(file);
    String second = translator.translate(file);

    assertEquals(first, second);
    assertEquals("import \"std/time\"\n\nfn tick():\n    # unknown statement\n\n", second);
  }
}

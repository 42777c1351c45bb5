package de.example.go2scar;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OutputBufferTest {

  @Test
  void linesAreIndentedFourSpacesPerLevel() {
    OutputBuffer out = new OutputBuffer();
    out.line("if ok:");
    out.indent(() -> {
      out.line("while true:");
      out.indent(() -> out.line("break"));
    });
    out.line("return");

    assertEquals("if ok:\n    while true:\n        break\nreturn\n", out.toString());
  }

  @Test
  void blankLinesCarryNoIndentation() {
    OutputBuffer out = new OutputBuffer();
    out.indent(out::blank);

    assertEquals("\n", out.toString());
  }

  @Test
  void depthIsRestoredWhenTheBodyThrows() {
    OutputBuffer out = new OutputBuffer();

    assertThrows(IllegalStateException.class, () -> out.indent(() -> {
      out.line("x");
      throw new IllegalStateException("boom");
    }));
    assertEquals(0, out.depth());

    out.line("y");
    assertEquals("    x\ny\n", out.toString());
  }
}

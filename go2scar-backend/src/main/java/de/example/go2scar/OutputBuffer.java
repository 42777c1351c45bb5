package de.example.go2scar;

public final class OutputBuffer {
  private static final String INDENT_UNIT = "    ";

  private final StringBuilder sb = new StringBuilder();
  private int depth = 0;

  public void indent(Runnable r) {
    depth++;
    try { r.run(); }
    finally { depth--; }
  }

  public void line(String s) {
    sb.append(INDENT_UNIT.repeat(depth)).append(s).append("\n");
  }

  // blank lines carry no indentation
  public void blank() {
    sb.append("\n");
  }

  public int depth() {
    return depth;
  }

  @Override
  public String toString() {
    return sb.toString();
  }
}

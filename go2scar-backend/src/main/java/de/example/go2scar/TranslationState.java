package de.example.go2scar;

/** State of one file translation; never shared between runs. */
public final class TranslationState {
  private final OutputBuffer out = new OutputBuffer();
  private int placeholders = 0;

  public OutputBuffer out() {
    return out;
  }

  public void placeholder(String what) {
    placeholders++;
    out.line("# " + what);
  }

  public int placeholders() {
    return placeholders;
  }

  public String text() {
    return out.toString();
  }
}

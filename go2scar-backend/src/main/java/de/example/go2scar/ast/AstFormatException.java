package de.example.go2scar.ast;

/**
 * Thrown when an AST document cannot be read into a {@link SourceFile}.
 */
public class AstFormatException extends RuntimeException {

  public AstFormatException(String message, Throwable cause) {
    super(message, cause);
  }

  public AstFormatException(String message) {
    super(message);
  }
}

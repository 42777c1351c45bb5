package de.example.go2scar.cli;

/**
 * The input file could not be read, or the output file could not be named or written.
 */
public class ConversionException extends RuntimeException {

  public ConversionException(String message) {
    super(message);
  }

  public ConversionException(String message, Throwable cause) {
    super(message, cause);
  }
}

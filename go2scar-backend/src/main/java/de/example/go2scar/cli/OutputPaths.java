package de.example.go2scar.cli;

import java.nio.file.Path;

/**
 * Default output location: next to the input, with {@code .json} and then {@code .go}
 * removed and the target extension appended ({@code hello.go.json -> hello.scar}).
 */
public final class OutputPaths {

  private OutputPaths() {
  }

  public static Path defaultFor(Path input, String targetExtension) {
    Path fileName = input.getFileName();
    if (fileName == null) {
      throw new ConversionException("Cannot derive an output file name from " + input);
    }

    String name = fileName.toString();
    name = stripSuffix(name, ".json");
    name = stripSuffix(name, ".go");
    return input.resolveSibling(name + targetExtension);
  }

  private static String stripSuffix(String s, String suffix) {
    return s.endsWith(suffix) ? s.substring(0, s.length() - suffix.length()) : s;
  }
}

package de.example.go2scar.cli;

import de.example.go2scar.GoToScarTranslator;
import de.example.go2scar.ast.AstReader;
import de.example.go2scar.ast.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads an AST document from disk, translates it and writes the Scar file.
 *
 * Read and write failures surface as {@link ConversionException}, malformed
 * documents as {@link de.example.go2scar.ast.AstFormatException}. Nothing is
 * written unless translation succeeded.
 */
@Service
public class ScarFileConverter {
  private static final Logger log = LoggerFactory.getLogger(ScarFileConverter.class);

  private final AstReader astReader;
  private final GoToScarTranslator translator;

  public ScarFileConverter(AstReader astReader, GoToScarTranslator translator) {
    this.astReader = astReader;
    this.translator = translator;
  }

  public void convert(Path input, Path output) {
    String json;
    try {
      json = Files.readString(input, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ConversionException("Cannot read " + input + ": " + describe(e), e);
    }

    SourceFile file = astReader.read(json);
    String scar = translator.translate(file);

    try {
      Files.writeString(output, scar, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ConversionException("Cannot write " + output + ": " + describe(e), e);
    }
    log.info("Converted {} to {} ({} declarations)", input, output, file.declarations().size());
  }

  private static String describe(IOException e) {
    String msg = e.getMessage();
    return msg == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + " " + msg;
  }
}

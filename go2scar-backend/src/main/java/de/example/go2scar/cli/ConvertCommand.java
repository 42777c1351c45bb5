package de.example.go2scar.cli;

import de.example.go2scar.ConverterProperties;
import de.example.go2scar.ast.AstFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * {@code go2scar <input> [output]}: converts one AST document and reports the
 * outcome through the exit code (0 on success, 1 on any failure).
 */
@Component
@Profile(ConvertCommand.PROFILE)
public class ConvertCommand implements ApplicationRunner, ExitCodeGenerator {
  public static final String PROFILE = "cli";

  private static final Logger log = LoggerFactory.getLogger(ConvertCommand.class);

  private final ScarFileConverter converter;
  private final ConverterProperties properties;
  private final PrintStream stdout;
  private final PrintStream stderr;
  private int exitCode = 0;

  @Autowired
  public ConvertCommand(ScarFileConverter converter, ConverterProperties properties) {
    this(converter, properties, System.out, System.err);
  }

  ConvertCommand(ScarFileConverter converter, ConverterProperties properties,
                 PrintStream stdout, PrintStream stderr) {
    this.converter = converter;
    this.properties = properties;
    this.stdout = stdout;
    this.stderr = stderr;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> positional = args.getNonOptionArgs();
    if (positional.isEmpty()) {
      stderr.println("Usage: go2scar <input.go.json> [output" + properties.targetExtension() + "]");
      exitCode = 1;
      return;
    }

    try {
      Path input = Path.of(positional.get(0));
      Path output = positional.size() > 1
          ? Path.of(positional.get(1))
          : OutputPaths.defaultFor(input, properties.targetExtension());

      converter.convert(input, output);
      stdout.println("Successfully converted " + input + " to " + output);
      exitCode = 0;
    } catch (ConversionException | AstFormatException | InvalidPathException e) {
      log.debug("Conversion failed", e);
      stderr.println("Error converting file: " + e.getMessage());
      exitCode = 1;
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}

package de.example.go2scar;

import de.example.go2scar.cli.ConvertCommand;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

import java.util.Arrays;

/**
 * Starts the HTTP API, or converts a single file when positional arguments are given:
 * {@code go2scar <input.go.json> [output.scar]}.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class Go2ScarApplication {

  public static void main(String[] args) {
    if (!hasPositionalArgs(args)) {
      SpringApplication.run(Go2ScarApplication.class, args);
      return;
    }

    SpringApplication app = new SpringApplication(Go2ScarApplication.class);
    app.setWebApplicationType(WebApplicationType.NONE);
    app.setAdditionalProfiles(ConvertCommand.PROFILE);
    System.exit(SpringApplication.exit(app.run(args)));
  }

  static boolean hasPositionalArgs(String[] args) {
    return Arrays.stream(args).anyMatch(a -> !a.startsWith("--"));
  }
}

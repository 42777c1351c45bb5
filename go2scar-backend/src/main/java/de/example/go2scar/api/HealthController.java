package de.example.go2scar.api;

import de.example.go2scar.ConverterProperties;

import java.time.Instant;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
// served under /api and at the root, for probes that do not know the prefix
@RequestMapping({"/api", ""})
public class HealthController {

  private final ConverterProperties properties;

  public HealthController(ConverterProperties properties) {
    this.properties = properties;
  }

  @GetMapping(value = {"/health", "/health/"}, produces = MediaType.APPLICATION_JSON_VALUE)
  public Map<String, Object> health() {
    return Map.of(
        "status", "ok",
        "service", "go2scar-backend",
        "target", properties.targetExtension(),
        "maxInputChars", properties.maxInputChars(),
        "time", Instant.now().toString()
    );
  }
}

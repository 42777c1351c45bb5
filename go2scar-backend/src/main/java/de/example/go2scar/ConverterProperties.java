package de.example.go2scar;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * {@code go2scar.*} settings.
 *
 * @param targetExtension extension appended to derived output paths
 * @param maxInputChars   largest AST document the HTTP API accepts
 * @param corsOrigins     origin patterns allowed to call {@code /api/**}
 */
@ConfigurationProperties(prefix = "go2scar")
public record ConverterProperties(
    @DefaultValue(".scar") String targetExtension,
    @DefaultValue("200000") int maxInputChars,
    @DefaultValue({"http://localhost:5173", "http://127.0.0.1:5173"}) List<String> corsOrigins
) {
}

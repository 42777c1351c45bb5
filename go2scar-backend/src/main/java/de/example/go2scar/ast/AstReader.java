package de.example.go2scar.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the JSON form of a parsed Go file.
 *
 * Every node is an object with a {@code kind} discriminator; node kinds this
 * tool does not model are read as the family's {@code Unsupported} variant so
 * that they turn into placeholders instead of failing the document.
 */
@Component
public class AstReader {
  private static final Logger log = LoggerFactory.getLogger(AstReader.class);

  private final ObjectMapper mapper;

  public AstReader(ObjectMapper objectMapper) {
    this.mapper = objectMapper.copy()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
  }

  public SourceFile read(String json) {
    if (json == null || json.isBlank()) {
      throw new AstFormatException("AST document is empty");
    }

    SourceFile file;
    try {
      file = mapper.readValue(json, SourceFile.class);
    } catch (JsonProcessingException e) {
      throw new AstFormatException("Malformed AST document: " + e.getOriginalMessage(), e);
    }

    if (file == null) {
      throw new AstFormatException("AST document does not describe a source file");
    }

    log.debug("Read AST for package {} ({} imports, {} declarations)",
        file.packageName(), file.imports().size(), file.declarations().size());
    return file;
  }
}

package de.example.go2scar.api;

import de.example.go2scar.ast.AstFormatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(AstFormatException.class)
  public ResponseEntity<String> handleAstFormat(AstFormatException e) {
    log.debug("Rejected AST document", e);
    return ResponseEntity.badRequest()
        .contentType(MediaType.TEXT_PLAIN)
        .body("Parse error (AST). Expected a JSON source file with 'imports' and 'declarations'.\n\n" + e.getMessage());
  }
}

package de.example.go2scar.api;

import de.example.go2scar.ConverterProperties;
import de.example.go2scar.GoToScarTranslator;
import de.example.go2scar.ast.AstReader;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
public class TranslateController {

  private final AstReader astReader;
  private final GoToScarTranslator translator;
  private final ConverterProperties properties;

  public TranslateController(AstReader astReader, GoToScarTranslator translator, ConverterProperties properties) {
    this.astReader = astReader;
    this.translator = translator;
    this.properties = properties;
  }

  @PostMapping(value = {"/translate", "/translate/"}, consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.TEXT_PLAIN_VALUE)
  public ResponseEntity<String> translate(@RequestBody(required = false) String input) {
    if (input == null || input.isBlank()) return ResponseEntity.ok("");
    if (input.length() > properties.maxInputChars()) return ResponseEntity.badRequest().body("Input too large.");

    return ResponseEntity.ok(translator.translate(astReader.read(input)));
  }
}

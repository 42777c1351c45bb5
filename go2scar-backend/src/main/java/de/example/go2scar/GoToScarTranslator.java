package de.example.go2scar;

import de.example.go2scar.ast.Decl;
import de.example.go2scar.ast.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Go AST -> Scar source, best effort.
 *
 * One translation is a single depth-first pass: mapped imports first, then every
 * declaration in source order. The components are stateless; all mutable state
 * lives in a {@link TranslationState} created per call, so concurrent calls are safe.
 */
@Service
public class GoToScarTranslator {
  private static final Logger log = LoggerFactory.getLogger(GoToScarTranslator.class);

  private final ImportMapper importMapper;
  private final DeclarationEmitter declarations;

  public GoToScarTranslator(ImportMapper importMapper, DeclarationEmitter declarations) {
    this.importMapper = importMapper;
    this.declarations = declarations;
  }

  public String translate(SourceFile file) {
    TranslationState state = new TranslationState();
    OutputBuffer out = state.out();

    List<String> modules = importMapper.mapAll(file.imports());
    for (String module : modules) {
      out.line("import \"" + module + "\"");
    }
    if (!modules.isEmpty()) out.blank();

    log.debug("Translating package {}: {} declarations, {} of {} imports mapped",
        file.packageName(), file.declarations().size(), modules.size(), file.imports().size());

    for (Decl d : file.declarations()) {
      declarations.emit(state, d);
    }

    if (state.placeholders() > 0) {
      log.warn("Package {} translated with {} placeholder(s) for unsupported constructs",
          file.packageName(), state.placeholders());
    }
    return state.text();
  }
}

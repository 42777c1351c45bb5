package de.example.go2scar.ast;

import java.util.List;

/**
 * One parsed Go file: its package clause, import paths in declaration order and
 * top-level declarations in source order.
 */
public record SourceFile(String packageName, List<String> imports, List<Decl> declarations) {
  public SourceFile {
    imports = imports == null ? List.of() : List.copyOf(imports);
    declarations = declarations == null ? List.of() : List.copyOf(declarations);
  }
}

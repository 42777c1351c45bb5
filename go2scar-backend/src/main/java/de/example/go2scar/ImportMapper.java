package de.example.go2scar;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Go standard-library import path -> Scar module. Paths without an entry have
 * no Scar counterpart and are dropped.
 */
@Component
public final class ImportMapper {

  private static final Map<String, String> MODULES = Map.ofEntries(
      Map.entry("crypto/sha256", "std/crypto"),
      Map.entry("crypto/sha512", "std/crypto"),
      Map.entry("crypto/sha1", "std/crypto"),
      Map.entry("crypto/md5", "std/crypto"),
      Map.entry("io", "std/io"),
      Map.entry("bufio", "std/io"),
      Map.entry("json", "std/json"),
      Map.entry("encoding/json", "std/json"),
      Map.entry("regexp", "std/regex"),
      Map.entry("os", "std/os"),
      Map.entry("strings", "std/strings"),
      Map.entry("strconv", "std/strings"),
      Map.entry("math", "std/math"),
      Map.entry("time", "std/time"),
      Map.entry("math/rand", "std/random")
  );

  public Optional<String> map(String importPath) {
    if (importPath == null) return Optional.empty();
    return Optional.ofNullable(MODULES.get(unquote(importPath.trim())));
  }

  /** Maps paths in declaration order, one module per mapped import. */
  public List<String> mapAll(List<String> importPaths) {
    List<String> modules = new ArrayList<>();
    for (String path : importPaths) {
      map(path).ifPresent(modules::add);
    }
    return List.copyOf(modules);
  }

  private static String unquote(String s) {
    if (s.length() >= 2 && s.startsWith("\"") && s.endsWith("\"")) {
      return s.substring(1, s.length() - 1);
    }
    return s;
  }
}

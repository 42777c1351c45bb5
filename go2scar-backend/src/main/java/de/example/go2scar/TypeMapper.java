package de.example.go2scar;

import de.example.go2scar.ast.TypeNode;
import org.springframework.stereotype.Component;

/**
 * Go type -> Scar type spelling. Total: names without a known mapping pass through.
 */
@Component
public final class TypeMapper implements TypeNode.Visitor<String> {

  public String map(TypeNode t) {
    if (t == null) return "";
    return t.accept(this);
  }

  @Override
  public String visit(TypeNode.Named t) {
    return switch (t.name()) {
      case "int", "int8", "int16", "int32", "uint", "uint16", "uint32", "rune" -> "int";
      case "int64", "uint64" -> "i64";
      case "string" -> "string";
      case "bool" -> "bool";
      case "byte", "uint8" -> "char";
      case "float32", "float64" -> "float";
      default -> t.name();
    };
  }

  @Override
  public String visit(TypeNode.Array t) {
    return "list[" + map(t.elem()) + "]";
  }

  @Override
  public String visit(TypeNode.MapType t) {
    return "map[" + map(t.key()) + ": " + map(t.value()) + "]";
  }

  @Override
  public String visit(TypeNode.Pointer t) {
    return "ref " + map(t.base());
  }

  // Scar has no separate syntax for foreign types; they read like a selector.
  @Override
  public String visit(TypeNode.Qualified t) {
    return t.owner() + "." + t.name();
  }

  @Override
  public String visit(TypeNode.Unsupported t) {
    return "unknown";
  }

  public boolean isSequence(TypeNode t) {
    return t instanceof TypeNode.Array;
  }

  public boolean isMap(TypeNode t) {
    return t instanceof TypeNode.MapType;
  }
}

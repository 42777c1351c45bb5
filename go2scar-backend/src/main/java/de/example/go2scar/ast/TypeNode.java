package de.example.go2scar.ast;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Objects;

/**
 * Go type expressions as they appear in declarations, parameters and conversions.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind", defaultImpl = TypeNode.Unsupported.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = TypeNode.Named.class, name = "Named"),
    @JsonSubTypes.Type(value = TypeNode.Array.class, name = "Array"),
    @JsonSubTypes.Type(value = TypeNode.MapType.class, name = "Map"),
    @JsonSubTypes.Type(value = TypeNode.Pointer.class, name = "Pointer"),
    @JsonSubTypes.Type(value = TypeNode.Qualified.class, name = "Qualified"),
    @JsonSubTypes.Type(value = TypeNode.Unsupported.class, name = "Unsupported")
})
public sealed interface TypeNode
    permits TypeNode.Named, TypeNode.Array, TypeNode.MapType, TypeNode.Pointer,
            TypeNode.Qualified, TypeNode.Unsupported {

  <T> T accept(Visitor<T> v);

  interface Visitor<T> {
    T visit(Named t);
    T visit(Array t);
    T visit(MapType t);
    T visit(Pointer t);
    T visit(Qualified t);
    T visit(Unsupported t);
  }

  record Named(String name) implements TypeNode {
    public Named {
      Objects.requireNonNull(name, "name");
    }

    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }

  /** Slices and fixed-length arrays alike. */
  record Array(TypeNode elem) implements TypeNode {
    public Array {
      Objects.requireNonNull(elem, "elem");
    }

    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }

  record MapType(TypeNode key, TypeNode value) implements TypeNode {
    public MapType {
      Objects.requireNonNull(key, "key");
      Objects.requireNonNull(value, "value");
    }

    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }

  record Pointer(TypeNode base) implements TypeNode {
    public Pointer {
      Objects.requireNonNull(base, "base");
    }

    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }

  /** A package-qualified type such as {@code bytes.Buffer}. */
  record Qualified(String owner, String name) implements TypeNode {
    public Qualified {
      Objects.requireNonNull(owner, "owner");
      Objects.requireNonNull(name, "name");
    }

    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }

  /** Channels, function types and anything else without a Scar spelling. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record Unsupported() implements TypeNode {
    @Override
    public <T> T accept(Visitor<T> v) { return v.visit(this); }
  }
}

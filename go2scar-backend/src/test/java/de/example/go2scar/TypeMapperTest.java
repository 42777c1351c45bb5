package de.example.go2scar;

import de.example.go2scar.ast.TypeNode;
import org.junit.jupiter.api.Test;

import static de.example.go2scar.Nodes.*;
import static org.junit.jupiter.api.Assertions.*;

class TypeMapperTest {

  private final TypeMapper mapper = new TypeMapper();

  @Test
  void integerWidths() {
    assertEquals("int", mapper.map(named("int")));
    assertEquals("int", mapper.map(named("int32")));
    assertEquals("int", mapper.map(named("rune")));
    assertEquals("i64", mapper.map(named("int64")));
    assertEquals("i64", mapper.map(named("uint64")));
  }

  @Test
  void scalarTypes() {
    assertEquals("string", mapper.map(named("string")));
    assertEquals("bool", mapper.map(named("bool")));
    assertEquals("char", mapper.map(named("byte")));
    assertEquals("float", mapper.map(named("float32")));
    assertEquals("float", mapper.map(named("float64")));
  }

  @Test
  void unknownNamesPassThrough() {
    assertEquals("Point", mapper.map(named("Point")));
    assertEquals("error", mapper.map(named("error")));
  }

  @Test
  void compositeTypesRecurse() {
    assertEquals("list[char]", mapper.map(listOf(named("byte"))));
    assertEquals("map[string: list[i64]]",
        mapper.map(new TypeNode.MapType(named("string"), listOf(named("int64")))));
    assertEquals("ref Node", mapper.map(new TypeNode.Pointer(named("Node"))));
    assertEquals("list[ref Node]", mapper.map(listOf(new TypeNode.Pointer(named("Node")))));
  }

  @Test
  void qualifiedTypesUseSelectorSpelling() {
    assertEquals("bytes.Buffer", mapper.map(new TypeNode.Qualified("bytes", "Buffer")));
    assertEquals("ref sync.Mutex", mapper.map(new TypeNode.Pointer(new TypeNode.Qualified("sync", "Mutex"))));
  }

  @Test
  void unsupportedTypes() {
    assertEquals("unknown", mapper.map(new TypeNode.Unsupported()));
    assertEquals("", mapper.map(null));
  }
}

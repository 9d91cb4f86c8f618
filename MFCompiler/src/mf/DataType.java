package mf;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/** Socket data types a formula can declare for parameters and returns. */
public enum DataType {
  FLOAT("float", "NodeSocketFloat"),
  INT("int", "NodeSocketInt"),
  BOOL("bool", "NodeSocketBool"),
  VEC3("vec3", "NodeSocketVector"),
  RGBA("rgba", "NodeSocketColor"),
  GEOMETRY("geo", "NodeSocketGeometry"),
  STRING("string", "NodeSocketString"),
  SHADER("shader", "NodeSocketShader"),
  OBJECT("object", "NodeSocketObject"),
  IMAGE("image", "NodeSocketImage"),
  COLLECTION("collection", "NodeSocketCollection"),
  TEXTURE("texture", "NodeSocketTexture"),
  MATERIAL("material", "NodeSocketMaterial"),
  ROTATION("rotation", "NodeSocketRotation"),
  // The "_" constant: leave the socket at its default.
  DEFAULT("_", ""),
  UNKNOWN("?", "");

  private static final ImmutableMap<String, DataType> REPR_MAP =
      Maps.uniqueIndex(Arrays.asList(values()), DataType::repr);

  private static final ImmutableMap<String, DataType> ALIASES =
      ImmutableMap.of("geometry", GEOMETRY, "vector", VEC3, "color", RGBA);

  private final String repr;
  private final String socketType;

  private DataType(String repr, String socketType) {
    this.repr = repr;
    this.socketType = socketType;
  }

  public String repr() {
    return repr;
  }

  public boolean isDeclarable() {
    return !socketType.isEmpty();
  }

  /** The node socket type id used when declaring a node group socket of this type. */
  public String socketType() {
    if (!isDeclarable()) {
      throw new IllegalStateException("No socket type for " + this);
    }
    return socketType;
  }

  /** Parses a type name as written in a parameter list. */
  public static Optional<DataType> parse(String name) {
    DataType type = REPR_MAP.get(name);
    if (type == null) {
      type = ALIASES.get(name);
    }
    if (type == null || !type.isDeclarable()) {
      return Optional.empty();
    }
    return Optional.of(type);
  }
}

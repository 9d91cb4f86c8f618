package mf;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

/** Socket layouts of the node types the builtins create, as the in-memory backend knows them. */
public final class NodeCatalog {

  @AutoValue
  public abstract static class SocketSpec {
    public abstract String name();

    public abstract DataType type();

    public abstract boolean multiInput();

    public abstract Optional<Object> defaultValue();

    static SocketSpec of(String name, DataType type, Object defaultValue) {
      return new AutoValue_NodeCatalog_SocketSpec(name, type, false, Optional.of(defaultValue));
    }

    static SocketSpec of(String name, DataType type) {
      return new AutoValue_NodeCatalog_SocketSpec(name, type, false, Optional.empty());
    }

    static SocketSpec multi(String name, DataType type) {
      return new AutoValue_NodeCatalog_SocketSpec(name, type, true, Optional.empty());
    }
  }

  @AutoValue
  public abstract static class NodeSpec {
    public abstract String typeId();

    /** Base of the generated node names, e.g. "Math" for "Math", "Math.001". */
    public abstract String defaultName();

    public abstract ImmutableList<SocketSpec> inputs();

    public abstract ImmutableList<SocketSpec> outputs();

    static NodeSpec of(
        String typeId, String defaultName, List<SocketSpec> inputs, List<SocketSpec> outputs) {
      return new AutoValue_NodeCatalog_NodeSpec(
          typeId, defaultName, ImmutableList.copyOf(inputs), ImmutableList.copyOf(outputs));
    }
  }

  private static final ImmutableList<Double> ZERO_VECTOR = ImmutableList.of(0.0, 0.0, 0.0);
  private static final ImmutableList<Double> ONE_VECTOR = ImmutableList.of(1.0, 1.0, 1.0);

  private static SocketSpec value(String name) {
    return SocketSpec.of(name, DataType.FLOAT, 0.5);
  }

  private static SocketSpec vector(String name) {
    return SocketSpec.of(name, DataType.VEC3, ZERO_VECTOR);
  }

  private static SocketSpec geometry(String name) {
    return SocketSpec.of(name, DataType.GEOMETRY);
  }

  private static final ImmutableMap<String, NodeSpec> SPECS =
      Maps.uniqueIndex(
          Arrays.asList(
              NodeSpec.of(
                  "ShaderNodeMath",
                  "Math",
                  ImmutableList.of(value("Value"), value("Value"), value("Value")),
                  ImmutableList.of(SocketSpec.of("Value", DataType.FLOAT))),
              NodeSpec.of(
                  "ShaderNodeVectorMath",
                  "Vector Math",
                  ImmutableList.of(
                      vector("Vector"),
                      vector("Vector"),
                      vector("Vector"),
                      SocketSpec.of("Scale", DataType.FLOAT, 1.0)),
                  ImmutableList.of(
                      SocketSpec.of("Vector", DataType.VEC3),
                      SocketSpec.of("Value", DataType.FLOAT))),
              NodeSpec.of(
                  "ShaderNodeCombineXYZ",
                  "Combine XYZ",
                  ImmutableList.of(
                      SocketSpec.of("X", DataType.FLOAT, 0.0),
                      SocketSpec.of("Y", DataType.FLOAT, 0.0),
                      SocketSpec.of("Z", DataType.FLOAT, 0.0)),
                  ImmutableList.of(SocketSpec.of("Vector", DataType.VEC3))),
              NodeSpec.of(
                  "ShaderNodeSeparateXYZ",
                  "Separate XYZ",
                  ImmutableList.of(vector("Vector")),
                  ImmutableList.of(
                      SocketSpec.of("X", DataType.FLOAT),
                      SocketSpec.of("Y", DataType.FLOAT),
                      SocketSpec.of("Z", DataType.FLOAT))),
              NodeSpec.of(
                  "FunctionNodeCompare",
                  "Compare",
                  ImmutableList.of(
                      SocketSpec.of("A", DataType.FLOAT, 0.0),
                      SocketSpec.of("B", DataType.FLOAT, 0.0),
                      SocketSpec.of("Epsilon", DataType.FLOAT, 0.001)),
                  ImmutableList.of(SocketSpec.of("Result", DataType.BOOL))),
              NodeSpec.of(
                  "FunctionNodeBooleanMath",
                  "Boolean Math",
                  ImmutableList.of(
                      SocketSpec.of("Boolean", DataType.BOOL, false),
                      SocketSpec.of("Boolean", DataType.BOOL, false)),
                  ImmutableList.of(SocketSpec.of("Boolean", DataType.BOOL))),
              NodeSpec.of(
                  "ShaderNodeValue",
                  "Value",
                  ImmutableList.of(),
                  ImmutableList.of(SocketSpec.of("Value", DataType.FLOAT, 0.5))),
              NodeSpec.of(
                  "FunctionNodeInputInt",
                  "Integer",
                  ImmutableList.of(),
                  ImmutableList.of(SocketSpec.of("Integer", DataType.INT))),
              NodeSpec.of(
                  "FunctionNodeInputBool",
                  "Boolean",
                  ImmutableList.of(),
                  ImmutableList.of(SocketSpec.of("Boolean", DataType.BOOL))),
              NodeSpec.of(
                  "FunctionNodeInputString",
                  "String",
                  ImmutableList.of(),
                  ImmutableList.of(SocketSpec.of("String", DataType.STRING))),
              NodeSpec.of(
                  "GeometryNodeJoinGeometry",
                  "Join Geometry",
                  ImmutableList.of(SocketSpec.multi("Geometry", DataType.GEOMETRY)),
                  ImmutableList.of(geometry("Geometry"))),
              NodeSpec.of(
                  "GeometryNodeSetPosition",
                  "Set Position",
                  ImmutableList.of(
                      geometry("Geometry"),
                      SocketSpec.of("Selection", DataType.BOOL, true),
                      vector("Position"),
                      vector("Offset")),
                  ImmutableList.of(geometry("Geometry"))),
              NodeSpec.of(
                  "GeometryNodeInputPosition",
                  "Position",
                  ImmutableList.of(),
                  ImmutableList.of(SocketSpec.of("Position", DataType.VEC3))),
              NodeSpec.of(
                  "GeometryNodeInputIndex",
                  "Index",
                  ImmutableList.of(),
                  ImmutableList.of(SocketSpec.of("Index", DataType.INT))),
              NodeSpec.of(
                  "GeometryNodeMeshCube",
                  "Cube",
                  ImmutableList.of(
                      SocketSpec.of("Size", DataType.VEC3, ONE_VECTOR),
                      SocketSpec.of("Vertices X", DataType.INT, 2),
                      SocketSpec.of("Vertices Y", DataType.INT, 2),
                      SocketSpec.of("Vertices Z", DataType.INT, 2)),
                  ImmutableList.of(geometry("Mesh"), SocketSpec.of("UV Map", DataType.VEC3))),
              NodeSpec.of(
                  "GeometryNodeTransform",
                  "Transform Geometry",
                  ImmutableList.of(
                      geometry("Geometry"),
                      vector("Translation"),
                      vector("Rotation"),
                      SocketSpec.of("Scale", DataType.VEC3, ONE_VECTOR)),
                  ImmutableList.of(geometry("Geometry"))),
              NodeSpec.of(
                  "ShaderNodeMapRange",
                  "Map Range",
                  ImmutableList.of(
                      SocketSpec.of("Value", DataType.FLOAT, 1.0),
                      SocketSpec.of("From Min", DataType.FLOAT, 0.0),
                      SocketSpec.of("From Max", DataType.FLOAT, 1.0),
                      SocketSpec.of("To Min", DataType.FLOAT, 0.0),
                      SocketSpec.of("To Max", DataType.FLOAT, 1.0)),
                  ImmutableList.of(SocketSpec.of("Result", DataType.FLOAT))),
              NodeSpec.of(
                  "ShaderNodeClamp",
                  "Clamp",
                  ImmutableList.of(
                      SocketSpec.of("Value", DataType.FLOAT, 1.0),
                      SocketSpec.of("Min", DataType.FLOAT, 0.0),
                      SocketSpec.of("Max", DataType.FLOAT, 1.0)),
                  ImmutableList.of(SocketSpec.of("Result", DataType.FLOAT))),
              NodeSpec.of(
                  "ShaderNodeTexNoise",
                  "Noise Texture",
                  ImmutableList.of(
                      vector("Vector"),
                      SocketSpec.of("Scale", DataType.FLOAT, 5.0),
                      SocketSpec.of("Detail", DataType.FLOAT, 2.0),
                      SocketSpec.of("Roughness", DataType.FLOAT, 0.5),
                      SocketSpec.of("Distortion", DataType.FLOAT, 0.0)),
                  ImmutableList.of(
                      SocketSpec.of("Fac", DataType.FLOAT),
                      SocketSpec.of("Color", DataType.RGBA)))),
          NodeSpec::typeId);

  public static Optional<NodeSpec> lookup(String typeId) {
    return Optional.ofNullable(SPECS.get(typeId));
  }

  public static ImmutableList<NodeSpec> all() {
    return SPECS.values().asList();
  }

  private NodeCatalog() {}
}

package mf;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Maps;
import com.google.common.collect.Range;

/**
 * The functions every formula can call without a library definition, each backed by one node.
 *
 * <p>A builtin may exist in only one tree type, or be backed by a different node in each.
 */
public final class Builtins {

  @AutoValue
  public abstract static class Builtin {
    public abstract String name();

    public abstract NodeInstance node();

    /** Argument names, matching {@link NodeInstance#inputs()} one to one. */
    public abstract ImmutableList<String> inputNames();

    /** Result names, matching {@link NodeInstance#outputs()} one to one. */
    public abstract ImmutableList<String> outputNames();

    static Builtin create(
        String name, NodeInstance node, List<String> inputNames, List<String> outputNames) {
      return new AutoValue_Builtins_Builtin(
          name, node, ImmutableList.copyOf(inputNames), ImmutableList.copyOf(outputNames));
    }
  }

  private static final ImmutableSet<TreeType> ALL_TREES = ImmutableSet.copyOf(TreeType.values());
  private static final ImmutableSet<TreeType> GEOMETRY = ImmutableSet.of(TreeType.GEOMETRY);

  /** Node that outputs one float; its value is set with {@code SET_OUTPUT}. */
  public static final NodeInstance VALUE_NODE =
      NodeInstance.create("ShaderNodeValue", ImmutableList.of(), indices(0), indices(1));

  public static final String COMBINE_XYZ = "combine_xyz";
  public static final String SEPARATE_XYZ = "separate_xyz";

  private static final ImmutableMap<AST.BinaryOperator, String> OPERATOR_FUNCTIONS =
      Maps.immutableEnumMap(
          ImmutableMap.<AST.BinaryOperator, String>builder()
              .put(AST.BinaryOperator.ADD, "add")
              .put(AST.BinaryOperator.SUBTRACT, "sub")
              .put(AST.BinaryOperator.MULTIPLY, "mul")
              .put(AST.BinaryOperator.DIVIDE, "div")
              .put(AST.BinaryOperator.MODULO, "mod")
              .put(AST.BinaryOperator.POWER, "pow")
              .put(AST.BinaryOperator.LESS, "less_than")
              .put(AST.BinaryOperator.LESS_EQUAL, "less_equal")
              .put(AST.BinaryOperator.GREATER, "greater_than")
              .put(AST.BinaryOperator.GREATER_EQUAL, "greater_equal")
              .put(AST.BinaryOperator.EQUAL, "equal")
              .put(AST.BinaryOperator.NOT_EQUAL, "not_equal")
              .put(AST.BinaryOperator.AND, "and")
              .put(AST.BinaryOperator.OR, "or")
              .build());

  private static final ImmutableTable<TreeType, String, Builtin> TABLE = buildTable();

  private static ImmutableTable<TreeType, String, Builtin> buildTable() {
    ImmutableTable.Builder<TreeType, String, Builtin> table = ImmutableTable.builder();

    // Scalar math.
    math(table, "add", "ADD", "a", "b");
    math(table, "sub", "SUBTRACT", "a", "b");
    math(table, "mul", "MULTIPLY", "a", "b");
    math(table, "div", "DIVIDE", "a", "b");
    math(table, "mod", "FLOORED_MODULO", "a", "b");
    math(table, "pow", "POWER", "base", "exponent");
    math(table, "multiply_add", "MULTIPLY_ADD", "value", "multiplier", "addend");
    math(table, "log", "LOGARITHM", "value", "base");
    math(table, "sqrt", "SQRT", "value");
    math(table, "exp", "EXPONENT", "value");
    math(table, "abs", "ABSOLUTE", "value");
    math(table, "sign", "SIGN", "value");
    math(table, "min", "MINIMUM", "a", "b");
    math(table, "max", "MAXIMUM", "a", "b");
    math(table, "round", "ROUND", "value");
    math(table, "floor", "FLOOR", "value");
    math(table, "ceil", "CEIL", "value");
    math(table, "fract", "FRACT", "value");
    math(table, "sin", "SINE", "value");
    math(table, "cos", "COSINE", "value");
    math(table, "tan", "TANGENT", "value");
    math(table, "asin", "ARCSINE", "value");
    math(table, "acos", "ARCCOSINE", "value");
    math(table, "atan", "ARCTANGENT", "value");
    math(table, "atan2", "ARCTAN2", "a", "b");
    math(table, "radians", "RADIANS", "degrees");
    math(table, "degrees", "DEGREES", "radians");

    // Comparisons. Shader trees only have the two the math node offers.
    compare(table, "less_than", "LESS_THAN", true);
    compare(table, "greater_than", "GREATER_THAN", true);
    compare(table, "less_equal", "LESS_EQUAL", false);
    compare(table, "greater_equal", "GREATER_EQUAL", false);
    compare(table, "equal", "EQUAL", false);
    compare(table, "not_equal", "NOT_EQUAL", false);

    booleanMath(table, "and", "AND", "a", "b");
    booleanMath(table, "or", "OR", "a", "b");
    booleanMath(table, "not", "NOT", "a");

    // Vectors.
    register(
        table,
        ALL_TREES,
        Builtin.create(
            COMBINE_XYZ,
            NodeInstance.create("ShaderNodeCombineXYZ", ImmutableList.of(), indices(3), indices(1)),
            ImmutableList.of("x", "y", "z"),
            ImmutableList.of("vector")));
    register(
        table,
        ALL_TREES,
        Builtin.create(
            SEPARATE_XYZ,
            NodeInstance.create(
                "ShaderNodeSeparateXYZ", ImmutableList.of(), indices(1), indices(3)),
            ImmutableList.of("vector"),
            ImmutableList.of("x", "y", "z")));
    vectorMath(table, "vadd", "ADD", indices(2), 0, "a", "b");
    vectorMath(table, "vsub", "SUBTRACT", indices(2), 0, "a", "b");
    vectorMath(table, "vmul", "MULTIPLY", indices(2), 0, "a", "b");
    vectorMath(table, "cross", "CROSS_PRODUCT", indices(2), 0, "a", "b");
    vectorMath(table, "normalize", "NORMALIZE", indices(1), 0, "vector");
    vectorMath(table, "scale", "SCALE", ImmutableList.of(0, 3), 0, "vector", "scale");
    vectorMath(table, "dot", "DOT_PRODUCT", indices(2), 1, "a", "b");
    vectorMath(table, "distance", "DISTANCE", indices(2), 1, "a", "b");
    vectorMath(table, "length", "LENGTH", indices(1), 1, "vector");

    // Utilities.
    register(
        table,
        ALL_TREES,
        Builtin.create(
            "map_range",
            NodeInstance.create(
                "ShaderNodeMapRange",
                ImmutableList.of(
                    NodeInstance.Property.create("data_type", "FLOAT"),
                    NodeInstance.Property.create("interpolation_type", "LINEAR")),
                indices(5),
                indices(1)),
            ImmutableList.of("value", "from_min", "from_max", "to_min", "to_max"),
            ImmutableList.of("result")));
    register(
        table,
        ALL_TREES,
        Builtin.create(
            "clamp",
            NodeInstance.create(
                "ShaderNodeClamp",
                ImmutableList.of(NodeInstance.Property.create("clamp_type", "MINMAX")),
                indices(3),
                indices(1)),
            ImmutableList.of("value", "min", "max"),
            ImmutableList.of("result")));
    register(
        table,
        ALL_TREES,
        Builtin.create(
            "noise",
            NodeInstance.create(
                "ShaderNodeTexNoise",
                ImmutableList.of(NodeInstance.Property.create("noise_dimensions", "3D")),
                indices(5),
                indices(2)),
            ImmutableList.of("vector", "scale", "detail", "roughness", "distortion"),
            ImmutableList.of("fac", "color")));

    // Geometry.
    geometry(table, Parser.JOIN_GEOMETRY, "GeometryNodeJoinGeometry", "geometry", "geometry");
    register(
        table,
        GEOMETRY,
        Builtin.create(
            "set_position",
            NodeInstance.create(
                "GeometryNodeSetPosition", ImmutableList.of(), indices(4), indices(1)),
            ImmutableList.of("geometry", "selection", "position", "offset"),
            ImmutableList.of("geometry")));
    register(
        table,
        GEOMETRY,
        Builtin.create(
            "transform",
            NodeInstance.create(
                "GeometryNodeTransform", ImmutableList.of(), indices(4), indices(1)),
            ImmutableList.of("geometry", "translation", "rotation", "scale"),
            ImmutableList.of("geometry")));
    register(
        table,
        GEOMETRY,
        Builtin.create(
            "cube",
            NodeInstance.create("GeometryNodeMeshCube", ImmutableList.of(), indices(4), indices(2)),
            ImmutableList.of("size", "vertices_x", "vertices_y", "vertices_z"),
            ImmutableList.of("mesh", "uv_map")));
    geometry(table, "position", "GeometryNodeInputPosition", null, "position");
    geometry(table, "index", "GeometryNodeInputIndex", null, "index");

    return table.build();
  }

  private static void register(
      ImmutableTable.Builder<TreeType, String, Builtin> table,
      Set<TreeType> treeTypes,
      Builtin builtin) {
    for (TreeType treeType : treeTypes) {
      table.put(treeType, builtin.name(), builtin);
    }
  }

  private static NodeInstance.Property operation(String operation) {
    return NodeInstance.Property.create("operation", operation);
  }

  private static void math(
      ImmutableTable.Builder<TreeType, String, Builtin> table,
      String name,
      String operation,
      String... inputs) {
    register(
        table,
        ALL_TREES,
        Builtin.create(
            name,
            NodeInstance.create(
                "ShaderNodeMath",
                ImmutableList.of(operation(operation)),
                indices(inputs.length),
                indices(1)),
            ImmutableList.copyOf(inputs),
            ImmutableList.of("value")));
  }

  private static void compare(
      ImmutableTable.Builder<TreeType, String, Builtin> table,
      String name,
      String operation,
      boolean inShaders) {
    ImmutableList<String> inputs = ImmutableList.of("a", "b");
    ImmutableList<String> outputs = ImmutableList.of("result");
    register(
        table,
        GEOMETRY,
        Builtin.create(
            name,
            NodeInstance.create(
                "FunctionNodeCompare",
                ImmutableList.of(
                    NodeInstance.Property.create("data_type", "FLOAT"), operation(operation)),
                indices(2),
                indices(1)),
            inputs,
            outputs));
    if (inShaders) {
      table.put(
          TreeType.SHADER,
          name,
          Builtin.create(
              name,
              NodeInstance.create(
                  "ShaderNodeMath", ImmutableList.of(operation(operation)), indices(2), indices(1)),
              inputs,
              outputs));
    }
  }

  private static void booleanMath(
      ImmutableTable.Builder<TreeType, String, Builtin> table,
      String name,
      String operation,
      String... inputs) {
    register(
        table,
        GEOMETRY,
        Builtin.create(
            name,
            NodeInstance.create(
                "FunctionNodeBooleanMath",
                ImmutableList.of(operation(operation)),
                indices(inputs.length),
                indices(1)),
            ImmutableList.copyOf(inputs),
            ImmutableList.of("result")));
  }

  private static void vectorMath(
      ImmutableTable.Builder<TreeType, String, Builtin> table,
      String name,
      String operation,
      List<Integer> inputIndices,
      int output,
      String... inputs) {
    register(
        table,
        ALL_TREES,
        Builtin.create(
            name,
            NodeInstance.create(
                "ShaderNodeVectorMath",
                ImmutableList.of(operation(operation)),
                inputIndices,
                ImmutableList.of(output)),
            ImmutableList.copyOf(inputs),
            ImmutableList.of(output == 0 ? "vector" : "value")));
  }

  // A geometry-only node with at most one input and one output.
  private static void geometry(
      ImmutableTable.Builder<TreeType, String, Builtin> table,
      String name,
      String typeId,
      String input,
      String output) {
    ImmutableList<String> inputs = input == null ? ImmutableList.of() : ImmutableList.of(input);
    register(
        table,
        GEOMETRY,
        Builtin.create(
            name,
            NodeInstance.create(typeId, ImmutableList.of(), indices(inputs.size()), indices(1)),
            inputs,
            ImmutableList.of(output)));
  }

  private static ImmutableList<Integer> indices(int count) {
    return ContiguousSet.create(Range.closedOpen(0, count), DiscreteDomain.integers()).asList();
  }

  public static Optional<Builtin> lookup(TreeType treeType, String name) {
    return Optional.ofNullable(TABLE.get(treeType, name));
  }

  /** True if {@code name} is a builtin in any tree type. */
  public static boolean exists(String name) {
    return TABLE.containsColumn(name);
  }

  public static String operatorFunction(AST.BinaryOperator op) {
    return OPERATOR_FUNCTIONS.get(op);
  }

  public static ImmutableList<Builtin> all(TreeType treeType) {
    return TABLE.row(treeType).values().asList();
  }

  /** An input node of {@code typeId} whose value is the fixed property {@code property}. */
  static NodeInstance inputNode(String typeId, String property, Object value) {
    return NodeInstance.create(
        typeId,
        ImmutableList.of(NodeInstance.Property.create(property, value)),
        ImmutableList.of(),
        indices(1));
  }

  private Builtins() {}
}

package mf;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;

public class InterpreterTest {

  private final MemoryGraphBackend backend = new MemoryGraphBackend();
  private final MemoryNodeTree tree = backend.createTree("Formula", TreeType.GEOMETRY);

  private StringBuilder file = new StringBuilder();

  private void println(String line) {
    file.append(line);
    file.append('\n');
  }

  private Interpreter build() throws CompilerException {
    return new Compiler(new Library(TreeType.GEOMETRY)).build(file.toString(), tree, backend);
  }

  private Interpreter run(Operation... operations) {
    Interpreter interpreter = new Interpreter(tree, new CompilationSession(backend));
    interpreter.execute(ImmutableList.copyOf(operations));
    return interpreter;
  }

  private static NodeInstance builtin(String name) {
    return Builtins.lookup(TreeType.GEOMETRY, name).get().node();
  }

  private static GraphSocket port(Interpreter interpreter, String name) {
    Value value = interpreter.variable(name).get();
    assertThat(value.kind()).isEqualTo(Value.Kind.PORT);
    return value.<Value.Port>cast().socket();
  }

  @Test
  public void arithmeticBuildsLinkedMathNodes() throws CompilerException {
    println("out r = 2 + 3 * 4;");

    Interpreter interpreter = build();

    assertThat(tree.nodes()).hasSize(2);
    GraphNode mul = tree.nodes().get(0);
    GraphNode add = tree.nodes().get(1);
    assertThat(mul.name()).isEqualTo("Math");
    assertThat(mul.properties()).containsEntry("operation", "MULTIPLY");
    assertThat(add.name()).isEqualTo("Math.001");
    assertThat(add.properties()).containsEntry("operation", "ADD");
    assertThat(mul.inputs().get(0).defaultValue()).hasValue(3.0);
    assertThat(mul.inputs().get(1).defaultValue()).hasValue(4.0);
    assertThat(add.inputs().get(0).defaultValue()).hasValue(2.0);
    assertThat(tree.linksInto(add.inputs().get(1))).containsExactly(mul.outputs().get(0));
    assertThat(port(interpreter, "r")).isSameInstanceAs(add.outputs().get(0));
  }

  @Test
  public void constantsBecomeLabeledValueNodes() throws CompilerException {
    println("v = 1.5;");
    println("n = 3;");

    Interpreter interpreter = build();

    GraphNode value = tree.nodes().get(0);
    assertThat(value.typeId()).isEqualTo("ShaderNodeValue");
    assertThat(value.label()).hasValue("v");
    assertThat(value.outputs().get(0).defaultValue()).hasValue(1.5);
    assertThat(port(interpreter, "v")).isSameInstanceAs(value.outputs().get(0));
    assertThat(interpreter.variable("n")).hasValue(Value.Constant.of(3));
  }

  @Test
  public void packAndSplitKeepOrder() {
    Interpreter interpreter =
        run(
            Operation.pushConstant(1),
            Operation.pushConstant(2),
            Operation.packList(2),
            Operation.splitStruct());

    assertThat(interpreter.stackSnapshot())
        .containsExactly(Value.Constant.of(1), Value.Constant.of(2))
        .inOrder();
  }

  @Test
  public void multipleOutputsAreSplitInDeclarationOrder() throws CompilerException {
    println("m, uv = cube();");

    Interpreter interpreter = build();

    assertThat(port(interpreter, "m").name()).isEqualTo("Mesh");
    assertThat(port(interpreter, "uv").name()).isEqualTo("UV Map");
  }

  @Test
  public void discardedOutputsKeepDeclarationIndices() throws CompilerException {
    println("function parts(v: vec3 = {0, 0, 0}) -> a: float, b: float, c: float {");
    println("  out a, b, c = separate_xyz(v);");
    println("}");
    println("out x, _, z = parts(position());");

    Interpreter interpreter = build();

    GraphNode separate = tree.nodesOfType("ShaderNodeSeparateXYZ").get(0);
    assertThat(port(interpreter, "x")).isSameInstanceAs(separate.outputs().get(0));
    assertThat(port(interpreter, "z")).isSameInstanceAs(separate.outputs().get(2));
  }

  @Test
  public void vectorComponents() throws CompilerException {
    println("p = position();");
    println("z = p.z;");

    Interpreter interpreter = build();

    GraphNode separate = tree.nodesOfType("ShaderNodeSeparateXYZ").get(0);
    assertThat(tree.linksInto(separate.inputs().get(0))).containsExactly(port(interpreter, "p"));
    assertThat(port(interpreter, "z")).isSameInstanceAs(separate.outputs().get(2));
  }

  @Test
  public void functionsDoNotLeakVariables() throws CompilerException {
    println("function f(x: float = 0) -> r: float {");
    println("  t = x * 2;");
    println("  out r = t + 1;");
    println("}");
    println("t = 5;");
    println("out y = f(position().x);");

    Interpreter interpreter = build();

    assertThat(interpreter.variable("t")).hasValue(Value.Constant.of(5));
    assertThat(interpreter.variable("x")).isEmpty();
    assertThat(interpreter.variable("r")).isEmpty();
    GraphNode add = tree.nodes().get(tree.nodes().size() - 1);
    assertThat(add.properties()).containsEntry("operation", "ADD");
    assertThat(port(interpreter, "y")).isSameInstanceAs(add.outputs().get(0));
  }

  @Test
  public void constantArgumentToPortInputBecomesValueNode() throws CompilerException {
    println("function ident(x: float = 0) -> r: float { out r = x; }");
    println("out y = ident(2.5);");

    Interpreter interpreter = build();

    GraphNode value = tree.nodes().get(0);
    assertThat(tree.nodes()).hasSize(1);
    assertThat(value.outputs().get(0).defaultValue()).hasValue(2.5);
    assertThat(port(interpreter, "y")).isSameInstanceAs(value.outputs().get(0));
  }

  @Test
  public void joinGeometryLinksNewestFirst() throws CompilerException {
    println("a = cube().mesh;");
    println("b = cube().mesh;");
    println("c = cube().mesh;");
    println("g = join_geometry(a, b, c);");

    build();

    GraphNode join = tree.nodesOfType("GeometryNodeJoinGeometry").get(0);
    ImmutableList<String> sources =
        tree.linksInto(join.input("Geometry"))
            .stream()
            .map(s -> s.node().name())
            .collect(ImmutableList.toImmutableList());
    assertThat(sources).containsExactly("Cube.002", "Cube.001", "Cube").inOrder();
  }

  @Test
  public void nodeGroupIsBuiltOnce() throws CompilerException {
    println("nodegroup \"Lift\"(geometry: geo, height: float = 1.0) -> geometry: geo {");
    println("  out geometry = set_position(geometry, offset={0, 0, height});");
    println("}");
    println("a = @\"Lift\"(cube().mesh);");
    println("b = @\"Lift\"(cube().mesh, height=2);");

    Interpreter interpreter = build();

    assertThat(backend.nodeGroupCreations()).isEqualTo(1);
    MemoryNodeTree group = backend.nodeGroup("Lift").get();
    assertThat(interpreter.createdNodes())
        .containsAtLeastElementsIn(group.nodesOfType("GeometryNodeSetPosition"));
    assertThat(interpreter.createdNodes()).containsAtLeastElementsIn(tree.nodes());
    ImmutableList<GraphNode> references = tree.nodesOfType("GeometryNodeGroup");
    assertThat(references).hasSize(2);
    MemoryNodeTree inner = backend.nodeGroup("Lift").get();
    assertThat(references.get(0).nodeTree().get()).isSameInstanceAs(inner);
    assertThat(references.get(1).nodeTree().get()).isSameInstanceAs(inner);
    assertThat(references.get(0).inputs().get(1).defaultValue()).hasValue(1.0);
    assertThat(references.get(1).inputs().get(1).defaultValue()).hasValue(2.0);

    GraphNode setPosition = inner.nodesOfType("GeometryNodeSetPosition").get(0);
    GraphNode groupOutput = inner.nodesOfType("NodeGroupOutput").get(0);
    assertThat(inner.linksInto(groupOutput.inputs().get(0)))
        .containsExactly(setPosition.outputs().get(0));
    GraphNode groupInput = inner.nodesOfType("NodeGroupInput").get(0);
    assertThat(inner.linksInto(setPosition.input("Geometry")))
        .containsExactly(groupInput.outputs().get(0));
  }

  @Test
  public void nodeGroupMayShareTheTreeName() throws CompilerException {
    MemoryNodeTree target = backend.createTree("Double", TreeType.GEOMETRY);
    String source =
        "nodegroup \"Double\"(x: float = 0) -> r: float { out r = x * 2; }\n"
            + "y = position().x * 3;\n"
            + "z = @\"Double\"(y);\n";

    Interpreter interpreter =
        new Compiler(new Library(TreeType.GEOMETRY)).build(source, target, backend);

    GraphNode reference = target.nodesOfType("GeometryNodeGroup").get(0);
    assertThat(port(interpreter, "z")).isSameInstanceAs(reference.outputs().get(0));
  }

  @Test
  public void endOfStatementClearsTheStack() {
    Interpreter interpreter = run(Operation.pushConstant(1), Operation.endOfStatement());

    assertThat(interpreter.stackSnapshot()).isEmpty();
  }

  @Test
  public void malformedStreamsFail() {
    assertThrows(VerifyException.class, () -> run(Operation.getVar("nope")));
    assertThrows(
        VerifyException.class, () -> run(Operation.pushConstant(1.5), Operation.createVar("x")));
    assertThrows(VerifyException.class, () -> run(Operation.createVar("x")));
    assertThrows(
        VerifyException.class, () -> run(Operation.pushConstant(1), Operation.splitStruct()));
    assertThrows(
        VerifyException.class,
        () ->
            run(
                Operation.pushConstant(1),
                Operation.packList(1),
                Operation.callBuiltin(builtin("join_geometry"))));
    assertThrows(
        VerifyException.class,
        () ->
            run(
                Operation.callBuiltin(builtin("position")),
                Operation.packList(1),
                Operation.pushConstant(2),
                Operation.callBuiltin(builtin("add"))));
  }
}

package mf;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class LowererTest {

  private Library library = new Library(TreeType.GEOMETRY);

  private Program lower(String... lines) throws CompilerException {
    return Compiler.compileInto(library, Compiler.parse(String.join("\n", lines)));
  }

  private static ImmutableList<Operation.Type> types(Program program) {
    return program
        .operations()
        .stream()
        .map(Operation::type)
        .collect(ImmutableList.toImmutableList());
  }

  private void assertErrors(String errorSubstr, String... lines) {
    CompilerException ex = assertThrows(CompilerException.class, () -> lower(lines));
    assertThat(ex).hasMessageThat().contains(errorSubstr);
  }

  private void assertShaderErrors(String errorSubstr, String... lines) {
    library = new Library(TreeType.SHADER);
    assertErrors(errorSubstr, lines);
  }

  @Test
  public void arithmetic() throws CompilerException {
    Program program = lower("out r = 2 + 3 * 4;");

    assertThat(program.operations())
        .containsExactly(
            Operation.pushConstant(2),
            Operation.pushConstant(3),
            Operation.pushConstant(4),
            Operation.callBuiltin(Builtins.lookup(TreeType.GEOMETRY, "mul").get().node()),
            Operation.callBuiltin(Builtins.lookup(TreeType.GEOMETRY, "add").get().node()),
            Operation.createVar("r"),
            Operation.endOfStatement())
        .inOrder();
    assertThat(program.outputs()).containsExactly("r");
  }

  @Test
  public void negationFoldsConstants() throws CompilerException {
    Program program = lower("x = position().x * -2;", "y = -x;");

    assertThat(program.operations()).contains(Operation.pushConstant(-2));
    assertThat(program.operations()).contains(Operation.pushConstant(-1.0));
  }

  @Test
  public void constantAssignmentsBecomeNamedNodes() throws CompilerException {
    Program program = lower("v = 1.5;", "n = 3;");

    assertThat(program.operations())
        .containsExactly(
            Operation.callBuiltin(Builtins.VALUE_NODE),
            Operation.setOutput(0, Value.Constant.of(1.5)),
            Operation.renameNode("v"),
            Operation.createVar("v"),
            Operation.endOfStatement(),
            Operation.pushConstant(3),
            Operation.createVar("n"),
            Operation.endOfStatement())
        .inOrder();
  }

  @Test
  public void aliasAssignment() throws CompilerException {
    Program program = lower("p = position();", "q = p;");

    assertThat(program.operations().subList(3, 6))
        .containsExactly(
            Operation.pushName("p"), Operation.createVar("q"), Operation.endOfStatement())
        .inOrder();
  }

  @Test
  public void multipleTargetsSplitTheStruct() throws CompilerException {
    Program program = lower("m, uv = cube();");

    assertThat(types(program))
        .containsExactly(
            Operation.Type.PUSH_VALUE,
            Operation.Type.PUSH_VALUE,
            Operation.Type.PUSH_VALUE,
            Operation.Type.PUSH_VALUE,
            Operation.Type.CALL_BUILTIN,
            Operation.Type.SPLIT_STRUCT,
            Operation.Type.CREATE_VAR,
            Operation.Type.CREATE_VAR,
            Operation.Type.END_OF_STATEMENT)
        .inOrder();
  }

  @Test
  public void skippedTargetsUseAHiddenVariable() throws CompilerException {
    Program program =
        lower(
            "function f() -> a: float, b: float, c: float {",
            "  out a = 1.5;",
            "  out b = 2.5;",
            "  out c = 3.5;",
            "}",
            "out x, _, z = f();");

    ImmutableList<Operation> ops = program.operations();
    assertThat(ops.get(0).type()).isEqualTo(Operation.Type.CALL_FUNCTION);
    assertThat(ops.subList(1, ops.size()))
        .containsExactly(
            Operation.createVar("$0"),
            Operation.getVar("$0"),
            Operation.getOutput(0),
            Operation.createVar("x"),
            Operation.getVar("$0"),
            Operation.getOutput(2),
            Operation.createVar("z"),
            Operation.endOfStatement())
        .inOrder();
    assertThat(program.outputs()).containsExactly("x", "z").inOrder();
  }

  @Test
  public void attributes() throws CompilerException {
    Program program = lower("c = cube();", "m = c.uv_map;", "y = position().y;");

    assertThat(types(program).subList(7, types(program).size()))
        .containsExactly(
            Operation.Type.GET_VAR,
            Operation.Type.GET_OUTPUT,
            Operation.Type.CREATE_VAR,
            Operation.Type.END_OF_STATEMENT,
            Operation.Type.CALL_BUILTIN,
            Operation.Type.CALL_BUILTIN,
            Operation.Type.GET_OUTPUT,
            Operation.Type.CREATE_VAR,
            Operation.Type.END_OF_STATEMENT)
        .inOrder();
    assertThat(program.operations()).contains(Operation.getOutput(1));
  }

  @Test
  public void joinGeometryPacksNames() throws CompilerException {
    Program program = lower("a = cube().mesh;", "b = cube().mesh;", "g = join_geometry(a, b);");

    int pack = types(program).indexOf(Operation.Type.PACK_LIST);
    assertThat(program.operations().subList(pack - 2, pack + 1))
        .containsExactly(Operation.pushName("a"), Operation.pushName("b"), Operation.packList(2))
        .inOrder();
    assertThat(program.operations().get(pack + 1).type())
        .isEqualTo(Operation.Type.CALL_BUILTIN);
  }

  @Test
  public void listsOnlyGoToMultiInputSockets() {
    String list = "A list can only be passed to a multi-input socket.";
    assertErrors(
        list,
        "function ident(x: float = 0) -> r: float { out r = x; }",
        "out y = ident([position().x]);");
    assertErrors(
        list,
        "nodegroup \"Pass\"(x: float = 0) -> r: float { out r = x; }",
        "out y = @\"Pass\"([position().x]);");
    assertErrors(list, "x = sin([position().x]);");
  }

  @Test
  public void listElementsAreNodeOutputs() {
    assertErrors(
        "'l' cannot be a list element.",
        "a = cube().mesh;",
        "b = cube().mesh;",
        "l = [a, b];",
        "g = join_geometry(l, cube().mesh);");
    String constants = "A list can only hold node outputs, not constants.";
    assertErrors(constants, "a = cube().mesh;", "g = join_geometry(a, 1);");
    assertErrors(constants, "a = cube().mesh;", "n = 2;", "g = join_geometry(a, n);");
    assertErrors(
        constants, "a = cube().mesh;", "loop i = 1 -> 2 { g = join_geometry(a, i); }");
  }

  @Test
  public void listedParametersArePortInputs() throws CompilerException {
    lower("function both(a: geo, b: geo) -> g: geo { out g = join_geometry(a, b); }");

    assertThat(library.lookup("both").get().portInputs()).containsExactly("a", "b");
    assertErrors("Argument 'b' of 'both' needs a value.", "g = both(cube().mesh, 1);");
  }

  @Test
  public void integerOutputsAreMaterialized() throws CompilerException {
    lower(
        "function four() -> n: int { out n = 4; }",
        "function three() -> n: int { m = 3; out n = m; }");

    assertThat(library.lookup("four").get().body())
        .contains(Operation.callBuiltin(Builtins.inputNode("FunctionNodeInputInt", "integer", 4)));
    assertThat(library.lookup("three").get().body())
        .contains(Operation.callBuiltin(Builtins.inputNode("FunctionNodeInputInt", "integer", 3)));
  }

  @Test
  public void loopsAreUnrolled() throws CompilerException {
    Program program = lower("loop i = 3 -> 1 { x = i; }");

    assertThat(types(program)).hasSize(18);
    assertThat(
            program
                .operations()
                .stream()
                .filter(op -> op.type() == Operation.Type.PUSH_VALUE)
                .collect(ImmutableList.toImmutableList()))
        .containsExactly(
            Operation.pushConstant(3),
            Operation.pushName("i"),
            Operation.pushConstant(2),
            Operation.pushName("i"),
            Operation.pushConstant(1),
            Operation.pushName("i"))
        .inOrder();
  }

  @Test
  public void definitionsAreAddedToTheLibrary() throws CompilerException {
    Program program =
        lower(
            "function ident(x: float = 0) -> r: float { out r = x; }",
            "function twice(x: float = 0) -> r: float { out r = x * 2; }");

    assertThat(program.definitions()).hasSize(2);
    assertThat(library.lookup("ident").get().portInputs()).containsExactly("x");
    assertThat(library.lookup("twice").get().portInputs()).isEmpty();
    assertThat(library.lookup("twice").get().body().get(0)).isEqualTo(Operation.getVar("x"));
  }

  @Test
  public void constantArgumentsToPortInputsAreMaterialized() throws CompilerException {
    Program program =
        lower(
            "function ident(x: float = 0) -> r: float { out r = x; }",
            "function twice(x: float = 0) -> r: float { out r = x * 2; }",
            "a = ident(2.5);",
            "b = twice(2.5);");

    assertThat(types(program).subList(0, 5))
        .containsExactly(
            Operation.Type.CALL_BUILTIN,
            Operation.Type.SET_OUTPUT,
            Operation.Type.CALL_FUNCTION,
            Operation.Type.CREATE_VAR,
            Operation.Type.END_OF_STATEMENT)
        .inOrder();
    assertThat(program.operations().get(5)).isEqualTo(Operation.pushConstant(2.5));
    assertThat(program.operations().get(6).type()).isEqualTo(Operation.Type.CALL_FUNCTION);
  }

  @Test
  public void defaultsFillMissingArguments() throws CompilerException {
    Program program =
        lower(
            "function twice(x: float = 4, y: float = 1) -> r: float { out r = x * y; }",
            "a = twice(y=3);");

    assertThat(program.operations().subList(0, 2))
        .containsExactly(Operation.pushConstant(4), Operation.pushConstant(3))
        .inOrder();
  }

  @Test
  public void methodCallPassesReceiverFirst() throws CompilerException {
    Program program = lower("p = position();", "l = p.length();");

    assertThat(program.operations().subList(3, 5))
        .containsExactly(
            Operation.getVar("p"),
            Operation.callBuiltin(Builtins.lookup(TreeType.GEOMETRY, "length").get().node()))
        .inOrder();
  }

  @Test
  public void nodeGroupCall() throws CompilerException {
    Program program =
        lower(
            "nodegroup \"Lift\"(geometry: geo, height: float = 1.0) -> geometry: geo {",
            "  out geometry = set_position(geometry, offset={0, 0, height});",
            "}",
            "g = @\"Lift\"(cube().mesh, height=2);");

    assertThat(types(program)).contains(Operation.Type.CALL_NODEGROUP);
    assertThat(library.lookup("Lift").get().isNodegroup()).isTrue();
  }

  @Test
  public void unknownNames() {
    assertErrors("Unknown variable 'q'.", "out r = q + 1;");
    assertErrors("Unknown function 'frob'.", "x = frob(1);");
    assertErrors("There is no node group called 'Nope'.", "x = @\"Nope\"();");
    assertErrors(
        "Unknown function 'later'.",
        "out y = later(1);",
        "function later(x: float = 0) -> r: float { out r = x; }");
  }

  @Test
  public void shaderTreesHaveFewerBuiltins() {
    assertShaderErrors("Function 'position' is not available in shader trees.", "x = position();");
    assertShaderErrors(
        "Operator '<=' is not available in shader trees.", "a = sin(1);", "b = a <= 2;");
    assertShaderErrors("Cannot hold a string constant in shader trees.", "s = \"text\";");
  }

  @Test
  public void argumentBinding() {
    assertErrors("'add' takes at most 2 arguments, got 3.", "x = add(1, 2, 3);");
    assertErrors("'add' has no argument 'c'.", "x = add(1, c=2);");
    assertErrors("Argument 'a' of 'add' is given more than once.", "x = add(1, a=2);");
    assertErrors(
        "Argument 'x' of 'ident' needs a value.",
        "function ident(x: float = 0) -> r: float { out r = x; }",
        "y = ident(\"text\");");
  }

  @Test
  public void assignmentErrors() {
    assertErrors("Expected 2 values, but the expression has 1.", "a, b = sin(1);");
    assertErrors("'_' has no value to assign to 'x'.", "x = _;");
    assertErrors(
        "Expression has no value to assign to 'x'.", "function nothing() {}", "x = nothing();");
    assertErrors("'foo' is not an output of this value.", "p = position();", "q = p.foo;");
    assertErrors("A loop can run at most 10000 times.", "loop 0 -> 20000 {}");
  }

  @Test
  public void definitionOutputErrors() {
    assertErrors(
        "'s' is not an output of 'f'.", "function f() -> r: float { out s = 1; out r = 1; }");
    assertErrors("Output 'r' of 'f' is never set.", "function f() -> r: float {}");
    assertErrors("Output 'r' of 'f' needs a value.", "function f() -> r: float { out r = \"s\"; }");
  }
}

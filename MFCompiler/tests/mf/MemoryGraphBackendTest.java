package mf;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;

public class MemoryGraphBackendTest {

  private final MemoryGraphBackend backend = new MemoryGraphBackend();
  private final MemoryNodeTree tree = backend.createTree("Formula", TreeType.GEOMETRY);

  @Test
  public void everyBuiltinNodeIsKnown() {
    for (TreeType treeType : TreeType.values()) {
      MemoryNodeTree scratch = backend.createTree("Scratch", treeType);
      for (Builtins.Builtin builtin : Builtins.all(treeType)) {
        NodeInstance instance = builtin.node();
        GraphNode node = scratch.addNode(instance.key());
        for (int index : instance.inputs()) {
          assertThat(index).isLessThan(node.inputs().size());
        }
        for (int index : instance.outputs()) {
          assertThat(index).isLessThan(node.outputs().size());
        }
        assertThat(builtin.inputNames()).hasSize(instance.inputs().size());
        assertThat(builtin.outputNames()).hasSize(instance.outputs().size());
      }
    }
  }

  @Test
  public void unknownNodeType() {
    assertThrows(IllegalArgumentException.class, () -> tree.addNode("ShaderNodeNope"));
  }

  @Test
  public void namesAreUnique() {
    ImmutableList<String> names =
        ImmutableList.of(
            tree.addNode("ShaderNodeMath").name(),
            tree.addNode("ShaderNodeMath").name(),
            tree.addNode("ShaderNodeValue").name(),
            tree.addNode("ShaderNodeMath").name());

    assertThat(names).containsExactly("Math", "Math.001", "Value", "Math.002").inOrder();
  }

  @Test
  public void linkReplacesSingleInput() {
    GraphNode a = tree.addNode("ShaderNodeValue");
    GraphNode b = tree.addNode("ShaderNodeValue");
    GraphNode math = tree.addNode("ShaderNodeMath");

    tree.link(a.outputs().get(0), math.inputs().get(0));
    tree.link(b.outputs().get(0), math.inputs().get(0));

    assertThat(tree.linksInto(math.inputs().get(0))).containsExactly(b.outputs().get(0));
    assertThat(tree.links()).hasSize(1);
  }

  @Test
  public void multiInputKeepsEveryLink() {
    GraphNode a = tree.addNode("GeometryNodeMeshCube");
    GraphNode b = tree.addNode("GeometryNodeMeshCube");
    GraphNode join = tree.addNode("GeometryNodeJoinGeometry");

    tree.link(a.outputs().get(0), join.input("Geometry"));
    tree.link(b.outputs().get(0), join.input("Geometry"));
    tree.link(a.outputs().get(0), join.input("Geometry"));

    assertThat(tree.linksInto(join.input("Geometry")))
        .containsExactly(a.outputs().get(0), b.outputs().get(0), a.outputs().get(0))
        .inOrder();
  }

  @Test
  public void linkChecksDirectionAndOwnership() {
    GraphNode a = tree.addNode("ShaderNodeMath");
    GraphNode b = tree.addNode("ShaderNodeMath");
    MemoryNodeTree other = backend.createTree("Other", TreeType.GEOMETRY);
    GraphNode c = other.addNode("ShaderNodeMath");

    assertThrows(
        IllegalArgumentException.class, () -> tree.link(a.inputs().get(0), b.inputs().get(0)));
    assertThrows(
        IllegalArgumentException.class, () -> tree.link(a.outputs().get(0), b.outputs().get(0)));
    assertThrows(
        IllegalArgumentException.class, () -> tree.link(c.outputs().get(0), b.inputs().get(0)));
  }

  @Test
  public void floatSocketsStoreIntegersAsFloats() {
    GraphNode math = tree.addNode("ShaderNodeMath");

    math.inputs().get(0).setDefaultValue(3);

    assertThat(math.inputs().get(0).defaultValue()).hasValue(3.0);
    assertThrows(IllegalArgumentException.class, () -> math.setProperty("operation", this));
  }

  @Test
  public void nodeGroups() {
    ImmutableList<SocketDeclaration> inputs =
        ImmutableList.of(
            SocketDeclaration.create(
                "height", DataType.FLOAT, Optional.of(Value.Constant.of(1.5))),
            SocketDeclaration.create("geometry", DataType.GEOMETRY));
    ImmutableList<SocketDeclaration> outputs =
        ImmutableList.of(SocketDeclaration.create("geometry", DataType.GEOMETRY));
    MemoryNodeTree inner = backend.createNodeGroup("Lift", TreeType.GEOMETRY, inputs, outputs);

    GraphNode groupInput = inner.addGroupInput();
    GraphNode groupOutput = inner.addGroupOutput();
    GraphNode reference = tree.addGroupReference(inner);

    assertThat(groupInput.outputs()).hasSize(2);
    assertThat(groupInput.outputs().get(0).defaultValue()).hasValue(1.5);
    assertThat(groupOutput.inputs().get(0).name()).isEqualTo("geometry");
    assertThat(reference.typeId()).isEqualTo("GeometryNodeGroup");
    assertThat(reference.nodeTree()).hasValue(inner);
    assertThat(reference.inputs().get(1).type()).isEqualTo(DataType.GEOMETRY);
    assertThat(backend.nodeGroup("Lift")).hasValue(inner);
    assertThat(backend.nodeGroupCreations()).isEqualTo(1);
    assertThrows(
        IllegalArgumentException.class,
        () -> backend.createNodeGroup("Lift", TreeType.GEOMETRY, inputs, outputs));
    assertThrows(
        IllegalArgumentException.class,
        () -> backend.createTree("Shader", TreeType.SHADER).addGroupReference(inner));
  }

  @Test
  public void socketIdentities() {
    GraphNode math = tree.addNode("ShaderNodeMath");

    assertThat(math.inputs().get(1).identity()).isEqualTo("Formula:Math:in:1");
    assertThat(math.outputs().get(0).identity()).isEqualTo("Formula:Math:out:0");
  }

  @Test
  public void treesSharingANameHaveDistinctIdentities() {
    MemoryNodeTree group =
        backend.createNodeGroup(
            "Formula", TreeType.GEOMETRY, ImmutableList.of(), ImmutableList.of());
    MemoryNodeTree again = backend.createTree("Formula", TreeType.GEOMETRY);

    assertThat(group.addNode("ShaderNodeMath").outputs().get(0).identity())
        .isEqualTo("Formula.001:Math:out:0");
    assertThat(again.addNode("ShaderNodeMath").outputs().get(0).identity())
        .isEqualTo("Formula.002:Math:out:0");
    assertThat(tree.addNode("ShaderNodeMath").outputs().get(0).identity())
        .isEqualTo("Formula:Math:out:0");
  }

  @Test
  public void dump() {
    GraphNode value = tree.addNode("ShaderNodeValue");
    GraphNode math = tree.addNode("ShaderNodeMath");
    math.setProperty("operation", "ADD");
    value.setLabel("x");
    tree.link(value.outputs().get(0), math.inputs().get(0));

    assertThat(tree.dump())
        .isEqualTo(
            "tree Formula (GeometryNodeTree)\n"
                + "  Value [ShaderNodeValue] \"x\"\n"
                + "  Math [ShaderNodeMath] {operation=ADD}\n"
                + "    Math.Value[1] = 0.5\n"
                + "    Math.Value[2] = 0.5\n"
                + "  Value.Value[0] -> Math.Value[0]\n");
  }
}

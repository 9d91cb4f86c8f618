package mf;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.graph.ElementOrder;
import com.google.common.graph.MutableNetwork;
import com.google.common.graph.NetworkBuilder;

/**
 * A {@link NodeTree} held in memory. Sockets are the graph's nodes and links its edges, so a
 * socket may have several incoming links only if it is a multi-input.
 */
public final class MemoryNodeTree implements NodeTree {

  /** An edge of the tree; compared by identity so parallel links stay distinct. */
  public static final class Link {
    private final MemorySocket from;
    private final MemorySocket to;

    private Link(MemorySocket from, MemorySocket to) {
      this.from = from;
      this.to = to;
    }

    public GraphSocket from() {
      return from;
    }

    public GraphSocket to() {
      return to;
    }

    @Override
    public String toString() {
      return from.describe() + " -> " + to.describe();
    }
  }

  final class MemoryNode implements GraphNode {
    private final String typeId;
    private final String name;
    private final ImmutableList<GraphSocket> inputs;
    private final ImmutableList<GraphSocket> outputs;
    private final Optional<NodeTree> nodeTree;
    private final Map<String, Object> properties = new HashMap<>();
    private Optional<String> label = Optional.empty();

    private MemoryNode(
        String typeId,
        String name,
        List<SocketTemplate> inputs,
        List<SocketTemplate> outputs,
        Optional<NodeTree> nodeTree) {
      this.typeId = typeId;
      this.name = name;
      this.inputs = createSockets(inputs, false);
      this.outputs = createSockets(outputs, true);
      this.nodeTree = nodeTree;
    }

    private ImmutableList<GraphSocket> createSockets(
        List<SocketTemplate> templates, boolean output) {
      ImmutableList.Builder<GraphSocket> sockets = ImmutableList.builder();
      for (int i = 0; i < templates.size(); i++) {
        MemorySocket socket = new MemorySocket(this, templates.get(i), output, i);
        network.addNode(socket);
        sockets.add(socket);
      }
      return sockets.build();
    }

    @Override
    public String typeId() {
      return typeId;
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public Optional<String> label() {
      return label;
    }

    @Override
    public void setLabel(String label) {
      this.label = Optional.of(label);
    }

    @Override
    public ImmutableMap<String, Object> properties() {
      return ImmutableMap.copyOf(properties);
    }

    @Override
    public void setProperty(String name, Object value) {
      Value.Constant.checkConstant(value);
      properties.put(name, value);
    }

    @Override
    public ImmutableList<GraphSocket> inputs() {
      return inputs;
    }

    @Override
    public ImmutableList<GraphSocket> outputs() {
      return outputs;
    }

    @Override
    public Optional<NodeTree> nodeTree() {
      return nodeTree;
    }

    MemoryNodeTree tree() {
      return MemoryNodeTree.this;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  final class MemorySocket implements GraphSocket {
    private final MemoryNode node;
    private final String name;
    private final DataType type;
    private final boolean output;
    private final boolean multiInput;
    private final int index;
    private Optional<Object> defaultValue;

    private MemorySocket(MemoryNode node, SocketTemplate template, boolean output, int index) {
      this.node = node;
      this.name = template.name;
      this.type = template.type;
      this.output = output;
      this.multiInput = template.multiInput;
      this.index = index;
      this.defaultValue = template.defaultValue.map(v -> coerce(template.type, v));
    }

    @Override
    public String name() {
      return name;
    }

    @Override
    public DataType type() {
      return type;
    }

    @Override
    public boolean isOutput() {
      return output;
    }

    @Override
    public boolean isMultiInput() {
      return multiInput;
    }

    @Override
    public Optional<Object> defaultValue() {
      return defaultValue;
    }

    @Override
    public void setDefaultValue(Object value) {
      Value.Constant.checkConstant(value);
      defaultValue = Optional.of(coerce(type, value));
    }

    @Override
    public GraphNode node() {
      return node;
    }

    @Override
    public String identity() {
      return String.format(
          "%s:%s:%s:%d", MemoryNodeTree.this.key, node.name, output ? "out" : "in", index);
    }

    private String describe() {
      return String.format("%s.%s[%d]", node.name, name, index);
    }

    @Override
    public String toString() {
      return identity();
    }
  }

  private static final class SocketTemplate {
    private final String name;
    private final DataType type;
    private final boolean multiInput;
    private final Optional<Object> defaultValue;

    private SocketTemplate(
        String name, DataType type, boolean multiInput, Optional<Object> defaultValue) {
      this.name = name;
      this.type = type;
      this.multiInput = multiInput;
      this.defaultValue = defaultValue;
    }

    private static SocketTemplate of(NodeCatalog.SocketSpec spec) {
      return new SocketTemplate(spec.name(), spec.type(), spec.multiInput(), spec.defaultValue());
    }

    private static SocketTemplate of(SocketDeclaration declaration) {
      return new SocketTemplate(
          declaration.name(),
          declaration.type(),
          false,
          declaration.defaultValue().flatMap(Value.Constant::value));
    }
  }

  // Integers written to float sockets are stored as floats, like the host does.
  private static Object coerce(DataType type, Object value) {
    if (type == DataType.FLOAT && value instanceof Integer) {
      return ((Integer) value).doubleValue();
    }
    return value;
  }

  private final String name;
  // Unique among the trees of one backend, unlike the name.
  private final String key;
  private final TreeType treeType;
  private final ImmutableList<SocketDeclaration> inputs;
  private final ImmutableList<SocketDeclaration> outputs;
  private final List<MemoryNode> nodes = new ArrayList<>();
  private final Map<String, Integer> nameCounts = new HashMap<>();
  private final MutableNetwork<MemorySocket, Link> network =
      NetworkBuilder.directed()
          .allowsParallelEdges(true)
          .edgeOrder(ElementOrder.insertion())
          .build();

  MemoryNodeTree(
      String name,
      String key,
      TreeType treeType,
      List<SocketDeclaration> inputs,
      List<SocketDeclaration> outputs) {
    this.name = name;
    this.key = key;
    this.treeType = treeType;
    this.inputs = ImmutableList.copyOf(inputs);
    this.outputs = ImmutableList.copyOf(outputs);
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public TreeType treeType() {
    return treeType;
  }

  @Override
  public ImmutableList<SocketDeclaration> inputs() {
    return inputs;
  }

  @Override
  public ImmutableList<SocketDeclaration> outputs() {
    return outputs;
  }

  @Override
  public GraphNode addNode(String typeId) {
    NodeCatalog.NodeSpec spec =
        NodeCatalog.lookup(typeId)
            .orElseThrow(() -> new IllegalArgumentException("Unknown node type " + typeId));
    return add(
        typeId,
        spec.defaultName(),
        toTemplates(spec.inputs()),
        toTemplates(spec.outputs()),
        Optional.empty());
  }

  @Override
  public GraphNode addGroupInput() {
    return add(
        "NodeGroupInput", "Group Input", ImmutableList.of(), declared(inputs), Optional.empty());
  }

  @Override
  public GraphNode addGroupOutput() {
    return add(
        "NodeGroupOutput", "Group Output", declared(outputs), ImmutableList.of(), Optional.empty());
  }

  @Override
  public GraphNode addGroupReference(NodeTree inner) {
    Preconditions.checkArgument(
        inner.treeType() == treeType, "Cannot use %s group %s", inner.treeType(), inner.name());
    return add(
        treeType.groupNodeId(),
        "Group",
        declared(inner.inputs()),
        declared(inner.outputs()),
        Optional.of(inner));
  }

  @Override
  public void link(GraphSocket from, GraphSocket to) {
    MemorySocket source = owned(from);
    MemorySocket target = owned(to);
    Preconditions.checkArgument(source.isOutput(), "%s is not an output", from);
    Preconditions.checkArgument(!target.isOutput(), "%s is not an input", to);
    if (!target.isMultiInput()) {
      ImmutableList.copyOf(network.inEdges(target)).forEach(network::removeEdge);
    }
    network.addEdge(source, target, new Link(source, target));
  }

  private MemorySocket owned(GraphSocket socket) {
    Preconditions.checkArgument(
        socket instanceof MemorySocket && ((MemorySocket) socket).node.tree() == this,
        "%s does not belong to tree %s",
        socket,
        name);
    return (MemorySocket) socket;
  }

  private GraphNode add(
      String typeId,
      String baseName,
      List<SocketTemplate> inputs,
      List<SocketTemplate> outputs,
      Optional<NodeTree> nodeTree) {
    MemoryNode node = new MemoryNode(typeId, uniqueName(baseName), inputs, outputs, nodeTree);
    nodes.add(node);
    return node;
  }

  // "Math", "Math.001", "Math.002", ...
  private String uniqueName(String baseName) {
    int count = nameCounts.merge(baseName, 1, Integer::sum) - 1;
    return count == 0 ? baseName : String.format("%s.%03d", baseName, count);
  }

  private static ImmutableList<SocketTemplate> toTemplates(List<NodeCatalog.SocketSpec> specs) {
    return specs.stream().map(SocketTemplate::of).collect(ImmutableList.toImmutableList());
  }

  private static ImmutableList<SocketTemplate> declared(List<SocketDeclaration> declarations) {
    return declarations.stream().map(SocketTemplate::of).collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<GraphNode> nodes() {
    return ImmutableList.copyOf(nodes);
  }

  public ImmutableList<GraphNode> nodesOfType(String typeId) {
    return nodes
        .stream()
        .filter(n -> n.typeId().equals(typeId))
        .collect(ImmutableList.toImmutableList());
  }

  /** All links, oldest first. */
  public ImmutableList<Link> links() {
    return ImmutableList.copyOf(network.edges());
  }

  /** The sockets linked into {@code input}, oldest link first. */
  public ImmutableList<GraphSocket> linksInto(GraphSocket input) {
    MemorySocket target = owned(input);
    return network
        .edges()
        .stream()
        .filter(l -> l.to == target)
        .map(Link::from)
        .collect(ImmutableList.toImmutableList());
  }

  /** Renders every node with its properties and unlinked input values, then every link. */
  public String dump() {
    StringBuilder out = new StringBuilder();
    out.append(String.format("tree %s (%s)\n", name, treeType.treeId()));
    for (MemoryNode node : nodes) {
      out.append(String.format("  %s [%s]", node.name, node.typeId));
      node.label.ifPresent(l -> out.append(String.format(" \"%s\"", l)));
      if (!node.properties.isEmpty()) {
        out.append(
            node.properties
                .entrySet()
                .stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", " {", "}")));
      }
      out.append('\n');
      for (GraphSocket input : node.inputs) {
        MemorySocket socket = (MemorySocket) input;
        if (network.inDegree(socket) == 0 && socket.defaultValue.isPresent()) {
          out.append(
              String.format("    %s = %s\n", socket.describe(), socket.defaultValue.get()));
        }
      }
    }
    for (Link link : network.edges()) {
      out.append(String.format("  %s\n", link));
    }
    return out.toString();
  }
}

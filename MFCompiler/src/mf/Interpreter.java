package mf;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Verify;
import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;

/**
 * Executes an operation stream against a {@link NodeTree}.
 *
 * <p>The stream is trusted to be well formed: a value of the wrong kind on the stack, an unbound
 * variable or a missing function output is a bug in whatever produced the stream, and fails with a
 * {@link VerifyException} rather than a diagnostic.
 */
public final class Interpreter {
  static final int MAX_CALL_DEPTH = 256;
  static final int MAX_ALIAS_DEPTH = 64;

  static final String JOIN_GEOMETRY_NODE = "GeometryNodeJoinGeometry";

  // Everything a function call or node group body replaces and restores.
  private static final class Frame {
    private final NodeTree tree;
    private final List<Value> stack = new ArrayList<>();
    private final Map<String, Value> variables;
    private final List<Optional<Value>> functionOutputs = new ArrayList<>();

    private Frame(NodeTree tree, Map<String, Value> variables, int numOutputs) {
      this.tree = tree;
      this.variables = variables;
      for (int i = 0; i < numOutputs; i++) {
        functionOutputs.add(Optional.empty());
      }
    }
  }

  private final CompilationSession session;
  private final Deque<Frame> savedFrames = new ArrayDeque<>();
  private final List<GraphNode> nodes = new ArrayList<>();
  private final Executor executor = new Executor();
  private Frame frame;

  public Interpreter(NodeTree tree, CompilationSession session) {
    this.session = session;
    this.frame = new Frame(tree, new HashMap<>(), 0);
  }

  public void execute(List<Operation> operations) {
    for (Operation operation : operations) {
      operation.accept(executor);
    }
  }

  public Optional<Value> variable(String name) {
    return Optional.ofNullable(frame.variables.get(name));
  }

  public ImmutableList<Value> stackSnapshot() {
    return ImmutableList.copyOf(frame.stack);
  }

  /** Every node created so far, in creation order, including those inside node groups. */
  public ImmutableList<GraphNode> createdNodes() {
    return ImmutableList.copyOf(nodes);
  }

  private class Executor implements Operation.Visitor<Void> {
    @Override
    public Void visitPushValue(Operation.PushValue op) {
      push(op.value());
      return null;
    }

    @Override
    public Void visitCreateVar(Operation.CreateVar op) {
      Value value = resolveAlias(pop());
      Verify.verify(
          value.is(Value.Kind.PORT)
              || value.is(Value.Kind.STRUCT)
              || (value.is(Value.Kind.CONSTANT) && value.<Value.Constant>cast().isInteger()),
          "CREATE_VAR '%s' expects a port, struct or integer, got %s",
          op.name(),
          value);
      frame.variables.put(op.name(), value);
      return null;
    }

    @Override
    public Void visitGetVar(Operation.GetVar op) {
      push(lookup(op.name()));
      return null;
    }

    @Override
    public Void visitGetOutput(Operation.GetOutput op) {
      push(popStruct().output(op.index()));
      return null;
    }

    @Override
    public Void visitSetOutput(Operation.SetOutput op) {
      List<GraphSocket> outputs = lastNode().outputs();
      Verify.verify(
          op.index() < outputs.size(), "%s has no output %s", lastNode().name(), op.index());
      outputs.get(op.index()).setDefaultValue(op.value().value().get());
      return null;
    }

    @Override
    public Void visitSetFunctionOut(Operation.SetFunctionOut op) {
      Value value = resolveAlias(pop());
      Verify.verify(
          value.is(Value.Kind.PORT) || value.is(Value.Kind.CONSTANT),
          "Function output %s must be a port or constant, got %s",
          op.index(),
          value);
      Verify.verify(
          op.index() < frame.functionOutputs.size(), "No function output %s", op.index());
      frame.functionOutputs.set(op.index(), Optional.of(value));
      return null;
    }

    @Override
    public Void visitSplitStruct(Operation.SplitStruct op) {
      frame.stack.addAll(popStruct().elements());
      return null;
    }

    @Override
    public Void visitCallFunction(Operation.CallFunction op) {
      CompiledFunction function = op.function();
      List<Value> args = popArgs(function.inputs().size());
      Map<String, Value> variables = new HashMap<>();
      for (int i = 0; i < args.size(); i++) {
        variables.put(function.inputs().get(i), detach(args.get(i)));
      }

      enterFrame(new Frame(frame.tree, variables, function.numOutputs()));
      execute(function.body());
      Frame inner = exitFrame();

      List<Value> outputs = new ArrayList<>();
      for (int i = 0; i < inner.functionOutputs.size(); i++) {
        Optional<Value> output = inner.functionOutputs.get(i);
        Verify.verify(output.isPresent(), "Function output %s was never set", i);
        outputs.add(output.get());
      }
      pushResults(outputs);
      return null;
    }

    @Override
    public Void visitCallNodegroup(Operation.CallNodegroup op) {
      CompiledNodeGroup group = op.nodeGroup();
      List<Value> args = popArgs(group.inputs().size());
      NodeTree inner = session.nodeGroupTree(group.name()).orElseGet(() -> buildNodeGroup(group));

      GraphNode node = frame.tree.addGroupReference(inner);
      for (int i = 0; i < args.size(); i++) {
        Value arg = resolveAlias(args.get(i));
        Verify.verify(
            !arg.is(Value.Kind.STRUCT), "Cannot pass %s to node group %s", arg, group.name());
        connect(frame.tree, arg, node.inputs().get(i));
      }
      nodes.add(node);

      pushResults(toPorts(node.outputs()));
      return null;
    }

    @Override
    public Void visitCallBuiltin(Operation.CallBuiltin op) {
      NodeInstance instance = op.node();
      List<Value> args = popArgs(instance.inputs().size());
      GraphNode node = frame.tree.addNode(instance.key());
      for (NodeInstance.Property property : instance.props()) {
        node.setProperty(property.name(), property.value());
      }
      for (int i = 0; i < args.size(); i++) {
        GraphSocket input = node.inputs().get(instance.inputs().get(i));
        Value arg = resolveAlias(args.get(i));
        if (arg.is(Value.Kind.STRUCT)) {
          linkAll(node, input, arg.cast());
        } else {
          connect(frame.tree, arg, input);
        }
      }
      nodes.add(node);

      List<GraphSocket> outputs = new ArrayList<>();
      for (int index : instance.outputs()) {
        GraphSocket socket = node.outputs().get(index);
        session.registerSocket(socket);
        outputs.add(socket);
      }
      pushResults(toPorts(outputs));
      return null;
    }

    @Override
    public Void visitRenameNode(Operation.RenameNode op) {
      lastNode().setLabel(op.label());
      return null;
    }

    @Override
    public Void visitEndOfStatement(Operation.EndOfStatement op) {
      frame.stack.clear();
      return null;
    }

    @Override
    public Void visitPackList(Operation.PackList op) {
      List<Value> elements = popArgs(op.count());
      push(Value.Struct.ofElements(elements));
      return null;
    }
  }

  private NodeTree buildNodeGroup(CompiledNodeGroup group) {
    NodeTree inner =
        session
            .backend()
            .createNodeGroup(group.name(), frame.tree.treeType(), group.inputs(), group.outputs());
    GraphNode groupInput = inner.addGroupInput();
    GraphNode groupOutput = inner.addGroupOutput();

    Map<String, Value> variables = new HashMap<>();
    for (GraphSocket socket : groupInput.outputs()) {
      variables.put(socket.name(), Value.Port.of(socket));
    }
    enterFrame(new Frame(inner, variables, group.outputs().size()));
    execute(group.body());
    Frame body = exitFrame();

    // Outputs never assigned stay at the interface default.
    for (int i = 0; i < body.functionOutputs.size(); i++) {
      GraphSocket target = groupOutput.inputs().get(i);
      body.functionOutputs.get(i).ifPresent(output -> connect(inner, output, target));
    }

    session.cacheNodeGroupTree(group.name(), inner);
    return inner;
  }

  private static void connect(NodeTree tree, Value value, GraphSocket input) {
    switch (value.kind()) {
      case PORT:
        tree.link(value.<Value.Port>cast().socket(), input);
        break;
      case CONSTANT:
        value.<Value.Constant>cast().value().ifPresent(input::setDefaultValue);
        break;
      default:
        throw new VerifyException(String.format("Cannot connect %s to %s", value, input));
    }
  }

  private void linkAll(GraphNode node, GraphSocket input, Value.Struct list) {
    if (node.typeId().equals(JOIN_GEOMETRY_NODE)) {
      // Every element goes to the one fan-in socket, newest link on top.
      GraphSocket geometry = node.input("Geometry");
      for (Value element : list.elements().reverse()) {
        frame.tree.link(socketOf(element), geometry);
      }
      return;
    }
    Verify.verify(input.isMultiInput(), "Cannot link a list into %s", input.identity());
    for (Value element : list.elements()) {
      frame.tree.link(socketOf(element), input);
    }
  }

  private GraphSocket socketOf(Value value) {
    Value resolved = resolveAlias(value);
    Verify.verify(resolved.is(Value.Kind.PORT), "List element %s is not a port", resolved);
    GraphSocket socket = resolved.<Value.Port>cast().socket();
    return session.lookupSocket(socket.identity()).orElse(socket);
  }

  private Value resolveAlias(Value value) {
    int hops = 0;
    while (value.is(Value.Kind.NAME_REF)) {
      String id = value.<Value.NameRef>cast().id();
      Verify.verify(++hops <= MAX_ALIAS_DEPTH, "Alias chain through '%s' is too long", id);
      value = lookup(id);
    }
    return value;
  }

  // Name references inside a list only make sense in the frame that packed it.
  private Value detach(Value value) {
    if (!value.is(Value.Kind.STRUCT)) {
      return resolveAlias(value);
    }
    Value.Struct struct = value.cast();
    if (struct.elements().stream().noneMatch(e -> e.is(Value.Kind.NAME_REF))) {
      return struct;
    }
    List<Value> elements = new ArrayList<>();
    for (Value element : struct.elements()) {
      elements.add(resolveAlias(element));
    }
    return Value.Struct.ofElements(elements);
  }

  private Value lookup(String name) {
    Value value = frame.variables.get(name);
    Verify.verifyNotNull(value, "Unbound variable '%s'", name);
    return value;
  }

  private void enterFrame(Frame next) {
    Verify.verify(
        savedFrames.size() < MAX_CALL_DEPTH, "Calls nested deeper than %s", MAX_CALL_DEPTH);
    savedFrames.push(frame);
    frame = next;
  }

  private Frame exitFrame() {
    Frame inner = frame;
    frame = savedFrames.pop();
    return inner;
  }

  private void push(Value value) {
    frame.stack.add(value);
  }

  private Value pop() {
    Verify.verify(!frame.stack.isEmpty(), "Stack underflow");
    return frame.stack.remove(frame.stack.size() - 1);
  }

  private Value.Struct popStruct() {
    Value value = pop();
    Verify.verify(value.is(Value.Kind.STRUCT), "Expected a struct, got %s", value);
    return value.cast();
  }

  // The top count values, in the order they were pushed.
  private List<Value> popArgs(int count) {
    Verify.verify(frame.stack.size() >= count, "Stack underflow: need %s values", count);
    List<Value> top = frame.stack.subList(frame.stack.size() - count, frame.stack.size());
    List<Value> args = new ArrayList<>(top);
    top.clear();
    return args;
  }

  private void pushResults(List<Value> outputs) {
    if (outputs.size() == 1) {
      push(outputs.get(0));
    } else if (outputs.size() > 1) {
      push(Value.Struct.ofOutputs(outputs));
    }
  }

  private GraphNode lastNode() {
    Verify.verify(!nodes.isEmpty(), "No node has been created yet");
    return nodes.get(nodes.size() - 1);
  }

  private static List<Value> toPorts(List<GraphSocket> sockets) {
    List<Value> ports = new ArrayList<>();
    for (GraphSocket socket : sockets) {
      ports.add(Value.Port.of(socket));
    }
    return ports;
  }
}

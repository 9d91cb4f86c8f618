package mf;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableList;

/**
 * Turns a validated syntax tree into the operation stream the {@link Interpreter} runs.
 *
 * <p>Definitions are compiled as they are met and added to the library, so a definition can call
 * any definition above it. Calls resolve against the library first, then the builtins of its tree
 * type.
 */
public final class Lowerer {
  private static final int MAX_LOOP_ITERATIONS = 10_000;

  private enum ShapeKind {
    NONE,
    SINGLE,
    STRUCT,
    LIST;
  }

  // What an expression leaves on the stack, known before anything runs.
  private static final class Shape {
    private static final Shape NONE = new Shape(ShapeKind.NONE, ImmutableList.of(), 0);
    private static final Shape SINGLE = new Shape(ShapeKind.SINGLE, ImmutableList.of(), 1);

    private final ShapeKind kind;
    private final ImmutableList<String> outputNames;
    private final int count;

    private Shape(ShapeKind kind, ImmutableList<String> outputNames, int count) {
      this.kind = kind;
      this.outputNames = outputNames;
      this.count = count;
    }

    static Shape ofOutputs(List<String> names) {
      switch (names.size()) {
        case 0:
          return NONE;
        case 1:
          return SINGLE;
        default:
          return new Shape(ShapeKind.STRUCT, ImmutableList.copyOf(names), names.size());
      }
    }

    static Shape ofList(int count) {
      return new Shape(ShapeKind.LIST, ImmutableList.of(), count);
    }
  }

  // The body being lowered: the top level or one definition.
  private static final class Scope {
    private final Optional<AST.Definition> definition;
    private final List<Operation> ops = new ArrayList<>();
    private final Map<String, Shape> variables = new HashMap<>();
    // Variables known to hold a constant while this body is lowered.
    private final Map<String, Value.Constant> constants = new HashMap<>();
    private final Set<String> params = new HashSet<>();
    private final Set<String> portParams = new HashSet<>();
    private final Set<String> assignedOutputs = new HashSet<>();
    private int hiddenCount = 0;

    private Scope(Optional<AST.Definition> definition) {
      this.definition = definition;
    }

    // Names no source identifier can take.
    private String hiddenName() {
      return "$" + hiddenCount++;
    }

    private void bind(String name, Shape shape) {
      variables.put(name, shape);
      constants.remove(name);
    }

    private void bindConstant(String name, Value.Constant constant) {
      variables.put(name, Shape.SINGLE);
      constants.put(name, constant);
    }

    private boolean inFunction() {
      return definition.isPresent() && !definition.get().isNodegroup();
    }
  }

  private final Library library;
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private final List<String> outputs = new ArrayList<>();
  private final List<Definition> definitions = new ArrayList<>();
  private final StatementLowerer statements = new StatementLowerer();
  private final ExprLowerer expressions = new ExprLowerer();
  private Scope scope = new Scope(Optional.empty());

  /** Definitions lowered here are added to {@code library}. */
  public Lowerer(Library library) {
    this.library = library;
  }

  public Program lower(AST.Module module) {
    scope = new Scope(Optional.empty());
    for (AST.Statement statement : module.body()) {
      statement.accept(statements, null);
    }
    return Program.create(scope.ops, outputs, definitions);
  }

  public ImmutableList<Diagnostic> diagnostics() {
    return ImmutableList.copyOf(diagnostics);
  }

  public boolean hasErrors() {
    return !diagnostics.isEmpty();
  }

  private void error(Token token, String message) {
    diagnostics.add(Diagnostic.at(token, message));
  }

  private void emit(Operation op) {
    scope.ops.add(op);
  }

  private String treeName() {
    return library.treeType() == TreeType.SHADER ? "shader" : "geometry";
  }

  // A parameter that is bound or returned as is must arrive as a socket.
  private void markPort(String name) {
    if (scope.inFunction() && scope.params.contains(name)) {
      scope.portParams.add(name);
    }
  }

  // Folds literals and reads variables known to hold a constant.
  private Optional<Value.Constant> constantOf(AST.Expr expr) {
    if (expr instanceof AST.Name) {
      return Optional.ofNullable(scope.constants.get(((AST.Name) expr).id()));
    }
    return ConstantFolder.fold(expr);
  }

  private Shape lowerExpr(AST.Expr expr) {
    return expr.accept(expressions, null);
  }

  private void lowerSingle(AST.Expr expr) {
    Shape shape = lowerExpr(expr);
    if (shape.kind != ShapeKind.SINGLE) {
      error(expr.token(), notSingleMessage(shape));
    }
  }

  // Multi-input sockets also take a whole list.
  private void lowerArgument(AST.Expr expr, boolean multiInput) {
    Shape shape = lowerExpr(expr);
    boolean accepted =
        shape.kind == ShapeKind.SINGLE || (shape.kind == ShapeKind.LIST && multiInput);
    if (!accepted) {
      error(expr.token(), notSingleMessage(shape));
    }
  }

  private static String notSingleMessage(Shape shape) {
    switch (shape.kind) {
      case NONE:
        return "Expression has no value.";
      case LIST:
        return "A list can only be passed to a multi-input socket.";
      default:
        return String.format("Expected a single value, but this has %d outputs.", shape.count);
    }
  }

  private static DataType typeOf(Object value) {
    if (value instanceof Integer) {
      return DataType.INT;
    } else if (value instanceof Double) {
      return DataType.FLOAT;
    } else if (value instanceof Boolean) {
      return DataType.BOOL;
    } else if (value instanceof String) {
      return DataType.STRING;
    }
    return DataType.VEC3;
  }

  /**
   * Emits a node whose output holds {@code constant} as a {@code type} socket. Returns false if
   * the tree type has no such node.
   */
  private boolean materialize(Value.Constant constant, DataType type) {
    if (!constant.value().isPresent()) {
      return false;
    }
    Object value = constant.value().get();
    Optional<Double> number = ConstantFolder.asDouble(value);
    boolean shader = library.treeType() == TreeType.SHADER;
    switch (type) {
      case FLOAT:
        if (!number.isPresent()) {
          return false;
        }
        emit(Operation.callBuiltin(Builtins.VALUE_NODE));
        emit(Operation.setOutput(0, Value.Constant.of(number.get())));
        return true;
      case INT:
        if (!number.isPresent()) {
          return false;
        }
        if (shader) {
          emit(Operation.callBuiltin(Builtins.VALUE_NODE));
          emit(Operation.setOutput(0, Value.Constant.of(number.get())));
        } else {
          int integer = (int) Math.round(number.get());
          emit(
              Operation.callBuiltin(
                  Builtins.inputNode("FunctionNodeInputInt", "integer", integer)));
        }
        return true;
      case BOOL:
        if (!(value instanceof Boolean) || shader) {
          return false;
        }
        emit(Operation.callBuiltin(Builtins.inputNode("FunctionNodeInputBool", "boolean", value)));
        return true;
      case STRING:
        if (!(value instanceof String) || shader) {
          return false;
        }
        emit(Operation.callBuiltin(Builtins.inputNode("FunctionNodeInputString", "string", value)));
        return true;
      case VEC3:
        ImmutableList<Double> components;
        if (number.isPresent()) {
          components = ImmutableList.of(number.get(), number.get(), number.get());
        } else if (value instanceof ImmutableList) {
          components = ((ImmutableList<?>) value)
              .stream()
              .map(Double.class::cast)
              .collect(ImmutableList.toImmutableList());
        } else {
          return false;
        }
        for (Double component : components) {
          emit(Operation.pushConstant(component));
        }
        emit(Operation.callBuiltin(builtin(Builtins.COMBINE_XYZ).node()));
        return true;
      default:
        return false;
    }
  }

  private Builtins.Builtin builtin(String name) {
    return Builtins.lookup(library.treeType(), name)
        .orElseThrow(() -> new IllegalStateException("Missing builtin " + name));
  }

  private void emitBuiltin(Token token, String name, String what) {
    Optional<Builtins.Builtin> builtin = Builtins.lookup(library.treeType(), name);
    if (builtin.isPresent()) {
      emit(Operation.callBuiltin(builtin.get().node()));
    } else {
      error(token, String.format("%s is not available in %s trees.", what, treeName()));
    }
  }

  private class ExprLowerer extends DefaultASTVisitor<Shape> {
    @Override
    public Shape visit(AST.Constant constant, Shape value) {
      emit(
          Operation.pushValue(
              constant.value().map(Value.Constant::of).orElse(Value.Constant.none())));
      return Shape.SINGLE;
    }

    @Override
    public Shape visit(AST.Name name, Shape value) {
      Shape shape = scope.variables.get(name.id());
      if (shape == null) {
        error(name.token(), String.format("Unknown variable '%s'.", name.id()));
        return Shape.SINGLE;
      }
      emit(Operation.getVar(name.id()));
      return shape;
    }

    @Override
    public Shape visit(AST.Vec3 vec, Shape value) {
      Optional<Value.Constant> constant = ConstantFolder.fold(vec);
      if (constant.isPresent()) {
        emit(Operation.pushValue(constant.get()));
        return Shape.SINGLE;
      }
      lowerSingle(vec.x());
      lowerSingle(vec.y());
      lowerSingle(vec.z());
      emit(Operation.callBuiltin(builtin(Builtins.COMBINE_XYZ).node()));
      return Shape.SINGLE;
    }

    @Override
    public Shape visit(AST.ListLiteral list, Shape value) {
      for (AST.Expr element : list.elements()) {
        Optional<Value.Constant> constant = constantOf(element);
        if (constant.isPresent()) {
          error(element.token(), "A list can only hold node outputs, not constants.");
          emit(Operation.pushValue(constant.get()));
        } else if (element instanceof AST.Name) {
          String id = ((AST.Name) element).id();
          Shape shape = scope.variables.get(id);
          if (shape == null) {
            error(element.token(), String.format("Unknown variable '%s'.", id));
          } else if (shape.kind != ShapeKind.SINGLE) {
            error(element.token(), String.format("'%s' cannot be a list element.", id));
          }
          // A parameter in a list must arrive as a socket.
          markPort(id);
          emit(Operation.pushName(id));
        } else {
          lowerSingle(element);
        }
      }
      emit(Operation.packList(list.elements().size()));
      return Shape.ofList(list.elements().size());
    }

    @Override
    public Shape visit(AST.UnaryOp unary, Shape value) {
      Optional<Value.Constant> constant = ConstantFolder.fold(unary);
      if (constant.isPresent()) {
        emit(Operation.pushValue(constant.get()));
        return Shape.SINGLE;
      }
      lowerSingle(unary.operand());
      switch (unary.op()) {
        case NEGATE:
          emit(Operation.pushConstant(-1.0));
          emitBuiltin(unary.token(), "mul", "Negation");
          break;
        case NOT:
          emitBuiltin(unary.token(), "not", "Operator 'not'");
          break;
      }
      return Shape.SINGLE;
    }

    @Override
    public Shape visit(AST.BinOp binOp, Shape value) {
      lowerSingle(binOp.left());
      lowerSingle(binOp.right());
      emitBuiltin(
          binOp.token(),
          Builtins.operatorFunction(binOp.op()),
          String.format("Operator '%s'", binOp.op().repr()));
      return Shape.SINGLE;
    }

    @Override
    public Shape visit(AST.Attribute attribute, Shape value) {
      Shape shape = lowerExpr(attribute.value());
      String attr = attribute.attr();
      if (shape.kind == ShapeKind.STRUCT && shape.outputNames.contains(attr)) {
        emit(Operation.getOutput(shape.outputNames.indexOf(attr)));
      } else if (shape.kind == ShapeKind.SINGLE && XYZ.contains(attr)) {
        emit(Operation.callBuiltin(builtin(Builtins.SEPARATE_XYZ).node()));
        emit(Operation.getOutput(XYZ.indexOf(attr)));
      } else {
        error(attribute.token(), String.format("'%s' is not an output of this value.", attr));
      }
      return Shape.SINGLE;
    }

    @Override
    public Shape visit(AST.Call call, Shape value) {
      String name = RecursionDetector.calleeName(call);
      List<AST.Expr> args = new ArrayList<>();
      if (call.func() instanceof AST.Attribute) {
        args.add(((AST.Attribute) call.func()).value());
      }
      args.addAll(call.args());

      Optional<Definition> definition = library.lookup(name);
      if (call.isGroupReference()) {
        if (!definition.isPresent() || !definition.get().isNodegroup()) {
          error(call.token(), String.format("There is no node group called '%s'.", name));
          return Shape.SINGLE;
        }
      }
      if (definition.isPresent()) {
        return callDefinition(call, definition.get(), args);
      }
      Optional<Builtins.Builtin> builtin = Builtins.lookup(library.treeType(), name);
      if (builtin.isPresent()) {
        return callBuiltin(call, builtin.get(), args);
      }
      if (Builtins.exists(name)) {
        error(
            call.token(),
            String.format("Function '%s' is not available in %s trees.", name, treeName()));
      } else {
        error(call.token(), String.format("Unknown function '%s'.", name));
      }
      return Shape.SINGLE;
    }
  }

  private static final ImmutableList<String> XYZ = ImmutableList.of("x", "y", "z");

  // Positional arguments first, then keywords by name. Empty on any mismatch.
  private Optional<List<Optional<AST.Expr>>> bindArguments(
      AST.Call call, String name, List<String> inputNames, List<AST.Expr> positional) {
    if (positional.size() > inputNames.size()) {
      error(
          call.token(),
          String.format(
              "'%s' takes at most %d arguments, got %d.",
              name, inputNames.size(), positional.size()));
      return Optional.empty();
    }
    List<Optional<AST.Expr>> bound = new ArrayList<>();
    for (int i = 0; i < inputNames.size(); i++) {
      bound.add(i < positional.size() ? Optional.of(positional.get(i)) : Optional.empty());
    }
    boolean valid = true;
    for (AST.Keyword keyword : call.keywords()) {
      int index = inputNames.indexOf(keyword.name());
      if (index < 0) {
        error(keyword.token(), String.format("'%s' has no argument '%s'.", name, keyword.name()));
        valid = false;
      } else if (bound.get(index).isPresent()) {
        error(
            keyword.token(),
            String.format("Argument '%s' of '%s' is given more than once.", keyword.name(), name));
        valid = false;
      } else {
        bound.set(index, Optional.of(keyword.value()));
      }
    }
    return valid ? Optional.of(bound) : Optional.empty();
  }

  private Shape callDefinition(AST.Call call, Definition definition, List<AST.Expr> args) {
    List<String> inputNames =
        definition
            .inputs()
            .stream()
            .map(SocketDeclaration::name)
            .collect(ImmutableList.toImmutableList());
    Optional<List<Optional<AST.Expr>>> bound =
        bindArguments(call, definition.name(), inputNames, args);
    Shape result =
        Shape.ofOutputs(
            definition
                .outputs()
                .stream()
                .map(SocketDeclaration::name)
                .collect(ImmutableList.toImmutableList()));
    if (!bound.isPresent()) {
      return result;
    }
    for (int i = 0; i < inputNames.size(); i++) {
      SocketDeclaration input = definition.inputs().get(i);
      Optional<AST.Expr> arg = bound.get().get(i);
      boolean needsPort =
          !definition.isNodegroup() && definition.portInputs().contains(input.name());
      Optional<Value.Constant> constant =
          arg.isPresent()
              ? constantOf(arg.get())
              : Optional.of(input.defaultValue().orElse(Value.Constant.none()));
      if (needsPort && constant.isPresent()) {
        if (!materialize(constant.get(), input.type())) {
          error(
              arg.map(AST.Expr::token).orElse(call.token()),
              String.format(
                  "Argument '%s' of '%s' needs a value.", input.name(), definition.name()));
        }
      } else if (arg.isPresent()) {
        lowerSingle(arg.get());
        if (needsPort && arg.get() instanceof AST.Name) {
          markPort(((AST.Name) arg.get()).id());
        }
      } else {
        emit(Operation.pushValue(constant.get()));
      }
    }
    if (definition.isNodegroup()) {
      emit(Operation.callNodegroup(definition.asNodeGroup()));
    } else {
      emit(Operation.callFunction(definition.asFunction()));
    }
    return result;
  }

  private Shape callBuiltin(AST.Call call, Builtins.Builtin builtin, List<AST.Expr> args) {
    Optional<List<Optional<AST.Expr>>> bound =
        bindArguments(call, builtin.name(), builtin.inputNames(), args);
    if (bound.isPresent()) {
      ImmutableList<NodeCatalog.SocketSpec> sockets =
          NodeCatalog.lookup(builtin.node().key()).get().inputs();
      for (int i = 0; i < bound.get().size(); i++) {
        Optional<AST.Expr> arg = bound.get().get(i);
        if (arg.isPresent()) {
          lowerArgument(arg.get(), sockets.get(builtin.node().inputs().get(i)).multiInput());
        } else {
          emit(Operation.pushNone());
        }
      }
      emit(Operation.callBuiltin(builtin.node()));
    }
    return Shape.ofOutputs(builtin.outputNames());
  }

  private class StatementLowerer extends VoidDefaultASTVisitor {
    @Override
    public void visitImpl(AST.Assign assign) {
      assign(assign.targets(), assign.value(), assign.token());
      emit(Operation.endOfStatement());
    }

    @Override
    public void visitImpl(AST.Out out) {
      if (scope.definition.isPresent()) {
        setOutputs(scope.definition.get(), out);
      } else {
        assign(out.targets(), out.value(), out.token());
        for (Optional<AST.Name> target : out.targets()) {
          if (target.isPresent() && !outputs.contains(target.get().id())) {
            outputs.add(target.get().id());
          }
        }
      }
      emit(Operation.endOfStatement());
    }

    @Override
    public void visitImpl(AST.ExprStatement statement) {
      lowerExpr(statement.expr());
      emit(Operation.endOfStatement());
    }

    @Override
    public void visitImpl(AST.Loop loop) {
      int step = loop.start() <= loop.end() ? 1 : -1;
      if (Math.abs((long) loop.end() - loop.start()) >= MAX_LOOP_ITERATIONS) {
        error(
            loop.token(),
            String.format("A loop can run at most %d times.", MAX_LOOP_ITERATIONS));
        return;
      }
      for (int i = loop.start(); ; i += step) {
        if (loop.var().isPresent()) {
          String name = loop.var().get().id();
          emit(Operation.pushConstant(i));
          emit(Operation.createVar(name));
          emit(Operation.endOfStatement());
          scope.bindConstant(name, Value.Constant.of(i));
        }
        for (AST.Statement statement : loop.body()) {
          statement.accept(this, null);
        }
        if (i == loop.end()) {
          break;
        }
      }
    }

    @Override
    public void visitImpl(AST.FunctionDef def) {
      define(def, Definition.Kind.FUNCTION);
    }

    @Override
    public void visitImpl(AST.NodegroupDef def) {
      define(def, Definition.Kind.NODEGROUP);
    }
  }

  private void assign(List<Optional<AST.Name>> targets, AST.Expr value, Token token) {
    if (targets.size() == 1) {
      if (targets.get(0).isPresent()) {
        assignSingle(targets.get(0).get(), value);
      } else {
        lowerExpr(value);
      }
      return;
    }
    Shape shape = lowerExpr(value);
    if (!checkCount(targets, shape, token)) {
      return;
    }
    if (targets.stream().allMatch(Optional::isPresent)) {
      emit(Operation.splitStruct());
      for (Optional<AST.Name> target : targets) {
        emit(Operation.createVar(target.get().id()));
        scope.bind(target.get().id(), Shape.SINGLE);
      }
      return;
    }
    String hidden = scope.hiddenName();
    emit(Operation.createVar(hidden));
    for (int i = 0; i < targets.size(); i++) {
      if (targets.get(i).isPresent()) {
        String name = targets.get(i).get().id();
        emit(Operation.getVar(hidden));
        emit(Operation.getOutput(i));
        emit(Operation.createVar(name));
        scope.bind(name, Shape.SINGLE);
      }
    }
  }

  private boolean checkCount(List<Optional<AST.Name>> targets, Shape shape, Token token) {
    if (shape.kind == ShapeKind.STRUCT && shape.count == targets.size()) {
      return true;
    }
    int count = shape.kind == ShapeKind.STRUCT ? shape.count : Math.min(shape.count, 1);
    error(
        token,
        String.format("Expected %d values, but the expression has %d.", targets.size(), count));
    return false;
  }

  private void assignSingle(AST.Name target, AST.Expr value) {
    String name = target.id();
    if (value instanceof AST.Name) {
      String id = ((AST.Name) value).id();
      Shape shape = scope.variables.get(id);
      if (shape == null) {
        error(value.token(), String.format("Unknown variable '%s'.", id));
        return;
      }
      markPort(id);
      emit(Operation.pushName(id));
      emit(Operation.createVar(name));
      if (scope.constants.containsKey(id)) {
        scope.bindConstant(name, scope.constants.get(id));
      } else {
        scope.bind(name, shape);
      }
      return;
    }
    Optional<Value.Constant> constant = ConstantFolder.fold(value);
    if (constant.isPresent() && !constant.get().isInteger()) {
      if (!constant.get().value().isPresent()) {
        error(value.token(), String.format("'_' has no value to assign to '%s'.", name));
        return;
      }
      DataType type = typeOf(constant.get().value().get());
      if (!materialize(constant.get(), type)) {
        error(
            value.token(),
            String.format("Cannot hold a %s constant in %s trees.", type.repr(), treeName()));
        return;
      }
      emit(Operation.renameNode(name));
      emit(Operation.createVar(name));
      scope.bind(name, Shape.SINGLE);
      return;
    }
    Shape shape = lowerExpr(value);
    if (shape.kind == ShapeKind.NONE) {
      error(value.token(), String.format("Expression has no value to assign to '%s'.", name));
      return;
    }
    emit(Operation.createVar(name));
    if (constant.isPresent()) {
      scope.bindConstant(name, constant.get());
    } else {
      scope.bind(name, shape);
    }
  }

  private void setOutputs(AST.Definition def, AST.Out out) {
    List<Optional<AST.Name>> targets = out.targets();
    List<Integer> indices = new ArrayList<>();
    boolean valid = true;
    for (Optional<AST.Name> target : targets) {
      int index = -1;
      if (target.isPresent()) {
        index = outputIndex(def, target.get().id());
        if (index < 0) {
          error(
              target.get().token(),
              String.format("'%s' is not an output of '%s'.", target.get().id(), def.name()));
          valid = false;
        }
      }
      indices.add(index);
    }
    if (!valid) {
      return;
    }
    if (targets.size() == 1) {
      if (targets.get(0).isPresent()) {
        setOutput(def, indices.get(0), out.value());
        scope.assignedOutputs.add(targets.get(0).get().id());
      } else {
        lowerExpr(out.value());
      }
      return;
    }
    Shape shape = lowerExpr(out.value());
    if (!checkCount(targets, shape, out.token())) {
      return;
    }
    if (targets.stream().allMatch(Optional::isPresent)) {
      emit(Operation.splitStruct());
      for (int index : indices) {
        emit(Operation.setFunctionOut(index));
      }
    } else {
      String hidden = scope.hiddenName();
      emit(Operation.createVar(hidden));
      for (int i = 0; i < targets.size(); i++) {
        if (targets.get(i).isPresent()) {
          emit(Operation.getVar(hidden));
          emit(Operation.getOutput(i));
          emit(Operation.setFunctionOut(indices.get(i)));
        }
      }
    }
    for (Optional<AST.Name> target : targets) {
      target.ifPresent(t -> scope.assignedOutputs.add(t.id()));
    }
  }

  private static int outputIndex(AST.Definition def, String name) {
    for (int i = 0; i < def.returns().size(); i++) {
      if (def.returns().get(i).name().equals(name)) {
        return i;
      }
    }
    return -1;
  }

  private void setOutput(AST.Definition def, int index, AST.Expr value) {
    AST.Arg output = def.returns().get(index);
    if (value instanceof AST.Name) {
      markPort(((AST.Name) value).id());
    }
    // Function outputs are always sockets, so a list can link them.
    Optional<Value.Constant> constant = constantOf(value);
    if (!def.isNodegroup() && constant.isPresent()) {
      if (!materialize(constant.get(), output.type())) {
        error(
            value.token(),
            String.format("Output '%s' of '%s' needs a value.", output.name(), def.name()));
        return;
      }
    } else {
      lowerSingle(value);
    }
    emit(Operation.setFunctionOut(index));
  }

  private void define(AST.Definition def, Definition.Kind kind) {
    Scope outer = scope;
    scope = new Scope(Optional.of(def));
    Definition.Builder builder = Definition.builder(kind, def.name());
    for (AST.Arg arg : def.args()) {
      builder.addInput(declaration(arg));
      scope.bind(arg.name(), Shape.SINGLE);
      scope.params.add(arg.name());
    }
    for (AST.Arg ret : def.returns()) {
      builder.addOutput(declaration(ret));
    }
    for (AST.Statement statement : def.body()) {
      statement.accept(statements, null);
    }
    if (kind == Definition.Kind.FUNCTION) {
      for (AST.Arg ret : def.returns()) {
        if (!scope.assignedOutputs.contains(ret.name())) {
          error(
              ret.token(),
              String.format("Output '%s' of '%s' is never set.", ret.name(), def.name()));
        }
      }
    }
    builder.setBody(scope.ops);
    builder.portInputsBuilder().addAll(scope.portParams);
    scope = outer;

    Definition definition = builder.build();
    library.define(definition);
    definitions.add(definition);
  }

  private static SocketDeclaration declaration(AST.Arg arg) {
    return SocketDeclaration.create(
        arg.name(), arg.type(), arg.defaultValue().flatMap(ConstantFolder::fold));
  }
}

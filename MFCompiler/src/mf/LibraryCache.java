package mf;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

/**
 * Binary form of a compiled {@link Library}, so loading needn't parse the sources again.
 *
 * <p>Layout: magic, format version, tree type, then every definition. Nested function and node
 * group descriptors are written inline wherever they are called.
 */
public final class LibraryCache {
  private LibraryCache() {}

  private static final int MAGIC = 0x4d46; // "MF"
  private static final int VERSION = 1;

  // Constants: varint tag, then the payload.
  private static final int CONSTANT_NONE = 0; // nothing
  private static final int CONSTANT_INT = 1; // 32-bit signed
  private static final int CONSTANT_FLOAT = 2; // 64-bit IEEE
  private static final int CONSTANT_BOOL = 3; // 0 = false, 1 = true
  private static final int CONSTANT_STRING = 4; // Varint size N, UTF 8 bytes
  private static final int CONSTANT_VECTOR = 5; // 3 x 64-bit IEEE

  // Pushed values.
  private static final int VALUE_CONSTANT = 0; // Constant
  private static final int VALUE_NAME_REF = 1; // Varint size N, UTF 8 bytes

  // Operations are tagged with Operation.Type ordinals; payloads:
  //   PUSH_VALUE        value
  //   CREATE_VAR        name
  //   GET_VAR           name
  //   GET_OUTPUT        varint index
  //   SET_OUTPUT        varint index, Constant
  //   SET_FUNCTION_OUT  varint index
  //   SPLIT_STRUCT      nothing
  //   CALL_FUNCTION     varint N, N names, varint outputs, body
  //   CALL_NODEGROUP    name, inputs, outputs, body
  //   CALL_BUILTIN      key, varint N, N (name, Constant), varint N, N inputs, varint N, N outputs
  //   RENAME_NODE       label
  //   END_OF_STATEMENT  nothing
  //   PACK_LIST         varint count

  public static byte[] write(Library library) {
    ByteArrayDataOutput out = ByteStreams.newDataOutput();
    writeVarint(MAGIC, out);
    writeVarint(VERSION, out);
    writeVarint(library.treeType().ordinal(), out);
    ImmutableList<Definition> definitions = library.definitions();
    writeVarint(definitions.size(), out);
    for (Definition definition : definitions) {
      writeDefinition(definition, out);
    }
    return out.toByteArray();
  }

  /**
   * Reads a library written by {@link #write}.
   *
   * @throws IOException if {@code bytes} isn't a library cache of this version
   */
  public static Library read(byte[] bytes) throws IOException {
    ByteArrayDataInput in = ByteStreams.newDataInput(bytes);
    try {
      if (readVarint(in) != MAGIC) {
        throw new IOException("Not a library cache");
      }
      int version = readVarint(in);
      if (version != VERSION) {
        throw new IOException(
            String.format("Library cache version %d, expected %d", version, VERSION));
      }
      Library library = new Library(readEnum(TreeType.values(), in));
      int count = readVarint(in);
      for (int i = 0; i < count; i++) {
        library.define(readDefinition(in));
      }
      return library;
    } catch (IllegalStateException | IllegalArgumentException | NegativeArraySizeException ex) {
      // Truncated input, or a value that doesn't decode.
      throw new IOException("Corrupt library cache", ex);
    }
  }

  // Writing.

  private static void writeDefinition(Definition definition, ByteArrayDataOutput out) {
    writeVarint(definition.kind().ordinal(), out);
    writeUTF8(definition.name(), out);
    writeDeclarations(definition.inputs(), out);
    writeDeclarations(definition.outputs(), out);
    writeVarint(definition.portInputs().size(), out);
    definition.portInputs().forEach(name -> writeUTF8(name, out));
    writeBody(definition.body(), out);
  }

  private static void writeDeclarations(
      List<SocketDeclaration> declarations, ByteArrayDataOutput out) {
    writeVarint(declarations.size(), out);
    for (SocketDeclaration declaration : declarations) {
      writeUTF8(declaration.name(), out);
      writeVarint(declaration.type().ordinal(), out);
      out.writeByte(declaration.defaultValue().isPresent() ? 1 : 0);
      declaration.defaultValue().ifPresent(value -> writeConstant(value, out));
    }
  }

  private static void writeBody(List<Operation> body, ByteArrayDataOutput out) {
    writeVarint(body.size(), out);
    OperationWriter writer = new OperationWriter(out);
    for (Operation op : body) {
      writeVarint(op.type().ordinal(), out);
      op.accept(writer);
    }
  }

  private static void writeConstant(Value.Constant constant, ByteArrayDataOutput out) {
    if (!constant.value().isPresent()) {
      writeVarint(CONSTANT_NONE, out);
      return;
    }
    Object value = constant.value().get();
    if (value instanceof Integer) {
      writeVarint(CONSTANT_INT, out);
      out.writeInt((Integer) value);
    } else if (value instanceof Double) {
      writeVarint(CONSTANT_FLOAT, out);
      out.writeDouble((Double) value);
    } else if (value instanceof Boolean) {
      writeVarint(CONSTANT_BOOL, out);
      out.writeByte((Boolean) value ? 1 : 0);
    } else if (value instanceof String) {
      writeVarint(CONSTANT_STRING, out);
      writeUTF8((String) value, out);
    } else {
      writeVarint(CONSTANT_VECTOR, out);
      for (Object component : (List<?>) value) {
        out.writeDouble((Double) component);
      }
    }
  }

  private static final class OperationWriter implements Operation.Visitor<Void> {
    private final ByteArrayDataOutput out;

    private OperationWriter(ByteArrayDataOutput out) {
      this.out = out;
    }

    @Override
    public Void visitPushValue(Operation.PushValue op) {
      if (op.value().is(Value.Kind.NAME_REF)) {
        writeVarint(VALUE_NAME_REF, out);
        writeUTF8(op.value().<Value.NameRef>cast().id(), out);
      } else {
        writeVarint(VALUE_CONSTANT, out);
        writeConstant(op.value().cast(), out);
      }
      return null;
    }

    @Override
    public Void visitCreateVar(Operation.CreateVar op) {
      writeUTF8(op.name(), out);
      return null;
    }

    @Override
    public Void visitGetVar(Operation.GetVar op) {
      writeUTF8(op.name(), out);
      return null;
    }

    @Override
    public Void visitGetOutput(Operation.GetOutput op) {
      writeVarint(op.index(), out);
      return null;
    }

    @Override
    public Void visitSetOutput(Operation.SetOutput op) {
      writeVarint(op.index(), out);
      writeConstant(op.value(), out);
      return null;
    }

    @Override
    public Void visitSetFunctionOut(Operation.SetFunctionOut op) {
      writeVarint(op.index(), out);
      return null;
    }

    @Override
    public Void visitSplitStruct(Operation.SplitStruct op) {
      return null;
    }

    @Override
    public Void visitCallFunction(Operation.CallFunction op) {
      CompiledFunction function = op.function();
      writeVarint(function.inputs().size(), out);
      function.inputs().forEach(name -> writeUTF8(name, out));
      writeVarint(function.numOutputs(), out);
      writeBody(function.body(), out);
      return null;
    }

    @Override
    public Void visitCallNodegroup(Operation.CallNodegroup op) {
      CompiledNodeGroup group = op.nodeGroup();
      writeUTF8(group.name(), out);
      writeDeclarations(group.inputs(), out);
      writeDeclarations(group.outputs(), out);
      writeBody(group.body(), out);
      return null;
    }

    @Override
    public Void visitCallBuiltin(Operation.CallBuiltin op) {
      NodeInstance node = op.node();
      writeUTF8(node.key(), out);
      writeVarint(node.props().size(), out);
      for (NodeInstance.Property prop : node.props()) {
        writeUTF8(prop.name(), out);
        writeConstant(Value.Constant.of(prop.value()), out);
      }
      writeIndices(node.inputs(), out);
      writeIndices(node.outputs(), out);
      return null;
    }

    @Override
    public Void visitRenameNode(Operation.RenameNode op) {
      writeUTF8(op.label(), out);
      return null;
    }

    @Override
    public Void visitEndOfStatement(Operation.EndOfStatement op) {
      return null;
    }

    @Override
    public Void visitPackList(Operation.PackList op) {
      writeVarint(op.count(), out);
      return null;
    }
  }

  private static void writeIndices(List<Integer> indices, ByteArrayDataOutput out) {
    writeVarint(indices.size(), out);
    indices.forEach(index -> writeVarint(index, out));
  }

  private static void writeVarint(int value, ByteArrayDataOutput out) {
    while (value >= 128) {
      out.writeByte((value % 128) | 128);
      value /= 128;
    }
    out.writeByte(value);
  }

  private static void writeUTF8(String str, ByteArrayDataOutput out) {
    byte[] bytes = str.getBytes(StandardCharsets.UTF_8);
    writeVarint(bytes.length, out);
    out.write(bytes);
  }

  // Reading.

  private static Definition readDefinition(ByteArrayDataInput in) throws IOException {
    Definition.Kind kind = readEnum(Definition.Kind.values(), in);
    Definition.Builder builder = Definition.builder(kind, readUTF8(in));
    readDeclarations(in).forEach(builder::addInput);
    readDeclarations(in).forEach(builder::addOutput);
    int ports = readVarint(in);
    for (int i = 0; i < ports; i++) {
      builder.portInputsBuilder().add(readUTF8(in));
    }
    return builder.setBody(readBody(in)).build();
  }

  private static ImmutableList<SocketDeclaration> readDeclarations(ByteArrayDataInput in)
      throws IOException {
    int count = readVarint(in);
    ImmutableList.Builder<SocketDeclaration> declarations = ImmutableList.builder();
    for (int i = 0; i < count; i++) {
      String name = readUTF8(in);
      DataType type = readEnum(DataType.values(), in);
      Optional<Value.Constant> defaultValue =
          in.readByte() != 0 ? Optional.of(readConstant(in)) : Optional.empty();
      declarations.add(SocketDeclaration.create(name, type, defaultValue));
    }
    return declarations.build();
  }

  private static ImmutableList<Operation> readBody(ByteArrayDataInput in) throws IOException {
    int count = readVarint(in);
    List<Operation> body = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      body.add(readOperation(in));
    }
    return ImmutableList.copyOf(body);
  }

  private static Operation readOperation(ByteArrayDataInput in) throws IOException {
    Operation.Type type = readEnum(Operation.Type.values(), in);
    switch (type) {
      case PUSH_VALUE:
        {
          int tag = readVarint(in);
          if (tag == VALUE_NAME_REF) {
            return Operation.pushName(readUTF8(in));
          } else if (tag == VALUE_CONSTANT) {
            return Operation.pushValue(readConstant(in));
          }
          throw new IOException("Unknown value tag " + tag);
        }
      case CREATE_VAR:
        return Operation.createVar(readUTF8(in));
      case GET_VAR:
        return Operation.getVar(readUTF8(in));
      case GET_OUTPUT:
        return Operation.getOutput(readVarint(in));
      case SET_OUTPUT:
        {
          int index = readVarint(in);
          return Operation.setOutput(index, readConstant(in));
        }
      case SET_FUNCTION_OUT:
        return Operation.setFunctionOut(readVarint(in));
      case SPLIT_STRUCT:
        return Operation.splitStruct();
      case CALL_FUNCTION:
        {
          int count = readVarint(in);
          ImmutableList.Builder<String> inputs = ImmutableList.builder();
          for (int i = 0; i < count; i++) {
            inputs.add(readUTF8(in));
          }
          int numOutputs = readVarint(in);
          return Operation.callFunction(
              CompiledFunction.create(inputs.build(), numOutputs, readBody(in)));
        }
      case CALL_NODEGROUP:
        {
          String name = readUTF8(in);
          ImmutableList<SocketDeclaration> inputs = readDeclarations(in);
          ImmutableList<SocketDeclaration> outputs = readDeclarations(in);
          return Operation.callNodegroup(
              CompiledNodeGroup.create(name, inputs, outputs, readBody(in)));
        }
      case CALL_BUILTIN:
        {
          String key = readUTF8(in);
          int count = readVarint(in);
          ImmutableList.Builder<NodeInstance.Property> props = ImmutableList.builder();
          for (int i = 0; i < count; i++) {
            String name = readUTF8(in);
            Value.Constant value = readConstant(in);
            if (!value.value().isPresent()) {
              throw new IOException("Property " + name + " has no value");
            }
            props.add(NodeInstance.Property.create(name, value.value().get()));
          }
          ImmutableList<Integer> inputs = readIndices(in);
          ImmutableList<Integer> outputs = readIndices(in);
          return Operation.callBuiltin(NodeInstance.create(key, props.build(), inputs, outputs));
        }
      case RENAME_NODE:
        return Operation.renameNode(readUTF8(in));
      case END_OF_STATEMENT:
        return Operation.endOfStatement();
      case PACK_LIST:
        return Operation.packList(readVarint(in));
    }
    throw new AssertionError("Unhandled operation " + type);
  }

  private static Value.Constant readConstant(ByteArrayDataInput in) throws IOException {
    int tag = readVarint(in);
    switch (tag) {
      case CONSTANT_NONE:
        return Value.Constant.none();
      case CONSTANT_INT:
        return Value.Constant.of(in.readInt());
      case CONSTANT_FLOAT:
        return Value.Constant.of(in.readDouble());
      case CONSTANT_BOOL:
        return Value.Constant.of(in.readByte() != 0);
      case CONSTANT_STRING:
        return Value.Constant.of(readUTF8(in));
      case CONSTANT_VECTOR:
        return Value.Constant.of(
            ImmutableList.of(in.readDouble(), in.readDouble(), in.readDouble()));
      default:
        throw new IOException("Unknown constant tag " + tag);
    }
  }

  private static ImmutableList<Integer> readIndices(ByteArrayDataInput in) {
    int count = readVarint(in);
    ImmutableList.Builder<Integer> indices = ImmutableList.builder();
    for (int i = 0; i < count; i++) {
      indices.add(readVarint(in));
    }
    return indices.build();
  }

  private static <E extends Enum<E>> E readEnum(E[] values, ByteArrayDataInput in)
      throws IOException {
    int ordinal = readVarint(in);
    if (ordinal < 0 || ordinal >= values.length) {
      throw new IOException("Enum ordinal out of range: " + ordinal);
    }
    return values[ordinal];
  }

  private static int readVarint(ByteArrayDataInput in) {
    int value = 0;
    int multiplier = 1;
    while (true) {
      int b = in.readUnsignedByte();
      value += (b & 127) * multiplier;
      if (b < 128) {
        return value;
      }
      multiplier *= 128;
    }
  }

  private static String readUTF8(ByteArrayDataInput in) {
    byte[] bytes = new byte[readVarint(in)];
    in.readFully(bytes);
    return new String(bytes, StandardCharsets.UTF_8);
  }
}

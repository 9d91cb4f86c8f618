package mf;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;

/**
 * One instruction of the stream the {@link Interpreter} executes.
 *
 * <p>The hierarchy is closed: every {@link Type} has exactly one subclass, and {@link Visitor}
 * has one method per subclass, so a consumer that forgets a kind doesn't compile.
 */
public abstract class Operation {
  public enum Type {
    PUSH_VALUE,
    CREATE_VAR,
    GET_VAR,
    GET_OUTPUT,
    SET_OUTPUT,
    SET_FUNCTION_OUT,
    SPLIT_STRUCT,
    CALL_FUNCTION,
    CALL_NODEGROUP,
    CALL_BUILTIN,
    RENAME_NODE,
    END_OF_STATEMENT,
    PACK_LIST;
  }

  public interface Visitor<R> {
    R visitPushValue(PushValue op);

    R visitCreateVar(CreateVar op);

    R visitGetVar(GetVar op);

    R visitGetOutput(GetOutput op);

    R visitSetOutput(SetOutput op);

    R visitSetFunctionOut(SetFunctionOut op);

    R visitSplitStruct(SplitStruct op);

    R visitCallFunction(CallFunction op);

    R visitCallNodegroup(CallNodegroup op);

    R visitCallBuiltin(CallBuiltin op);

    R visitRenameNode(RenameNode op);

    R visitEndOfStatement(EndOfStatement op);

    R visitPackList(PackList op);
  }

  // Only the nested subclasses below.
  Operation() {}

  public abstract Type type();

  public abstract <R> R accept(Visitor<R> visitor);

  /** Pushes a constant or a variable reference. */
  @AutoValue
  public abstract static class PushValue extends Operation {
    public abstract Value value();

    @Override
    public Type type() {
      return Type.PUSH_VALUE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPushValue(this);
    }
  }

  /** Pops a value and binds it to {@link #name()}. */
  @AutoValue
  public abstract static class CreateVar extends Operation {
    public abstract String name();

    @Override
    public Type type() {
      return Type.CREATE_VAR;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCreateVar(this);
    }
  }

  @AutoValue
  public abstract static class GetVar extends Operation {
    public abstract String name();

    @Override
    public Type type() {
      return Type.GET_VAR;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitGetVar(this);
    }
  }

  /** Pops a struct and pushes its output {@link #index()}, in declaration order. */
  @AutoValue
  public abstract static class GetOutput extends Operation {
    public abstract int index();

    @Override
    public Type type() {
      return Type.GET_OUTPUT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitGetOutput(this);
    }
  }

  /** Sets the value of an output socket of the most recently created node. */
  @AutoValue
  public abstract static class SetOutput extends Operation {
    public abstract int index();

    public abstract Value.Constant value();

    @Override
    public Type type() {
      return Type.SET_OUTPUT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSetOutput(this);
    }
  }

  /** Pops a value and records it as output {@link #index()} of the enclosing definition. */
  @AutoValue
  public abstract static class SetFunctionOut extends Operation {
    public abstract int index();

    @Override
    public Type type() {
      return Type.SET_FUNCTION_OUT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSetFunctionOut(this);
    }
  }

  @AutoValue
  public abstract static class SplitStruct extends Operation {
    @Override
    public Type type() {
      return Type.SPLIT_STRUCT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitSplitStruct(this);
    }
  }

  @AutoValue
  public abstract static class CallFunction extends Operation {
    public abstract CompiledFunction function();

    @Override
    public Type type() {
      return Type.CALL_FUNCTION;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCallFunction(this);
    }
  }

  @AutoValue
  public abstract static class CallNodegroup extends Operation {
    public abstract CompiledNodeGroup nodeGroup();

    @Override
    public Type type() {
      return Type.CALL_NODEGROUP;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCallNodegroup(this);
    }
  }

  @AutoValue
  public abstract static class CallBuiltin extends Operation {
    public abstract NodeInstance node();

    @Override
    public Type type() {
      return Type.CALL_BUILTIN;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCallBuiltin(this);
    }
  }

  /** Sets the display label of the most recently created node. */
  @AutoValue
  public abstract static class RenameNode extends Operation {
    public abstract String label();

    @Override
    public Type type() {
      return Type.RENAME_NODE;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitRenameNode(this);
    }
  }

  @AutoValue
  public abstract static class EndOfStatement extends Operation {
    @Override
    public Type type() {
      return Type.END_OF_STATEMENT;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitEndOfStatement(this);
    }
  }

  /** Pops {@link #count()} values and pushes them as one list, in source order. */
  @AutoValue
  public abstract static class PackList extends Operation {
    public abstract int count();

    @Override
    public Type type() {
      return Type.PACK_LIST;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
      return visitor.visitPackList(this);
    }
  }

  private static final SplitStruct SPLIT_STRUCT = new AutoValue_Operation_SplitStruct();
  private static final EndOfStatement END_OF_STATEMENT = new AutoValue_Operation_EndOfStatement();

  public static PushValue pushValue(Value value) {
    Preconditions.checkArgument(
        value.is(Value.Kind.CONSTANT) || value.is(Value.Kind.NAME_REF),
        "Only constants and variable references can be pushed: %s",
        value);
    return new AutoValue_Operation_PushValue(value);
  }

  public static PushValue pushConstant(Object value) {
    return pushValue(Value.Constant.of(value));
  }

  public static PushValue pushNone() {
    return pushValue(Value.Constant.none());
  }

  public static PushValue pushName(String id) {
    return pushValue(Value.NameRef.of(id));
  }

  public static CreateVar createVar(String name) {
    return new AutoValue_Operation_CreateVar(name);
  }

  public static GetVar getVar(String name) {
    return new AutoValue_Operation_GetVar(name);
  }

  public static GetOutput getOutput(int index) {
    Preconditions.checkArgument(index >= 0, "negative output index %s", index);
    return new AutoValue_Operation_GetOutput(index);
  }

  public static SetOutput setOutput(int index, Value.Constant value) {
    Preconditions.checkArgument(value.value().isPresent(), "SET_OUTPUT needs a value");
    return new AutoValue_Operation_SetOutput(index, value);
  }

  public static SetFunctionOut setFunctionOut(int index) {
    return new AutoValue_Operation_SetFunctionOut(index);
  }

  public static SplitStruct splitStruct() {
    return SPLIT_STRUCT;
  }

  public static CallFunction callFunction(CompiledFunction function) {
    return new AutoValue_Operation_CallFunction(function);
  }

  public static CallNodegroup callNodegroup(CompiledNodeGroup nodeGroup) {
    return new AutoValue_Operation_CallNodegroup(nodeGroup);
  }

  public static CallBuiltin callBuiltin(NodeInstance node) {
    return new AutoValue_Operation_CallBuiltin(node);
  }

  public static RenameNode renameNode(String label) {
    return new AutoValue_Operation_RenameNode(label);
  }

  public static EndOfStatement endOfStatement() {
    return END_OF_STATEMENT;
  }

  public static PackList packList(int count) {
    Preconditions.checkArgument(count >= 0, "negative count %s", count);
    return new AutoValue_Operation_PackList(count);
  }
}

package mf;

import java.util.List;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** A function or node group a formula can call, compiled to an operation stream. */
@AutoValue
public abstract class Definition {
  public enum Kind {
    FUNCTION,
    NODEGROUP;
  }

  public abstract Kind kind();

  public abstract String name();

  public abstract ImmutableList<SocketDeclaration> inputs();

  public abstract ImmutableList<SocketDeclaration> outputs();

  public abstract ImmutableList<Operation> body();

  /**
   * Inputs the body binds to a variable or returns unchanged. Callers must pass a socket for
   * these, so constant arguments are turned into value nodes first.
   */
  public abstract ImmutableSet<String> portInputs();

  public boolean isNodegroup() {
    return kind() == Kind.NODEGROUP;
  }

  public Optional<Integer> inputIndex(String name) {
    return indexOf(inputs(), name);
  }

  public Optional<Integer> outputIndex(String name) {
    return indexOf(outputs(), name);
  }

  private static Optional<Integer> indexOf(List<SocketDeclaration> sockets, String name) {
    for (int i = 0; i < sockets.size(); i++) {
      if (sockets.get(i).name().equals(name)) {
        return Optional.of(i);
      }
    }
    return Optional.empty();
  }

  @Memoized
  public CompiledFunction asFunction() {
    Preconditions.checkState(kind() == Kind.FUNCTION, "%s is a node group", name());
    return CompiledFunction.create(
        inputs().stream().map(SocketDeclaration::name).collect(ImmutableList.toImmutableList()),
        outputs().size(),
        body());
  }

  @Memoized
  public CompiledNodeGroup asNodeGroup() {
    Preconditions.checkState(kind() == Kind.NODEGROUP, "%s is a function", name());
    return CompiledNodeGroup.create(name(), inputs(), outputs(), body());
  }

  public static Builder builder(Kind kind, String name) {
    return new AutoValue_Definition.Builder().setKind(kind).setName(name);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    abstract Builder setKind(Kind kind);

    abstract Builder setName(String name);

    public abstract ImmutableList.Builder<SocketDeclaration> inputsBuilder();

    public abstract ImmutableList.Builder<SocketDeclaration> outputsBuilder();

    public abstract Builder setBody(List<Operation> body);

    public abstract ImmutableSet.Builder<String> portInputsBuilder();

    public final Builder addInput(SocketDeclaration input) {
      inputsBuilder().add(input);
      return this;
    }

    public final Builder addOutput(SocketDeclaration output) {
      outputsBuilder().add(output);
      return this;
    }

    public abstract Definition build();
  }
}

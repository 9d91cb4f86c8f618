package mf;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A node group: its body is built into an inner tree once and referenced at every call. */
@AutoValue
public abstract class CompiledNodeGroup {
  public abstract String name();

  public abstract ImmutableList<SocketDeclaration> inputs();

  public abstract ImmutableList<SocketDeclaration> outputs();

  public abstract ImmutableList<Operation> body();

  public static CompiledNodeGroup create(
      String name,
      List<SocketDeclaration> inputs,
      List<SocketDeclaration> outputs,
      List<Operation> body) {
    return new AutoValue_CompiledNodeGroup(
        name,
        ImmutableList.copyOf(inputs),
        ImmutableList.copyOf(outputs),
        ImmutableList.copyOf(body));
  }
}

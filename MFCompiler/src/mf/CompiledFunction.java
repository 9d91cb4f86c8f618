package mf;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A function body that is expanded inline at every call. */
@AutoValue
public abstract class CompiledFunction {
  /** Parameter names, bound in order to the call's arguments. */
  public abstract ImmutableList<String> inputs();

  public abstract int numOutputs();

  public abstract ImmutableList<Operation> body();

  public static CompiledFunction create(
      List<String> inputs, int numOutputs, List<Operation> body) {
    return new AutoValue_CompiledFunction(
        ImmutableList.copyOf(inputs), numOutputs, ImmutableList.copyOf(body));
  }
}

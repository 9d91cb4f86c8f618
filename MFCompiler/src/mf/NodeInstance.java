package mf;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * A builtin node call: the node type to create, fixed property assignments, and which of its
 * sockets take the call's arguments and produce its results.
 */
@AutoValue
public abstract class NodeInstance {
  @AutoValue
  public abstract static class Property {
    public abstract String name();

    /** Integer, Double, Boolean or String. */
    public abstract Object value();

    public static Property create(String name, Object value) {
      Value.Constant.checkConstant(value);
      return new AutoValue_NodeInstance_Property(name, value);
    }
  }

  /** The node type id, e.g. {@code ShaderNodeMath}. */
  public abstract String key();

  public abstract ImmutableList<Property> props();

  /** Input socket indices, one per argument. */
  public abstract ImmutableList<Integer> inputs();

  /** Output socket indices, in declaration order. */
  public abstract ImmutableList<Integer> outputs();

  public static NodeInstance create(
      String key, List<Property> props, List<Integer> inputs, List<Integer> outputs) {
    return new AutoValue_NodeInstance(
        key,
        ImmutableList.copyOf(props),
        ImmutableList.copyOf(inputs),
        ImmutableList.copyOf(outputs));
  }
}

package mf;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** A lowered formula: the top level operation stream and what it declared along the way. */
@AutoValue
public abstract class Program {
  public abstract ImmutableList<Operation> operations();

  /** Names bound by top level {@code out} statements, in source order. */
  public abstract ImmutableList<String> outputs();

  /** Definitions made by the formula itself. */
  public abstract ImmutableList<Definition> definitions();

  public static Program create(
      List<Operation> operations, List<String> outputs, List<Definition> definitions) {
    return new AutoValue_Program(
        ImmutableList.copyOf(operations),
        ImmutableList.copyOf(outputs),
        ImmutableList.copyOf(definitions));
  }
}

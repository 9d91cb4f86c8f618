package mf;

import java.util.Optional;

import com.google.auto.value.AutoValue;

/** A typed input or output of a node group, with an optional default value. */
@AutoValue
public abstract class SocketDeclaration {
  public abstract String name();

  public abstract DataType type();

  public abstract Optional<Value.Constant> defaultValue();

  public static SocketDeclaration create(
      String name, DataType type, Optional<Value.Constant> defaultValue) {
    return new AutoValue_SocketDeclaration(name, type, defaultValue);
  }

  public static SocketDeclaration create(String name, DataType type) {
    return create(name, type, Optional.empty());
  }
}

package mf;

import java.util.Optional;

public interface GraphSocket {
  String name();

  DataType type();

  boolean isOutput();

  /** True for inputs that accept any number of links. */
  boolean isMultiInput();

  Optional<Object> defaultValue();

  void setDefaultValue(Object value);

  GraphNode node();

  /** Canonical textual identity, unique among all sockets of one backend. */
  String identity();
}

package mf;

import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

public interface GraphNode {
  String typeId();

  /** Unique within the owning tree. */
  String name();

  Optional<String> label();

  void setLabel(String label);

  ImmutableMap<String, Object> properties();

  void setProperty(String name, Object value);

  ImmutableList<GraphSocket> inputs();

  ImmutableList<GraphSocket> outputs();

  /** The referenced inner tree, for group reference nodes. */
  Optional<NodeTree> nodeTree();

  /** The first input socket called {@code name}. */
  default GraphSocket input(String name) {
    return inputs()
        .stream()
        .filter(s -> s.name().equals(name))
        .findFirst()
        .orElseThrow(
            () -> new IllegalArgumentException(
                String.format("%s has no input '%s'", typeId(), name)));
  }
}
